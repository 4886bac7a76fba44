package com.studioflow.orchestrator.workflow;

import com.studioflow.orchestrator.model.Job;
import com.studioflow.orchestrator.model.JobStatus;
import com.studioflow.orchestrator.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.UUID;

/**
 * Periodic safety net: ticks every live graph job, least recently touched
 * first. Covers lost notifications, restarts and jobs nobody triggered.
 */
@Component
public class WorkflowSweeper {

    private static final Logger log = LoggerFactory.getLogger(WorkflowSweeper.class);

    private final JobRepository jobRepo;
    private final StageRouter   router;
    private final int           batchSize;

    public WorkflowSweeper(JobRepository jobRepo,
                           StageRouter router,
                           @Value("${studioflow.workflow.sweep-batch-size:50}") int batchSize) {
        this.jobRepo   = jobRepo;
        this.router    = router;
        this.batchSize = batchSize;
    }

    @Scheduled(fixedDelayString = "${studioflow.workflow.sweep-interval-ms:15000}",
               initialDelayString = "${studioflow.workflow.sweep-interval-ms:15000}")
    public void sweep() {
        List<UUID> ids = jobRepo.findIdsForSweep(Job.KIND_MUSIC_VIDEO,
                EnumSet.of(JobStatus.QUEUED, JobStatus.RUNNING), PageRequest.of(0, batchSize));
        if (ids.isEmpty()) return;
        log.debug("Sweeping {} graph jobs", ids.size());
        int advanced = 0;
        for (UUID id : ids) {
            try {
                TickResult r = router.tick(id, "sweep");
                if (r.stageIn() != r.stageOut() || r.status().isTerminal()) advanced++;
            } catch (Exception e) {
                log.warn("Sweep tick of job {} failed: {}", id, e.getMessage());
            }
        }
        if (advanced > 0) {
            log.info("Sweep advanced {} of {} graph jobs", advanced, ids.size());
        }
    }
}
