package com.studioflow.orchestrator.workflow;

import com.studioflow.orchestrator.model.Job;
import com.studioflow.orchestrator.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Best-effort "tick this job now" used after a provider run resolves or a
 * human acts. Never throws: the outbox dispatcher and the sweeper deliver
 * whatever this misses.
 */
@Component
public class WorkflowNotifier {

    private static final Logger log = LoggerFactory.getLogger(WorkflowNotifier.class);

    private final StageRouter   router;
    private final JobRepository jobRepo;

    public WorkflowNotifier(StageRouter router, JobRepository jobRepo) {
        this.router  = router;
        this.jobRepo = jobRepo;
    }

    public void notifyJob(UUID jobId, String trigger) {
        try {
            boolean graphJob = jobRepo.findById(jobId).map(Job::isGraphJob).orElse(false);
            if (!graphJob) return;
            TickResult result = router.tick(jobId, trigger);
            log.debug("Notified job {} ({}): {} -> {} stop={}", jobId, trigger,
                    result.stageIn(), result.stageOut(), result.stopReason());
        } catch (Exception e) {
            log.warn("Notify of job {} ({}) failed, the sweep will retry: {}", jobId, trigger, e.getMessage());
        }
    }
}
