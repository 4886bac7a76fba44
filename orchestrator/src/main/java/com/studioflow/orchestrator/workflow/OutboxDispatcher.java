package com.studioflow.orchestrator.workflow;

import com.studioflow.orchestrator.model.JobEvent;
import com.studioflow.orchestrator.repository.JobEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Delivers job events written in the same transaction as the change they
 * announce.
 *
 * A batch is claimed by stamping {@code processed_at} under SKIP LOCKED,
 * so concurrent dispatchers split the work. Each distinct job in the batch
 * is ticked once; when the tick throws, its events are reopened until they
 * have been tried {@value #MAX_ATTEMPTS} times.
 */
@Component
public class OutboxDispatcher {

    private static final Logger log = LoggerFactory.getLogger(OutboxDispatcher.class);

    static final int MAX_ATTEMPTS = 5;

    private final JobEventRepository  eventRepo;
    private final StageRouter         router;
    private final TransactionTemplate tx;
    private final int                 batchSize;

    public OutboxDispatcher(JobEventRepository eventRepo,
                            StageRouter router,
                            PlatformTransactionManager txManager,
                            @Value("${studioflow.outbox.batch-size:100}") int batchSize) {
        this.eventRepo = eventRepo;
        this.router    = router;
        this.tx        = new TransactionTemplate(txManager);
        this.batchSize = batchSize;
    }

    @Scheduled(fixedDelayString = "${studioflow.outbox.poll-interval-ms:1000}")
    public void dispatch() {
        List<JobEvent> batch = claimBatch();
        if (batch.isEmpty()) return;

        Set<UUID> jobIds = new LinkedHashSet<>();
        batch.forEach(e -> jobIds.add(e.getJobId()));
        for (UUID jobId : jobIds) {
            try {
                router.tick(jobId, "outbox");
            } catch (Exception e) {
                log.warn("Outbox tick of job {} failed: {}", jobId, e.getMessage());
                reopen(batch, jobId);
            }
        }
    }

    List<JobEvent> claimBatch() {
        List<JobEvent> claimed = tx.execute(status -> {
            List<JobEvent> events = eventRepo.lockPending(batchSize);
            Instant now = Instant.now();
            for (JobEvent e : events) {
                e.incrementAttempts();
                e.setProcessedAt(now);
            }
            return eventRepo.saveAll(events);
        });
        return claimed == null ? List.of() : claimed;
    }

    private void reopen(List<JobEvent> batch, UUID jobId) {
        try {
            tx.executeWithoutResult(status -> {
                for (JobEvent e : batch) {
                    if (!e.getJobId().equals(jobId) || e.getAttempts() >= MAX_ATTEMPTS) continue;
                    eventRepo.findById(e.getId()).ifPresent(fresh -> {
                        fresh.setProcessedAt(null);
                        eventRepo.save(fresh);
                    });
                }
            });
        } catch (Exception e) {
            log.warn("Could not reopen outbox events of job {}: {}", jobId, e.getMessage());
        }
    }
}
