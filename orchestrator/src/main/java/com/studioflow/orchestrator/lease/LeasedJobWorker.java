package com.studioflow.orchestrator.lease;

import com.studioflow.orchestrator.model.Job;
import com.studioflow.orchestrator.repository.JobRepository;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;

/**
 * Polls every registered {@link LeasedJobHandler} kind and runs claimed
 * jobs on a fixed pool. Claims never exceed the number of free threads.
 */
@Component
public class LeasedJobWorker {

    private static final Logger log = LoggerFactory.getLogger(LeasedJobWorker.class);

    public static final String WORKER_ERROR = "WORKER_ERROR";

    private final Map<String, LeasedJobHandler> handlers = new LinkedHashMap<>();
    private final JobLeaseService leases;
    private final JobRepository   jobRepo;
    private final ExecutorService workers;
    private final Semaphore       freeWorkers;
    private final String          workerId;

    public LeasedJobWorker(List<LeasedJobHandler> allHandlers,
                           JobLeaseService leases,
                           JobRepository jobRepo,
                           @Value("${studioflow.worker.leased-jobs.threads:2}") int threads) {
        for (LeasedJobHandler h : allHandlers) {
            if (handlers.put(h.kind(), h) != null) {
                throw new IllegalStateException("Two handlers registered for job kind '" + h.kind() + "'");
            }
        }
        this.leases      = leases;
        this.jobRepo     = jobRepo;
        this.workers     = Executors.newFixedThreadPool(threads);
        this.freeWorkers = new Semaphore(threads);
        this.workerId    = "jobs-" + UUID.randomUUID().toString().substring(0, 8);
    }

    public boolean handles(String kind) {
        return handlers.containsKey(kind);
    }

    @Scheduled(fixedDelayString = "${studioflow.worker.leased-jobs.poll-interval-ms:2000}")
    public void poll() {
        for (LeasedJobHandler handler : handlers.values()) {
            int free = freeWorkers.availablePermits();
            if (free == 0) return;
            List<UUID> claimed;
            try {
                claimed = leases.claimNextJobs(handler.kind(), free, workerId);
            } catch (Exception e) {
                log.warn("Claiming {} jobs failed: {}", handler.kind(), e.getMessage());
                continue;
            }
            for (UUID jobId : claimed) {
                freeWorkers.acquireUninterruptibly();
                workers.submit(() -> {
                    try {
                        process(handler, jobId);
                    } finally {
                        freeWorkers.release();
                    }
                });
            }
        }
    }

    void process(LeasedJobHandler handler, UUID jobId) {
        MDC.put("jobId", jobId.toString());
        MDC.put("jobKind", handler.kind());
        try {
            Job job = jobRepo.findById(jobId).orElse(null);
            if (job == null) {
                log.warn("Claimed job {} vanished", jobId);
                return;
            }
            MDC.put("attempt", String.valueOf(job.getAttemptCount()));
            handler.handle(job);
            leases.verifyOutcome(jobId);
        } catch (Exception e) {
            log.error("Handler {} failed on job {}: {}", handler.kind(), jobId, e.getMessage(), e);
            try {
                leases.handleFailure(jobId, WORKER_ERROR, e.getMessage());
            } catch (Exception inner) {
                log.error("Could not record failure of job {}: {}", jobId, inner.getMessage());
            }
        } finally {
            MDC.clear();
        }
    }

    @PreDestroy
    void shutdown() {
        workers.shutdown();
    }
}
