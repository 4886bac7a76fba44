package com.studioflow.orchestrator.queue;

import com.studioflow.orchestrator.model.ProviderRun;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;

/**
 * Background poller that drains the provider run queue.
 *
 * The DB is the queue: {@code SELECT ... FOR UPDATE SKIP LOCKED} is the
 * dequeue, so any number of processes can run this poller side by side.
 * Each poll claims runs only while a worker thread is free, which keeps
 * claimed-but-waiting runs at zero.
 */
@Component
@EnableScheduling
public class ProviderRunScheduler {

    private static final Logger log = LoggerFactory.getLogger(ProviderRunScheduler.class);

    private final ProviderRunQueue    queue;
    private final ProviderRunExecutor executor;
    private final ExecutorService     workers;
    private final Semaphore           freeWorkers;
    private final String              workerId;

    public ProviderRunScheduler(ProviderRunQueue queue,
                                ProviderRunExecutor executor,
                                @Value("${studioflow.worker.provider-runs.threads:4}") int threads) {
        this.queue       = queue;
        this.executor    = executor;
        this.workers     = Executors.newFixedThreadPool(threads);
        this.freeWorkers = new Semaphore(threads);
        this.workerId    = "runs-" + UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Claim runs until the queue is empty or every worker thread is busy.
     * fixedDelay waits for the previous poll to finish before the next one.
     */
    @Scheduled(fixedDelayString = "${studioflow.worker.provider-runs.poll-interval-ms:500}")
    public void poll() {
        while (freeWorkers.tryAcquire()) {
            Optional<ProviderRun> claimed;
            try {
                claimed = queue.claimNext(workerId);
            } catch (Exception e) {
                freeWorkers.release();
                log.warn("Claiming a provider run failed: {}", e.getMessage());
                return;
            }
            if (claimed.isEmpty()) {
                freeWorkers.release();
                return;
            }
            ProviderRun run = claimed.get();
            workers.submit(() -> {
                try {
                    executor.run(run);
                } catch (Exception e) {
                    log.error("Unhandled error executing run {}: {}", run.getId(), e.getMessage(), e);
                    executor.failUnexpected(run, e);
                } finally {
                    freeWorkers.release();
                }
            });
        }
    }

    @PreDestroy
    void shutdown() {
        workers.shutdown();
    }
}
