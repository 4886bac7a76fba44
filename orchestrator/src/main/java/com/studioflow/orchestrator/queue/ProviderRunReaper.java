package com.studioflow.orchestrator.queue;

import com.studioflow.orchestrator.model.ProviderRun;
import com.studioflow.orchestrator.model.RunStatus;
import com.studioflow.orchestrator.repository.ProviderRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Fails provider runs whose worker disappeared.
 *
 * A run is stalled when it has been RUNNING for longer than the provider
 * timeout plus a grace period: a live worker would have written a terminal
 * status by then. Without this, its candidate group would wait forever.
 */
@Component
public class ProviderRunReaper {

    private static final Logger log = LoggerFactory.getLogger(ProviderRunReaper.class);

    private final ProviderRunRepository runRepo;
    private final ProviderRunExecutor   executor;
    private final Duration              stallAfter;

    public ProviderRunReaper(ProviderRunRepository runRepo,
                             ProviderRunExecutor executor,
                             @Value("${studioflow.provider.timeout-sec:300}") long timeoutSec,
                             @Value("${studioflow.worker.provider-runs.stall-grace-sec:120}") long graceSec) {
        this.runRepo    = runRepo;
        this.executor   = executor;
        this.stallAfter = Duration.ofSeconds(timeoutSec + graceSec);
    }

    @Scheduled(fixedDelayString = "${studioflow.worker.provider-runs.reap-interval-ms:60000}")
    public void reap() {
        Instant cutoff = Instant.now().minus(stallAfter);
        List<ProviderRun> stalled = runRepo.findTop50ByStatusAndStartedAtBefore(RunStatus.RUNNING, cutoff);
        for (ProviderRun run : stalled) {
            log.warn("Failing stalled run {} (worker={}, started={})", run.getId(), run.getWorkerId(), run.getStartedAt());
            executor.failUnexpected(run, new IllegalStateException("worker lost after " + stallAfter));
        }
    }
}
