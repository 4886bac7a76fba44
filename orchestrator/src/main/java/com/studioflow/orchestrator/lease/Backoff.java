package com.studioflow.orchestrator.lease;

import java.time.Duration;

/** Retry delay for leased jobs: 5 s doubling per attempt, capped at 60 s. */
public final class Backoff {

    static final long BASE_SECONDS = 5;
    static final long CAP_SECONDS  = 60;

    private Backoff() {}

    /** @param attempt the attempt that just failed, 1-based */
    public static Duration delayFor(int attempt) {
        int a = Math.max(1, attempt);
        if (a > 5) return Duration.ofSeconds(CAP_SECONDS);
        return Duration.ofSeconds(Math.min(CAP_SECONDS, BASE_SECONDS << (a - 1)));
    }
}
