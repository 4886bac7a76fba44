package com.studioflow.orchestrator.lease;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class BackoffTest {

    @Test
    void doublesFromFiveSecondsAndCapsAtSixty() {
        assertThat(Backoff.delayFor(1)).isEqualTo(Duration.ofSeconds(5));
        assertThat(Backoff.delayFor(2)).isEqualTo(Duration.ofSeconds(10));
        assertThat(Backoff.delayFor(3)).isEqualTo(Duration.ofSeconds(20));
        assertThat(Backoff.delayFor(4)).isEqualTo(Duration.ofSeconds(40));
        assertThat(Backoff.delayFor(5)).isEqualTo(Duration.ofSeconds(60));
        assertThat(Backoff.delayFor(6)).isEqualTo(Duration.ofSeconds(60));
        assertThat(Backoff.delayFor(40)).isEqualTo(Duration.ofSeconds(60));
    }

    @Test
    void neverDecreases() {
        Duration previous = Duration.ZERO;
        for (int attempt = 1; attempt <= 100; attempt++) {
            Duration d = Backoff.delayFor(attempt);
            assertThat(d).isGreaterThanOrEqualTo(previous);
            previous = d;
        }
    }

    @Test
    void nonPositiveAttempt_treatedAsFirst() {
        assertThat(Backoff.delayFor(0)).isEqualTo(Duration.ofSeconds(5));
        assertThat(Backoff.delayFor(-3)).isEqualTo(Duration.ofSeconds(5));
    }
}
