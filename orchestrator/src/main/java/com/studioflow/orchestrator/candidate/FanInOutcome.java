package com.studioflow.orchestrator.candidate;

/** What a fan-in observed about the current candidate group. */
public enum FanInOutcome {
    /** No group pointer: the fan-out has not happened (or was reset). */
    NO_GROUP,
    /** At least one member is still queued or running. */
    WAITING_PARALLEL,
    /** Every member failed; the next attempt was scheduled. */
    RETRY,
    /** Every member failed and the attempt cap is reached. */
    EXHAUSTED,
    /** A human must pick; {@code required_action} was raised. */
    ACTION_REQUIRED,
    /** A winner is chosen and promoted. */
    CHOSEN
}
