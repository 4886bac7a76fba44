package com.studioflow.orchestrator.workflow;

/**
 * Raised by a stage node when the job cannot continue as submitted.
 *
 * {@link Kind#VALIDATION}, {@link Kind#INTEGRITY} and {@link Kind#EXHAUSTED}
 * fail the job with {@link #getCode()} as its error code. The other kinds
 * roll the tick back and leave the job for the next trigger.
 */
public class WorkflowException extends RuntimeException {

    public enum Kind {
        /** The job input or a resolved action is unusable. */
        VALIDATION,
        /** A stage finished without the outputs the next stage needs. */
        INTEGRITY,
        /** Every retry of a candidate group failed. */
        EXHAUSTED,
        /** The job row kept changing underneath the tick. */
        CONCURRENCY,
        /** A collaborator failed in a way the next tick may not see again. */
        PROVIDER
    }

    private final Kind   kind;
    private final String code;

    public WorkflowException(Kind kind, String code, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
        this.code = code;
    }

    public Kind   getKind() { return kind; }
    public String getCode() { return code; }

    public boolean failsJob() {
        return kind == Kind.VALIDATION || kind == Kind.INTEGRITY || kind == Kind.EXHAUSTED;
    }

    public static WorkflowException invalidInput(String message) {
        return new WorkflowException(Kind.VALIDATION, "INVALID_INPUT", message);
    }

    public static WorkflowException noOutputs(String message) {
        return new WorkflowException(Kind.INTEGRITY, "NO_OUTPUTS", message);
    }
}
