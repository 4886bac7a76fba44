package com.studioflow.orchestrator.provider;

/**
 * Thrown when a provider call fails in a way the worker turns into a
 * failed candidate or run (rejected request, transport error, timeout,
 * unreadable response).
 *
 * Unchecked: the worker catches it at the run boundary; nothing else
 * needs to.
 */
public class ProviderException extends RuntimeException {

    public enum Kind { REJECTED, TRANSPORT, TIMEOUT, BAD_RESPONSE }

    private final Kind kind;

    public ProviderException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public ProviderException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
