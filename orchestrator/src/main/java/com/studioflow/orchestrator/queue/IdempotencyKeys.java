package com.studioflow.orchestrator.queue;

import com.studioflow.orchestrator.model.RunType;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.UUID;

/**
 * Deterministic provider-run keys: the same logical run always maps to the
 * same key, so enqueueing it twice is a no-op.
 */
public final class IdempotencyKeys {

    private IdempotencyKeys() {}

    /**
     * @param target candidate id for candidate runs, group id otherwise
     */
    public static String forRun(UUID jobId, RunType runType, UUID target, int attempt) {
        return sha256("studioflow:" + jobId + ":" + runType.code() + ":" + target + ":attempt:" + attempt);
    }

    static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
