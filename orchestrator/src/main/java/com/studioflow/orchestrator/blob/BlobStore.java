package com.studioflow.orchestrator.blob;

import java.time.Duration;

/**
 * Where media bytes live. Database rows only ever hold the locator
 * returned by {@link #put}.
 */
public interface BlobStore {

    /** Store the bytes and return an opaque {@code blob://} locator. */
    String put(byte[] bytes, String contentType);

    /** Read back the bytes behind a locator. */
    byte[] get(String locator);

    /** Time-limited URL a client can fetch the blob from. */
    String sign(String locator, Duration ttl);
}
