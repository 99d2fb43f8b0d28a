package com.flagship.media_ledger.storage;

import java.time.Duration;

/**
 * Durable store holding generated media and stitched outputs.
 *
 * Output existence is the fallback signal used by reconciliation when a
 * worker callback never arrives, so {@link #exists(String)} must reflect
 * what is actually stored rather than what we expect to be there.
 */
public interface ObjectStore {

    void put(String path, byte[] data, String contentType);

    /**
     * @throws ObjectStoreException if the store cannot answer; callers treat this as "unknown"
     */
    boolean exists(String path);

    void delete(String path);

    String generateTimeLimitedUrl(String path, Duration ttl);
}
