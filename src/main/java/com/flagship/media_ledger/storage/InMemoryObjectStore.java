package com.flagship.media_ledger.storage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Object store for local runs and tests. URLs it hands out are not
 * fetchable; they only carry the path and the expiry.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "storage.s3.enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryObjectStore implements ObjectStore {

    private final Map<String, byte[]> objects = new ConcurrentHashMap<>();

    @Override
    public void put(String path, byte[] data, String contentType) {
        objects.put(path, data.clone());
        log.debug("Stored in-memory object {} ({})", path, contentType);
    }

    @Override
    public boolean exists(String path) {
        return objects.containsKey(path);
    }

    @Override
    public void delete(String path) {
        objects.remove(path);
    }

    @Override
    public String generateTimeLimitedUrl(String path, Duration ttl) {
        return "memory://" + path + "?expires_in=" + ttl.toSeconds();
    }
}
