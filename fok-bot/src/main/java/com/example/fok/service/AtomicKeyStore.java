package com.example.fok.service;

import java.time.Duration;

/**
 * Shared key/value operations that must be atomic across bot replicas.
 * Implementations report an unreachable store as {@code ServiceException} with {@code STORAGE_UNAVAILABLE}.
 */
public interface AtomicKeyStore {

    /**
     * Increments the counter and sets its expiry when the increment created it.
     *
     * @return the counter value after the increment
     */
    long incrementAndExpire(String key, Duration ttl);

    /**
     * @return {@code true} if this call created the key
     */
    boolean setIfAbsent(String key, Duration ttl);

    boolean exists(String key);
}
