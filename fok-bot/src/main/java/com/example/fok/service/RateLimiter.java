package com.example.fok.service;

import com.example.fok.config.FokProperties;
import com.example.fok.service.exception.ServiceException;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Fixed-window counter per subject, shared by every replica through {@link AtomicKeyStore}.
 * When the store is unreachable events are admitted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RateLimiter {

    private final AtomicKeyStore keyStore;
    private final RedisKeyFactory keyFactory;
    private final FokProperties fokProperties;

    public RateLimitDecision admit(String subject, Instant now) {
        FokProperties.RateLimit config = fokProperties.getRateLimit();
        if (!config.isEnabled() || !StringUtils.hasText(subject)) {
            return RateLimitDecision.allow();
        }
        Duration window = config.getWindow();
        long windowMillis = Math.max(1L, window.toMillis());
        long windowIndex = Math.floorDiv(now.toEpochMilli(), windowMillis);

        long count;
        try {
            count = keyStore.incrementAndExpire(keyFactory.rateLimitKey(subject, windowIndex), window);
        } catch (ServiceException ex) {
            log.warn("rate_limit.storage_unavailable subject={} admitting event: {}", subject, ex.getMessage());
            return RateLimitDecision.allow();
        }
        if (count <= config.getRequests()) {
            return RateLimitDecision.allow();
        }

        Duration retryAfter = Duration.ofMillis((windowIndex + 1) * windowMillis - now.toEpochMilli());
        boolean warn = markWarned(subject, windowIndex, window);
        if (warn) {
            log.info("Throttling {} for {} ms after {} events in the current window",
                    subject, retryAfter.toMillis(), count);
        }
        return RateLimitDecision.throttled(retryAfter, warn);
    }

    private boolean markWarned(String subject, long windowIndex, Duration window) {
        try {
            return keyStore.setIfAbsent(keyFactory.rateLimitWarnedKey(subject, windowIndex), window);
        } catch (ServiceException ex) {
            log.warn("rate_limit.storage_unavailable subject={} skipping cooldown notice: {}",
                    subject, ex.getMessage());
            return false;
        }
    }
}
