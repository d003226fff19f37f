package com.example.fok.service;

import java.time.Duration;

/**
 * Outcome of {@link RateLimiter#admit}. {@code warn} is set on the first throttled event of a window only.
 */
public record RateLimitDecision(boolean allowed, Duration retryAfter, boolean warn) {

    private static final RateLimitDecision ALLOWED = new RateLimitDecision(true, Duration.ZERO, false);

    public static RateLimitDecision allow() {
        return ALLOWED;
    }

    public static RateLimitDecision throttled(Duration retryAfter, boolean warn) {
        return new RateLimitDecision(false, retryAfter, warn);
    }

    public boolean throttled() {
        return !allowed;
    }
}
