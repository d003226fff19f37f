package com.example.fok.service;

import com.example.fok.config.FokProperties;
import org.springframework.stereotype.Component;

@Component
public class RedisKeyFactory {

    private final FokProperties fokProperties;

    public RedisKeyFactory(FokProperties fokProperties) {
        this.fokProperties = fokProperties;
    }

    private String prefix() {
        return fokProperties.getRedis().getKeyPrefix();
    }

    public String sessionKey(String userId) {
        return "%s:session:%s".formatted(prefix(), userId);
    }

    public String rateLimitKey(String subject, long windowIndex) {
        return "%s:rate:%s:%d".formatted(prefix(), subject, windowIndex);
    }

    public String rateLimitWarnedKey(String subject, long windowIndex) {
        return "%s:rate:%s:%d:warned".formatted(prefix(), subject, windowIndex);
    }

    public String deliveredKey(String notificationId) {
        return "%s:delivered:%s".formatted(prefix(), notificationId);
    }
}
