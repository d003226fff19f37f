package com.example.fok.service;

import com.example.fok.domain.ConversationSession;
import com.example.fok.service.exception.ErrorCode;
import com.example.fok.service.exception.ServiceException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

@Slf4j
@Repository
public class RedisConversationSessionRepository implements ConversationSessionRepository {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final RedisKeyFactory keyFactory;

    public RedisConversationSessionRepository(
            StringRedisTemplate redisTemplate, RedisKeyFactory keyFactory, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.keyFactory = keyFactory;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<ConversationSession> find(String userId) {
        String raw;
        try {
            raw = redisTemplate.opsForValue().get(keyFactory.sessionKey(userId));
        } catch (DataAccessException ex) {
            throw unavailable(ex);
        }
        if (raw == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(raw, ConversationSession.class));
        } catch (JsonProcessingException ex) {
            log.warn("Discarding unreadable conversation session for user {}", userId, ex);
            return Optional.empty();
        }
    }

    @Override
    public void save(ConversationSession session, Duration ttl) {
        try {
            redisTemplate.opsForValue().set(keyFactory.sessionKey(session.getUserId()), writeAsJson(session), ttl);
        } catch (DataAccessException ex) {
            throw unavailable(ex);
        }
    }

    @Override
    public void delete(String userId) {
        try {
            redisTemplate.delete(keyFactory.sessionKey(userId));
        } catch (DataAccessException ex) {
            throw unavailable(ex);
        }
    }

    private String writeAsJson(ConversationSession session) {
        try {
            return objectMapper.writeValueAsString(session);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize conversation session", e);
        }
    }

    private ServiceException unavailable(DataAccessException ex) {
        return new ServiceException(ErrorCode.STORAGE_UNAVAILABLE, "Conversation store unavailable", ex);
    }
}
