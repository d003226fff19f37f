package com.example.fok.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.mock;

import com.example.fok.config.FokProperties;
import com.example.fok.domain.ConversationFlow;
import com.example.fok.domain.ConversationSession;
import com.example.fok.service.exception.ErrorCode;
import com.example.fok.service.exception.ServiceException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

@DisplayName("RedisConversationSessionRepository")
class RedisConversationSessionRepositoryTest {

    private static final String KEY = "fok:session:100";

    private StringRedisTemplate redisTemplate;
    private ValueOperations<String, String> valueOperations;
    private RedisConversationSessionRepository repository;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redisTemplate = mock(StringRedisTemplate.class);
        valueOperations = mock(ValueOperations.class);
        given(redisTemplate.opsForValue()).willReturn(valueOperations);
        ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        repository = new RedisConversationSessionRepository(
                redisTemplate, new RedisKeyFactory(new FokProperties()), objectMapper);
    }

    @Test
    @DisplayName("stores the session as JSON with the given TTL and reads it back")
    void savesAndReadsSession() {
        Map<String, String> scratch = new HashMap<>();
        scratch.put("facilityId", "fok-1");
        ConversationSession session = ConversationSession.builder()
                .userId("100")
                .flow(ConversationFlow.SUBMIT_APPLICATION)
                .step("AWAITING_SPORT")
                .scratch(scratch)
                .updatedAt(Instant.parse("2024-05-01T10:00:00Z"))
                .expiresAt(Instant.parse("2024-05-01T10:30:00Z"))
                .build();

        repository.save(session, Duration.ofMinutes(30));

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        then(valueOperations).should().set(eq(KEY), json.capture(), eq(Duration.ofMinutes(30)));
        given(valueOperations.get(KEY)).willReturn(json.getValue());

        ConversationSession loaded = repository.find("100").orElseThrow();
        assertThat(loaded.getFlow()).isEqualTo(ConversationFlow.SUBMIT_APPLICATION);
        assertThat(loaded.getScratch()).containsEntry("facilityId", "fok-1");
        assertThat(loaded.getExpiresAt()).isEqualTo(session.getExpiresAt());
    }

    @Test
    @DisplayName("an unreadable session is treated as absent")
    void unreadableSession() {
        given(valueOperations.get(KEY)).willReturn("{not json");

        assertThat(repository.find("100")).isEmpty();
    }

    @Test
    @DisplayName("Redis failures surface as storage unavailable")
    void redisDown() {
        given(valueOperations.get(anyString())).willThrow(new RedisConnectionFailureException("refused"));

        assertThatThrownBy(() -> repository.find("100"))
                .isInstanceOf(ServiceException.class)
                .extracting(ex -> ((ServiceException) ex).getCode())
                .isEqualTo(ErrorCode.STORAGE_UNAVAILABLE);
    }
}
