package com.example.fok.service;

import com.example.fok.domain.ConversationSession;
import java.time.Duration;
import java.util.Optional;

public interface ConversationSessionRepository {

    Optional<ConversationSession> find(String userId);

    void save(ConversationSession session, Duration ttl);

    void delete(String userId);
}
