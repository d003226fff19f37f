package com.example.fok.persistence;

import com.example.fok.notification.NotificationOutbox;
import com.example.fok.notification.OutboxEntry;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class JpaNotificationOutbox implements NotificationOutbox {

    private static final int MAX_ERROR_LENGTH = 1000;

    private final NotificationOutboxJpaRepository outboxJpaRepository;
    private final NotificationOutboxMapper mapper;

    @Override
    @Transactional(readOnly = true)
    public List<OutboxEntry> findUndispatched(int limit, int maxAttempts) {
        return outboxJpaRepository.findByDispatchedAtIsNullAndAttemptsLessThanOrderByIdAsc(
                        maxAttempts, PageRequest.of(0, Math.max(1, limit)))
                .stream()
                .map(mapper::toEntry)
                .toList();
    }

    @Override
    @Transactional
    public void markDispatched(long id, Instant dispatchedAt) {
        outboxJpaRepository.markDispatched(id, dispatchedAt);
    }

    @Override
    @Transactional
    public void markFailed(long id, String error) {
        String truncated = error != null && error.length() > MAX_ERROR_LENGTH
                ? error.substring(0, MAX_ERROR_LENGTH)
                : error;
        outboxJpaRepository.markFailed(id, truncated);
    }

    @Override
    @Transactional
    public int purgeDispatchedBefore(Instant cutoff) {
        return outboxJpaRepository.deleteDispatchedBefore(cutoff);
    }
}
