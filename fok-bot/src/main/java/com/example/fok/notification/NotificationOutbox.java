package com.example.fok.notification;

import java.time.Instant;
import java.util.List;

/**
 * Durable table of notifications written in the same transaction as the state change that produced them.
 */
public interface NotificationOutbox {

    /**
     * Oldest undispatched rows that have failed fewer than {@code maxAttempts} times.
     */
    List<OutboxEntry> findUndispatched(int limit, int maxAttempts);

    void markDispatched(long id, Instant dispatchedAt);

    void markFailed(long id, String error);

    int purgeDispatchedBefore(Instant cutoff);
}
