package com.example.fok.notification;

import com.example.fok.config.FokProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Moves committed outbox rows onto the delivery queue. A row stays undispatched until the broker acknowledged it,
 * so the handoff is at-least-once.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutboxRelay {

    private final NotificationOutbox outbox;
    private final NotificationDispatcher dispatcher;
    private final FokProperties fokProperties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "#{T(java.time.Duration).parse('${fok.outbox.poll-interval:PT2S}').toMillis()}")
    public void relay() {
        List<OutboxEntry> entries;
        try {
            entries = outbox.findUndispatched(fokProperties.getOutbox().getBatchSize(), maxAttempts());
        } catch (RuntimeException ex) {
            log.warn("Unable to read notification outbox", ex);
            return;
        }
        for (OutboxEntry entry : entries) {
            Notification notification = entry.notification();
            try {
                dispatcher.enqueue(notification);
                outbox.markDispatched(entry.id(), clock.instant());
            } catch (RuntimeException ex) {
                int attempt = entry.attempts() + 1;
                if (attempt >= maxAttempts()) {
                    log.error("Relay of notification {} (outbox row {}) failed {} times, giving up: {}",
                            notification.getNotificationId(), entry.id(), attempt, ex.getMessage());
                } else {
                    log.warn("Relay of notification {} failed (attempt {}): {}",
                            notification.getNotificationId(), attempt, ex.getMessage());
                }
                recordFailure(entry, ex);
            }
        }
    }

    @Scheduled(cron = "${fok.outbox.purge-cron:0 30 3 * * *}")
    public void purgeDispatched() {
        Duration retention = fokProperties.getOutbox().getRetention();
        if (retention == null || retention.isZero() || retention.isNegative()) {
            return;
        }
        Instant cutoff = clock.instant().minus(retention);
        try {
            int purged = outbox.purgeDispatchedBefore(cutoff);
            if (purged > 0) {
                log.info("Purged {} dispatched notifications older than {}", purged, cutoff);
            }
        } catch (RuntimeException ex) {
            log.warn("Failed to purge dispatched notifications", ex);
        }
    }

    private int maxAttempts() {
        int configured = fokProperties.getOutbox().getMaxAttempts();
        return configured > 0 ? configured : Integer.MAX_VALUE;
    }

    private void recordFailure(OutboxEntry entry, RuntimeException cause) {
        try {
            outbox.markFailed(entry.id(), cause.getMessage());
        } catch (RuntimeException ex) {
            log.warn("Unable to record relay failure for outbox row {}", entry.id(), ex);
        }
    }
}
