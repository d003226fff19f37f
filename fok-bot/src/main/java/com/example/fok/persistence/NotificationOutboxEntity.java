package com.example.fok.persistence;

import com.example.fok.notification.NotificationTemplate;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(
        name = "notification_outbox",
        indexes = @Index(name = "ix_outbox_dispatched", columnList = "dispatched_at, id"))
public class NotificationOutboxEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "notification_id", nullable = false, unique = true, updatable = false, length = 64)
    private String notificationId;

    @Column(name = "target_id", nullable = false, length = 64)
    private String targetId;

    @Enumerated(EnumType.STRING)
    @Column(name = "template", nullable = false, length = 64)
    private NotificationTemplate template;

    @Column(name = "params", columnDefinition = "text")
    private String params;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "dispatched_at")
    private Instant dispatchedAt;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "last_error", length = 1000)
    private String lastError;
}
