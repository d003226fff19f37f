package com.example.fok.persistence;

import com.example.fok.domain.ApplicationStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(
        name = "applications",
        uniqueConstraints = @UniqueConstraint(name = "uk_applications_pending_key", columnNames = "pending_key"),
        indexes = {
                @Index(name = "ix_applications_user", columnList = "user_id, created_at"),
                @Index(name = "ix_applications_status", columnList = "status, created_at")
        })
public class ApplicationEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "user_id", nullable = false, updatable = false, length = 64)
    private String userId;

    @Column(name = "facility_id", nullable = false, updatable = false, length = 64)
    private String facilityId;

    @Column(name = "facility_name", length = 255)
    private String facilityName;

    @Column(name = "sport", nullable = false, length = 128)
    private String sport;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private ApplicationStatus status;

    /**
     * Set only while the application is pending; the unique constraint rejects duplicate submissions.
     */
    @Column(name = "pending_key", length = 400)
    private String pendingKey;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "processed_by", length = 64)
    private String processedBy;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    @Version
    @Column(name = "version")
    private Long version;
}
