package com.example.fok.domain;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Application implements Serializable {

    private String id;
    private String userId;
    private String facilityId;
    private String facilityName;
    private String sport;
    private ApplicationStatus status;
    private Instant createdAt;
    private Instant updatedAt;
    private String processedBy;
    private Instant completedAt;
    private Instant cancelledAt;
    private long version;
    @Builder.Default
    private List<StatusChange> statusHistory = new ArrayList<>();

    /**
     * Idempotency key held by an application while it is pending. Sport is compared case- and
     * whitespace-insensitively.
     */
    public static String pendingKey(String userId, String facilityId, String sport) {
        String normalizedSport = sport == null ? "" : sport.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        return userId + "|" + facilityId + "|" + normalizedSport;
    }

    public String pendingKey() {
        return status == ApplicationStatus.PENDING ? pendingKey(userId, facilityId, sport) : null;
    }

    public String shortId() {
        if (id == null) {
            return "";
        }
        return id.length() <= 6 ? id : id.substring(id.length() - 6);
    }
}
