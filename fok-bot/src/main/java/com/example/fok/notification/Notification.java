package com.example.fok.notification;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.io.Serializable;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Notification implements Serializable {

    /**
     * Target that fans out to the admin chat and every staff member.
     */
    public static final String ADMIN_CHANNEL = "admin";

    private String notificationId;
    private String target;
    private NotificationTemplate template;
    @Builder.Default
    private Map<String, String> params = new HashMap<>();
    private Instant createdAt;

    public static Notification of(String target, NotificationTemplate template, Map<String, String> params, Instant now) {
        return Notification.builder()
                .notificationId(UUID.randomUUID().toString())
                .target(target)
                .template(template)
                .params(new HashMap<>(params))
                .createdAt(now)
                .build();
    }

    @JsonIgnore
    public boolean isForAdmins() {
        return ADMIN_CHANNEL.equals(target);
    }
}
