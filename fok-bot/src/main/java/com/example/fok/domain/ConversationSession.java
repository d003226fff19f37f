package com.example.fok.domain;

import java.io.Serializable;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationSession implements Serializable {

    private String userId;
    private ConversationFlow flow;
    private String step;
    @Builder.Default
    private Map<String, String> scratch = new HashMap<>();
    private Instant updatedAt;
    private Instant expiresAt;

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
