package com.example.fok.inbound;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single message, command, shared contact or button press received from the messenger.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InboundEvent {

    @NotBlank
    @Size(max = 64)
    private String userId;

    @NotNull
    private InboundEventType type;

    @Size(max = 4096)
    private String payload;

    private Instant timestamp;

    private String username;

    private String firstName;

    private String eventId;

    /**
     * Text starting with a slash is a command whatever the adapter reported.
     */
    public InboundEventType effectiveType() {
        if (type == InboundEventType.TEXT && payload != null && payload.trim().startsWith("/")) {
            return InboundEventType.COMMAND;
        }
        return type;
    }

    public String trimmedPayload() {
        return payload == null ? "" : payload.trim();
    }
}
