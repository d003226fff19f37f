package com.example.fok.domain;

import java.io.Serializable;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class User implements Serializable {

    private String id;
    private String username;
    private String firstName;
    private String displayName;
    private String phone;
    @Builder.Default
    private UserRole role = UserRole.NONE;
    @Builder.Default
    private RegistrationState registrationState = RegistrationState.STARTED;
    private boolean blocked;
    private int totalApplications;
    private Instant createdAt;
    private Instant lastActivityAt;
    private Long version;

    public boolean isRegistered() {
        return registrationState == RegistrationState.COMPLETED;
    }
}
