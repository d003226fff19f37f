package com.example.fok.persistence;

import com.example.fok.domain.RegistrationState;
import com.example.fok.domain.UserRole;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(name = "users", indexes = @Index(name = "ix_users_role", columnList = "role"))
public class UserEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "username", length = 128)
    private String username;

    @Column(name = "first_name", length = 255)
    private String firstName;

    @Column(name = "display_name", length = 255)
    private String displayName;

    @Column(name = "phone", length = 32)
    private String phone;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 32)
    private UserRole role;

    @Enumerated(EnumType.STRING)
    @Column(name = "registration_state", nullable = false, length = 32)
    private RegistrationState registrationState;

    @Column(name = "blocked", nullable = false)
    private boolean blocked;

    @Column(name = "total_applications", nullable = false)
    private int totalApplications;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "last_activity_at")
    private Instant lastActivityAt;

    @Version
    @Column(name = "version")
    private Long version;
}
