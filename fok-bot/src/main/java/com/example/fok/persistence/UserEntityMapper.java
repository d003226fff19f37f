package com.example.fok.persistence;

import com.example.fok.domain.RegistrationState;
import com.example.fok.domain.User;
import com.example.fok.domain.UserRole;
import org.springframework.stereotype.Component;

@Component
public class UserEntityMapper {

    public UserEntity toEntity(User user) {
        UserEntity entity = new UserEntity();
        entity.setId(user.getId());
        entity.setUsername(user.getUsername());
        entity.setFirstName(user.getFirstName());
        entity.setDisplayName(user.getDisplayName());
        entity.setPhone(user.getPhone());
        entity.setRole(user.getRole() != null ? user.getRole() : UserRole.NONE);
        entity.setRegistrationState(
                user.getRegistrationState() != null ? user.getRegistrationState() : RegistrationState.STARTED);
        entity.setBlocked(user.isBlocked());
        entity.setTotalApplications(user.getTotalApplications());
        entity.setCreatedAt(user.getCreatedAt());
        entity.setLastActivityAt(user.getLastActivityAt());
        entity.setVersion(user.getVersion());
        return entity;
    }

    public User toDomain(UserEntity entity) {
        if (entity == null) {
            return null;
        }
        return User.builder()
                .id(entity.getId())
                .username(entity.getUsername())
                .firstName(entity.getFirstName())
                .displayName(entity.getDisplayName())
                .phone(entity.getPhone())
                .role(entity.getRole())
                .registrationState(entity.getRegistrationState())
                .blocked(entity.isBlocked())
                .totalApplications(entity.getTotalApplications())
                .createdAt(entity.getCreatedAt())
                .lastActivityAt(entity.getLastActivityAt())
                .version(entity.getVersion())
                .build();
    }
}
