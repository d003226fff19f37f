package com.example.fok.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Operations gated by role.
 */
public enum Capability {
    TRANSITION_APPLICATIONS(EnumSet.of(UserRole.ADMIN, UserRole.SUPER_ADMIN)),
    VIEW_ALL_APPLICATIONS(EnumSet.of(UserRole.ADMIN, UserRole.SUPER_ADMIN)),
    BLOCK_USERS(EnumSet.of(UserRole.ADMIN, UserRole.SUPER_ADMIN)),
    MANAGE_ADMINS(EnumSet.of(UserRole.SUPER_ADMIN));

    private final Set<UserRole> grantedTo;

    Capability(Set<UserRole> grantedTo) {
        this.grantedTo = grantedTo;
    }

    public boolean isGrantedTo(UserRole role) {
        return role != null && grantedTo.contains(role);
    }
}
