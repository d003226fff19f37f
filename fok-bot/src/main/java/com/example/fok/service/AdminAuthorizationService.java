package com.example.fok.service;

import com.example.fok.config.FokProperties;
import com.example.fok.domain.Capability;
import com.example.fok.domain.User;
import com.example.fok.domain.UserRole;
import com.example.fok.service.exception.ErrorCode;
import com.example.fok.service.exception.ServiceException;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Resolves roles and guards privileged operations. Identities listed in {@code fok.admin.super-admin-ids} are
 * super admins regardless of what the user record says.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdminAuthorizationService {

    private final UserAccountService userAccountService;
    private final FokProperties fokProperties;

    public UserRole roleOf(String userId) {
        if (!StringUtils.hasText(userId)) {
            return UserRole.NONE;
        }
        if (isConfiguredSuperAdmin(userId)) {
            return UserRole.SUPER_ADMIN;
        }
        return userAccountService.find(userId)
                .map(User::getRole)
                .orElse(UserRole.NONE);
    }

    public boolean isAdmin(String userId) {
        return roleOf(userId).isStaff();
    }

    public boolean can(String userId, Capability capability) {
        return capability.isGrantedTo(roleOf(userId));
    }

    public UserRole require(String userId, Capability capability) {
        UserRole role = roleOf(userId);
        if (!capability.isGrantedTo(role)) {
            log.info("Denied {} to {} with role {}", capability, userId, role);
            throw new ServiceException(ErrorCode.FORBIDDEN, "Operation requires additional privileges");
        }
        return role;
    }

    public UserRole requireAdmin(String userId) {
        UserRole role = roleOf(userId);
        if (!role.isStaff()) {
            log.info("Denied admin access to {}", userId);
            throw new ServiceException(ErrorCode.FORBIDDEN, "Operation requires admin privileges");
        }
        return role;
    }

    public User grantAdmin(String actorId, String targetId) {
        require(actorId, Capability.MANAGE_ADMINS);
        User target = userAccountService.require(targetId);
        if (!target.isRegistered()) {
            throw new ServiceException(ErrorCode.UNREGISTERED, "Only registered users can become admins");
        }
        if (target.getRole() == UserRole.ADMIN || target.getRole() == UserRole.SUPER_ADMIN) {
            return target;
        }
        target.setRole(UserRole.ADMIN);
        User saved = userAccountService.save(target);
        log.info("User {} granted admin role to {}", actorId, targetId);
        return saved;
    }

    public User revokeAdmin(String actorId, String targetId) {
        require(actorId, Capability.MANAGE_ADMINS);
        if (isConfiguredSuperAdmin(targetId)) {
            throw new ServiceException(ErrorCode.FORBIDDEN, "Configured super admins cannot be demoted");
        }
        User target = userAccountService.require(targetId);
        if (target.getRole() == UserRole.NONE) {
            return target;
        }
        target.setRole(UserRole.NONE);
        User saved = userAccountService.save(target);
        log.info("User {} revoked admin role from {}", actorId, targetId);
        return saved;
    }

    public User setBlocked(String actorId, String targetId, boolean blocked) {
        UserRole actorRole = require(actorId, Capability.BLOCK_USERS);
        if (actorId.equals(targetId)) {
            throw new ServiceException(ErrorCode.BAD_REQUEST, "Users cannot block themselves");
        }
        if (roleOf(targetId).isStaff() && !Capability.MANAGE_ADMINS.isGrantedTo(actorRole)) {
            throw new ServiceException(ErrorCode.FORBIDDEN, "Only super admins can block staff members");
        }
        User target = userAccountService.require(targetId);
        if (target.isBlocked() == blocked) {
            return target;
        }
        target.setBlocked(blocked);
        User saved = userAccountService.save(target);
        log.info("User {} {} user {}", actorId, blocked ? "blocked" : "unblocked", targetId);
        return saved;
    }

    /**
     * Staff identities for notification fan-out: stored admins plus configured super admins.
     */
    public List<String> staffIds() {
        LinkedHashSet<String> ids = new LinkedHashSet<>();
        userAccountService.findByRoles(EnumSet.of(UserRole.ADMIN, UserRole.SUPER_ADMIN))
                .forEach(user -> ids.add(user.getId()));
        ids.addAll(superAdminIds());
        return List.copyOf(ids);
    }

    private boolean isConfiguredSuperAdmin(String userId) {
        return superAdminIds().contains(userId);
    }

    private List<String> superAdminIds() {
        List<String> configured = fokProperties.getAdmin().getSuperAdminIds();
        return configured == null
                ? List.of()
                : configured.stream().filter(StringUtils::hasText).map(String::trim).toList();
    }
}
