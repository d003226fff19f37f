package com.example.fok.controller;

import com.example.fok.domain.User;
import com.example.fok.dto.UserRoleResponse;
import com.example.fok.service.AdminAuthorizationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin/users")
public class AdminController {

    private static final String ACTOR_HEADER = "X-Actor-Id";

    private final AdminAuthorizationService authorizationService;

    public AdminController(AdminAuthorizationService authorizationService) {
        this.authorizationService = authorizationService;
    }

    @GetMapping("/{userId}/role")
    public ResponseEntity<UserRoleResponse> role(
            @PathVariable String userId, @RequestHeader(ACTOR_HEADER) String actorId) {
        if (!userId.equals(actorId)) {
            authorizationService.requireAdmin(actorId);
        }
        return ResponseEntity.ok(new UserRoleResponse(userId, authorizationService.roleOf(userId)));
    }

    @PostMapping("/{userId}/admin")
    public ResponseEntity<UserRoleResponse> grantAdmin(
            @PathVariable String userId, @RequestHeader(ACTOR_HEADER) String actorId) {
        User user = authorizationService.grantAdmin(actorId, userId);
        return ResponseEntity.ok(new UserRoleResponse(user.getId(), authorizationService.roleOf(user.getId())));
    }

    @DeleteMapping("/{userId}/admin")
    public ResponseEntity<UserRoleResponse> revokeAdmin(
            @PathVariable String userId, @RequestHeader(ACTOR_HEADER) String actorId) {
        User user = authorizationService.revokeAdmin(actorId, userId);
        return ResponseEntity.ok(new UserRoleResponse(user.getId(), user.getRole()));
    }

    @PostMapping("/{userId}/block")
    public ResponseEntity<Void> block(@PathVariable String userId, @RequestHeader(ACTOR_HEADER) String actorId) {
        authorizationService.setBlocked(actorId, userId, true);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{userId}/block")
    public ResponseEntity<Void> unblock(@PathVariable String userId, @RequestHeader(ACTOR_HEADER) String actorId) {
        authorizationService.setBlocked(actorId, userId, false);
        return ResponseEntity.noContent().build();
    }
}
