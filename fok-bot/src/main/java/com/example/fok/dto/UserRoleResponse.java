package com.example.fok.dto;

import com.example.fok.domain.UserRole;

public record UserRoleResponse(String userId, UserRole role) {
}
