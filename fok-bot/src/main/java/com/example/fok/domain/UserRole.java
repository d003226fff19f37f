package com.example.fok.domain;

public enum UserRole {
    NONE,
    ADMIN,
    SUPER_ADMIN;

    public boolean isStaff() {
        return this != NONE;
    }
}
