package com.example.fok.domain;

import java.util.EnumSet;
import java.util.Set;

public enum ApplicationStatus {
    PENDING("⏳ Ожидает обработки"),
    ACCEPTED("✅ Принята"),
    TRANSFERRED("📤 Передана в учреждение"),
    COMPLETED("🎉 Выполнена"),
    CANCELLED("❌ Отменена");

    private final String displayName;

    ApplicationStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public Set<ApplicationStatus> allowedTargets() {
        return switch (this) {
            case PENDING -> EnumSet.of(ACCEPTED, CANCELLED);
            case ACCEPTED -> EnumSet.of(TRANSFERRED, COMPLETED, CANCELLED);
            case TRANSFERRED -> EnumSet.of(COMPLETED, CANCELLED);
            case COMPLETED, CANCELLED -> EnumSet.noneOf(ApplicationStatus.class);
        };
    }

    public boolean canTransitionTo(ApplicationStatus target) {
        return target != null && allowedTargets().contains(target);
    }

    public boolean isTerminal() {
        return allowedTargets().isEmpty();
    }
}
