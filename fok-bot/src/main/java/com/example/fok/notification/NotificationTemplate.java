package com.example.fok.notification;

public enum NotificationTemplate {
    /**
     * Sent to staff when a user submits a new application.
     */
    APPLICATION_CREATED,
    /**
     * Sent to the owner when an application moves to another status.
     */
    APPLICATION_STATUS_CHANGED
}
