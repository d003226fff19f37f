package com.example.fok.notification;

public record OutboxEntry(long id, Notification notification, int attempts) {
}
