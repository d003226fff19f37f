package com.example.fok.notification;

import lombok.extern.slf4j.Slf4j;

/**
 * Writes notifications to the log. Used when no messenger token is configured.
 */
@Slf4j
public class LoggingNotificationChannel implements NotificationChannel {

    @Override
    public void send(String recipientId, String text) {
        log.info("Notification for {}:\n{}", recipientId, text);
    }
}
