package com.example.fok.notification;

/**
 * Transport that puts rendered text in front of a recipient.
 */
public interface NotificationChannel {

    /**
     * @throws NotificationDeliveryException when the recipient could not be reached
     */
    void send(String recipientId, String text);
}
