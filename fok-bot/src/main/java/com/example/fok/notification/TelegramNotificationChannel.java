package com.example.fok.notification;

import lombok.extern.slf4j.Slf4j;
import org.telegram.telegrambots.bots.DefaultAbsSender;
import org.telegram.telegrambots.bots.DefaultBotOptions;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

@Slf4j
public class TelegramNotificationChannel extends DefaultAbsSender implements NotificationChannel {

    public TelegramNotificationChannel(String botToken) {
        super(new DefaultBotOptions(), botToken);
    }

    @Override
    public void send(String recipientId, String text) {
        try {
            execute(SendMessage.builder()
                    .chatId(recipientId)
                    .text(text)
                    .parseMode("HTML")
                    .disableWebPagePreview(true)
                    .build());
        } catch (TelegramApiException e) {
            throw new NotificationDeliveryException("Telegram rejected message for " + recipientId, e);
        }
    }
}
