package com.example.fok.config;

import com.example.fok.notification.LoggingNotificationChannel;
import com.example.fok.notification.NotificationChannel;
import com.example.fok.notification.TelegramNotificationChannel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

@Slf4j
@Configuration
public class NotificationChannelConfig {

    @Bean
    @ConditionalOnProperty(prefix = "fok.telegram", name = "enabled", havingValue = "true")
    public NotificationChannel telegramNotificationChannel(FokProperties fokProperties) {
        String token = fokProperties.getTelegram().getToken();
        if (!StringUtils.hasText(token)) {
            throw new IllegalStateException("fok.telegram.token must be set when Telegram delivery is enabled");
        }
        log.info("Delivering notifications through Telegram bot {}", fokProperties.getTelegram().getUsername());
        return new TelegramNotificationChannel(token);
    }

    @Bean
    @ConditionalOnProperty(prefix = "fok.telegram", name = "enabled", havingValue = "false", matchIfMissing = true)
    public NotificationChannel loggingNotificationChannel() {
        log.info("Telegram delivery disabled, notifications are written to the log");
        return new LoggingNotificationChannel();
    }
}
