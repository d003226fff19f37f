package com.example.fok.persistence;

import com.example.fok.notification.Notification;
import com.example.fok.notification.OutboxEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationOutboxMapper {

    private static final TypeReference<Map<String, String>> PARAMS_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public NotificationOutboxEntity toEntity(Notification notification) {
        NotificationOutboxEntity entity = new NotificationOutboxEntity();
        entity.setNotificationId(notification.getNotificationId());
        entity.setTargetId(notification.getTarget());
        entity.setTemplate(notification.getTemplate());
        entity.setParams(writeParams(notification.getParams()));
        entity.setCreatedAt(notification.getCreatedAt());
        entity.setAttempts(0);
        return entity;
    }

    public OutboxEntry toEntry(NotificationOutboxEntity entity) {
        Notification notification = Notification.builder()
                .notificationId(entity.getNotificationId())
                .target(entity.getTargetId())
                .template(entity.getTemplate())
                .params(readParams(entity.getNotificationId(), entity.getParams()))
                .createdAt(entity.getCreatedAt())
                .build();
        return new OutboxEntry(entity.getId(), notification, entity.getAttempts());
    }

    private String writeParams(Map<String, String> params) {
        if (CollectionUtils.isEmpty(params)) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(params);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize notification parameters", e);
        }
    }

    private Map<String, String> readParams(String notificationId, String json) {
        if (!StringUtils.hasText(json)) {
            return new HashMap<>();
        }
        try {
            return objectMapper.readValue(json, PARAMS_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable parameters on outbox notification {}", notificationId, e);
            return new HashMap<>();
        }
    }
}
