package com.example.fok.notification;

import com.example.fok.config.FokProperties;
import com.example.fok.service.AdminAuthorizationService;
import com.example.fok.service.AtomicKeyStore;
import com.example.fok.service.RedisKeyFactory;
import com.example.fok.service.exception.ServiceException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Consumes queued notifications and sends them through the configured channel. Admin notifications fan out to
 * the admin chat and every staff member; the record fails, and is retried by the container, only when no
 * recipient could be reached.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationDeliveryWorker {

    private final NotificationChannel notificationChannel;
    private final NotificationRenderer renderer;
    private final AdminAuthorizationService authorizationService;
    private final AtomicKeyStore keyStore;
    private final RedisKeyFactory keyFactory;
    private final FokProperties fokProperties;

    @KafkaListener(
            topics = "${fok.kafka.notification-topic:fok.notifications}",
            groupId = "${fok.kafka.delivery-group:fok-delivery}",
            containerFactory = "notificationListenerContainerFactory")
    public void onNotification(Notification notification) {
        deliver(notification);
    }

    public void deliver(Notification notification) {
        String deliveredKey = keyFactory.deliveredKey(notification.getNotificationId());
        if (alreadyDelivered(deliveredKey)) {
            log.debug("Skipping notification {}: already delivered", notification.getNotificationId());
            return;
        }

        String text = renderer.render(notification);
        List<String> recipients = recipientsOf(notification);
        if (recipients.isEmpty()) {
            log.warn("Notification {} has no recipients", notification.getNotificationId());
            return;
        }

        List<String> failed = new ArrayList<>();
        RuntimeException lastFailure = null;
        for (String recipient : recipients) {
            try {
                notificationChannel.send(recipient, text);
            } catch (RuntimeException ex) {
                failed.add(recipient);
                lastFailure = ex;
                log.warn("Delivery of notification {} to {} failed: {}",
                        notification.getNotificationId(), recipient, ex.getMessage());
            }
        }
        if (failed.size() == recipients.size()) {
            throw new NotificationDeliveryException(
                    "No recipient reachable for notification " + notification.getNotificationId(), lastFailure);
        }
        markDelivered(deliveredKey);
        log.debug("Delivered notification {} to {}/{} recipients",
                notification.getNotificationId(), recipients.size() - failed.size(), recipients.size());
    }

    private List<String> recipientsOf(Notification notification) {
        if (!notification.isForAdmins()) {
            return List.of(notification.getTarget());
        }
        Set<String> recipients = new LinkedHashSet<>();
        String adminChat = fokProperties.getAdmin().getChatId();
        if (StringUtils.hasText(adminChat)) {
            recipients.add(adminChat.trim());
        }
        recipients.addAll(authorizationService.staffIds());
        return List.copyOf(recipients);
    }

    private boolean alreadyDelivered(String key) {
        try {
            return keyStore.exists(key);
        } catch (ServiceException ex) {
            log.warn("Delivery dedupe check unavailable, sending anyway: {}", ex.getMessage());
            return false;
        }
    }

    private void markDelivered(String key) {
        try {
            keyStore.setIfAbsent(key, fokProperties.getDelivery().getDedupeTtl());
        } catch (ServiceException ex) {
            log.warn("Unable to record delivery marker {}: {}", key, ex.getMessage());
        }
    }
}
