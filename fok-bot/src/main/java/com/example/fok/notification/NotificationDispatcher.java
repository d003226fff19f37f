package com.example.fok.notification;

import com.example.fok.config.FokProperties;
import com.example.fok.service.exception.ErrorCode;
import com.example.fok.service.exception.ServiceException;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Hands notifications to the delivery queue. Returns only after the broker acknowledged the record.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationDispatcher {

    private final KafkaTemplate<String, Notification> notificationKafkaTemplate;
    private final FokProperties fokProperties;

    public boolean enqueue(Notification notification) {
        if (notification == null
                || !StringUtils.hasText(notification.getNotificationId())
                || !StringUtils.hasText(notification.getTarget())
                || notification.getTemplate() == null) {
            throw new ServiceException(ErrorCode.BAD_REQUEST, "Notification requires id, target and template");
        }
        FokProperties.Kafka kafka = fokProperties.getKafka();
        Duration timeout = kafka.getSendTimeout();
        try {
            notificationKafkaTemplate
                    .send(kafka.getNotificationTopic(), notification.getTarget(), notification)
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.debug("Queued notification {} ({}) for {}",
                    notification.getNotificationId(), notification.getTemplate(), notification.getTarget());
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ServiceException(ErrorCode.STORAGE_UNAVAILABLE, "Interrupted while queueing notification", ex);
        } catch (ExecutionException | TimeoutException | KafkaException ex) {
            throw new ServiceException(ErrorCode.STORAGE_UNAVAILABLE, "Notification queue unavailable", ex);
        }
    }
}
