package com.example.fok.config;

import com.example.fok.notification.Notification;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.listener.DeadLetterPublishingRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.kafka.support.serializer.ErrorHandlingDeserializer;
import org.springframework.kafka.support.serializer.JsonDeserializer;
import org.springframework.kafka.support.serializer.JsonSerializer;
import org.springframework.util.backoff.FixedBackOff;

@Slf4j
@Configuration
public class KafkaConfig {

    @Bean
    public ProducerFactory<String, Notification> notificationProducerFactory(
            KafkaProperties properties, ObjectMapper objectMapper) {
        return new DefaultKafkaProducerFactory<>(
                properties.buildProducerProperties(),
                new StringSerializer(),
                new JsonSerializer<>(objectMapper));
    }

    @Bean
    public KafkaTemplate<String, Notification> notificationKafkaTemplate(
            ProducerFactory<String, Notification> notificationProducerFactory) {
        return new KafkaTemplate<>(notificationProducerFactory);
    }

    @Bean
    public ConsumerFactory<String, Notification> notificationConsumerFactory(
            KafkaProperties properties, ObjectMapper objectMapper) {
        JsonDeserializer<Notification> valueDeserializer =
                new JsonDeserializer<>(Notification.class, objectMapper, false);
        return new DefaultKafkaConsumerFactory<>(
                properties.buildConsumerProperties(),
                new StringDeserializer(),
                new ErrorHandlingDeserializer<>(valueDeserializer));
    }

    /**
     * Failed deliveries are retried at a fixed interval; exhausted records are parked on the dead-letter topic.
     */
    @Bean
    public DefaultErrorHandler notificationErrorHandler(
            KafkaTemplate<String, Notification> notificationKafkaTemplate, FokProperties fokProperties) {
        String deadLetterTopic = fokProperties.getKafka().getDeadLetterTopic();
        DeadLetterPublishingRecoverer deadLetters = new DeadLetterPublishingRecoverer(
                notificationKafkaTemplate, (record, ex) -> new TopicPartition(deadLetterTopic, -1));
        FokProperties.Delivery delivery = fokProperties.getDelivery();
        return new DefaultErrorHandler(
                (record, ex) -> {
                    log.error("Notification delivery exhausted for record {} (key {}), moving to {}",
                            record.offset(), record.key(), deadLetterTopic, ex);
                    deadLetters.accept(record, ex);
                },
                new FixedBackOff(delivery.getRetryInterval().toMillis(), delivery.getMaxRetries()));
    }

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, Notification> notificationListenerContainerFactory(
            ConsumerFactory<String, Notification> notificationConsumerFactory,
            DefaultErrorHandler notificationErrorHandler) {
        ConcurrentKafkaListenerContainerFactory<String, Notification> factory =
                new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(notificationConsumerFactory);
        factory.setCommonErrorHandler(notificationErrorHandler);
        return factory;
    }

    @Bean
    public NewTopic notificationTopic(FokProperties fokProperties) {
        return TopicBuilder.name(fokProperties.getKafka().getNotificationTopic())
                .partitions(fokProperties.getKafka().getPartitions())
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic notificationDeadLetterTopic(FokProperties fokProperties) {
        return TopicBuilder.name(fokProperties.getKafka().getDeadLetterTopic())
                .partitions(1)
                .replicas(1)
                .build();
    }
}
