package com.example.fok.config;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "fok")
public class FokProperties {

    @NestedConfigurationProperty
    private final Redis redis = new Redis();

    @NestedConfigurationProperty
    private final RateLimit rateLimit = new RateLimit();

    @NestedConfigurationProperty
    private final Conversation conversation = new Conversation();

    @NestedConfigurationProperty
    private final Lifecycle lifecycle = new Lifecycle();

    @NestedConfigurationProperty
    private final Kafka kafka = new Kafka();

    @NestedConfigurationProperty
    private final Outbox outbox = new Outbox();

    @NestedConfigurationProperty
    private final Delivery delivery = new Delivery();

    @NestedConfigurationProperty
    private final Admin admin = new Admin();

    @NestedConfigurationProperty
    private final Telegram telegram = new Telegram();

    public Redis getRedis() {
        return redis;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public Conversation getConversation() {
        return conversation;
    }

    public Lifecycle getLifecycle() {
        return lifecycle;
    }

    public Kafka getKafka() {
        return kafka;
    }

    public Outbox getOutbox() {
        return outbox;
    }

    public Delivery getDelivery() {
        return delivery;
    }

    public Admin getAdmin() {
        return admin;
    }

    public Telegram getTelegram() {
        return telegram;
    }

    @Validated
    public static class Redis {

        /**
         * Prefix applied to all Redis keys controlled by the bot.
         */
        private String keyPrefix = "fok";

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }
    }

    @Validated
    public static class RateLimit {

        /**
         * Toggle to enable or disable per-user rate limiting.
         */
        private boolean enabled = true;

        /**
         * Maximum number of inbound events a user may send per window.
         */
        private int requests = 30;

        /**
         * Length of the fixed counting window. Plain numbers are read as seconds.
         */
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration window = Duration.ofSeconds(60);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getRequests() {
            return requests;
        }

        public void setRequests(int requests) {
            this.requests = requests;
        }

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }
    }

    @Validated
    public static class Conversation {

        /**
         * Idle time after which an unfinished dialog is considered abandoned.
         */
        private Duration sessionTimeout = Duration.ofMinutes(30);

        public Duration getSessionTimeout() {
            return sessionTimeout;
        }

        public void setSessionTimeout(Duration sessionTimeout) {
            this.sessionTimeout = sessionTimeout;
        }
    }

    @Validated
    public static class Lifecycle {

        /**
         * Attempts of the read-compare-write cycle before a transition fails with a conflict.
         */
        private int maxTransitionAttempts = 3;

        private int defaultPageSize = 10;

        private int maxPageSize = 50;

        public int getMaxTransitionAttempts() {
            return maxTransitionAttempts;
        }

        public void setMaxTransitionAttempts(int maxTransitionAttempts) {
            this.maxTransitionAttempts = maxTransitionAttempts;
        }

        public int getDefaultPageSize() {
            return defaultPageSize;
        }

        public void setDefaultPageSize(int defaultPageSize) {
            this.defaultPageSize = defaultPageSize;
        }

        public int getMaxPageSize() {
            return maxPageSize;
        }

        public void setMaxPageSize(int maxPageSize) {
            this.maxPageSize = maxPageSize;
        }
    }

    @Validated
    public static class Kafka {

        /**
         * Topic consumed by the delivery workers.
         */
        private String notificationTopic = "fok.notifications";

        /**
         * Topic receiving notifications whose delivery retries were exhausted.
         */
        private String deadLetterTopic = "fok.notifications.dlt";

        private String deliveryGroup = "fok-delivery";

        private int partitions = 6;

        /**
         * Maximum time to wait for the broker to acknowledge a notification.
         */
        private Duration sendTimeout = Duration.ofSeconds(5);

        public String getNotificationTopic() {
            return notificationTopic;
        }

        public void setNotificationTopic(String notificationTopic) {
            this.notificationTopic = notificationTopic;
        }

        public String getDeadLetterTopic() {
            return deadLetterTopic;
        }

        public void setDeadLetterTopic(String deadLetterTopic) {
            this.deadLetterTopic = deadLetterTopic;
        }

        public String getDeliveryGroup() {
            return deliveryGroup;
        }

        public void setDeliveryGroup(String deliveryGroup) {
            this.deliveryGroup = deliveryGroup;
        }

        public int getPartitions() {
            return partitions;
        }

        public void setPartitions(int partitions) {
            this.partitions = partitions;
        }

        public Duration getSendTimeout() {
            return sendTimeout;
        }

        public void setSendTimeout(Duration sendTimeout) {
            this.sendTimeout = sendTimeout;
        }
    }

    @Validated
    public static class Outbox {

        /**
         * Interval between outbox relay cycles.
         */
        private Duration pollInterval = Duration.ofSeconds(2);

        /**
         * Maximum rows handed to the queue per relay cycle.
         */
        private int batchSize = 100;

        /**
         * Relay attempts after which a row is no longer picked up. Zero or less retries forever.
         */
        private int maxAttempts = 10;

        /**
         * How long dispatched rows are kept before they are purged.
         */
        private Duration retention = Duration.ofDays(7);

        /**
         * Schedule of the purge of dispatched rows.
         */
        private String purgeCron = "0 30 3 * * *";

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }

        public String getPurgeCron() {
            return purgeCron;
        }

        public void setPurgeCron(String purgeCron) {
            this.purgeCron = purgeCron;
        }
    }

    @Validated
    public static class Delivery {

        private Duration retryInterval = Duration.ofSeconds(60);

        private long maxRetries = 3;

        /**
         * How long a delivered notification id is remembered to suppress redelivery.
         */
        private Duration dedupeTtl = Duration.ofHours(24);

        public Duration getRetryInterval() {
            return retryInterval;
        }

        public void setRetryInterval(Duration retryInterval) {
            this.retryInterval = retryInterval;
        }

        public long getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(long maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getDedupeTtl() {
            return dedupeTtl;
        }

        public void setDedupeTtl(Duration dedupeTtl) {
            this.dedupeTtl = dedupeTtl;
        }
    }

    @Validated
    public static class Admin {

        /**
         * Chat receiving staff notifications in addition to individual admins. Blank disables it.
         */
        private String chatId;

        /**
         * Identities treated as super admins regardless of their stored role.
         */
        private List<String> superAdminIds = new ArrayList<>();

        public String getChatId() {
            return chatId;
        }

        public void setChatId(String chatId) {
            this.chatId = chatId;
        }

        public List<String> getSuperAdminIds() {
            return superAdminIds;
        }

        public void setSuperAdminIds(List<String> superAdminIds) {
            this.superAdminIds = superAdminIds;
        }
    }

    @Validated
    public static class Telegram {

        private boolean enabled;

        private String token;

        private String username;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }
    }
}
