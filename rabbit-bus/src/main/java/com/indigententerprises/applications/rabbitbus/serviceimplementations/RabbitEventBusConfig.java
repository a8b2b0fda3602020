package com.indigententerprises.applications.rabbitbus.serviceimplementations;

import com.indigententerprises.applications.toolkit.serviceimplementations.ExponentialBackoff;
import com.indigententerprises.applications.toolkit.serviceinterfaces.RetryMechanism;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * maxAttempts is compared with the broker's x-delivery-count: a message is requeued while the
 * count is below it and dead-lettered afterwards.
 */
public final class RabbitEventBusConfig {

    private final String amqpUri;
    private final String exchangeName;
    private final String deadLetterExchangeName;
    private final String deadLetterQueueName;
    private final int consumerPrefetch;
    private final int maxAttempts;
    private final RetryMechanism retryMechanism;
    private final String queuePrefix;
    private final long queueExpirationMs;
    private final long reconnectionDelayMs;
    private final long confirmTimeoutMs;
    private final Logger logger;

    private RabbitEventBusConfig(final Builder builder) {
        this.amqpUri = builder.amqpUri;
        this.exchangeName = builder.exchangeName;
        this.deadLetterExchangeName = builder.deadLetterExchangeName != null
                ? builder.deadLetterExchangeName
                : builder.exchangeName + ".dlx";
        this.deadLetterQueueName = builder.deadLetterQueueName != null
                ? builder.deadLetterQueueName
                : builder.exchangeName + ".dlq";
        this.consumerPrefetch = builder.consumerPrefetch;
        this.maxAttempts = builder.maxAttempts;
        this.retryMechanism = builder.retryMechanism != null
                ? builder.retryMechanism
                : new ExponentialBackoff(1000L);
        this.queuePrefix = builder.queuePrefix;
        this.queueExpirationMs = builder.queueExpirationMs;
        this.reconnectionDelayMs = builder.reconnectionDelayMs;
        this.confirmTimeoutMs = builder.confirmTimeoutMs;
        this.logger = builder.logger;
    }

    public static Builder builder(final String amqpUri, final String exchangeName) {
        return new Builder(amqpUri, exchangeName);
    }

    public String getAmqpUri() {
        return amqpUri;
    }

    public String getExchangeName() {
        return exchangeName;
    }

    public String getDeadLetterExchangeName() {
        return deadLetterExchangeName;
    }

    public String getDeadLetterQueueName() {
        return deadLetterQueueName;
    }

    public int getConsumerPrefetch() {
        return consumerPrefetch;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public RetryMechanism getRetryMechanism() {
        return retryMechanism;
    }

    public String getQueuePrefix() {
        return queuePrefix;
    }

    public long getQueueExpirationMs() {
        return queueExpirationMs;
    }

    public long getReconnectionDelayMs() {
        return reconnectionDelayMs;
    }

    public long getConfirmTimeoutMs() {
        return confirmTimeoutMs;
    }

    public Logger getLogger(final Class<?> component) {
        return logger != null ? logger : LoggerFactory.getLogger(component);
    }

    public static final class Builder {
        private final String amqpUri;
        private final String exchangeName;
        private String deadLetterExchangeName;
        private String deadLetterQueueName;
        private int consumerPrefetch = 10;
        private int maxAttempts = 3;
        private RetryMechanism retryMechanism;
        private String queuePrefix = "";
        private long queueExpirationMs = 30 * 60_000L;
        private long reconnectionDelayMs = 2000L;
        private long confirmTimeoutMs = 5000L;
        private Logger logger;

        private Builder(final String amqpUri, final String exchangeName) {
            this.amqpUri = Objects.requireNonNull(amqpUri, "amqpUri");
            this.exchangeName = Objects.requireNonNull(exchangeName, "exchangeName");
        }

        public Builder deadLetterExchangeName(final String deadLetterExchangeName) {
            this.deadLetterExchangeName = deadLetterExchangeName;
            return this;
        }

        public Builder deadLetterQueueName(final String deadLetterQueueName) {
            this.deadLetterQueueName = deadLetterQueueName;
            return this;
        }

        public Builder consumerPrefetch(final int consumerPrefetch) {
            this.consumerPrefetch = consumerPrefetch;
            return this;
        }

        public Builder maxAttempts(final int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be at least 1");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder retryMechanism(final RetryMechanism retryMechanism) {
            this.retryMechanism = retryMechanism;
            return this;
        }

        public Builder queuePrefix(final String queuePrefix) {
            this.queuePrefix = queuePrefix == null ? "" : queuePrefix;
            return this;
        }

        public Builder queueExpirationMs(final long queueExpirationMs) {
            this.queueExpirationMs = queueExpirationMs;
            return this;
        }

        public Builder reconnectionDelayMs(final long reconnectionDelayMs) {
            this.reconnectionDelayMs = reconnectionDelayMs;
            return this;
        }

        public Builder confirmTimeoutMs(final long confirmTimeoutMs) {
            this.confirmTimeoutMs = confirmTimeoutMs;
            return this;
        }

        public Builder logger(final Logger logger) {
            this.logger = logger;
            return this;
        }

        public RabbitEventBusConfig build() {
            return new RabbitEventBusConfig(this);
        }
    }
}
