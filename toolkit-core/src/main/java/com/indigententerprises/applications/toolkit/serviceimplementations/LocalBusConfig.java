package com.indigententerprises.applications.toolkit.serviceimplementations;

import com.indigententerprises.applications.toolkit.serviceinterfaces.RetryMechanism;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * settings shared by the in-process event and command buses.
 * maxAttempts counts the first attempt: 1 means no retry.
 */
public final class LocalBusConfig {

    private final int maxAttempts;
    private final RetryMechanism retryMechanism;
    private final int dispatchThreads;
    private final Logger logger;

    private LocalBusConfig(final Builder builder) {
        this.maxAttempts = builder.maxAttempts;
        this.retryMechanism = builder.retryMechanism != null
                ? builder.retryMechanism
                : new ExponentialBackoff(builder.retryInitialDelayMs);
        this.dispatchThreads = builder.dispatchThreads;
        this.logger = builder.logger;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static LocalBusConfig defaults() {
        return builder().build();
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public RetryMechanism getRetryMechanism() {
        return retryMechanism;
    }

    public int getDispatchThreads() {
        return dispatchThreads;
    }

    public Logger getLogger(final Class<?> component) {
        return logger != null ? logger : LoggerFactory.getLogger(component);
    }

    public static final class Builder {
        private int maxAttempts = 1;
        private long retryInitialDelayMs = 500L;
        private RetryMechanism retryMechanism;
        private int dispatchThreads = 2;
        private Logger logger;

        private Builder() {}

        public Builder maxAttempts(final int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be at least 1");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder retryInitialDelayMs(final long retryInitialDelayMs) {
            this.retryInitialDelayMs = retryInitialDelayMs;
            return this;
        }

        public Builder retryMechanism(final RetryMechanism retryMechanism) {
            this.retryMechanism = retryMechanism;
            return this;
        }

        public Builder dispatchThreads(final int dispatchThreads) {
            if (dispatchThreads < 1) {
                throw new IllegalArgumentException("dispatchThreads must be at least 1");
            }
            this.dispatchThreads = dispatchThreads;
            return this;
        }

        public Builder logger(final Logger logger) {
            this.logger = logger;
            return this;
        }

        public LocalBusConfig build() {
            return new LocalBusConfig(this);
        }
    }
}
