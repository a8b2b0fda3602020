package com.indigententerprises.applications.toolkit.serviceimplementations;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * contextName partitions one outbox table between bounded contexts; null is a context of its own.
 */
public final class OutboxConfig {

    private final String tableName;
    private final String contextName;
    private final long monitoringIntervalMs;
    private final long claimLeaseMs;
    private final int publishThreads;
    private final Logger logger;

    private OutboxConfig(final Builder builder) {
        this.tableName = builder.tableName;
        this.contextName = builder.contextName;
        this.monitoringIntervalMs = builder.monitoringIntervalMs;
        this.claimLeaseMs = builder.claimLeaseMs;
        this.publishThreads = builder.publishThreads;
        this.logger = builder.logger;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getTableName() {
        return tableName;
    }

    public String getContextName() {
        return contextName;
    }

    public long getMonitoringIntervalMs() {
        return monitoringIntervalMs;
    }

    public long getClaimLeaseMs() {
        return claimLeaseMs;
    }

    public int getPublishThreads() {
        return publishThreads;
    }

    public Logger getLogger(final Class<?> component) {
        return logger != null ? logger : LoggerFactory.getLogger(component);
    }

    public static final class Builder {
        private String tableName = "outbox";
        private String contextName;
        private long monitoringIntervalMs = 500L;
        private long claimLeaseMs = 60_000L;
        private int publishThreads = 4;
        private Logger logger;

        private Builder() {}

        public Builder tableName(final String tableName) {
            this.tableName = tableName;
            return this;
        }

        public Builder contextName(final String contextName) {
            this.contextName = contextName;
            return this;
        }

        public Builder monitoringIntervalMs(final long monitoringIntervalMs) {
            if (monitoringIntervalMs <= 0) {
                throw new IllegalArgumentException("monitoringIntervalMs must be positive");
            }
            this.monitoringIntervalMs = monitoringIntervalMs;
            return this;
        }

        public Builder claimLeaseMs(final long claimLeaseMs) {
            if (claimLeaseMs <= 0) {
                throw new IllegalArgumentException("claimLeaseMs must be positive");
            }
            this.claimLeaseMs = claimLeaseMs;
            return this;
        }

        public Builder publishThreads(final int publishThreads) {
            if (publishThreads < 1) {
                throw new IllegalArgumentException("publishThreads must be at least 1");
            }
            this.publishThreads = publishThreads;
            return this;
        }

        public Builder logger(final Logger logger) {
            this.logger = logger;
            return this;
        }

        public OutboxConfig build() {
            return new OutboxConfig(this);
        }
    }
}
