package com.indigententerprises.applications.toolkit.serviceimplementations;

import com.indigententerprises.applications.toolkit.serviceinterfaces.RetryMechanism;

public final class ExponentialBackoff implements RetryMechanism {

    private final long initialDelayMs;
    private final long maxDelayMs;

    public ExponentialBackoff(final long initialDelayMs) {
        this(initialDelayMs, Long.MAX_VALUE);
    }

    public ExponentialBackoff(final long initialDelayMs, final long maxDelayMs) {
        if (initialDelayMs < 0 || maxDelayMs < 0) {
            throw new IllegalArgumentException("delays must not be negative");
        }

        this.initialDelayMs = initialDelayMs;
        this.maxDelayMs = maxDelayMs;
    }

    @Override
    public long getDelay(final int retryCount) {
        final double delay = Math.floor(initialDelayMs * Math.pow(2, retryCount - 1));
        return delay >= maxDelayMs ? maxDelayMs : (long) delay;
    }
}
