package com.indigententerprises.applications.toolkit.serviceinterfaces;

public interface RetryMechanism {
    /**
     * @param retryCount 1-based attempt number
     * @return delay in milliseconds before that attempt
     */
    long getDelay(int retryCount);
}
