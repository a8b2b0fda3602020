package com.indigententerprises.applications.toolkit.domain;

public enum OutboxStatus {
    SCHEDULED,
    PROCESSING,
    PUBLISHED
}
