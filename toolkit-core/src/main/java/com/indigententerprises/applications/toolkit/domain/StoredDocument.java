package com.indigententerprises.applications.toolkit.domain;

import java.time.Instant;

public record StoredDocument(
        String id,
        int version,
        String json,
        Instant createdAt,
        Instant updatedAt
) {}
