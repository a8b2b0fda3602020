package com.indigententerprises.applications.toolkit.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * self-describing wire form of an event: {"name": ..., "payload": {...}}.
 * used by the outbox table and by the broker bus.
 */
public record Envelope(
        String name,
        JsonNode payload
) {
    @JsonIgnore
    public boolean isComplete() {
        return name != null && !name.isBlank() && payload != null && !payload.isNull();
    }
}
