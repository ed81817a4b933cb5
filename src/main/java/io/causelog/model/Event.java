package io.causelog.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One immutable row of the log. {@code causationId} is {@code null} for root events.
 */
public record Event(
        long id,
        int version,
        long timestamp,
        String actor,
        String origin,
        String command,
        JsonNode payload,
        String correlationId,
        Long causationId,
        JsonNode metadata
) {
    public boolean isRoot() {
        return causationId == null;
    }
}
