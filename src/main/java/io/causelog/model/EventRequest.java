package io.causelog.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Input to {@code store}. Only {@code command} is required; absent fields take their
 * defaults when the row is written (empty actor/origin, empty object payload and
 * metadata, version 1).
 */
public record EventRequest(
        String actor,
        String origin,
        String command,
        JsonNode payload,
        Integer version,
        String correlationId,
        Long causationId,
        JsonNode metadata
) {
    public static EventRequest of(String command, JsonNode payload) {
        return new EventRequest(null, null, command, payload, null, null, null, null);
    }

    public static EventRequest of(String command) {
        return of(command, null);
    }

    public EventRequest withActor(String actor) {
        return new EventRequest(actor, origin, command, payload, version, correlationId, causationId, metadata);
    }

    public EventRequest withOrigin(String origin) {
        return new EventRequest(actor, origin, command, payload, version, correlationId, causationId, metadata);
    }

    public EventRequest withVersion(int version) {
        return new EventRequest(actor, origin, command, payload, version, correlationId, causationId, metadata);
    }

    public EventRequest withCorrelationId(String correlationId) {
        return new EventRequest(actor, origin, command, payload, version, correlationId, causationId, metadata);
    }

    public EventRequest causedBy(Long causationId) {
        return new EventRequest(actor, origin, command, payload, version, correlationId, causationId, metadata);
    }

    public EventRequest withMetadata(JsonNode metadata) {
        return new EventRequest(actor, origin, command, payload, version, correlationId, causationId, metadata);
    }

    public boolean hasCommand() {
        return command != null && !command.isBlank();
    }

    /**
     * Absent versions default to 1; explicit ones must be at least 1.
     */
    public boolean hasValidVersion() {
        return version == null || version >= 1;
    }

    public boolean hasCorrelationId() {
        return correlationId != null && !correlationId.isBlank();
    }
}
