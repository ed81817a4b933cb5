package io.causelog.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Ambient transaction context merged into a request by {@code storeWithContext}.
 * Non-null ids override the request's; metadata fields override same-named request fields.
 */
public record EventContext(String correlationId, Long causationId, JsonNode metadata) {
    /**
     * Context for events emitted while handling {@code parent}.
     */
    public static EventContext from(Event parent) {
        return new EventContext(parent.correlationId(), parent.id(), null);
    }
}
