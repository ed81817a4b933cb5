package io.causelog.projection;

import com.fasterxml.jackson.databind.JsonNode;
import io.causelog.model.Event;

/**
 * Row context handed to a handler next to the migrated payload.
 */
public record EventMeta(
        long timestamp,
        String actor,
        String origin,
        String command,
        long id,
        int version,
        String correlationId,
        Long causationId,
        JsonNode metadata
) {
    public static EventMeta from(Event row) {
        return new EventMeta(
                row.timestamp(),
                row.actor(),
                row.origin(),
                row.command(),
                row.id(),
                row.version(),
                row.correlationId(),
                row.causationId(),
                row.metadata()
        );
    }
}
