package io.causelog.projection;

import com.fasterxml.jackson.databind.JsonNode;
import io.causelog.model.Event;
import io.causelog.model.EventRequest;

/**
 * Structured failure report sent to {@code Hooks} and {@link Projection#error}.
 * {@code id} and {@code timestamp} are {@code null} when nothing was persisted.
 */
public record DispatchError(
        Kind kind,
        String message,
        Throwable error,
        String command,
        JsonNode payload,
        String actor,
        String origin,
        Long id,
        int version,
        Long timestamp,
        String correlationId,
        Long causationId,
        JsonNode metadata
) {
    public enum Kind {
        /** Request refused before anything was written. */
        VALIDATION,
        /** Handler, migration or result hook threw while dispatching a persisted row. */
        HANDLER
    }

    public static DispatchError validation(String message, EventRequest request) {
        return new DispatchError(
                Kind.VALIDATION,
                message,
                null,
                request.command(),
                request.payload(),
                request.actor(),
                request.origin(),
                null,
                request.version() == null ? 1 : request.version(),
                null,
                request.correlationId(),
                request.causationId(),
                request.metadata()
        );
    }

    public static DispatchError handler(Event row, Throwable error) {
        String message = display(row.actor()) + " at " + display(row.origin()) + " initiated "
                + row.command() + " that led to an error: " + error.getMessage();
        return new DispatchError(
                Kind.HANDLER,
                message,
                error,
                row.command(),
                row.payload(),
                row.actor(),
                row.origin(),
                row.id(),
                row.version(),
                row.timestamp(),
                row.correlationId(),
                row.causationId(),
                row.metadata()
        );
    }

    private static String display(String value) {
        return value == null || value.isBlank() ? "<unknown>" : value;
    }
}
