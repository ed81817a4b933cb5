package io.causelog.projection;

import com.fasterxml.jackson.databind.JsonNode;
import io.causelog.model.Event;

import java.util.Optional;

/**
 * A read model rebuilt by dispatching events to it.
 *
 * <p>For each event the dispatcher resolves a handler in this order: a handler registered
 * under the event's command, then a named query registered under the command, then
 * {@link #handleDefault}. The default branch is mandatory.
 */
public interface Projection {
    Optional<CommandHandler> handler(String command);

    default Optional<NamedQuery> query(String command) {
        return Optional.empty();
    }

    Object handleDefault(JsonNode payload, EventMeta meta) throws Exception;

    default void done(Event row, Object result) {
    }

    default void error(DispatchError error) {
    }

    default MigrationTable migrations() {
        return MigrationTable.empty();
    }

    static DefaultProjection.Builder builder() {
        return DefaultProjection.builder();
    }
}
