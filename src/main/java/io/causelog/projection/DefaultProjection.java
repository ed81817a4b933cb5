package io.causelog.projection;

import com.fasterxml.jackson.databind.JsonNode;
import io.causelog.model.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Registry-backed {@link Projection}: handlers and queries keyed by command name.
 */
public final class DefaultProjection implements Projection {
    private static final Logger logger = LoggerFactory.getLogger(DefaultProjection.class);

    private final Map<String, CommandHandler> handlers;
    private final Map<String, NamedQuery> queries;
    private final CommandHandler fallback;
    private final BiConsumer<Event, Object> onDone;
    private final Consumer<DispatchError> onError;
    private final MigrationTable migrations;

    private DefaultProjection(Builder builder) {
        this.handlers = Map.copyOf(builder.handlers);
        this.queries = Map.copyOf(builder.queries);
        this.fallback = builder.fallback;
        this.onDone = builder.onDone;
        this.onError = builder.onError;
        this.migrations = builder.migrations;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Optional<CommandHandler> handler(String command) {
        return Optional.ofNullable(handlers.get(command));
    }

    @Override
    public Optional<NamedQuery> query(String command) {
        return Optional.ofNullable(queries.get(command));
    }

    @Override
    public Object handleDefault(JsonNode payload, EventMeta meta) throws Exception {
        return fallback.handle(payload, meta);
    }

    @Override
    public void done(Event row, Object result) {
        onDone.accept(row, result);
    }

    @Override
    public void error(DispatchError error) {
        onError.accept(error);
    }

    @Override
    public MigrationTable migrations() {
        return migrations;
    }

    public static final class Builder {
        private final Map<String, CommandHandler> handlers = new HashMap<>();
        private final Map<String, NamedQuery> queries = new HashMap<>();
        private CommandHandler fallback = (payload, meta) -> {
            logger.debug("{} is unknown to the projection; event {} ignored", meta.command(), meta.id());
            return null;
        };
        private BiConsumer<Event, Object> onDone = (row, result) -> {
        };
        private Consumer<DispatchError> onError = error -> {
        };
        private MigrationTable migrations = MigrationTable.empty();

        private Builder() {
        }

        public Builder on(String command, CommandHandler handler) {
            handlers.put(requireCommand(command), handler);
            return this;
        }

        public Builder query(String command, NamedQuery query) {
            queries.put(requireCommand(command), query);
            return this;
        }

        public Builder otherwise(CommandHandler fallback) {
            this.fallback = fallback;
            return this;
        }

        public Builder onDone(BiConsumer<Event, Object> onDone) {
            this.onDone = onDone;
            return this;
        }

        public Builder onError(Consumer<DispatchError> onError) {
            this.onError = onError;
            return this;
        }

        public Builder migrations(MigrationTable migrations) {
            this.migrations = migrations == null ? MigrationTable.empty() : migrations;
            return this;
        }

        public DefaultProjection build() {
            return new DefaultProjection(this);
        }

        private static String requireCommand(String command) {
            if (command == null || command.isBlank()) {
                throw new IllegalArgumentException("command must not be blank");
            }
            return command;
        }
    }
}
