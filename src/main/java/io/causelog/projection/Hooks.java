package io.causelog.projection;

import io.causelog.model.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Notification callbacks run after a dispatch: one per command with a default fallback,
 * plus an error hook. Hooks are expected not to throw.
 */
public final class Hooks {
    private static final Logger logger = LoggerFactory.getLogger(Hooks.class);
    private static final ResultHook NO_RESULT = (result, row) -> {
    };
    private static final ErrorHook NO_ERROR = error -> {
    };

    private final Map<String, ResultHook> byCommand;
    private final ResultHook fallback;
    private final ErrorHook onError;

    private Hooks(Map<String, ResultHook> byCommand, ResultHook fallback, ErrorHook onError) {
        this.byCommand = Map.copyOf(byCommand);
        this.fallback = fallback;
        this.onError = onError;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Ignores results and errors.
     */
    public static Hooks silent() {
        return new Hooks(Map.of(), NO_RESULT, NO_ERROR);
    }

    /**
     * Logs results at DEBUG and errors at WARN.
     */
    public static Hooks logging() {
        return new Hooks(
                Map.of(),
                (result, row) -> logger.debug("{} (event {}) processed with result {}", row.command(), row.id(), result),
                Hooks::logError
        );
    }

    /**
     * Ignores results, logs errors at WARN.
     */
    public static Hooks errorsOnly() {
        return new Hooks(Map.of(), NO_RESULT, Hooks::logError);
    }

    public ResultHook resultHook(String command) {
        ResultHook hook = command == null ? null : byCommand.get(command);
        return hook == null ? fallback : hook;
    }

    public void error(DispatchError error) {
        onError.onError(error);
    }

    private static void logError(DispatchError error) {
        logger.warn("{} [kind={}, id={}, correlationId={}, causationId={}]",
                error.message(), error.kind(), error.id(), error.correlationId(), error.causationId(), error.error());
    }

    @FunctionalInterface
    public interface ResultHook {
        void onResult(Object result, Event row);
    }

    @FunctionalInterface
    public interface ErrorHook {
        void onError(DispatchError error);
    }

    public static final class Builder {
        private final Map<String, ResultHook> byCommand = new HashMap<>();
        private ResultHook fallback = NO_RESULT;
        private ErrorHook onError = NO_ERROR;

        private Builder() {
        }

        public Builder on(String command, ResultHook hook) {
            byCommand.put(command, hook);
            return this;
        }

        public Builder otherwise(ResultHook hook) {
            this.fallback = hook;
            return this;
        }

        public Builder onError(ErrorHook hook) {
            this.onError = hook;
            return this;
        }

        public Hooks build() {
            return new Hooks(byCommand, fallback, onError);
        }
    }
}
