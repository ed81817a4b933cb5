package io.causelog.projection;

import com.fasterxml.jackson.databind.JsonNode;
import io.causelog.model.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Hands one persisted row to a projection: exactly one handler invocation, then exactly one
 * result hook, then {@link Projection#done}. Any failure along the way is reported to the
 * error hook and to {@link Projection#error} and comes back as a failed
 * {@link DispatchResult}; nothing is rethrown.
 */
public final class ProjectionDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(ProjectionDispatcher.class);

    public DispatchResult execute(Event row, Projection projection, Hooks hooks) {
        Object result;
        try {
            JsonNode payload = projection.migrations().apply(row.command(), row.version(), row.payload());
            result = invoke(row, payload, projection);
            hooks.resultHook(row.command()).onResult(result, row);
            projection.done(row, result);
        } catch (Exception e) {
            DispatchError error = DispatchError.handler(row, e);
            logger.debug("Dispatch of event {} ({}) failed", row.id(), row.command(), e);
            report(error, hooks, projection);
            return DispatchResult.fail(error);
        }
        return DispatchResult.ok(result);
    }

    private Object invoke(Event row, JsonNode payload, Projection projection) throws Exception {
        Optional<CommandHandler> handler = projection.handler(row.command());
        if (handler.isPresent()) {
            return handler.get().handle(payload, EventMeta.from(row));
        }
        Optional<NamedQuery> query = projection.query(row.command());
        if (query.isPresent()) {
            return query.get().run(payload);
        }
        return projection.handleDefault(payload, EventMeta.from(row));
    }

    /**
     * Delivers a failure to both sinks. A sink that throws is logged and does not stop the
     * other one from running.
     */
    public static void report(DispatchError error, Hooks hooks, Projection projection) {
        try {
            hooks.error(error);
        } catch (RuntimeException e) {
            logger.warn("Error hook threw while reporting event {} ({})", error.id(), error.command(), e);
        }
        if (projection == null) {
            return;
        }
        try {
            projection.error(error);
        } catch (RuntimeException e) {
            logger.warn("Projection error hook threw while reporting event {} ({})", error.id(), error.command(), e);
        }
    }
}
