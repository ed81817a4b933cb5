package io.causelog.pattern;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.causelog.model.Event;
import io.causelog.model.EventRequest;
import io.causelog.projection.Hooks;
import io.causelog.projection.Projection;
import io.causelog.storage.EventStore;
import io.causelog.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Writes events as either external (something that happened to the system, a root) or
 * internal (something the system did in response, always caused by a parent).
 *
 * <p>Each helper stores through {@link EventStore#append} and returns the written row.
 * Rejected writes surface as {@link IllegalArgumentException}.
 */
public final class PatternedEventStore {
    private static final Logger logger = LoggerFactory.getLogger(PatternedEventStore.class);
    private static final Set<String> EXTERNAL_PREFIXES = Set.of(
            "user", "time", "webhook", "api", "manual", "scheduled", "motion", "vote", "decision", "external");
    private static final List<String> EXTERNAL_PATTERNS = List.of(
            "Clicked", "Submitted", "Started", "Ended", "Passed", "Failed", "Received", "Expired", "Reached", "Occurred");

    private final EventStore store;
    private final Projection projection;
    private final Hooks hooks;
    private final Options options;
    private final Clock clock;

    public PatternedEventStore(EventStore store, Projection projection, Hooks hooks) {
        this(store, projection, hooks, Options.defaults(), Clock.systemUTC());
    }

    public PatternedEventStore(EventStore store, Projection projection, Hooks hooks, Options options, Clock clock) {
        this.store = store;
        this.projection = projection;
        this.hooks = hooks;
        this.options = options;
        this.clock = clock;
    }

    /**
     * @param metadata may be {@code null}; overrides the {@code eventType}/{@code timestamp} stamp
     */
    public Event storeExternal(EventRequest request, ObjectNode metadata) {
        if (options.enforcePatterns()) {
            if (request.causationId() != null) {
                throw new IllegalArgumentException("External event '" + request.command() + "' cannot have causationId");
            }
            if (!looksExternal(request.command())) {
                logger.warn("'{}' does not follow the external event naming convention", request.command());
            }
        }
        EventRequest effective = request;
        if (options.autoCorrelation() && !request.hasCorrelationId()) {
            effective = effective.withCorrelationId(UUID.randomUUID().toString());
        }
        ObjectNode stamp = Jsons.object();
        stamp.put("eventType", "external");
        stamp.put("timestamp", clock.millis());
        return write(effective.withMetadata(merge(request.metadata(), stamp, metadata)));
    }

    /**
     * @param parentId the causing event; falls back to the request's causation id when {@code null}
     */
    public Event storeInternal(EventRequest request, Long parentId, ObjectNode metadata) {
        Long effectiveParent = parentId != null ? parentId : request.causationId();
        if (options.enforcePatterns()) {
            if (effectiveParent == null) {
                throw new IllegalArgumentException(
                        "Internal event '" + request.command() + "' must have a parent event or causationId");
            }
            if (looksExternal(request.command())) {
                logger.warn("'{}' looks like an external event but is stored as internal", request.command());
            }
        }
        String correlationId = request.correlationId();
        if (options.validateRelationships() && effectiveParent != null) {
            Optional<Event> parent = store.retrieveByID(effectiveParent);
            if (parent.isEmpty()) {
                throw new IllegalArgumentException("Parent event " + effectiveParent + " not found");
            }
            if (!request.hasCorrelationId()) {
                correlationId = parent.get().correlationId();
            }
        }
        ObjectNode stamp = Jsons.object();
        stamp.put("eventType", "internal");
        if (effectiveParent == null) {
            stamp.putNull("parentId");
        } else {
            stamp.put("parentId", effectiveParent);
        }
        stamp.put("generatedAt", clock.millis());
        return write(request
                .causedBy(effectiveParent)
                .withCorrelationId(correlationId)
                .withMetadata(merge(request.metadata(), stamp, metadata)));
    }

    /**
     * Internal event under {@code context.primary()}, secondary correlations kept in metadata.
     */
    public Event storeInternalWithContexts(EventRequest request, Long parentId, CorrelationContext context) {
        ObjectNode metadata = context.toMetadata();
        if (request.metadata() != null && request.metadata().isObject()) {
            metadata.setAll((ObjectNode) request.metadata().deepCopy());
        }
        String primary = context.primary() != null ? context.primary() : request.correlationId();
        return storeInternal(request.withCorrelationId(primary), parentId, metadata);
    }

    /**
     * Stores every request as an internal event of {@code parentId}, tagged with a shared
     * batch id and its 1-based position.
     */
    public Batch batchInternal(long parentId, List<EventRequest> requests) {
        String batchId = UUID.randomUUID().toString();
        List<Event> events = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            EventRequest request = requests.get(i);
            ObjectNode metadata = Jsons.object();
            metadata.put("batchId", batchId);
            metadata.put("batchPosition", i + 1);
            metadata.put("batchTotal", requests.size());
            if (request.metadata() != null && request.metadata().isObject()) {
                metadata.setAll((ObjectNode) request.metadata().deepCopy());
            }
            events.add(storeInternal(request, parentId, metadata));
        }
        return new Batch(batchId, List.copyOf(events));
    }

    public Transaction createTransaction(String name, ObjectNode metadata) {
        ObjectNode transactionMeta = Jsons.object();
        transactionMeta.put("transactionName", name);
        transactionMeta.put("startedAt", clock.millis());
        if (metadata != null) {
            transactionMeta.setAll(metadata.deepCopy());
        }
        return new Transaction(UUID.randomUUID().toString(), transactionMeta);
    }

    /**
     * Subject-first names ({@code userClicked}, {@code webhookReceived}) and past-tense
     * outcomes ({@code PaymentFailed}) read as external.
     */
    static boolean looksExternal(String command) {
        if (command == null || command.isEmpty()) {
            return false;
        }
        String prefix = command.split("(?=[A-Z])")[0].toLowerCase(Locale.ROOT);
        if (EXTERNAL_PREFIXES.contains(prefix)) {
            return true;
        }
        for (String pattern : EXTERNAL_PATTERNS) {
            if (command.contains(pattern)) {
                return true;
            }
        }
        return false;
    }

    private Event write(EventRequest request) {
        EventStore.StoredEvent stored = store.append(request, projection, hooks);
        if (stored.row() == null) {
            throw new IllegalArgumentException(stored.result().error().message());
        }
        return stored.row();
    }

    private static ObjectNode merge(JsonNode base, ObjectNode stamp, ObjectNode overrides) {
        ObjectNode out = Jsons.object();
        if (base != null && base.isObject()) {
            out.setAll((ObjectNode) base.deepCopy());
        }
        out.setAll(stamp);
        if (overrides != null) {
            out.setAll(overrides.deepCopy());
        }
        return out;
    }

    public record Options(boolean enforcePatterns, boolean validateRelationships, boolean autoCorrelation) {
        public static Options defaults() {
            return new Options(true, true, true);
        }
    }

    public record Batch(String batchId, List<Event> events) {
        public int count() {
            return events.size();
        }
    }

    /**
     * Shared correlation id and metadata for a group of related writes.
     */
    public final class Transaction {
        private final String correlationId;
        private final ObjectNode metadata;

        private Transaction(String correlationId, ObjectNode metadata) {
            this.correlationId = correlationId;
            this.metadata = metadata;
        }

        public String correlationId() {
            return correlationId;
        }

        public ObjectNode metadata() {
            return metadata.deepCopy();
        }

        public Event external(EventRequest request, ObjectNode extra) {
            return storeExternal(request.withCorrelationId(correlationId), scoped(request, extra));
        }

        public Event internal(EventRequest request, long parentId, ObjectNode extra) {
            return storeInternal(request.withCorrelationId(correlationId), parentId, scoped(request, extra));
        }

        private ObjectNode scoped(EventRequest request, ObjectNode extra) {
            ObjectNode out = metadata.deepCopy();
            if (extra != null) {
                out.setAll(extra.deepCopy());
            }
            if (request.metadata() != null && request.metadata().isObject()) {
                out.setAll((ObjectNode) request.metadata().deepCopy());
            }
            return out;
        }
    }
}
