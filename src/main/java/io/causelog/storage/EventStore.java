package io.causelog.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.causelog.config.StoreSettings;
import io.causelog.model.Event;
import io.causelog.model.EventContext;
import io.causelog.model.EventLineage;
import io.causelog.model.EventRequest;
import io.causelog.model.MissingParentPolicy;
import io.causelog.model.Page;
import io.causelog.projection.DispatchError;
import io.causelog.projection.DispatchResult;
import io.causelog.projection.Hooks;
import io.causelog.projection.Projection;
import io.causelog.projection.ProjectionDispatcher;
import io.causelog.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.UUID;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Append-only command log with causal bookkeeping.
 *
 * <p>Every stored event gets a strictly increasing id and a correlation id resolved as
 * follows: an explicit correlation id always wins; otherwise a causation id inherits the
 * parent's correlation; otherwise a fresh correlation id starts a new transaction. After the
 * row is committed it is dispatched synchronously to the given projection.
 */
public final class EventStore {
    private static final Logger logger = LoggerFactory.getLogger(EventStore.class);
    public static final int DEFAULT_PAGE_LIMIT = 100;

    private static final String SELECT = "SELECT " + EventRows.COLUMNS + " FROM events";
    private static final String INSERT = """
            INSERT INTO events(version,timestamp,actor,origin,command,payload,correlation_id,causation_id,metadata)
            VALUES(?,?,?,?,?,?,?,?,?)
            RETURNING\s""" + EventRows.COLUMNS;
    private static final Projection JOURNAL_ONLY = Projection.builder().build();

    private final Database database;
    private final StoreSettings settings;
    private final QueryCache cache;
    private final ProjectionDispatcher dispatcher;
    private final Clock clock;

    public EventStore(Database database) {
        this(database, cacheFor(database.settings()), new ProjectionDispatcher(), Clock.systemUTC());
    }

    /**
     * @param cache may be {@code null} to run without a query cache
     */
    public EventStore(Database database, QueryCache cache, ProjectionDispatcher dispatcher, Clock clock) {
        this.database = database;
        this.settings = database.settings();
        this.cache = cache;
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    private static QueryCache cacheFor(StoreSettings settings) {
        StoreSettings.Cache cache = settings.cache();
        return cache.enabled() ? new QueryCache(cache.maxSize(), cache.ttlMs()) : null;
    }

    /**
     * Appends the event without a read model attached.
     */
    public DispatchResult store(EventRequest request) {
        return store(request, JOURNAL_ONLY, Hooks.silent());
    }

    public DispatchResult store(EventRequest request, Projection projection, Hooks hooks) {
        return append(request, projection, hooks).result();
    }

    /**
     * Same as {@link #store(EventRequest, Projection, Hooks)} but also hands back the written
     * row, which is {@code null} when the request was rejected.
     */
    public StoredEvent append(EventRequest request, Projection projection, Hooks hooks) {
        Objects.requireNonNull(projection, "projection");
        Objects.requireNonNull(hooks, "hooks");
        if (!request.hasCommand()) {
            return reject(DispatchError.validation("No command given; aborting", request), hooks);
        }
        if (!request.hasValidVersion()) {
            return reject(DispatchError.validation(invalidVersionMessage(request), request), hooks);
        }
        Event row;
        try (Connection c = database.openConnection()) {
            String correlationId = resolveCorrelationId(c, request);
            if (correlationId == null) {
                return reject(DispatchError.validation(missingParentMessage(request), request), hooks);
            }
            row = insert(c, request, correlationId);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to store event: " + request.command(), e);
        }
        logger.debug("Stored event {} ({}) correlationId={} causationId={}",
                row.id(), row.command(), row.correlationId(), row.causationId());
        return new StoredEvent(row, dispatcher.execute(row, projection, hooks));
    }

    /**
     * Stores {@code request} inside an ongoing transaction. Ids from {@code context} replace
     * the request's and context metadata is merged over the request metadata.
     */
    public DispatchResult storeWithContext(EventRequest request, EventContext context, Projection projection, Hooks hooks) {
        return appendWithContext(request, context, projection, hooks).result();
    }

    public StoredEvent appendWithContext(EventRequest request, EventContext context, Projection projection, Hooks hooks) {
        String correlationId = context.correlationId() != null ? context.correlationId() : request.correlationId();
        Long causationId = context.causationId() != null ? context.causationId() : request.causationId();
        ObjectNode metadata = Jsons.object();
        if (request.metadata() != null && request.metadata().isObject()) {
            metadata.setAll((ObjectNode) request.metadata().deepCopy());
        }
        if (context.metadata() != null && context.metadata().isObject()) {
            metadata.setAll((ObjectNode) context.metadata().deepCopy());
        }
        EventRequest enriched = request
                .withCorrelationId(correlationId)
                .causedBy(causationId)
                .withMetadata(metadata);
        return append(enriched, projection, hooks);
    }

    /**
     * Inserts and dispatches every event in one transaction. Any invalid event rolls back
     * the whole batch and raises {@link BulkAbortException}; handler failures are reported
     * through the hooks as usual and do not abort. Clears the query cache on success.
     *
     * <p>Handlers run before the batch commits, so they cannot read the batch's rows through
     * another connection.
     *
     * @param projection may be {@code null} to journal the batch without a read model
     */
    public List<StoredEvent> storeBulk(List<EventRequest> events, Projection projection, Hooks hooks) {
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("Events must be a non-empty list");
        }
        for (int i = 0; i < events.size(); i++) {
            if (!events.get(i).hasCommand()) {
                throw new BulkAbortException("No command given for event at index " + i + "; aborting bulk insert", i);
            }
            if (!events.get(i).hasValidVersion()) {
                throw new BulkAbortException(invalidVersionMessage(events.get(i)) + " (index " + i + ")", i);
            }
        }
        Projection effectiveProjection = projection == null ? JOURNAL_ONLY : projection;
        Hooks effectiveHooks = hooks == null ? Hooks.errorsOnly() : hooks;
        List<StoredEvent> results = new ArrayList<>(events.size());
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                for (int i = 0; i < events.size(); i++) {
                    EventRequest request = events.get(i);
                    String correlationId = resolveCorrelationId(c, request);
                    if (correlationId == null) {
                        throw new BulkAbortException(missingParentMessage(request) + " (index " + i + ")", i);
                    }
                    Event row = insert(c, request, correlationId);
                    DispatchResult result = dispatcher.execute(row, effectiveProjection, effectiveHooks);
                    results.add(new StoredEvent(row, result));
                }
                c.commit();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (BulkAbortException e) {
            throw e;
        } catch (SQLException | RuntimeException e) {
            throw new BulkAbortException("Bulk insert failed; batch rolled back", -1, e);
        }
        if (cache != null) {
            cache.clear();
        }
        logger.debug("Stored bulk batch of {} events ({}..{})", results.size(),
                results.get(0).row().id(), results.get(results.size() - 1).row().id());
        return results;
    }

    /**
     * Validation failures go to the hooks only; the projection never sees an event that was
     * not written.
     */
    private StoredEvent reject(DispatchError error, Hooks hooks) {
        logger.debug("Rejected event: {}", error.message());
        ProjectionDispatcher.report(error, hooks, null);
        return new StoredEvent(null, DispatchResult.fail(error));
    }

    private String invalidVersionMessage(EventRequest request) {
        return "Version " + request.version() + " is not a positive payload version; aborting";
    }

    private String missingParentMessage(EventRequest request) {
        return "Causation id " + request.causationId() + " does not reference an existing event; aborting";
    }

    /**
     * Returns {@code null} when the request must be refused under
     * {@link MissingParentPolicy#REJECT}.
     */
    private String resolveCorrelationId(Connection c, EventRequest request) throws SQLException {
        if (request.hasCorrelationId()) {
            return request.correlationId();
        }
        if (request.causationId() == null) {
            return newCorrelationId();
        }
        ParentLookup parent = lookupParent(c, request.causationId());
        if (parent.found() && parent.correlationId() != null) {
            return parent.correlationId();
        }
        if (!parent.found() && settings.missingParentPolicy() == MissingParentPolicy.REJECT) {
            return null;
        }
        String fresh = newCorrelationId();
        if (parent.found()) {
            logger.warn("Parent event {} carries no correlation id; {} starts correlation {}",
                    request.causationId(), request.command(), fresh);
        } else {
            logger.warn("Causation id {} references no existing event; {} starts correlation {}",
                    request.causationId(), request.command(), fresh);
        }
        return fresh;
    }

    private String newCorrelationId() {
        return UUID.randomUUID().toString();
    }

    private ParentLookup lookupParent(Connection c, long causationId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT correlation_id FROM events WHERE id=?")) {
            ps.setLong(1, causationId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return new ParentLookup(false, null);
                }
                return new ParentLookup(true, rs.getString(1));
            }
        }
    }

    private Event insert(Connection c, EventRequest request, String correlationId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(INSERT)) {
            ps.setInt(1, request.version() == null ? 1 : request.version());
            ps.setLong(2, clock.millis());
            ps.setString(3, request.actor() == null ? "" : request.actor());
            ps.setString(4, request.origin() == null ? "" : request.origin());
            ps.setString(5, request.command());
            ps.setString(6, Jsons.toCompactJson(request.payload() == null ? Jsons.object() : request.payload()));
            ps.setString(7, correlationId);
            if (request.causationId() == null) {
                ps.setNull(8, Types.INTEGER);
            } else {
                ps.setLong(8, request.causationId());
            }
            ps.setString(9, Jsons.toCompactJson(request.metadata() == null ? Jsons.object() : request.metadata()));
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new SQLException("Insert returned no row for command " + request.command());
                }
                return EventRows.map(rs);
            }
        }
    }

    public Optional<Event> retrieveByID(long id) {
        List<Event> rows = select(" WHERE id=?", List.of(id), "retrieve event " + id);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public Optional<Event> retrieveByIdCached(long id) {
        if (cache == null) {
            return retrieveByID(id);
        }
        String key = "byId:" + id;
        Event cached = (Event) cache.get(key);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<Event> loaded = retrieveByID(id);
        loaded.ifPresent(event -> cache.put(key, event));
        return loaded;
    }

    public List<Event> getTransaction(String correlationId) {
        return select(" WHERE correlation_id=? ORDER BY id", List.of(correlationId),
                "load transaction " + correlationId);
    }

    /**
     * May return a list that predates later single-event writes to the same correlation
     * until the entry expires or a bulk write clears the cache.
     */
    @SuppressWarnings("unchecked")
    public List<Event> getTransactionCached(String correlationId) {
        if (cache == null) {
            return getTransaction(correlationId);
        }
        String key = "transaction:" + correlationId;
        List<Event> cached = (List<Event>) cache.get(key);
        if (cached != null) {
            return cached;
        }
        List<Event> loaded = List.copyOf(getTransaction(correlationId));
        cache.put(key, loaded);
        return loaded;
    }

    public List<Event> getChildEvents(long eventId) {
        return select(" WHERE causation_id=? ORDER BY id", List.of(eventId), "load children of " + eventId);
    }

    public Optional<EventLineage> getEventLineage(long eventId) {
        Optional<Event> event = retrieveByID(eventId);
        if (event.isEmpty()) {
            return Optional.empty();
        }
        Long causationId = event.get().causationId();
        Event parent = causationId == null ? null : retrieveByID(causationId).orElse(null);
        return Optional.of(new EventLineage(event.get(), parent, getChildEvents(eventId)));
    }

    /**
     * Replays the whole log through {@code projection} and calls {@code onDone} once.
     */
    public long cycleThrough(Projection projection, Runnable onDone) {
        return cycleThrough(projection, onDone, Hooks.logging(), 0L, null);
    }

    /**
     * Replays events with {@code start <= id < stop} in ascending id order, a page at a time,
     * then calls {@code onDone} exactly once.
     *
     * @param stop exclusive upper bound, or {@code null} to run to the end of the log
     * @return number of events dispatched
     */
    public long cycleThrough(Projection projection, Runnable onDone, Hooks hooks, long start, Long stop) {
        String sql = stop == null
                ? SELECT + " WHERE id >= ? ORDER BY id LIMIT ?"
                : SELECT + " WHERE id >= ? AND id < ? ORDER BY id LIMIT ?";
        int pageSize = settings.pageSize();
        long cursor = start;
        long dispatched = 0L;
        while (true) {
            List<Object> params = new ArrayList<>();
            params.add(cursor);
            if (stop != null) {
                params.add(stop);
            }
            params.add(pageSize);
            List<Event> page = select(sql.substring(SELECT.length()), params, "replay from id " + cursor);
            if (page.isEmpty()) {
                break;
            }
            for (Event row : page) {
                dispatcher.execute(row, projection, hooks);
                dispatched++;
            }
            cursor = page.get(page.size() - 1).id() + 1;
        }
        logger.debug("Replayed {} events from id {} (stop={})", dispatched, start, stop);
        onDone.run();
        return dispatched;
    }

    /**
     * Resumes a projection from a snapshot: replays every event after the checkpoint.
     */
    public long replayFrom(Checkpoint checkpoint, Projection projection, Runnable onDone, Hooks hooks) {
        return cycleThrough(projection, onDone, hooks, checkpoint.eventId() + 1, null);
    }

    /**
     * Lazy sequence of decoded batches in ascending id order. Each batch is read only when
     * the consumer pulls it; the stream ends at the first empty batch or past {@code endId}.
     */
    public Stream<List<Event>> streamEvents(StreamQuery query) {
        EventBatchIterator iterator = new EventBatchIterator(database, query);
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
                false
        );
    }

    public Page getByCorrelationIdPaginated(String correlationId, int limit, int offset) {
        return page("correlation_id=?", "id", correlationId, limit, offset);
    }

    public Page getChildEventsPaginated(long eventId, int limit, int offset) {
        return page("causation_id=?", "id", eventId, limit, offset);
    }

    public Page getEventsByActorPaginated(String actor, int limit, int offset) {
        return page("actor=?", "timestamp DESC, id DESC", actor, limit, offset);
    }

    public Page getEventsByCommandPaginated(String command, int limit, int offset) {
        return page("command=?", "timestamp DESC, id DESC", command, limit, offset);
    }

    /**
     * Both bounds are inclusive epoch milliseconds.
     */
    public Page getEventsInTimeRangePaginated(long startMs, long endMs, int limit, int offset) {
        return page("timestamp >= ? AND timestamp <= ?", "timestamp DESC, id DESC", List.of(startMs, endMs), limit, offset);
    }

    private Page page(String where, String orderBy, Object param, int limit, int offset) {
        return page(where, orderBy, List.of(param), limit, offset);
    }

    private Page page(String where, String orderBy, List<Object> params, int limit, int offset) {
        int safeLimit = limit <= 0 ? DEFAULT_PAGE_LIMIT : limit;
        int safeOffset = Math.max(0, offset);
        long total;
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM events WHERE " + where)) {
            EventRows.bind(ps, params);
            try (ResultSet rs = ps.executeQuery()) {
                total = rs.next() ? rs.getLong(1) : 0L;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count events where " + where, e);
        }
        List<Object> pageParams = new ArrayList<>(params);
        pageParams.add(safeLimit);
        pageParams.add(safeOffset);
        List<Event> events = select(" WHERE " + where + " ORDER BY " + orderBy + " LIMIT ? OFFSET ?",
                pageParams, "page events where " + where);
        return Page.of(events, total, safeLimit, safeOffset);
    }

    private List<Event> select(String tail, List<?> params, String action) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(SELECT + tail)) {
            EventRows.bind(ps, params);
            return EventRows.readAll(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to " + action, e);
        }
    }

    public void clearCache() {
        if (cache != null) {
            cache.clear();
        }
    }

    public CacheStats cacheStats() {
        if (cache == null) {
            return new CacheStats(false, 0, 0, 0L);
        }
        return new CacheStats(true, cache.size(), cache.maxSize(), cache.ttlMs());
    }

    /**
     * Drops and recreates the log. For tests only; refused unless settings allow it.
     */
    public void reset() {
        database.resetEvents();
        clearCache();
    }

    /**
     * A written row with the outcome of dispatching it.
     */
    public record StoredEvent(Event row, DispatchResult result) {
    }

    public record CacheStats(boolean enabled, int size, int maxSize, long ttlMs) {
    }

    private record ParentLookup(boolean found, String correlationId) {
    }
}
