package io.causelog.storage;

import io.causelog.model.Event;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Pull-based cursor over the log. A batch is fetched only when the consumer asks for it, and
 * the cursor then moves to {@code last id + 1}, so an interrupted stream can be resumed by
 * starting a new query at that id.
 */
final class EventBatchIterator implements Iterator<List<Event>> {
    private final Database database;
    private final StreamQuery query;
    private long cursor;
    private List<Event> pending;
    private boolean exhausted;

    EventBatchIterator(Database database, StreamQuery query) {
        this.database = database;
        this.query = query;
        this.cursor = Math.max(0L, query.startId());
    }

    @Override
    public boolean hasNext() {
        if (pending != null) {
            return true;
        }
        if (exhausted) {
            return false;
        }
        if (query.endId() != null && cursor > query.endId()) {
            exhausted = true;
            return false;
        }
        List<Event> batch = fetch();
        if (batch.isEmpty()) {
            exhausted = true;
            return false;
        }
        cursor = batch.get(batch.size() - 1).id() + 1;
        pending = batch;
        return true;
    }

    @Override
    public List<Event> next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        List<Event> out = pending;
        pending = null;
        return out;
    }

    private List<Event> fetch() {
        StringBuilder sql = new StringBuilder("SELECT ").append(EventRows.COLUMNS).append(" FROM events WHERE id >= ?");
        List<Object> params = new ArrayList<>();
        params.add(cursor);
        if (query.endId() != null) {
            sql.append(" AND id <= ?");
            params.add(query.endId());
        }
        if (!StreamQuery.blank(query.correlationId())) {
            sql.append(" AND correlation_id = ?");
            params.add(query.correlationId());
        } else if (!StreamQuery.blank(query.actor())) {
            sql.append(" AND actor = ?");
            params.add(query.actor());
        } else if (!StreamQuery.blank(query.command())) {
            sql.append(" AND command = ?");
            params.add(query.command());
        }
        sql.append(" ORDER BY id LIMIT ?");
        params.add(query.batchSize());
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql.toString())) {
            EventRows.bind(ps, params);
            return EventRows.readAll(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to stream events from id " + cursor, e);
        }
    }
}
