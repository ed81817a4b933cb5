package io.causelog.storage;

import com.fasterxml.jackson.databind.JsonNode;
import io.causelog.model.Event;
import io.causelog.util.Jsons;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Row decoding shared by the store and the lineage engine.
 */
public final class EventRows {
    public static final String COLUMNS =
            "id,version,timestamp,actor,origin,command,payload,correlation_id,causation_id,metadata";

    private EventRows() {
    }

    public static Event map(ResultSet rs) throws SQLException {
        long causation = rs.getLong("causation_id");
        Long causationId = rs.wasNull() ? null : causation;
        JsonNode payload = Jsons.readTree(rs.getString("payload"));
        JsonNode metadata = Jsons.readTree(rs.getString("metadata"));
        return new Event(
                rs.getLong("id"),
                rs.getInt("version"),
                rs.getLong("timestamp"),
                rs.getString("actor"),
                rs.getString("origin"),
                rs.getString("command"),
                payload == null ? Jsons.object() : payload,
                rs.getString("correlation_id"),
                causationId,
                metadata == null ? Jsons.object() : metadata
        );
    }

    public static List<Event> readAll(PreparedStatement ps) throws SQLException {
        List<Event> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(map(rs));
            }
        }
        return out;
    }

    public static void bind(PreparedStatement ps, List<?> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            Object value = params.get(i);
            if (value instanceof Long) {
                ps.setLong(i + 1, (Long) value);
            } else if (value instanceof Integer) {
                ps.setInt(i + 1, (Integer) value);
            } else {
                ps.setString(i + 1, value == null ? null : value.toString());
            }
        }
    }
}
