package io.causelog.storage;

import io.causelog.config.CauseLogConfig;
import io.causelog.config.StoreSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

public final class Database {
    private static final Logger logger = LoggerFactory.getLogger(Database.class);
    private static final String MIGRATION_SCHEMA_VERSION = "causelog.schema.migration.v1";
    private static final String CREATE_EVENTS_TABLE = """
            CREATE TABLE IF NOT EXISTS events (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                version INTEGER NOT NULL DEFAULT 1,
                timestamp INTEGER NOT NULL,
                actor TEXT,
                origin TEXT,
                command TEXT NOT NULL,
                payload TEXT,
                correlation_id TEXT,
                causation_id INTEGER,
                metadata TEXT
            )
            """;

    private final CauseLogConfig config;
    private final String jdbcUrl;

    public Database(CauseLogConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public StoreSettings settings() {
        return config.settings();
    }

    public CauseLogConfig config() {
        return config;
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
        logger.info("Event log ready at {}", config.dbFile());
    }

    public Connection openConnection() throws SQLException {
        Properties props = new Properties();
        props.setProperty("busy_timeout", "5000");
        props.setProperty("synchronous", "NORMAL");
        return DriverManager.getConnection(jdbcUrl, props);
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute(CREATE_EVENTS_TABLE);
            ensureEventColumns(conn);
            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);
            applyIndexSettings(conn);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite schema", e);
        }
    }

    private void ensureEventColumns(Connection conn) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(events)")) {
            while (rs.next()) {
                columns.add(rs.getString("name").toLowerCase());
            }
        }
        // Logs written before causal tracking have neither column.
        try (Statement st = conn.createStatement()) {
            if (!columns.contains("correlation_id")) {
                st.execute("ALTER TABLE events ADD COLUMN correlation_id TEXT");
            }
            if (!columns.contains("causation_id")) {
                st.execute("ALTER TABLE events ADD COLUMN causation_id INTEGER");
            }
            if (!columns.contains("metadata")) {
                st.execute("ALTER TABLE events ADD COLUMN metadata TEXT");
            }
        }
    }

    /**
     * Creates every enabled index and drops every disabled one, so flipping a toggle in the
     * settings file takes effect on the next {@link #init()}.
     */
    private void applyIndexSettings(Connection conn) throws SQLException {
        StoreSettings.Indexes indexes = settings().indexes();
        Map<String, IndexDefinition> wanted = new LinkedHashMap<>();
        wanted.put("idx_events_correlation_id", new IndexDefinition("correlation_id", indexes.correlationId()));
        wanted.put("idx_events_causation_id", new IndexDefinition("causation_id", indexes.causationId()));
        wanted.put("idx_events_command", new IndexDefinition("command", indexes.command()));
        wanted.put("idx_events_actor", new IndexDefinition("actor", indexes.actor()));
        wanted.put("idx_events_timestamp", new IndexDefinition("timestamp", indexes.timestamp()));
        wanted.put("idx_events_version", new IndexDefinition("version", indexes.version()));
        wanted.put("idx_events_correlation_command", new IndexDefinition("correlation_id, command", indexes.correlationCommand()));
        wanted.put("idx_events_actor_timestamp", new IndexDefinition("actor, timestamp", indexes.actorTimestamp()));
        try (Statement st = conn.createStatement()) {
            for (Map.Entry<String, IndexDefinition> entry : wanted.entrySet()) {
                if (entry.getValue().enabled()) {
                    st.execute("CREATE INDEX IF NOT EXISTS " + entry.getKey()
                            + " ON events(" + entry.getValue().columns() + ")");
                } else {
                    st.execute("DROP INDEX IF EXISTS " + entry.getKey());
                }
            }
        }
        if (!indexes.correlationId() || !indexes.causationId()) {
            logger.warn("Correlation or causation index disabled; lineage queries will scan the events table");
        }
    }

    public List<String> listEventIndexes() {
        List<String> out = new ArrayList<>();
        try (Connection c = openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT name FROM sqlite_master WHERE type='index' AND tbl_name='events' AND name LIKE 'idx_%' ORDER BY name")) {
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(rs.getString(1));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list event indexes", e);
        }
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
        }
    }

    private void applyVersionedMigrations(Connection conn) throws SQLException {
        List<MigrationStep> steps = new ArrayList<>();
        steps.add(new MigrationStep(
                "20261001_001_backfill_empty_metadata",
                "Normalize missing metadata to an empty JSON object",
                List.of("UPDATE events SET metadata='{}' WHERE metadata IS NULL OR metadata=''")
        ));
        steps.add(new MigrationStep(
                "20261001_002_backfill_event_version",
                "Default unversioned events to version 1",
                List.of("UPDATE events SET version=1 WHERE version IS NULL OR version<1")
        ));
        for (MigrationStep step : steps) {
            if (isMigrationApplied(conn, step.version())) {
                continue;
            }
            applyMigration(conn, step);
        }
    }

    private boolean isMigrationApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schema_migrations WHERE version=? AND success=1 LIMIT 1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void applyMigration(Connection conn, MigrationStep step) throws SQLException {
        String checksum = checksum(step);
        try (Statement st = conn.createStatement()) {
            for (String sql : step.sql()) {
                st.execute(sql);
            }
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
            ps.setString(1, step.version());
            ps.setString(2, step.description());
            ps.setString(3, checksum);
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.executeUpdate();
        }
        logger.info("Applied schema migration {}", step.version());
    }

    private String checksum(MigrationStep step) {
        StringBuilder sb = new StringBuilder();
        sb.append(MIGRATION_SCHEMA_VERSION).append('|')
                .append(step.version()).append('|')
                .append(step.description()).append('|');
        for (String sql : step.sql()) {
            sb.append(sql).append(';');
        }
        return Integer.toHexString(sb.toString().hashCode());
    }

    private record MigrationStep(String version, String description, List<String> sql) {
    }

    private record IndexDefinition(String columns, boolean enabled) {
    }

    private void applyAndValidatePragmas() {
        String journalMode = settings().walEnabled() ? "wal" : "delete";
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=" + journalMode.toUpperCase());

            validatePragma(st, "journal_mode", journalMode);
            validatePragma(st, "synchronous", "1");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }

    /**
     * Drops and recreates the events table. Refused unless the settings allow it; never a
     * production path.
     */
    public void resetEvents() {
        if (!settings().allowReset()) {
            throw new IllegalStateException("Event log reset is disabled; set allowReset in settings to enable it");
        }
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("DROP TABLE IF EXISTS events");
            st.execute(CREATE_EVENTS_TABLE);
            applyIndexSettings(conn);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to reset event log", e);
        }
        logger.info("Event log reset at {}", config.dbFile());
    }

    public List<SchemaMigrationRow> listSchemaMigrations(int limit) {
        String sql = """
                SELECT version,description,checksum,applied_at_ms,success
                FROM schema_migrations
                ORDER BY applied_at_ms DESC, version DESC
                LIMIT ?
                """;
        int safeLimit = Math.max(1, limit);
        List<SchemaMigrationRow> out = new ArrayList<>();
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, safeLimit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new SchemaMigrationRow(
                            rs.getString("version"),
                            rs.getString("description"),
                            rs.getString("checksum"),
                            rs.getLong("applied_at_ms"),
                            rs.getInt("success") == 1
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list schema migrations", e);
        }
    }

    public record SchemaMigrationRow(
            String version,
            String description,
            String checksum,
            long appliedAtMs,
            boolean success
    ) {
    }
}
