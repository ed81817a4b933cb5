package io.causelog.projection;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Payload transformers per command, indexed by the version they upgrade from.
 *
 * <p>Entry {@code i} (zero based) upgrades a version {@code i + 1} payload to version
 * {@code i + 2}. An event stored at version {@code v} therefore runs entries
 * {@code v - 1} through the end of the list, in order. Migrations run at dispatch time
 * only; the stored payload is never rewritten, so replay always reflects the current table.
 */
public final class MigrationTable {
    private static final MigrationTable EMPTY = new MigrationTable(Map.of());

    private final Map<String, List<PayloadMigration>> byCommand;

    private MigrationTable(Map<String, List<PayloadMigration>> byCommand) {
        this.byCommand = byCommand;
    }

    public static MigrationTable empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<PayloadMigration> forCommand(String command) {
        return byCommand.getOrDefault(command, List.of());
    }

    /**
     * The payload version an up-to-date event of {@code command} is written at.
     */
    public int currentVersion(String command) {
        return forCommand(command).size() + 1;
    }

    public JsonNode apply(String command, int version, JsonNode payload) throws Exception {
        List<PayloadMigration> steps = forCommand(command);
        int from = Math.max(1, version) - 1;
        if (from >= steps.size()) {
            return payload;
        }
        JsonNode current = payload == null ? null : payload.deepCopy();
        for (int i = from; i < steps.size(); i++) {
            current = steps.get(i).migrate(current);
        }
        return current;
    }

    public static final class Builder {
        private final Map<String, List<PayloadMigration>> byCommand = new HashMap<>();

        private Builder() {
        }

        public Builder add(String command, PayloadMigration... steps) {
            if (command == null || command.isBlank()) {
                throw new IllegalArgumentException("command must not be blank");
            }
            List<PayloadMigration> list = byCommand.computeIfAbsent(command, k -> new ArrayList<>());
            for (PayloadMigration step : steps) {
                list.add(step == null ? PayloadMigration.identity() : step);
            }
            return this;
        }

        public MigrationTable build() {
            Map<String, List<PayloadMigration>> copy = new HashMap<>();
            byCommand.forEach((k, v) -> copy.put(k, List.copyOf(v)));
            return new MigrationTable(Collections.unmodifiableMap(copy));
        }
    }
}
