package io.causelog.projection;

import com.fasterxml.jackson.databind.JsonNode;

@FunctionalInterface
public interface PayloadMigration {
    JsonNode migrate(JsonNode payload) throws Exception;

    /**
     * Placeholder for a version whose payload shape did not change.
     */
    static PayloadMigration identity() {
        return payload -> payload;
    }
}
