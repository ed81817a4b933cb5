package io.causelog.storage;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A projection state dump taken after {@code eventId} was applied. Produced and restored by
 * an external snapshot service; the store only uses {@code eventId} to skip ahead.
 */
public record Checkpoint(long eventId, JsonNode state) {
}
