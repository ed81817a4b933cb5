package io.causelog.projection;

import com.fasterxml.jackson.databind.JsonNode;

@FunctionalInterface
public interface CommandHandler {
    Object handle(JsonNode payload, EventMeta meta) throws Exception;
}
