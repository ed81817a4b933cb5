package io.causelog.projection;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Read-only passthrough a projection exposes under a command name.
 */
@FunctionalInterface
public interface NamedQuery {
    Object run(JsonNode payload) throws Exception;
}
