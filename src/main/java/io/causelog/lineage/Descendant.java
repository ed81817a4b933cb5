package io.causelog.lineage;

import io.causelog.model.Event;

/**
 * A transitive child together with its hop distance from the queried event (children are at 1).
 */
public record Descendant(Event event, int depth) {
}
