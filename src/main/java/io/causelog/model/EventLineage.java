package io.causelog.model;

import java.util.List;

/**
 * Single-hop view around one event. {@code parent} is {@code null} for roots and for
 * events whose causation id points at a missing row.
 */
public record EventLineage(Event event, Event parent, List<Event> children) {
}
