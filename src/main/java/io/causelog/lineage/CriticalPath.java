package io.causelog.lineage;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.causelog.model.Event;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Longest root-to-leaf chain of a correlation. {@code length} counts events, not hops.
 */
public record CriticalPath(List<Event> events) {
    public CriticalPath {
        events = List.copyOf(events);
    }

    @JsonProperty
    public List<Long> ids() {
        return events.stream().map(Event::id).toList();
    }

    @JsonProperty
    public int length() {
        return events.size();
    }

    @JsonProperty
    public String pathString() {
        return events.stream().map(e -> String.valueOf(e.id())).collect(Collectors.joining("->"));
    }
}
