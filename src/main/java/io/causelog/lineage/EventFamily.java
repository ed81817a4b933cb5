package io.causelog.lineage;

import io.causelog.model.Event;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An event with its ancestors (nearest first), descendants and cousins.
 */
public record EventFamily(Event event, List<Event> ancestors, List<Descendant> descendants, List<Event> cousins) {
    public EventFamily {
        ancestors = List.copyOf(ancestors);
        descendants = List.copyOf(descendants);
        cousins = List.copyOf(cousins);
    }

    /**
     * Distinct relatives in id order, the event itself excluded.
     */
    public List<Event> members() {
        Map<Long, Event> byId = new LinkedHashMap<>();
        ancestors.forEach(e -> byId.putIfAbsent(e.id(), e));
        descendants.forEach(d -> byId.putIfAbsent(d.event().id(), d.event()));
        cousins.forEach(e -> byId.putIfAbsent(e.id(), e));
        byId.remove(event.id());
        List<Event> out = new ArrayList<>(byId.values());
        out.sort(Comparator.comparingLong(Event::id));
        return out;
    }
}
