package io.causelog.pattern;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.causelog.model.Event;
import io.causelog.model.EventRequest;

import java.util.ArrayList;
import java.util.List;

/**
 * Declares an external trigger and the internal events it causes, then writes them in
 * declaration order. Each {@code then} step is caused by the step declared right before it;
 * {@code thenEach} fans several steps out from that same parent.
 */
public final class EventChainBuilder {
    private final PatternedEventStore store;
    private final List<Step> steps = new ArrayList<>();

    public EventChainBuilder(PatternedEventStore store) {
        this.store = store;
    }

    public EventChainBuilder startWith(EventRequest external, ObjectNode metadata) {
        steps.add(new Step(true, external, metadata, -1));
        return this;
    }

    public EventChainBuilder then(EventRequest internal, ObjectNode metadata) {
        requireStarted();
        steps.add(new Step(false, internal, metadata, steps.size() - 1));
        return this;
    }

    public EventChainBuilder thenEach(List<EventRequest> internals, ObjectNode metadata) {
        requireStarted();
        int parentIndex = steps.size() - 1;
        for (EventRequest internal : internals) {
            steps.add(new Step(false, internal, metadata, parentIndex));
        }
        return this;
    }

    public Result execute() {
        List<Event> written = new ArrayList<>(steps.size());
        boolean[] hasChild = new boolean[steps.size()];
        for (Step step : steps) {
            if (step.external()) {
                written.add(store.storeExternal(step.request(), step.metadata()));
            } else {
                hasChild[step.parentIndex()] = true;
                written.add(store.storeInternal(step.request(), written.get(step.parentIndex()).id(), step.metadata()));
            }
        }
        List<Event> leaves = new ArrayList<>();
        for (int i = 0; i < written.size(); i++) {
            if (!hasChild[i]) {
                leaves.add(written.get(i));
            }
        }
        return new Result(List.copyOf(written), List.copyOf(leaves));
    }

    private void requireStarted() {
        if (steps.isEmpty()) {
            throw new IllegalStateException("Chain must start with an external event");
        }
    }

    private record Step(boolean external, EventRequest request, ObjectNode metadata, int parentIndex) {
    }

    public record Result(List<Event> events, List<Event> leafEvents) {
        public int count() {
            return events.size();
        }

        public Event rootEvent() {
            return events.isEmpty() ? null : events.get(0);
        }
    }
}
