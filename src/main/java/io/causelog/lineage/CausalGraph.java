package io.causelog.lineage;

import io.causelog.model.Event;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.LongToIntFunction;

/**
 * In-memory causation forest over one correlation group. Edges only connect events that both
 * belong to the group; roots are the group's events without a causation id.
 */
public final class CausalGraph {
    private final Map<Long, Event> byId;
    private final Map<Long, List<Event>> children;
    private final List<Event> roots;
    private Map<Long, Integer> heights;
    private final Map<Long, Integer> depths = new HashMap<>();

    private CausalGraph(Map<Long, Event> byId, Map<Long, List<Event>> children, List<Event> roots) {
        this.byId = byId;
        this.children = children;
        this.roots = roots;
    }

    public static CausalGraph of(List<Event> events) {
        List<Event> sorted = new ArrayList<>(events);
        sorted.sort(Comparator.comparingLong(Event::id));
        Map<Long, Event> byId = new LinkedHashMap<>();
        for (Event event : sorted) {
            byId.put(event.id(), event);
        }
        Map<Long, List<Event>> children = new HashMap<>();
        List<Event> roots = new ArrayList<>();
        for (Event event : byId.values()) {
            if (event.isRoot()) {
                roots.add(event);
            } else if (byId.containsKey(event.causationId()) && event.causationId() != event.id()) {
                children.computeIfAbsent(event.causationId(), k -> new ArrayList<>()).add(event);
            }
        }
        return new CausalGraph(byId, children, List.copyOf(roots));
    }

    public boolean isEmpty() {
        return byId.isEmpty();
    }

    public List<Event> events() {
        return List.copyOf(byId.values());
    }

    public Event event(long id) {
        return byId.get(id);
    }

    public List<Event> roots() {
        return roots;
    }

    /**
     * Direct children in id order.
     */
    public List<Event> children(long id) {
        return children.getOrDefault(id, List.of());
    }

    /**
     * Number of events on the longest downward chain starting at {@code id}, the event itself
     * included. Unknown ids have height 0.
     */
    public int height(long id) {
        if (!byId.containsKey(id)) {
            return 0;
        }
        if (heights == null) {
            heights = computeHeights();
        }
        return heights.getOrDefault(id, 1);
    }

    /**
     * Hops from {@code id} up to its root. The walk stays inside the graph while it can; once a
     * causation id points outside it, {@code outside} supplies the depth of that parent.
     */
    public int depth(long id, LongToIntFunction outside) {
        if (!byId.containsKey(id)) {
            return 0;
        }
        Deque<Event> path = new ArrayDeque<>();
        Set<Long> seen = new HashSet<>();
        Event current = byId.get(id);
        int base = 0;
        while (current != null && !depths.containsKey(current.id()) && seen.add(current.id())) {
            path.push(current);
            Long parentId = current.causationId();
            if (parentId == null) {
                base = -1;
                break;
            }
            Event parent = byId.get(parentId);
            if (parent == null) {
                base = outside.applyAsInt(parentId);
                break;
            }
            current = parent;
        }
        if (current != null && depths.containsKey(current.id())) {
            base = depths.get(current.id());
        }
        while (!path.isEmpty()) {
            base++;
            depths.put(path.pop().id(), base);
        }
        return depths.get(id);
    }

    /**
     * Longest chain from {@code startId} down to a leaf. At each branch point the child with
     * the tallest subtree is taken; equal heights go to the lowest id.
     */
    public List<Event> longestChainFrom(long startId) {
        List<Event> chain = new ArrayList<>();
        Set<Long> seen = new HashSet<>();
        Event current = byId.get(startId);
        while (current != null && seen.add(current.id())) {
            chain.add(current);
            Event next = null;
            int best = 0;
            for (Event child : children(current.id())) {
                int h = height(child.id());
                if (h > best) {
                    best = h;
                    next = child;
                }
            }
            current = next;
        }
        return chain;
    }

    /**
     * Every root-to-node path, grouped by root in root id order, nodes in id order per root.
     */
    public List<Branch> branches() {
        List<Branch> out = new ArrayList<>();
        for (Event root : roots) {
            List<Branch> forRoot = new ArrayList<>();
            Set<Long> seen = new HashSet<>();
            Deque<List<Long>> stack = new ArrayDeque<>();
            stack.push(List.of(root.id()));
            seen.add(root.id());
            while (!stack.isEmpty()) {
                List<Long> path = stack.pop();
                long id = path.get(path.size() - 1);
                forRoot.add(new Branch(byId.get(id), root.id(), path, path.size() - 1));
                for (Event child : children(id)) {
                    if (seen.add(child.id())) {
                        List<Long> next = new ArrayList<>(path);
                        next.add(child.id());
                        stack.push(next);
                    }
                }
            }
            forRoot.sort(Comparator.comparingLong(b -> b.event().id()));
            out.addAll(forRoot);
        }
        return out;
    }

    private Map<Long, Integer> computeHeights() {
        Map<Long, Integer> out = new HashMap<>();
        Set<Long> entered = new HashSet<>();
        for (Long start : byId.keySet()) {
            if (out.containsKey(start)) {
                continue;
            }
            Deque<Long> stack = new ArrayDeque<>();
            stack.push(start);
            while (!stack.isEmpty()) {
                long id = stack.peek();
                if (entered.add(id)) {
                    for (Event child : children(id)) {
                        if (!entered.contains(child.id())) {
                            stack.push(child.id());
                        }
                    }
                    continue;
                }
                stack.pop();
                if (out.containsKey(id)) {
                    continue;
                }
                int best = 0;
                for (Event child : children(id)) {
                    best = Math.max(best, out.getOrDefault(child.id(), 0));
                }
                out.put(id, best + 1);
            }
        }
        return out;
    }
}
