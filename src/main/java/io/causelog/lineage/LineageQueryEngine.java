package io.causelog.lineage;

import io.causelog.lineage.report.EventTreeRenderer;
import io.causelog.lineage.report.LineageReport;
import io.causelog.lineage.report.ReportRequest;
import io.causelog.model.Event;
import io.causelog.storage.Database;
import io.causelog.storage.EventRows;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-only graph queries over the log. Edges run from an event to its cause through
 * {@code causation_id}; {@code correlation_id} groups events independently of those edges.
 * Queries never modify the log and return empty collections rather than failing when nothing
 * matches.
 */
public final class LineageQueryEngine {
    private static final String SELECT = "SELECT " + EventRows.COLUMNS + " FROM events";
    private static final int IN_CHUNK = 500;

    private final Database database;
    private final Clock clock;
    private final EventTreeRenderer treeRenderer = new EventTreeRenderer();

    public LineageQueryEngine(Database database) {
        this(database, Clock.systemUTC());
    }

    public LineageQueryEngine(Database database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    public Optional<Event> getEvent(long id) {
        List<Event> rows = select(" WHERE id=?", List.of(id), "load event " + id);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<Event> getEventsByCorrelationId(String correlationId) {
        return select(" WHERE correlation_id=? ORDER BY id", List.of(correlationId),
                "load correlation " + correlationId);
    }

    public List<Event> getRootEvents() {
        return select(" WHERE causation_id IS NULL ORDER BY id", List.of(), "load root events");
    }

    /**
     * Root events with {@code startId <= id <= endId}.
     */
    public List<Event> getRootEventsInRange(long startId, long endId) {
        return select(" WHERE causation_id IS NULL AND id BETWEEN ? AND ? ORDER BY id",
                List.of(startId, endId), "load root events in range");
    }

    public List<Event> getRootEventsByType(String command) {
        return select(" WHERE causation_id IS NULL AND command=? ORDER BY id", List.of(command),
                "load root events of " + command);
    }

    /**
     * Root events whose top-level payload field {@code field} equals {@code value} as text.
     */
    public List<Event> getRootEventsByPayloadField(String field, String value) {
        return select(" WHERE causation_id IS NULL AND CAST(json_extract(payload, ?) AS TEXT)=? ORDER BY id",
                List.of("$." + field, value), "load root events by payload field " + field);
    }

    public List<Event> getRootEventsByUser(String userId) {
        return getRootEventsByPayloadField("userId", userId);
    }

    public List<Event> getDirectChildren(long id) {
        return select(" WHERE causation_id=? ORDER BY id", List.of(id), "load children of " + id);
    }

    public List<Event> getChildrenByType(long id, String command) {
        return select(" WHERE causation_id=? AND command=? ORDER BY id", List.of(id, command),
                "load children of " + id + " by type");
    }

    /**
     * Transitive children ordered by depth, then id. The event itself is never included.
     */
    public List<Descendant> getDescendantEvents(long id) {
        List<Descendant> out = new ArrayList<>();
        Set<Long> seen = new HashSet<>();
        seen.add(id);
        List<Long> frontier = List.of(id);
        int depth = 0;
        try (Connection c = database.openConnection()) {
            while (!frontier.isEmpty()) {
                depth++;
                List<Event> level = new ArrayList<>();
                for (int from = 0; from < frontier.size(); from += IN_CHUNK) {
                    List<Long> chunk = frontier.subList(from, Math.min(frontier.size(), from + IN_CHUNK));
                    String placeholders = chunk.stream().map(x -> "?").collect(Collectors.joining(","));
                    try (PreparedStatement ps = c.prepareStatement(SELECT + " WHERE causation_id IN (" + placeholders + ")")) {
                        EventRows.bind(ps, chunk);
                        level.addAll(EventRows.readAll(ps));
                    }
                }
                level.sort(Comparator.comparingLong(Event::id));
                List<Long> next = new ArrayList<>();
                for (Event event : level) {
                    if (seen.add(event.id())) {
                        out.add(new Descendant(event, depth));
                        next.add(event.id());
                    }
                }
                frontier = next;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load descendants of " + id, e);
        }
        return out;
    }

    /**
     * Events sharing this event's causation id. Roots have no siblings.
     */
    public List<Event> getSiblingEvents(long id) {
        Optional<Event> event = getEvent(id);
        if (event.isEmpty() || event.get().causationId() == null) {
            return List.of();
        }
        return select(" WHERE causation_id=? AND id<>? ORDER BY id", List.of(event.get().causationId(), id),
                "load siblings of " + id);
    }

    /**
     * Every other event of the same correlation group.
     */
    public List<Event> getRelatedEvents(long id) {
        Optional<Event> event = getEvent(id);
        if (event.isEmpty() || event.get().correlationId() == null) {
            return List.of();
        }
        return select(" WHERE correlation_id=? AND id<>? ORDER BY id", List.of(event.get().correlationId(), id),
                "load events related to " + id);
    }

    /**
     * Ancestors from the direct parent up to the root. Stops at a missing parent.
     */
    public List<Event> getAncestorEvents(long id) {
        List<Event> out = new ArrayList<>();
        Set<Long> seen = new HashSet<>();
        seen.add(id);
        Optional<Event> current = getEvent(id);
        while (current.isPresent() && current.get().causationId() != null) {
            long parentId = current.get().causationId();
            if (!seen.add(parentId)) {
                break;
            }
            current = getEvent(parentId);
            current.ifPresent(out::add);
        }
        return out;
    }

    /**
     * Non-root events of the same correlation that are neither ancestors, descendants nor
     * siblings of {@code id}. Other roots of the correlation are left out here but do belong
     * to the {@link #getEventFamily family}.
     */
    public List<Event> getCousinEvents(long id) {
        Optional<Event> event = getEvent(id);
        if (event.isEmpty() || event.get().correlationId() == null) {
            return List.of();
        }
        return cousinsOf(event.get(), getAncestorEvents(id), getDescendantEvents(id), false);
    }

    private List<Event> cousinsOf(Event event, List<Event> ancestors, List<Descendant> descendants, boolean includeRoots) {
        if (event.correlationId() == null) {
            return List.of();
        }
        Set<Long> excluded = new HashSet<>();
        excluded.add(event.id());
        ancestors.forEach(a -> excluded.add(a.id()));
        descendants.forEach(d -> excluded.add(d.event().id()));
        List<Event> out = new ArrayList<>();
        for (Event candidate : getEventsByCorrelationId(event.correlationId())) {
            if ((candidate.isRoot() && !includeRoots) || excluded.contains(candidate.id())) {
                continue;
            }
            if (event.causationId() != null && event.causationId().equals(candidate.causationId())) {
                continue;
            }
            out.add(candidate);
        }
        return out;
    }

    /**
     * Ancestors, descendants and the rest of the correlation except siblings, other roots
     * included.
     */
    public Optional<EventFamily> getEventFamily(long id) {
        Optional<Event> event = getEvent(id);
        if (event.isEmpty()) {
            return Optional.empty();
        }
        List<Event> ancestors = getAncestorEvents(id);
        List<Descendant> descendants = getDescendantEvents(id);
        return Optional.of(new EventFamily(event.get(), ancestors, descendants,
                cousinsOf(event.get(), ancestors, descendants, true)));
    }

    /**
     * Hops from the root; 0 for roots and unknown ids. A causation id pointing at a missing
     * event still counts as one hop.
     */
    public int getEventDepth(long id) {
        int depth = 0;
        Set<Long> seen = new HashSet<>();
        seen.add(id);
        Optional<Event> current = getEvent(id);
        while (current.isPresent() && current.get().causationId() != null) {
            long parentId = current.get().causationId();
            if (!seen.add(parentId)) {
                break;
            }
            depth++;
            current = getEvent(parentId);
        }
        return depth;
    }

    public List<Branch> getEventBranches(String correlationId) {
        return CausalGraph.of(getEventsByCorrelationId(correlationId)).branches();
    }

    /**
     * Longest root-to-leaf chain in the correlation. Equal lengths are decided by lowest id,
     * first among roots and then at every branch point.
     */
    public Optional<CriticalPath> getCriticalPath(String correlationId) {
        CausalGraph graph = CausalGraph.of(getEventsByCorrelationId(correlationId));
        Event bestRoot = null;
        int best = 0;
        for (Event root : graph.roots()) {
            int h = graph.height(root.id());
            if (h > best) {
                best = h;
                bestRoot = root;
            }
        }
        if (bestRoot == null) {
            return Optional.empty();
        }
        return Optional.of(new CriticalPath(graph.longestChainFrom(bestRoot.id())));
    }

    /**
     * Events whose causation id references no stored event.
     */
    public List<Event> findOrphanedEvents() {
        return select(" WHERE causation_id IS NOT NULL AND causation_id NOT IN (SELECT id FROM events) ORDER BY id",
                List.of(), "find orphaned events");
    }

    public int getEventInfluence(long id) {
        return getDescendantEvents(id).size();
    }

    public LineageReport generateEventReport(ReportRequest request) {
        String generatedAt = Instant.now(clock).toString();
        List<Event> events = List.of();
        String title = "";
        if (request.correlationId() != null && !request.correlationId().isBlank()) {
            events = getEventsByCorrelationId(request.correlationId());
            title = "Event Report for Correlation ID: " + request.correlationId();
        } else if (request.eventId() != null) {
            Optional<Event> main = getEvent(request.eventId());
            if (main.isPresent() && main.get().correlationId() != null) {
                events = getEventsByCorrelationId(main.get().correlationId());
                title = "Event Report for Event ID: " + request.eventId()
                        + " (Correlation: " + main.get().correlationId() + ")";
            }
        }
        if (events.isEmpty()) {
            return LineageReport.empty(title, generatedAt);
        }
        List<LineageReport.ReportEvent> rows = events.stream()
                .map(e -> new LineageReport.ReportEvent(e.id(), e.command(), e.causationId(), e.correlationId(),
                        e.timestamp(), e.payload(), e.isRoot()))
                .toList();
        CausalGraph graph = CausalGraph.of(events);
        return new LineageReport(
                title,
                generatedAt,
                rows,
                request.includeMetrics() ? metrics(graph) : null,
                request.includeRelationships() ? relationships(graph) : null,
                null
        );
    }

    /**
     * Renders the report in the requested format.
     */
    public String renderEventReport(ReportRequest request) {
        return request.format().renderer().render(generateEventReport(request));
    }

    public String generateVisualEventTree(String correlationId) {
        List<Event> events = getEventsByCorrelationId(correlationId);
        if (events.isEmpty()) {
            return "No events found for correlation ID: " + correlationId;
        }
        return treeRenderer.render(correlationId, CausalGraph.of(events).branches());
    }

    private LineageReport.Metrics metrics(CausalGraph graph) {
        List<Event> events = graph.events();
        Map<String, Integer> distribution = new LinkedHashMap<>();
        int roots = 0;
        long minId = Long.MAX_VALUE;
        long maxId = Long.MIN_VALUE;
        long totalDepth = 0;
        for (Event event : events) {
            distribution.merge(event.command(), 1, Integer::sum);
            if (event.isRoot()) {
                roots++;
            }
            minId = Math.min(minId, event.id());
            maxId = Math.max(maxId, event.id());
            totalDepth += graph.depth(event.id(), this::getEventDepth);
        }
        return new LineageReport.Metrics(
                events.size(),
                roots,
                events.size() - roots,
                distribution.size(),
                distribution,
                events.size() > 1 ? maxId - minId : 0L,
                String.format(Locale.ROOT, "%.2f", (double) totalDepth / events.size())
        );
    }

    private LineageReport.Relationships relationships(CausalGraph graph) {
        List<LineageReport.BranchPoint> branchPoints = new ArrayList<>();
        List<LineageReport.EventRef> leaves = new ArrayList<>();
        for (Event event : graph.events()) {
            List<Event> children = graph.children(event.id());
            if (children.size() > 1) {
                branchPoints.add(new LineageReport.BranchPoint(event.id(), event.command(), children.size(),
                        children.stream().map(LineageQueryEngine::ref).toList()));
            }
            if (children.isEmpty() && !event.isRoot()) {
                leaves.add(ref(event));
            }
        }
        List<LineageReport.Chain> chains = new ArrayList<>();
        for (Event root : graph.roots()) {
            List<Event> chain = graph.longestChainFrom(root.id());
            if (chain.size() > 1) {
                chains.add(new LineageReport.Chain(root.id(), chain.size(),
                        chain.stream().map(LineageQueryEngine::ref).toList()));
            }
        }
        return new LineageReport.Relationships(branchPoints, leaves, chains);
    }

    private static LineageReport.EventRef ref(Event event) {
        return new LineageReport.EventRef(event.id(), event.command());
    }

    private List<Event> select(String tail, List<?> params, String action) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(SELECT + tail)) {
            EventRows.bind(ps, params);
            return EventRows.readAll(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to " + action, e);
        }
    }
}
