package io.causelog.lineage;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.causelog.config.CauseLogConfig;
import io.causelog.config.StoreSettings;
import io.causelog.lineage.report.LineageReport;
import io.causelog.lineage.report.ReportFormat;
import io.causelog.lineage.report.ReportRequest;
import io.causelog.model.Event;
import io.causelog.model.EventRequest;
import io.causelog.storage.Database;
import io.causelog.storage.EventStore;
import io.causelog.util.Jsons;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class LineageQueryEngineTest {
    private Path root;
    private EventStore store;
    private LineageQueryEngine engine;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("causelog-test-lineage-");
        Database db = new Database(CauseLogConfig.fromRoot(root.toString()).withSettings(StoreSettings.defaults()));
        db.init();
        store = new EventStore(db);
        engine = new LineageQueryEngine(db, Clock.fixed(Instant.parse("2026-10-01T12:00:00Z"), ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() throws Exception {
        deleteRecursively(root);
    }

    /**
     * <pre>
     * order:  1 CreateOrder ── 2 ReserveStock ── 4 ShipOrder ── 5 NotifyCustomer
     *                      └── 3 ChargeCard ── 6 Refund
     *         7 Audit (second root)
     * other:  8 Other
     * orphan: 9 Dangling (causation 999)
     * </pre>
     */
    private void seedOrder() {
        ObjectNode user = Jsons.object();
        user.put("userId", "u-1");
        store.store(EventRequest.of("CreateOrder", user).withCorrelationId("order"));
        store.store(EventRequest.of("ReserveStock").causedBy(1L));
        store.store(EventRequest.of("ChargeCard").causedBy(1L));
        store.store(EventRequest.of("ShipOrder").causedBy(2L));
        store.store(EventRequest.of("NotifyCustomer").causedBy(4L));
        store.store(EventRequest.of("Refund").causedBy(3L));
        store.store(EventRequest.of("Audit").withCorrelationId("order"));
        store.store(EventRequest.of("Other"));
        store.store(EventRequest.of("Dangling").causedBy(999L));
    }

    @Test
    void rootQueries() {
        seedOrder();
        Assertions.assertEquals(List.of(1L, 7L, 8L), ids(engine.getRootEvents()));
        Assertions.assertEquals(List.of(7L, 8L), ids(engine.getRootEventsInRange(2L, 8L)));
        Assertions.assertEquals(List.of(7L), ids(engine.getRootEventsByType("Audit")));
        Assertions.assertEquals(List.of(1L), ids(engine.getRootEventsByUser("u-1")));
        Assertions.assertEquals(List.of(1L), ids(engine.getRootEventsByPayloadField("userId", "u-1")));
        Assertions.assertTrue(engine.getRootEventsByUser("u-2").isEmpty());
    }

    @Test
    void childAndDescendantQueries() {
        seedOrder();
        Assertions.assertEquals(List.of(2L, 3L), ids(engine.getDirectChildren(1L)));
        Assertions.assertEquals(List.of(3L), ids(engine.getChildrenByType(1L, "ChargeCard")));

        List<Descendant> descendants = engine.getDescendantEvents(1L);
        Assertions.assertEquals(List.of(2L, 3L, 4L, 6L, 5L),
                descendants.stream().map(d -> d.event().id()).toList());
        Assertions.assertEquals(List.of(1, 1, 2, 2, 3), descendants.stream().map(Descendant::depth).toList());

        List<Long> depthOne = descendants.stream().filter(d -> d.depth() == 1).map(d -> d.event().id()).toList();
        Assertions.assertEquals(ids(engine.getDirectChildren(1L)), depthOne);

        Assertions.assertEquals(5, engine.getEventInfluence(1L));
        Assertions.assertEquals(0, engine.getEventInfluence(5L));
        Assertions.assertTrue(engine.getDescendantEvents(42L).isEmpty());
    }

    @Test
    void siblingsCousinsAndFamily() {
        seedOrder();
        Assertions.assertEquals(List.of(3L), ids(engine.getSiblingEvents(2L)));
        Assertions.assertTrue(engine.getSiblingEvents(1L).isEmpty());

        Assertions.assertEquals(List.of(3L, 6L), ids(engine.getCousinEvents(4L)));
        Assertions.assertEquals(List.of(2L, 1L), ids(engine.getAncestorEvents(4L)));
        Assertions.assertEquals(List.of(2L, 3L, 4L, 5L, 6L, 7L), ids(engine.getRelatedEvents(1L)));

        EventFamily family = engine.getEventFamily(4L).orElseThrow();
        Assertions.assertEquals(List.of(1L, 2L, 3L, 5L, 6L, 7L), ids(family.members()));
        Assertions.assertEquals(List.of(3L, 6L, 7L), ids(family.cousins()));
        Assertions.assertTrue(engine.getEventFamily(42L).isEmpty());
    }

    @Test
    void cousinsOfARootAreTheOtherRootsNonRootEvents() {
        seedOrder();
        Assertions.assertTrue(engine.getCousinEvents(1L).isEmpty());
        Assertions.assertEquals(List.of(2L, 3L, 4L, 5L, 6L), ids(engine.getCousinEvents(7L)));
        Assertions.assertTrue(engine.getCousinEvents(8L).isEmpty());
        Assertions.assertTrue(engine.getCousinEvents(42L).isEmpty());
    }

    @Test
    void familyReachesEveryRootOfTheCorrelation() {
        store.store(EventRequest.of("Opened").withCorrelationId("case"));
        store.store(EventRequest.of("Assigned").causedBy(1L));
        store.store(EventRequest.of("Escalated").withCorrelationId("case"));
        store.store(EventRequest.of("Paged").causedBy(3L));

        Assertions.assertEquals(List.of(1L, 3L, 4L), ids(engine.getEventFamily(2L).orElseThrow().members()));
        Assertions.assertEquals(List.of(4L), ids(engine.getCousinEvents(2L)));
        Assertions.assertEquals(List.of(1L, 2L, 4L), ids(engine.getEventFamily(3L).orElseThrow().members()));
    }

    @Test
    void depthCountsHopsIncludingDanglingParent() {
        seedOrder();
        Assertions.assertEquals(0, engine.getEventDepth(1L));
        Assertions.assertEquals(1, engine.getEventDepth(2L));
        Assertions.assertEquals(3, engine.getEventDepth(5L));
        Assertions.assertEquals(1, engine.getEventDepth(9L));
        Assertions.assertEquals(0, engine.getEventDepth(42L));
    }

    @Test
    void orphansAreNotRoots() {
        seedOrder();
        Assertions.assertEquals(List.of(9L), ids(engine.findOrphanedEvents()));
        Assertions.assertFalse(ids(engine.getRootEvents()).contains(9L));
    }

    @Test
    void branchesAndCriticalPathAgree() {
        seedOrder();
        List<Branch> branches = engine.getEventBranches("order");
        Assertions.assertEquals(List.of(1L, 2L, 3L, 4L, 5L, 6L, 7L),
                branches.stream().map(b -> b.event().id()).toList());
        Branch notify = branches.get(4);
        Assertions.assertEquals("1->2->4->5", notify.pathString());
        Assertions.assertEquals(3, notify.depth());
        Assertions.assertEquals(1L, notify.rootId());
        Assertions.assertEquals(7L, branches.get(6).rootId());

        CriticalPath path = engine.getCriticalPath("order").orElseThrow();
        Assertions.assertEquals("1->2->4->5", path.pathString());
        int deepest = branches.stream().mapToInt(Branch::depth).max().orElse(-1);
        Assertions.assertEquals(deepest + 1, path.length());

        Assertions.assertTrue(engine.getCriticalPath("missing").isEmpty());
        Assertions.assertTrue(engine.getEventBranches("missing").isEmpty());
    }

    @Test
    void chainDepthsAndCriticalPath() {
        store.store(EventRequest.of("A").withCorrelationId("chain"));
        store.store(EventRequest.of("B").causedBy(1L));
        store.store(EventRequest.of("C").causedBy(2L));

        Assertions.assertEquals(List.of(0, 1, 2),
                List.of(engine.getEventDepth(1L), engine.getEventDepth(2L), engine.getEventDepth(3L)));
        Assertions.assertEquals("1->2->3", engine.getCriticalPath("chain").orElseThrow().pathString());
    }

    @Test
    void criticalPathTiesGoToLowestId() {
        store.store(EventRequest.of("RootA").withCorrelationId("tie"));
        store.store(EventRequest.of("RootB").withCorrelationId("tie"));
        store.store(EventRequest.of("ChildB1").causedBy(2L));
        store.store(EventRequest.of("ChildB2").causedBy(2L));
        store.store(EventRequest.of("ChildA").causedBy(1L));

        CriticalPath path = engine.getCriticalPath("tie").orElseThrow();
        Assertions.assertEquals(List.of(1L, 5L), path.ids());
        Assertions.assertEquals(2, path.length());

        store.store(EventRequest.of("Grandchild").causedBy(4L));
        Assertions.assertEquals("2->4->6", engine.getCriticalPath("tie").orElseThrow().pathString());
    }

    @Test
    void reportModelSummarisesTheCorrelation() {
        seedOrder();
        LineageReport report = engine.generateEventReport(ReportRequest.forCorrelation("order"));

        Assertions.assertFalse(report.isError());
        Assertions.assertEquals("Event Report for Correlation ID: order", report.title());
        Assertions.assertEquals("2026-10-01T12:00:00Z", report.generatedAt());
        Assertions.assertEquals(7, report.events().size());

        LineageReport.Metrics metrics = report.metrics();
        Assertions.assertEquals(7, metrics.totalEvents());
        Assertions.assertEquals(2, metrics.rootEvents());
        Assertions.assertEquals(5, metrics.childEvents());
        Assertions.assertEquals(7, metrics.uniqueEventTypes());
        Assertions.assertEquals(6L, metrics.timeSpan());
        Assertions.assertEquals("1.29", metrics.averageDepth());
        Assertions.assertEquals(1, metrics.eventTypeDistribution().get("Refund"));

        LineageReport.Relationships relationships = report.relationships();
        Assertions.assertEquals(1, relationships.branchPoints().size());
        Assertions.assertEquals(1L, relationships.branchPoints().get(0).eventId());
        Assertions.assertEquals(2, relationships.branchPoints().get(0).childCount());
        Assertions.assertEquals(List.of(5L, 6L),
                relationships.leafEvents().stream().map(LineageReport.EventRef::id).toList());
        Assertions.assertEquals(1, relationships.chains().size());
        Assertions.assertEquals(4, relationships.chains().get(0).length());

        LineageReport byEvent = engine.generateEventReport(ReportRequest.forEvent(4L).withMetrics(false).withRelationships(false));
        Assertions.assertEquals("Event Report for Event ID: 4 (Correlation: order)", byEvent.title());
        Assertions.assertNull(byEvent.metrics());
        Assertions.assertNull(byEvent.relationships());
    }

    @Test
    void averageDepthFollowsParentsOutsideTheCorrelation() {
        seedOrder();
        store.store(EventRequest.of("Followup").withCorrelationId("split").causedBy(4L));
        store.store(EventRequest.of("Closed").causedBy(10L));

        LineageReport report = engine.generateEventReport(ReportRequest.forCorrelation("split"));
        Assertions.assertEquals(0, report.metrics().rootEvents());
        Assertions.assertEquals("3.50", report.metrics().averageDepth());
        Assertions.assertEquals(4, engine.getEventDepth(11L));
    }

    @Test
    void emptyInputsRenderNotFoundMessages() {
        LineageReport report = engine.generateEventReport(ReportRequest.forCorrelation("nothing"));
        Assertions.assertTrue(report.isError());
        Assertions.assertEquals("Error: No events found", engine.renderEventReport(ReportRequest.forCorrelation("nothing")));
        Assertions.assertEquals("# Error\n\nNo events found",
                engine.renderEventReport(ReportRequest.forEvent(42L).withFormat(ReportFormat.MARKDOWN)));
        Assertions.assertEquals("No events found for correlation ID: nothing", engine.generateVisualEventTree("nothing"));
    }

    @Test
    void visualTreeDrawsEveryRoot() {
        seedOrder();
        String expected = "Event Tree for Correlation ID: order\n"
                + "═".repeat(50) + "\n\n"
                + "├── [1] CreateOrder\n"
                + "│   ├── [2] ReserveStock\n"
                + "│   │   └── [4] ShipOrder\n"
                + "│   │       └── [5] NotifyCustomer\n"
                + "│   └── [3] ChargeCard\n"
                + "│       └── [6] Refund\n"
                + "└── [7] Audit\n";
        Assertions.assertEquals(expected, engine.generateVisualEventTree("order"));
    }

    @Test
    void jsonReportIsParseable() {
        seedOrder();
        String json = engine.renderEventReport(ReportRequest.forCorrelation("order").withFormat(ReportFormat.JSON));
        Map<?, ?> parsed = Jsons.mapper().convertValue(Jsons.readTree(json), Map.class);
        Assertions.assertEquals("Event Report for Correlation ID: order", parsed.get("title"));
        Assertions.assertFalse(parsed.containsKey("error"));
        Assertions.assertEquals(7, ((List<?>) parsed.get("events")).size());
    }

    private static List<Long> ids(List<Event> events) {
        return events.stream().map(Event::id).toList();
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
