package io.causelog.bulk;

import com.fasterxml.jackson.databind.JsonNode;
import io.causelog.config.CauseLogConfig;
import io.causelog.config.StoreSettings;
import io.causelog.model.Event;
import io.causelog.model.EventRequest;
import io.causelog.model.MissingParentPolicy;
import io.causelog.projection.Hooks;
import io.causelog.projection.Projection;
import io.causelog.storage.BulkAbortException;
import io.causelog.storage.Database;
import io.causelog.storage.EventStore;
import io.causelog.storage.StreamQuery;
import io.causelog.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

final class EventArchiveTest {

    @Test
    void exportWritesOneObjectPerEventHonouringTheQuery() throws Exception {
        Path root = Files.createTempDirectory("causelog-test-archive-export-");
        try {
            EventStore store = new EventStore(open(root, StoreSettings.defaults()));
            store.store(EventRequest.of("Opened").withCorrelationId("case").withActor("alice"));
            store.store(EventRequest.of("Assigned").causedBy(1L));
            store.store(EventRequest.of("Unrelated").withCorrelationId("other"));
            Path file = root.resolve("case.jsonl");

            EventArchive.ExportSummary summary = new EventArchive(store)
                    .exportTo(file, StreamQuery.all().withBatchSize(1).forCorrelation("case"), false);

            Assertions.assertEquals(2L, summary.totalExported());
            List<String> lines = Files.readAllLines(file);
            Assertions.assertEquals(2, lines.size());
            JsonNode first = Jsons.readTree(lines.get(0));
            Assertions.assertEquals(1L, first.path("id").asLong());
            Assertions.assertEquals("Opened", first.path("command").asText());
            Assertions.assertEquals("alice", first.path("actor").asText());
            Assertions.assertTrue(first.path("causationId").isNull());
            Assertions.assertFalse(first.has("metadata"));
            Assertions.assertEquals(1L, Jsons.readTree(lines.get(1)).path("causationId").asLong());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void importRebuildsTheLogInBatches() throws Exception {
        Path source = Files.createTempDirectory("causelog-test-archive-source-");
        Path target = Files.createTempDirectory("causelog-test-archive-target-");
        try {
            EventStore from = new EventStore(open(source, StoreSettings.defaults()));
            from.store(EventRequest.of("Opened").withCorrelationId("case").withVersion(2));
            from.store(EventRequest.of("Assigned").causedBy(1L).withMetadata(Jsons.readTree("{\"by\":\"bot\"}")));
            from.store(EventRequest.of("Closed").causedBy(2L));
            Path file = source.resolve("all.jsonl");
            new EventArchive(from).exportTo(file, StreamQuery.all(), true);

            EventStore to = new EventStore(open(target, StoreSettings.defaults()));
            List<String> handled = new ArrayList<>();
            Projection projection = Projection.builder()
                    .otherwise((payload, meta) -> handled.add(meta.command()))
                    .build();
            EventArchive.ImportSummary summary = new EventArchive(to).importFrom(file,
                    EventArchive.ImportOptions.defaults().withBatchSize(2).dispatchingTo(projection, Hooks.silent()));

            Assertions.assertEquals(3L, summary.totalImported());
            Assertions.assertEquals(0L, summary.totalErrors());
            Assertions.assertEquals(List.of("Opened", "Assigned", "Closed"), handled);
            List<Event> events = to.getTransaction("case");
            Assertions.assertEquals(3, events.size());
            Assertions.assertEquals(2, events.get(0).version());
            Assertions.assertEquals("bot", events.get(1).metadata().path("by").asText());
            Assertions.assertEquals(2L, events.get(2).causationId());
        } finally {
            deleteRecursively(source);
            deleteRecursively(target);
        }
    }

    @Test
    void invalidLineStopsTheImportUnlessSkipping() throws Exception {
        Path root = Files.createTempDirectory("causelog-test-archive-invalid-");
        try {
            EventStore store = new EventStore(open(root, StoreSettings.defaults()));
            Path file = root.resolve("mixed.jsonl");
            Files.writeString(file, String.join("\n",
                    "{\"command\":\"One\"}",
                    "not json",
                    "",
                    "{\"command\":\"Two\",\"payload\":[1,2]}",
                    "{\"payload\":{}}",
                    "{\"command\":\"Three\",\"payload\":{\"n\":3}}"
            ) + "\n");
            EventArchive archive = new EventArchive(store);

            IllegalArgumentException failure = Assertions.assertThrows(IllegalArgumentException.class,
                    () -> archive.importFrom(file, EventArchive.ImportOptions.defaults()));
            Assertions.assertTrue(failure.getMessage().startsWith("Invalid event on line 2"));
            Assertions.assertTrue(store.retrieveByID(1L).isEmpty());

            EventArchive.ImportSummary summary = archive.importFrom(file, EventArchive.ImportOptions.defaults().skippingErrors());
            Assertions.assertEquals(2L, summary.totalImported());
            Assertions.assertEquals(List.of(2, 4, 5), summary.errors().stream().map(EventArchive.ImportError::line).toList());
            Assertions.assertEquals("Invalid payload field: must be object", summary.errors().get(1).error());
            Assertions.assertEquals("Three", store.retrieveByID(2L).orElseThrow().command());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void abortedBatchIsRecordedWhenSkippingAndEarlierBatchesStay() throws Exception {
        Path root = Files.createTempDirectory("causelog-test-archive-batch-");
        try {
            StoreSettings settings = StoreSettings.defaults().withMissingParentPolicy(MissingParentPolicy.REJECT);
            EventStore store = new EventStore(open(root, settings));
            Path file = root.resolve("batches.jsonl");
            Files.writeString(file, String.join("\n",
                    "{\"command\":\"A\"}",
                    "{\"command\":\"B\"}",
                    "{\"command\":\"C\"}",
                    "{\"command\":\"D\",\"causationId\":999}",
                    "{\"command\":\"E\"}"
            ));
            EventArchive archive = new EventArchive(store);

            EventArchive.ImportSummary summary = archive.importFrom(file,
                    EventArchive.ImportOptions.defaults().withBatchSize(2).skippingErrors());

            Assertions.assertEquals(3L, summary.totalImported());
            Assertions.assertEquals(2L, summary.totalErrors());
            Assertions.assertEquals(1, summary.errors().size());
            Assertions.assertEquals(2, summary.errors().get(0).batchSize());
            Assertions.assertEquals(List.of("A", "B", "E"), store.streamEvents(StreamQuery.all())
                    .flatMap(List::stream).map(Event::command).toList());

            Assertions.assertThrows(BulkAbortException.class, () -> archive.importFrom(file,
                    EventArchive.ImportOptions.defaults().withBatchSize(2)));
        } finally {
            deleteRecursively(root);
        }
    }

    private static Database open(Path root, StoreSettings settings) {
        Database db = new Database(CauseLogConfig.fromRoot(root.toString()).withSettings(settings));
        db.init();
        return db;
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
