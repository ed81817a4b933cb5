package io.causelog.bulk;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.causelog.model.Event;
import io.causelog.model.EventRequest;
import io.causelog.projection.Hooks;
import io.causelog.projection.Projection;
import io.causelog.storage.BulkAbortException;
import io.causelog.storage.EventStore;
import io.causelog.storage.StreamQuery;
import io.causelog.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Moves the log in and out of JSON Lines files, one event object per line.
 *
 * <p>Export streams batches through {@link EventStore#streamEvents}. Import groups lines into
 * {@link EventStore#storeBulk} batches, so each batch is all-or-nothing while batches written
 * before a failure stay committed. Ids are reassigned on import; causation ids are written as
 * they appear in the file.
 */
public final class EventArchive {
    private static final Logger logger = LoggerFactory.getLogger(EventArchive.class);
    public static final int DEFAULT_IMPORT_BATCH_SIZE = 100;
    static final int MAX_REPORTED_ERRORS = 100;

    private final EventStore store;

    public EventArchive(EventStore store) {
        this.store = store;
    }

    public ExportSummary exportTo(Path file, StreamQuery query, boolean includeMetadata) {
        long exported = 0L;
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             Stream<List<Event>> batches = store.streamEvents(query)) {
            Iterator<List<Event>> it = batches.iterator();
            while (it.hasNext()) {
                for (Event event : it.next()) {
                    writer.write(Jsons.toCompactJson(toLine(event, includeMetadata)));
                    writer.newLine();
                    exported++;
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to export events to " + file, e);
        }
        logger.info("Exported {} events to {}", exported, file);
        return new ExportSummary(exported);
    }

    public ImportSummary importFrom(Path file, ImportOptions options) {
        long imported = 0L;
        long failed = 0L;
        List<ImportError> errors = new ArrayList<>();
        List<EventRequest> batch = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                EventRequest request;
                try {
                    request = parse(line, options.validate());
                } catch (RuntimeException e) {
                    if (!options.skipErrors()) {
                        throw new IllegalArgumentException("Invalid event on line " + lineNumber + ": " + e.getMessage(), e);
                    }
                    record(errors, ImportError.atLine(lineNumber, e.getMessage()));
                    continue;
                }
                batch.add(request);
                if (batch.size() >= options.batchSize()) {
                    int written = flush(batch, options, errors);
                    imported += written;
                    failed += batch.size() - written;
                    batch.clear();
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to import events from " + file, e);
        }
        if (!batch.isEmpty()) {
            int written = flush(batch, options, errors);
            imported += written;
            failed += batch.size() - written;
        }
        logger.info("Imported {} events from {} ({} in failed batches, {} errors recorded)",
                imported, file, failed, errors.size());
        return new ImportSummary(imported, failed, List.copyOf(errors));
    }

    private int flush(List<EventRequest> batch, ImportOptions options, List<ImportError> errors) {
        try {
            store.storeBulk(List.copyOf(batch), options.projection(), options.hooks());
            return batch.size();
        } catch (BulkAbortException e) {
            if (!options.skipErrors()) {
                throw e;
            }
            logger.warn("Skipping import batch of {} events: {}", batch.size(), e.getMessage());
            record(errors, ImportError.forBatch(batch.size(), e.getMessage()));
            return 0;
        }
    }

    private static void record(List<ImportError> errors, ImportError error) {
        if (errors.size() < MAX_REPORTED_ERRORS) {
            errors.add(error);
        }
    }

    static ObjectNode toLine(Event event, boolean includeMetadata) {
        ObjectNode line = Jsons.object();
        line.put("id", event.id());
        line.put("version", event.version());
        line.put("timestamp", event.timestamp());
        line.put("actor", event.actor());
        line.put("origin", event.origin());
        line.put("command", event.command());
        line.set("payload", event.payload());
        line.put("correlationId", event.correlationId());
        if (event.causationId() == null) {
            line.putNull("causationId");
        } else {
            line.put("causationId", event.causationId());
        }
        if (includeMetadata) {
            line.set("metadata", event.metadata());
        }
        return line;
    }

    static EventRequest parse(String line, boolean validate) {
        JsonNode node = Jsons.readTree(line);
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("line is not a JSON object");
        }
        if (validate) {
            if (!node.path("command").isTextual() || node.path("command").asText().isBlank()) {
                throw new IllegalArgumentException("Missing required field: command");
            }
            if (node.has("payload") && !node.get("payload").isObject()) {
                throw new IllegalArgumentException("Invalid payload field: must be object");
            }
        }
        return new EventRequest(
                text(node, "actor"),
                text(node, "origin"),
                text(node, "command"),
                node.get("payload"),
                node.path("version").isIntegralNumber() ? node.get("version").asInt() : null,
                text(node, "correlationId"),
                node.path("causationId").isIntegralNumber() ? node.get("causationId").asLong() : null,
                node.path("metadata").isObject() ? node.get("metadata") : null
        );
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    public record ExportSummary(long totalExported) {
    }

    public record ImportSummary(long totalImported, long totalErrors, List<ImportError> errors) {
    }

    /**
     * Either a rejected line or a rolled-back batch.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ImportError(Integer line, Integer batchSize, String error) {
        static ImportError atLine(int line, String error) {
            return new ImportError(line, null, error);
        }

        static ImportError forBatch(int batchSize, String error) {
            return new ImportError(null, batchSize, error);
        }
    }

    /**
     * @param projection may be {@code null} to journal without a read model
     * @param hooks may be {@code null} to only log dispatch errors
     */
    public record ImportOptions(int batchSize, boolean validate, boolean skipErrors, Projection projection, Hooks hooks) {
        public ImportOptions {
            if (batchSize <= 0) {
                throw new IllegalArgumentException("batchSize must be positive");
            }
        }

        public static ImportOptions defaults() {
            return new ImportOptions(DEFAULT_IMPORT_BATCH_SIZE, true, false, null, null);
        }

        public ImportOptions withBatchSize(int batchSize) {
            return new ImportOptions(batchSize, validate, skipErrors, projection, hooks);
        }

        public ImportOptions skippingErrors() {
            return new ImportOptions(batchSize, validate, true, projection, hooks);
        }

        public ImportOptions withoutValidation() {
            return new ImportOptions(batchSize, false, skipErrors, projection, hooks);
        }

        public ImportOptions dispatchingTo(Projection projection, Hooks hooks) {
            return new ImportOptions(batchSize, validate, skipErrors, projection, hooks);
        }
    }
}
