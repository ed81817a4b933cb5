package io.causelog.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.causelog.bulk.EventArchive;
import io.causelog.config.CauseLogConfig;
import io.causelog.lineage.CriticalPath;
import io.causelog.lineage.EventFamily;
import io.causelog.lineage.LineageQueryEngine;
import io.causelog.lineage.report.ReportFormat;
import io.causelog.lineage.report.ReportRequest;
import io.causelog.model.Event;
import io.causelog.model.EventLineage;
import io.causelog.model.EventRequest;
import io.causelog.projection.Hooks;
import io.causelog.projection.Projection;
import io.causelog.storage.BulkAbortException;
import io.causelog.storage.Database;
import io.causelog.storage.EventStore;
import io.causelog.storage.StreamQuery;
import io.causelog.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
        name = "causelog",
        mixinStandardHelpOptions = true,
        description = "Causal event log CLI",
        subcommands = {
                CauseLogCommand.InitCommand.class,
                CauseLogCommand.AppendCommand.class,
                CauseLogCommand.ShowCommand.class,
                CauseLogCommand.TransactionCommand.class,
                CauseLogCommand.LineageCommand.class,
                CauseLogCommand.RootsCommand.class,
                CauseLogCommand.ChildrenCommand.class,
                CauseLogCommand.DescendantsCommand.class,
                CauseLogCommand.SiblingsCommand.class,
                CauseLogCommand.CousinsCommand.class,
                CauseLogCommand.FamilyCommand.class,
                CauseLogCommand.DepthCommand.class,
                CauseLogCommand.InfluenceCommand.class,
                CauseLogCommand.BranchesCommand.class,
                CauseLogCommand.CriticalPathCommand.class,
                CauseLogCommand.OrphansCommand.class,
                CauseLogCommand.ReportCommand.class,
                CauseLogCommand.TreeCommand.class,
                CauseLogCommand.ExportCommand.class,
                CauseLogCommand.ImportCommand.class,
                CauseLogCommand.SchemaMigrationsCommand.class
        }
)
public final class CauseLogCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory", defaultValue = CauseLogConfig.DEFAULT_ROOT)
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | append | show | transaction | lineage | roots | children | descendants | siblings | cousins | family | depth | influence | branches | critical-path | orphans | report | tree | export | import | schema-migrations");
    }

    CauseLogConfig config() {
        return CauseLogConfig.fromRoot(root);
    }

    Database database() {
        Database database = new Database(config());
        database.init();
        return database;
    }

    EventStore store() {
        return new EventStore(database());
    }

    LineageQueryEngine engine() {
        return new LineageQueryEngine(database());
    }

    static int notFound(String what) {
        ObjectNode error = Jsons.object();
        error.put("error", what + " not found");
        System.out.println(Jsons.toJson(error));
        return 1;
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        CauseLogCommand parent;

        @Override
        public Integer call() {
            Database database = parent.database();
            System.out.println("Initialized causelog at: " + database.config().rootDir());
            return 0;
        }
    }

    @Command(name = "append", description = "Store one event (no read model attached)")
    static final class AppendCommand implements Callable<Integer> {
        @ParentCommand
        CauseLogCommand parent;

        @Option(names = {"--command"}, required = true, description = "Command name")
        String command;

        @Option(names = {"--payload"}, defaultValue = "{}", description = "Payload JSON")
        String payload;

        @Option(names = {"--actor"}, description = "Who initiated the command")
        String actor;

        @Option(names = {"--origin"}, description = "Where the command came from")
        String origin;

        @Option(names = {"--correlation-id"}, description = "Explicit correlation id")
        String correlationId;

        @Option(names = {"--causation-id"}, description = "Id of the event that caused this one")
        Long causationId;

        @Option(names = {"--payload-version"}, description = "Payload version")
        Integer version;

        @Option(names = {"--metadata"}, description = "Metadata JSON")
        String metadata;

        @Override
        public Integer call() {
            JsonNode payloadNode = Jsons.readTree(payload);
            EventRequest request = new EventRequest(
                    actor,
                    origin,
                    command,
                    payloadNode == null ? Jsons.object() : payloadNode,
                    version,
                    correlationId,
                    causationId,
                    Jsons.readTree(metadata)
            );
            EventStore.StoredEvent stored = parent.store().append(request, Projection.builder().build(), Hooks.silent());
            if (stored.row() == null) {
                ObjectNode error = Jsons.object();
                error.put("error", stored.result().error().message());
                System.out.println(Jsons.toJson(error));
                return 1;
            }
            System.out.println(Jsons.toJson(stored.row()));
            return 0;
        }
    }

    @Command(name = "show", description = "Show one event by id")
    static final class ShowCommand implements Callable<Integer> {
        @ParentCommand
        CauseLogCommand parent;

        @Parameters(index = "0", description = "Event id")
        long id;

        @Override
        public Integer call() {
            Optional<Event> event = parent.store().retrieveByID(id);
            if (event.isEmpty()) {
                return notFound("event");
            }
            System.out.println(Jsons.toJson(event.get()));
            return 0;
        }
    }

    @Command(name = "transaction", description = "List all events of a correlation id")
    static final class TransactionCommand implements Callable<Integer> {
        @ParentCommand
        CauseLogCommand parent;

        @Parameters(index = "0", description = "Correlation id")
        String correlationId;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.store().getTransaction(correlationId)));
            return 0;
        }
    }

    @Command(name = "lineage", description = "Show an event with its parent and direct children")
    static final class LineageCommand implements Callable<Integer> {
        @ParentCommand
        CauseLogCommand parent;

        @Parameters(index = "0", description = "Event id")
        long id;

        @Override
        public Integer call() {
            Optional<EventLineage> lineage = parent.store().getEventLineage(id);
            if (lineage.isEmpty()) {
                return notFound("event");
            }
            System.out.println(Jsons.toJson(lineage.get()));
            return 0;
        }
    }

    @Command(name = "roots", description = "List root events, optionally filtered")
    static final class RootsCommand implements Callable<Integer> {
        @ParentCommand
        CauseLogCommand parent;

        @Option(names = {"--command"}, description = "Only roots of this command")
        String command;

        @Option(names = {"--from-id"}, description = "Lowest id (inclusive, requires --to-id)")
        Long fromId;

        @Option(names = {"--to-id"}, description = "Highest id (inclusive, requires --from-id)")
        Long toId;

        @Option(names = {"--field"}, description = "Payload field to match (requires --value)")
        String field;

        @Option(names = {"--value"}, description = "Payload field value")
        String value;

        @Override
        public Integer call() {
            LineageQueryEngine engine = parent.engine();
            List<Event> roots;
            if (command != null) {
                roots = engine.getRootEventsByType(command);
            } else if (fromId != null && toId != null) {
                roots = engine.getRootEventsInRange(fromId, toId);
            } else if (field != null && value != null) {
                roots = engine.getRootEventsByPayloadField(field, value);
            } else {
                roots = engine.getRootEvents();
            }
            System.out.println(Jsons.toJson(roots));
            return 0;
        }
    }

    @Command(name = "children", description = "List direct children of an event")
    static final class ChildrenCommand implements Callable<Integer> {
        @ParentCommand
        CauseLogCommand parent;

        @Parameters(index = "0", description = "Event id")
        long id;

        @Option(names = {"--command"}, description = "Only children of this command")
        String command;

        @Override
        public Integer call() {
            LineageQueryEngine engine = parent.engine();
            List<Event> children = command == null
                    ? engine.getDirectChildren(id)
                    : engine.getChildrenByType(id, command);
            System.out.println(Jsons.toJson(children));
            return 0;
        }
    }

    @Command(name = "descendants", description = "List all transitive children with their depth")
    static final class DescendantsCommand implements Callable<Integer> {
        @ParentCommand
        CauseLogCommand parent;

        @Parameters(index = "0", description = "Event id")
        long id;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.engine().getDescendantEvents(id)));
            return 0;
        }
    }

    @Command(name = "siblings", description = "List events sharing the same cause")
    static final class SiblingsCommand implements Callable<Integer> {
        @ParentCommand
        CauseLogCommand parent;

        @Parameters(index = "0", description = "Event id")
        long id;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.engine().getSiblingEvents(id)));
            return 0;
        }
    }

    @Command(name = "cousins", description = "List unrelated non-root events of the same correlation")
    static final class CousinsCommand implements Callable<Integer> {
        @ParentCommand
        CauseLogCommand parent;

        @Parameters(index = "0", description = "Event id")
        long id;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.engine().getCousinEvents(id)));
            return 0;
        }
    }

    @Command(name = "family", description = "Show ancestors, descendants and cousins of an event")
    static final class FamilyCommand implements Callable<Integer> {
        @ParentCommand
        CauseLogCommand parent;

        @Parameters(index = "0", description = "Event id")
        long id;

        @Override
        public Integer call() {
            Optional<EventFamily> family = parent.engine().getEventFamily(id);
            if (family.isEmpty()) {
                return notFound("event");
            }
            System.out.println(Jsons.toJson(family.get()));
            return 0;
        }
    }

    @Command(name = "depth", description = "Print the causation depth of an event")
    static final class DepthCommand implements Callable<Integer> {
        @ParentCommand
        CauseLogCommand parent;

        @Parameters(index = "0", description = "Event id")
        long id;

        @Override
        public Integer call() {
            ObjectNode out = Jsons.object();
            out.put("id", id);
            out.put("depth", parent.engine().getEventDepth(id));
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "influence", description = "Print how many events an event led to")
    static final class InfluenceCommand implements Callable<Integer> {
        @ParentCommand
        CauseLogCommand parent;

        @Parameters(index = "0", description = "Event id")
        long id;

        @Override
        public Integer call() {
            ObjectNode out = Jsons.object();
            out.put("id", id);
            out.put("influence", parent.engine().getEventInfluence(id));
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "branches", description = "List every root-to-event path of a correlation")
    static final class BranchesCommand implements Callable<Integer> {
        @ParentCommand
        CauseLogCommand parent;

        @Parameters(index = "0", description = "Correlation id")
        String correlationId;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.engine().getEventBranches(correlationId)));
            return 0;
        }
    }

    @Command(name = "critical-path", description = "Show the longest causation chain of a correlation")
    static final class CriticalPathCommand implements Callable<Integer> {
        @ParentCommand
        CauseLogCommand parent;

        @Parameters(index = "0", description = "Correlation id")
        String correlationId;

        @Override
        public Integer call() {
            Optional<CriticalPath> path = parent.engine().getCriticalPath(correlationId);
            if (path.isEmpty()) {
                return notFound("correlation");
            }
            System.out.println(Jsons.toJson(path.get()));
            return 0;
        }
    }

    @Command(name = "orphans", description = "List events whose cause does not exist")
    static final class OrphansCommand implements Callable<Integer> {
        @ParentCommand
        CauseLogCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.engine().findOrphanedEvents()));
            return 0;
        }
    }

    @Command(name = "report", description = "Render a lineage report for a correlation or an event")
    static final class ReportCommand implements Callable<Integer> {
        @ParentCommand
        CauseLogCommand parent;

        @Option(names = {"--correlation-id"}, description = "Correlation to report on")
        String correlationId;

        @Option(names = {"--event-id"}, description = "Report on the correlation of this event")
        Long eventId;

        @Option(names = {"--format"}, defaultValue = "text", description = "text|json|markdown")
        String format;

        @Option(names = {"--no-metrics"}, description = "Skip the metrics section")
        boolean noMetrics;

        @Option(names = {"--no-relationships"}, description = "Skip the relationships section")
        boolean noRelationships;

        @Override
        public Integer call() {
            if (correlationId == null && eventId == null) {
                System.err.println("--correlation-id or --event-id is required");
                return 2;
            }
            ReportRequest request = new ReportRequest(
                    correlationId,
                    eventId,
                    !noMetrics,
                    !noRelationships,
                    ReportFormat.fromString(format)
            );
            System.out.println(parent.engine().renderEventReport(request));
            return 0;
        }
    }

    @Command(name = "tree", description = "Draw the causation tree of a correlation")
    static final class TreeCommand implements Callable<Integer> {
        @ParentCommand
        CauseLogCommand parent;

        @Parameters(index = "0", description = "Correlation id")
        String correlationId;

        @Override
        public Integer call() {
            System.out.print(parent.engine().generateVisualEventTree(correlationId));
            System.out.println();
            return 0;
        }
    }

    @Command(name = "export", description = "Write events to a JSON Lines file")
    static final class ExportCommand implements Callable<Integer> {
        @ParentCommand
        CauseLogCommand parent;

        @Option(names = {"--out"}, required = true, description = "Target .jsonl file")
        Path out;

        @Option(names = {"--start-id"}, defaultValue = "0", description = "Lowest id to export")
        long startId;

        @Option(names = {"--end-id"}, description = "Highest id to export (inclusive)")
        Long endId;

        @Option(names = {"--correlation-id"}, description = "Only this correlation")
        String correlationId;

        @Option(names = {"--actor"}, description = "Only this actor")
        String actor;

        @Option(names = {"--command"}, description = "Only this command")
        String command;

        @Option(names = {"--no-metadata"}, description = "Leave metadata out of each line")
        boolean noMetadata;

        @Override
        public Integer call() {
            StreamQuery query = StreamQuery.all()
                    .from(startId)
                    .until(endId)
                    .forCorrelation(correlationId)
                    .forActor(actor)
                    .forCommand(command);
            System.out.println(Jsons.toJson(new EventArchive(parent.store()).exportTo(out, query, !noMetadata)));
            return 0;
        }
    }

    @Command(name = "import", description = "Append events from a JSON Lines file")
    static final class ImportCommand implements Callable<Integer> {
        @ParentCommand
        CauseLogCommand parent;

        @Option(names = {"--in"}, required = true, description = "Source .jsonl file")
        Path in;

        @Option(names = {"--batch-size"}, defaultValue = "100", description = "Events per transaction")
        int batchSize;

        @Option(names = {"--skip-errors"}, description = "Record bad lines and failed batches instead of stopping")
        boolean skipErrors;

        @Override
        public Integer call() {
            EventArchive.ImportOptions options = EventArchive.ImportOptions.defaults().withBatchSize(batchSize);
            if (skipErrors) {
                options = options.skippingErrors();
            }
            try {
                System.out.println(Jsons.toJson(new EventArchive(parent.store()).importFrom(in, options)));
                return 0;
            } catch (IllegalArgumentException | BulkAbortException e) {
                ObjectNode error = Jsons.object();
                error.put("error", e.getMessage());
                System.out.println(Jsons.toJson(error));
                return 1;
            }
        }
    }

    @Command(name = "schema-migrations", description = "Show applied schema migration versions")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        CauseLogCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows to print")
        int limit;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.database().listSchemaMigrations(limit)));
            return 0;
        }
    }
}
