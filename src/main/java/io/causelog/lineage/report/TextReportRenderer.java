package io.causelog.lineage.report;

import java.util.stream.Collectors;

/**
 * Plain sectioned text: title, metrics, relationships, then one line per event.
 */
public final class TextReportRenderer implements ReportRenderer {
    @Override
    public String render(LineageReport report) {
        if (report.isError()) {
            return "Error: " + report.error();
        }
        StringBuilder out = new StringBuilder();
        out.append(report.title()).append('\n');
        out.append("=".repeat(report.title().length())).append("\n\n");
        out.append("Generated: ").append(report.generatedAt()).append("\n\n");

        LineageReport.Metrics metrics = report.metrics();
        if (metrics != null) {
            out.append("METRICS\n-------\n");
            out.append("Total Events: ").append(metrics.totalEvents()).append('\n');
            out.append("Root Events: ").append(metrics.rootEvents()).append('\n');
            out.append("Child Events: ").append(metrics.childEvents()).append('\n');
            out.append("Unique Event Types: ").append(metrics.uniqueEventTypes()).append('\n');
            out.append("Average Depth: ").append(metrics.averageDepth()).append('\n');
            out.append("Time Span: ").append(metrics.timeSpan()).append(" event IDs\n\n");
            out.append("Event Type Distribution:\n");
            metrics.eventTypeDistribution().forEach((type, count) ->
                    out.append("  ").append(type).append(": ").append(count).append('\n'));
            out.append('\n');
        }

        LineageReport.Relationships relationships = report.relationships();
        if (relationships != null) {
            out.append("RELATIONSHIPS\n-------------\n");
            if (!relationships.branchPoints().isEmpty()) {
                out.append("Branch Points: ").append(relationships.branchPoints().size()).append('\n');
                for (LineageReport.BranchPoint bp : relationships.branchPoints()) {
                    out.append("  Event ").append(bp.eventId()).append(" (").append(bp.command()).append(") -> ")
                            .append(bp.childCount()).append(" children\n");
                }
                out.append('\n');
            }
            if (!relationships.chains().isEmpty()) {
                out.append("Longest Chains:\n");
                for (LineageReport.Chain chain : relationships.chains()) {
                    out.append("  ").append(chain.length()).append(" events: ")
                            .append(chain.events().stream()
                                    .map(e -> e.id() + "(" + e.command() + ")")
                                    .collect(Collectors.joining(" -> ")))
                            .append('\n');
                }
                out.append('\n');
            }
            if (!relationships.leafEvents().isEmpty()) {
                out.append("Leaf Events: ").append(relationships.leafEvents().size()).append('\n');
                for (LineageReport.EventRef leaf : relationships.leafEvents()) {
                    out.append("  ").append(leaf.id()).append(" (").append(leaf.command()).append(")\n");
                }
                out.append('\n');
            }
        }

        out.append("EVENTS\n------\n");
        for (LineageReport.ReportEvent event : report.events()) {
            out.append(event.id()).append(": ").append(event.command());
            if (event.root()) {
                out.append(" [ROOT]");
            }
            if (event.causationId() != null) {
                out.append(" <- ").append(event.causationId());
            }
            out.append('\n');
        }
        return out.toString();
    }
}
