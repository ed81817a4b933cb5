package io.causelog.lineage.report;

import java.util.stream.Collectors;

public final class MarkdownReportRenderer implements ReportRenderer {
    @Override
    public String render(LineageReport report) {
        if (report.isError()) {
            return "# Error\n\n" + report.error();
        }
        StringBuilder out = new StringBuilder();
        out.append("# ").append(report.title()).append("\n\n");
        out.append("*Generated: ").append(report.generatedAt()).append("*\n\n");

        LineageReport.Metrics metrics = report.metrics();
        if (metrics != null) {
            out.append("## Metrics\n\n");
            out.append("- **Total Events:** ").append(metrics.totalEvents()).append('\n');
            out.append("- **Root Events:** ").append(metrics.rootEvents()).append('\n');
            out.append("- **Child Events:** ").append(metrics.childEvents()).append('\n');
            out.append("- **Unique Event Types:** ").append(metrics.uniqueEventTypes()).append('\n');
            out.append("- **Average Depth:** ").append(metrics.averageDepth()).append('\n');
            out.append("- **Time Span:** ").append(metrics.timeSpan()).append(" event IDs\n\n");
            out.append("### Event Type Distribution\n\n");
            metrics.eventTypeDistribution().forEach((type, count) ->
                    out.append("- **").append(type).append(":** ").append(count).append('\n'));
            out.append('\n');
        }

        LineageReport.Relationships relationships = report.relationships();
        if (relationships != null) {
            out.append("## Relationships\n\n");
            if (!relationships.branchPoints().isEmpty()) {
                out.append("### Branch Points\n\n");
                for (LineageReport.BranchPoint bp : relationships.branchPoints()) {
                    out.append("- Event **").append(bp.eventId()).append("** (").append(bp.command())
                            .append(") branches to ").append(bp.childCount()).append(" children\n");
                }
                out.append('\n');
            }
            if (!relationships.chains().isEmpty()) {
                out.append("### Longest Chains\n\n");
                for (LineageReport.Chain chain : relationships.chains()) {
                    out.append("- ").append(chain.length()).append(" events: ")
                            .append(chain.events().stream()
                                    .map(e -> "**" + e.id() + "**(" + e.command() + ")")
                                    .collect(Collectors.joining(" → ")))
                            .append('\n');
                }
                out.append('\n');
            }
            if (!relationships.leafEvents().isEmpty()) {
                out.append("### Leaf Events\n\n");
                for (LineageReport.EventRef leaf : relationships.leafEvents()) {
                    out.append("- ").append(leaf.id()).append(" (").append(leaf.command()).append(")\n");
                }
                out.append('\n');
            }
        }

        out.append("## Events\n\n");
        out.append("| ID | Command | Root | Causation |\n");
        out.append("|----|---------|------|-----------|\n");
        for (LineageReport.ReportEvent event : report.events()) {
            out.append("| ").append(event.id())
                    .append(" | ").append(event.command())
                    .append(" | ").append(event.root() ? "✓" : "")
                    .append(" | ").append(event.causationId() == null ? "" : event.causationId())
                    .append(" |\n");
        }
        return out.toString();
    }
}
