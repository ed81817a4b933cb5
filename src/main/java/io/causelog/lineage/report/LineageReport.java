package io.causelog.lineage.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Format-independent summary of one correlation group. {@code metrics} and
 * {@code relationships} are {@code null} when they were not requested; {@code error} is set
 * instead of content when no events matched.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LineageReport(
        String title,
        String generatedAt,
        List<ReportEvent> events,
        Metrics metrics,
        Relationships relationships,
        String error
) {
    public static LineageReport empty(String title, String generatedAt) {
        return new LineageReport(title, generatedAt, List.of(), null, null, "No events found");
    }

    public boolean isError() {
        return error != null;
    }

    public record ReportEvent(
            long id,
            String command,
            Long causationId,
            String correlationId,
            long timestamp,
            JsonNode payload,
            boolean root
    ) {
    }

    /**
     * {@code timeSpan} is measured in event ids, not wall time.
     */
    public record Metrics(
            int totalEvents,
            int rootEvents,
            int childEvents,
            int uniqueEventTypes,
            Map<String, Integer> eventTypeDistribution,
            long timeSpan,
            String averageDepth
    ) {
    }

    public record Relationships(List<BranchPoint> branchPoints, List<EventRef> leafEvents, List<Chain> chains) {
    }

    public record BranchPoint(long eventId, String command, int childCount, List<EventRef> children) {
    }

    public record Chain(long startEvent, int length, List<EventRef> events) {
    }

    public record EventRef(long id, String command) {
    }
}
