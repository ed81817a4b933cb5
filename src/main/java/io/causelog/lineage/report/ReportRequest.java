package io.causelog.lineage.report;

/**
 * Selects a correlation group either directly or through one of its events. When both are
 * given the correlation id wins.
 */
public record ReportRequest(
        String correlationId,
        Long eventId,
        boolean includeMetrics,
        boolean includeRelationships,
        ReportFormat format
) {
    public ReportRequest {
        format = format == null ? ReportFormat.TEXT : format;
    }

    public static ReportRequest forCorrelation(String correlationId) {
        return new ReportRequest(correlationId, null, true, true, ReportFormat.TEXT);
    }

    public static ReportRequest forEvent(long eventId) {
        return new ReportRequest(null, eventId, true, true, ReportFormat.TEXT);
    }

    public ReportRequest withFormat(ReportFormat format) {
        return new ReportRequest(correlationId, eventId, includeMetrics, includeRelationships, format);
    }

    public ReportRequest withMetrics(boolean include) {
        return new ReportRequest(correlationId, eventId, include, includeRelationships, format);
    }

    public ReportRequest withRelationships(boolean include) {
        return new ReportRequest(correlationId, eventId, includeMetrics, include, format);
    }
}
