package io.causelog.lineage.report;

import java.util.Locale;

public enum ReportFormat {
    TEXT(new TextReportRenderer()),
    JSON(new JsonReportRenderer()),
    MARKDOWN(new MarkdownReportRenderer());

    private final ReportRenderer renderer;

    ReportFormat(ReportRenderer renderer) {
        this.renderer = renderer;
    }

    public ReportRenderer renderer() {
        return renderer;
    }

    /**
     * Blank or unknown names fall back to {@link #TEXT}.
     */
    public static ReportFormat fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return TEXT;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "json" -> JSON;
            case "markdown", "md" -> MARKDOWN;
            default -> TEXT;
        };
    }
}
