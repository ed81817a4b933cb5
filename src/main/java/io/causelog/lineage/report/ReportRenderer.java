package io.causelog.lineage.report;

@FunctionalInterface
public interface ReportRenderer {
    String render(LineageReport report);
}
