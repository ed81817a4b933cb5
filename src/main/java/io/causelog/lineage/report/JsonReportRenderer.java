package io.causelog.lineage.report;

import io.causelog.util.Jsons;

public final class JsonReportRenderer implements ReportRenderer {
    @Override
    public String render(LineageReport report) {
        return Jsons.toJson(report);
    }
}
