package com.acme.pci.render;

import com.acme.pci.model.CheckItem;
import com.acme.pci.model.CounterSnapshot;
import com.acme.pci.model.Report;
import com.acme.pci.model.ReportMetadata;
import com.acme.pci.model.ReportSummary;
import com.acme.pci.model.Section;

/**
 * Flat, newline-delimited rendition for log capture and diffing between runs.
 */
public final class TextSummaryRenderer implements ReportRenderer {

    @Override public String extension() { return "txt"; }

    @Override
    public String render(Report report) {
        ReportRenderer.requireFinalized(report);
        ReportMetadata md = report.metadata();
        StringBuilder sb = new StringBuilder();
        sb.append(md.title()).append('\n');
        sb.append("AWS Account: ").append(md.accountId()).append('\n');
        sb.append("AWS Region: ").append(md.region()).append('\n');
        sb.append("Scope: ").append(md.scope()).append('\n');
        sb.append("Assessment Date: ").append(Formats.DATE_TIME.format(md.assessedAt())).append('\n');
        sb.append("Assessed By: ").append(md.actor()).append('\n');

        for (Section s : report.sections()) {
            sb.append('\n').append("== ").append(s.title()).append(" ==").append('\n');
            for (CheckItem item : s.items()) {
                sb.append('[').append(item.outcome().badge()).append("] ").append(item.title()).append('\n');
            }
        }

        sb.append('\n').append(totals(report.summary()));
        return sb.toString();
    }

    public static String totals(ReportSummary summary) {
        CounterSnapshot c = summary.counts();
        return "Total checks: " + c.total() + '\n'
                + "Passed: " + c.passed() + '\n'
                + "Failed: " + c.failed() + '\n'
                + "Warnings/Manual: " + c.warning() + '\n'
                + "Access denied: " + c.accessDenied() + '\n'
                + "Compliance: " + summary.percentage() + "% (" + summary.band() + ")\n";
    }
}
