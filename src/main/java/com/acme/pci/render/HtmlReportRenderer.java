package com.acme.pci.render;

import com.acme.pci.model.CheckItem;
import com.acme.pci.model.CounterSnapshot;
import com.acme.pci.model.Enums.Outcome;
import com.acme.pci.model.Enums.Rag;
import com.acme.pci.model.Report;
import com.acme.pci.model.ReportMetadata;
import com.acme.pci.model.ReportSummary;
import com.acme.pci.model.Section;
import com.acme.pci.util.ComplianceCalculator;

import java.time.ZoneId;
import java.util.List;
import java.util.Locale;

import static com.acme.pci.util.HtmlUtil.escape;

public final class HtmlReportRenderer implements ReportRenderer {

    static final String DETAIL_SPLIT = "<br><br><strong>";

    private static final String STYLE = """
                body { font-family: 'Segoe UI', Tahoma, Geneva, Verdana, sans-serif; line-height: 1.6; color: #333; margin: 0; padding: 20px; background-color: #f5f5f5; }
                .container { max-width: 1200px; margin: 0 auto; background-color: #fff; padding: 30px; box-shadow: 0 0 10px rgba(0, 0, 0, 0.1); border-radius: 5px; }
                h1 { border-bottom: 2px solid #2196F3; padding-bottom: 10px; margin-top: 0; }
                h2 { color: #2196F3; border-bottom: 1px solid #eee; padding-bottom: 5px; }
                h3 { color: #555; margin: 0 0 6px 0; }
                .info-table, .summary-table { width: 100%; border-collapse: collapse; margin: 15px 0; }
                .info-table th, .info-table td, .summary-table th, .summary-table td { padding: 10px; border: 1px solid #ddd; text-align: left; }
                .info-table th { background-color: #f0f0f0; width: 25%; }
                .summary-table th { background-color: #e0e0e0; }
                .summary-box { margin-top: 20px; padding: 15px; background-color: #f0f0f0; border-radius: 5px; }
                .section { margin-bottom: 30px; border: 1px solid #ddd; border-radius: 5px; overflow: hidden; }
                .section-header { background-color: #f0f0f0; padding: 10px 15px; cursor: pointer; position: relative; font-weight: bold; }
                .section-header:hover { background-color: #e0e0e0; }
                .section-header::after { content: "+"; position: absolute; right: 15px; top: 10px; }
                .section-header.active::after { content: "-"; }
                .section-metrics { font-weight: normal; color: #757575; margin-left: 10px; font-size: 0.9em; }
                .section-content { padding: 15px; }
                .check-item { border-left: 4px solid #ddd; padding: 10px; margin-bottom: 10px; background-color: #f9f9f9; }
                .check-item.pass { border-left-color: #4CAF50; }
                .check-item.fail { border-left-color: #f44336; }
                .check-item.warning { border-left-color: #ff9800; }
                .check-item.info { border-left-color: #2196F3; }
                .check-item.access-denied { border-left-color: #757575; }
                .badge { display: inline-block; padding: 0 6px; border-radius: 3px; color: #fff; font-size: 0.85em; }
                .badge.pass { background-color: #4CAF50; }
                .badge.fail { background-color: #f44336; }
                .badge.warning { background-color: #ff9800; }
                .badge.info { background-color: #2196F3; }
                .badge.access-denied { background-color: #757575; }
                .recommendation { margin-top: 10px; padding: 10px; background-color: #e1f5fe; border-left: 4px solid #03a9f4; }
                details { border: 1px solid #ddd; border-radius: 4px; padding: 0.5em 0.5em 0; margin: 10px 0; }
                summary { font-weight: bold; cursor: pointer; }
                .progress-container { width: 100%; background-color: #ddd; border-radius: 5px; margin-top: 10px; }
                .progress-bar { height: 25px; border-radius: 5px; text-align: center; line-height: 25px; color: white; }
                .timestamp { color: #757575; font-style: italic; text-align: right; }
                pre { background-color: #f5f5f5; padding: 10px; border-radius: 5px; overflow-x: auto; }
                .green { color: #4CAF50; } .red { color: #f44336; } .yellow { color: #ff9800; } .blue { color: #2196F3; } .gray { color: #757575; }
                @media print { .section-content { display: block !important; } .section-header::after { display: none; } }
            """;

    private static final String SCRIPT = """
                function toggleSection(header) {
                    header.classList.toggle('active');
                    header.nextElementSibling.style.display = header.classList.contains('active') ? 'block' : 'none';
                }
            """;

    private static final List<String> NOTES = List.of(
            "This report provides a high-level assessment of AWS controls for the selected PCI DSS requirement.",
            "Many checks require manual verification of documentation and procedures.",
            "Access-denied and warning/manual checks are excluded from the compliance percentage.",
            "A full PCI DSS assessment requires detailed analysis of all system components in the CDE.",
            "This report does not replace the need for a qualified security assessor (QSA)."
    );

    @Override public String extension() { return "html"; }

    @Override
    public String render(Report report) {
        ReportRenderer.requireFinalized(report);
        ReportMetadata md = report.metadata();
        StringBuilder html = new StringBuilder(16_384);

        html.append("<!DOCTYPE html>\n<html lang=\"en\">\n<head>\n")
                .append("<meta charset=\"UTF-8\">\n")
                .append("<meta name=\"viewport\" content=\"width=device-width, initial-scale=1.0\">\n")
                .append("<title>").append(escape(md.title())).append("</title>\n")
                .append("<style>\n").append(STYLE).append("</style>\n")
                .append("<script>\n").append(SCRIPT).append("</script>\n")
                .append("</head>\n<body>\n<div class=\"container\">\n")
                .append("<h1>").append(escape(md.title())).append("</h1>\n");

        appendHeader(html, md);
        appendSummary(html, report.summary());

        html.append("<div id=\"report-content\">\n");
        List<Section> sections = report.sections();
        for (int i = 0; i < sections.size(); i++) appendSection(html, sections.get(i), i == 0);
        html.append("<h3>Important Notes</h3>\n<ol>\n");
        for (String note : NOTES) html.append("<li>").append(escape(note)).append("</li>\n");
        html.append("</ol>\n</div>\n");

        html.append("<div class=\"timestamp\">Report generated on: ")
                .append(escape(Formats.DATE_TIME.format(report.summary().finalizedAt().atZone(ZoneId.systemDefault()))))
                .append("</div>\n</div>\n</body>\n</html>\n");
        return html.toString();
    }

    private static void appendHeader(StringBuilder html, ReportMetadata md) {
        html.append("<table class=\"info-table\">\n");
        row(html, "AWS Account", md.accountId());
        row(html, "AWS Region", md.region());
        row(html, "Scope", md.scope());
        row(html, "Assessment Date", Formats.DATE_TIME.format(md.assessedAt()));
        row(html, "Assessed By", md.actor());
        html.append("</table>\n");
    }

    private static void row(StringBuilder html, String key, String value) {
        html.append("<tr><th>").append(escape(key)).append("</th><td>").append(escape(value)).append("</td></tr>\n");
    }

    static void appendSummary(StringBuilder html, ReportSummary summary) {
        CounterSnapshot c = summary.counts();
        int pct = summary.percentage();
        html.append("<div class=\"summary-box\">\n<h2 style=\"margin-top: 0;\">Summary</h2>\n")
                .append("<div id=\"summary-statistics\">\n<table class=\"summary-table\">\n")
                .append("<tr><th>Total Checks</th><th>Passed</th><th>Failed</th><th>Warnings/Manual</th><th>Access Denied</th><th>Compliance</th></tr>\n")
                .append("<tr><td>").append(c.total()).append("</td>")
                .append("<td><span class=\"green\">").append(c.passed()).append("</span></td>")
                .append("<td><span class=\"red\">").append(c.failed()).append("</span></td>")
                .append("<td><span class=\"yellow\">").append(c.warning()).append("</span></td>")
                .append("<td><span class=\"gray\">").append(c.accessDenied()).append("</span></td>")
                .append("<td>").append(pct).append("%</td></tr>\n</table>\n")
                .append("<div class=\"progress-container\">\n")
                .append("<div class=\"progress-bar\" data-band=\"").append(summary.band()).append("\" style=\"width: ")
                .append(pct).append("%; background-color: ").append(bandColor(summary.band())).append(";\">")
                .append(pct).append("%</div>\n</div>\n</div>\n</div>\n");
    }

    static String bandColor(Rag band) {
        return switch (band) {
            case RED -> "#f44336";
            case AMBER -> "#ff9800";
            case GREEN -> "#4CAF50";
        };
    }

    private static void appendSection(StringBuilder html, Section s, boolean open) {
        CounterSnapshot tally = s.tally();
        html.append("<div class=\"section\" data-initial-state=\"").append(s.displayState().name().toLowerCase(Locale.ROOT)).append("\">\n")
                .append("<div class=\"section-header").append(open ? " active" : "").append("\" onclick=\"toggleSection(this)\">")
                .append(escape(s.title()))
                .append("<span class=\"section-metrics\">").append(ComplianceCalculator.percentage(tally)).append("% compliant (")
                .append(tally.passed()).append(" passed, ").append(tally.failed()).append(" failed, ")
                .append(tally.warning()).append(" warnings)</span></div>\n")
                .append("<div class=\"section-content\" style=\"display: ").append(open ? "block" : "none").append(";\">\n")
                .append("<div id=\"").append(escape(s.id())).append("\">\n");
        for (CheckItem item : s.items()) appendItem(html, item);
        html.append("</div>\n</div>\n</div>\n");
    }

    private static void appendItem(StringBuilder html, CheckItem item) {
        String css = item.outcome().cssClass();
        html.append("<div class=\"check-item ").append(css).append("\">\n")
                .append("<h3><span class=\"badge ").append(css).append("\">[").append(item.outcome().badge()).append("]</span> ")
                .append(escape(item.title())).append("</h3>\n")
                .append("<div class=\"details\">").append(detailsBody(item)).append("</div>\n");
        if (item.hasRecommendation()) {
            html.append("<div class=\"recommendation\"><strong>Recommendation:</strong> ")
                    .append(escape(item.recommendation())).append("</div>\n");
        }
        html.append("</div>\n");
    }

    /** Long failure details are split into a summary line and an expandable block. */
    static String detailsBody(CheckItem item) {
        String d = item.details();
        int idx = d.indexOf(DETAIL_SPLIT);
        if (item.outcome() != Outcome.FAIL || idx < 0) return d;
        return "<div class=\"summary-details\">" + d.substring(0, idx) + "</div>\n"
                + "<details><summary>Click to view detailed information</summary>\n"
                + "<div class=\"details-content\">" + d.substring(idx + "<br><br>".length()) + "</div>\n</details>";
    }
}
