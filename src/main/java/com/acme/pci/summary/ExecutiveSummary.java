package com.acme.pci.summary;

import com.acme.pci.model.CheckItem;
import com.acme.pci.model.CounterSnapshot;
import com.acme.pci.model.Enums.DisplayState;
import com.acme.pci.model.Report;
import com.acme.pci.model.ReportMetadata;
import com.acme.pci.model.ReportSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.acme.pci.util.HtmlUtil.escape;

/**
 * Rolls the per-requirement reports of one account up into a single report with one item per
 * requirement and the failed findings of all of them.
 */
public final class ExecutiveSummary {
    private static final Logger log = LoggerFactory.getLogger(ExecutiveSummary.class);

    public static final String TITLE = "PCI DSS 4.0 - Executive Summary Report";
    public static final String OVERVIEW_SECTION = "requirement-overview";
    public static final String FINDINGS_SECTION = "high-priority-findings";
    public static final String NO_FINDINGS_TITLE = "No high priority findings detected.";

    private record Area(String name, String remediation) {}

    private static final Map<String, Area> AREAS = Map.ofEntries(
            Map.entry("1", new Area("Network Security Controls",
                    "Critical network security issues exist. Review firewall configurations, network segmentation, and access control mechanisms.")),
            Map.entry("2", new Area("Secure Configuration",
                    "System configuration deficiencies exist. Address vendor-supplied defaults and harden system configurations.")),
            Map.entry("3", new Area("Stored Cardholder Data",
                    "Issues with protection of stored cardholder data. Review encryption mechanisms and data storage practices.")),
            Map.entry("4", new Area("Transmitted Cardholder Data",
                    "Data transmission security issues exist. Ensure all transmissions are encrypted with strong cryptography.")),
            Map.entry("5", new Area("Malware Protection",
                    "Deficiencies in malware protection mechanisms. Review anti-malware solutions and processes.")),
            Map.entry("6", new Area("Secure Systems & Applications",
                    "Application security deficiencies exist. Address secure development practices and vulnerability management.")),
            Map.entry("7", new Area("Access Control",
                    "Access control issues exist. Review access restrictions and least privilege implementation.")),
            Map.entry("8", new Area("Authentication",
                    "Authentication mechanism deficiencies exist. Review identity management and MFA implementation.")),
            Map.entry("9", new Area("Physical Access",
                    "Physical security control issues exist. Address physical access restrictions and protections.")),
            Map.entry("10", new Area("Logging & Monitoring",
                    "Audit logging and monitoring deficiencies exist. Review logging mechanisms and monitoring processes.")),
            Map.entry("11", new Area("Security Testing",
                    "Security testing and scanning issues exist. Address vulnerability scanning and penetration testing processes.")),
            Map.entry("12", new Area("Security Policy",
                    "Information security policy deficiencies exist. Review security policies and procedures documentation.")));

    private ExecutiveSummary() {}

    /**
     * Account details come from the first result. The overall counts are the sum over every
     * requirement that got past the permission gate.
     */
    public static Report build(List<RequirementResult> results, ZonedDateTime generatedAt) {
        if (results == null || results.isEmpty()) {
            throw new IllegalArgumentException("No requirement reports to summarize");
        }
        ReportMetadata first = results.get(0).metadata();
        String requirements = results.stream().map(RequirementResult::requirement).collect(Collectors.joining(", "));
        Report report = new Report(new ReportMetadata(TITLE, ReportMetadata.ALL_REQUIREMENTS, first.accountId(),
                first.region(), first.scope(), first.actor(), generatedAt));

        report.openSection(OVERVIEW_SECTION, "Requirement Overview (" + requirements + ")", DisplayState.EXPANDED);
        CounterSnapshot overall = CounterSnapshot.EMPTY;
        for (RequirementResult r : results) {
            report.appendItem(OVERVIEW_SECTION, overviewItem(r));
            if (!r.aborted()) overall = overall.plus(r.counts());
        }

        report.openSection(FINDINGS_SECTION, "High Priority Findings", DisplayState.COLLAPSED);
        int findings = 0;
        for (RequirementResult r : results) {
            for (CheckItem f : r.failures()) {
                report.appendItem(FINDINGS_SECTION, CheckItem.fail("Requirement " + r.requirement() + ": " + f.title(),
                        f.details(), f.recommendation()));
                findings++;
            }
        }
        if (findings == 0) {
            report.appendItem(FINDINGS_SECTION, CheckItem.pass(NO_FINDINGS_TITLE,
                    "<p>Access denied and manual verification items are not listed here.</p>"));
        }

        ReportSummary summary = report.finalizeReport(overall);
        log.info("Executive summary over requirements {}: {}% compliant, {} high priority findings",
                requirements, summary.percentage(), findings);
        return report;
    }

    static CheckItem overviewItem(RequirementResult r) {
        String title = "Requirement " + r.requirement() + " (" + areaName(r.requirement()) + ")";
        String link = "<p><a href=\"" + escape(r.baseName()) + ".html\" target=\"_blank\">View detailed report</a></p>";
        if (r.aborted()) {
            return CheckItem.warn(title, "<p>Not assessed: the run was aborted at the permission check.</p>" + link,
                    "Grant the missing read permissions and re-run Requirement " + r.requirement() + ".");
        }

        CounterSnapshot c = r.counts();
        String details = "<p><strong>Summary:</strong> " + c.passed() + " of " + c.total() + " checks passed, "
                + c.failed() + " failed, " + c.warning() + " require manual verification, "
                + c.accessDenied() + " access denied.</p>"
                + "<p>Compliance: " + r.percentage() + "% (" + r.band() + ")</p>" + link;
        if (c.failed() > 0) {
            return CheckItem.fail(title, details, remediation(r.requirement()));
        }
        if (c.warning() > 0) {
            return CheckItem.warn(title, details, "Complete the " + c.warning() + " manual verification items in the detailed report.");
        }
        if (c.accessDenied() > 0) {
            return CheckItem.warn(title, details, "Grant the missing read permissions so the denied checks can be evaluated.");
        }
        return CheckItem.pass(title, details);
    }

    static String areaName(String requirement) {
        Area a = AREAS.get(requirement);
        return a == null ? "PCI DSS" : a.name();
    }

    static String remediation(String requirement) {
        Area a = AREAS.get(requirement);
        return a == null ? "Critical compliance issues exist. Review the detailed report for specific findings." : a.remediation();
    }
}
