package com.acme.pci.checks;

import com.acme.pci.checks.AwsEvidence.LogGroup;
import com.acme.pci.checks.AwsEvidence.Trail;
import com.acme.pci.model.Enums.DisplayState;
import com.acme.pci.model.Enums.Verdict;
import com.acme.pci.model.ReportMetadata;
import com.acme.pci.probe.ApiCall;
import com.acme.pci.probe.CapabilityCatalog;
import com.acme.pci.util.HtmlUtil;

import java.util.ArrayList;
import java.util.List;

public final class Requirements {
    private Requirements() {}

    static final int MIN_LOG_RETENTION_DAYS = 365;

    public static RequirementSuite forNumber(String requirement) {
        return switch (requirement) {
            case "1" -> requirement1();
            case "10" -> requirement10();
            default -> throw new IllegalArgumentException("Unsupported requirement '" + requirement + "'; expected 1, 10 or all");
        };
    }

    /** A single requirement number, or {@code all} for every implemented requirement in order. */
    public static List<RequirementSuite> forSelection(String selection) {
        if (ReportMetadata.ALL_REQUIREMENTS.equalsIgnoreCase(selection)) return List.of(requirement1(), requirement10());
        return List.of(forNumber(selection));
    }

    public static RequirementSuite requirement1() {
        return new RequirementSuite("1", "Install and Maintain Network Security Controls", CapabilityCatalog.REQUIREMENT_1, List.of(
                new CheckSection("target-vpcs", "Target VPC Environments", DisplayState.COLLAPSED, List.of(
                        new TargetVpcDiscoveryCheck())),
                new CheckSection("req-1.2", "Requirement 1.2: Network security controls are configured and maintained", DisplayState.NONE, List.of(
                        new ManualCheck("1.2.1", "1.2.1 - Configuration standards for NSC rulesets",
                                "<p>Configuration standards for network security control rulesets must be defined, implemented and maintained.</p>"),
                        new FlowLogsCheck())),
                new CheckSection("req-1.3", "Requirement 1.3: Network access to and from the CDE is restricted", DisplayState.NONE, List.of(
                        new AdminPortExposureCheck(),
                        new ManualCheck("1.3.3", "1.3.3 - NSCs between wireless networks and the CDE",
                                "<p>Wireless networks must be separated from the CDE by network security controls.</p>"))),
                new CheckSection("req-1.4", "Requirement 1.4: Network connections between trusted and untrusted networks are controlled", DisplayState.NONE, List.of(
                        new DefaultVpcUsageCheck())),
                new CheckSection("req-1.5", "Requirement 1.5: Risks from computing devices connecting to untrusted networks are mitigated", DisplayState.NONE, List.of(
                        new ManualCheck("1.5.1", "1.5.1 - Security controls on devices connecting to untrusted networks",
                                "<p>Devices that connect to both untrusted networks and the CDE must run security controls that users cannot alter.</p>")))
        ));
    }

    public static RequirementSuite requirement10() {
        ApiCall trails = ApiCall.of("cloudtrail", "describe-trails", "CloudTrail Trails");
        ApiCall logGroups = ApiCall.of("logs", "describe-log-groups", "CloudWatch Logs");
        return new RequirementSuite("10", "Log and Monitor All Access to System Components and Cardholder Data", CapabilityCatalog.REQUIREMENT_10, List.of(
                new CheckSection("req-10.2", "Requirement 10.2: Audit logs are implemented", DisplayState.EXPANDED, List.of(
                        new ProbeCheck<>("cloudtrail-multi-region", "10.2.1 - Audit logs are enabled (multi-region CloudTrail)",
                                trails, AwsEvidence.TRAILS,
                                list -> list.stream().anyMatch(Trail::multiRegion) ? Verdict.COMPLIANT : Verdict.NON_COMPLIANT,
                                Requirements::describeTrails,
                                "Create a multi-region CloudTrail trail that records management events for all regions."))),
                new CheckSection("req-10.3", "Requirement 10.3: Audit logs are protected from destruction and unauthorized modifications", DisplayState.NONE, List.of(
                        new ProbeCheck<>("cloudtrail-log-validation", "10.3.2 - Log file integrity validation",
                                trails, AwsEvidence.TRAILS, Requirements::validationVerdict,
                                Requirements::describeTrails,
                                "Enable log file validation on every CloudTrail trail."))),
                new CheckSection("req-10.4", "Requirement 10.4: Audit logs are reviewed", DisplayState.NONE, List.of(
                        new ManualCheck("10.4.1", "10.4.1 - Daily review of security events",
                                "<p>Security events and logs of critical system components must be reviewed at least once daily.</p>"))),
                new CheckSection("req-10.5", "Requirement 10.5: Audit log history is retained", DisplayState.NONE, List.of(
                        new ProbeCheck<>("log-retention", "10.5.1 - Audit log retention of at least 12 months",
                                logGroups, AwsEvidence.LOG_GROUPS, Requirements::retentionVerdict,
                                Requirements::describeRetention,
                                "Set CloudWatch Logs retention to at least 365 days for audit log groups, or archive them to S3 with a matching lifecycle."))),
                new CheckSection("req-10.7", "Requirement 10.7: Failures of critical security control systems are detected", DisplayState.NONE, List.of(
                        new ManualCheck("10.7.2", "10.7.2 - Detection of security control failures",
                                "<p>Failures of critical security control systems must be detected, alerted and addressed promptly.</p>")))
        ));
    }

    static Verdict validationVerdict(List<Trail> trails) {
        if (trails.isEmpty()) return Verdict.INCOMPLETE;
        return trails.stream().allMatch(Trail::logFileValidation) ? Verdict.COMPLIANT : Verdict.NON_COMPLIANT;
    }

    static Verdict retentionVerdict(List<LogGroup> groups) {
        if (groups.isEmpty()) return Verdict.INCOMPLETE;
        return shortRetention(groups).isEmpty() ? Verdict.COMPLIANT : Verdict.NON_COMPLIANT;
    }

    static List<LogGroup> shortRetention(List<LogGroup> groups) {
        List<LogGroup> out = new ArrayList<>();
        for (LogGroup g : groups) {
            if (g.retentionDays() != null && g.retentionDays() < MIN_LOG_RETENTION_DAYS) out.add(g);
        }
        return out;
    }

    static String describeTrails(List<Trail> trails) {
        if (trails.isEmpty()) return "<p>No CloudTrail trails are configured.</p>";
        StringBuilder sb = new StringBuilder("<p>").append(trails.size()).append(" trail(s) found:</p><ul>");
        for (Trail t : trails) {
            sb.append("<li>").append(HtmlUtil.escape(t.name()))
                    .append(t.multiRegion() ? " (multi-region)" : " (single region)")
                    .append(t.logFileValidation() ? ", log file validation enabled" : ", log file validation disabled")
                    .append("</li>");
        }
        return sb.append("</ul>").toString();
    }

    static String describeRetention(List<LogGroup> groups) {
        if (groups.isEmpty()) return "<p>No CloudWatch log groups were found.</p>";
        List<LogGroup> shortOnes = shortRetention(groups);
        if (shortOnes.isEmpty()) {
            return "<p>All " + groups.size() + " log group(s) retain events for at least " + MIN_LOG_RETENTION_DAYS + " days or never expire.</p>";
        }
        StringBuilder sb = new StringBuilder("<p>").append(shortOnes.size()).append(" of ").append(groups.size())
                .append(" log group(s) keep events for less than ").append(MIN_LOG_RETENTION_DAYS).append(" days.</p>")
                .append("<br><br><strong>Log groups below the retention minimum:</strong><ul>");
        for (LogGroup g : shortOnes) {
            sb.append("<li>").append(HtmlUtil.escape(g.name())).append(": ").append(g.retentionDays()).append(" days</li>");
        }
        return sb.append("</ul>").toString();
    }
}
