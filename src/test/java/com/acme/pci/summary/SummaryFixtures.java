package com.acme.pci.summary;

import com.acme.pci.engine.PermissionGate;
import com.acme.pci.model.CheckItem;
import com.acme.pci.model.CounterSnapshot;
import com.acme.pci.model.Enums.DisplayState;
import com.acme.pci.model.Report;
import com.acme.pci.model.ReportMetadata;

import java.time.ZoneId;
import java.time.ZonedDateTime;

final class SummaryFixtures {
    private SummaryFixtures() {}

    static ZonedDateTime at(int hour, int minute) {
        return ZonedDateTime.of(2026, 3, 14, hour, minute, 0, 0, ZoneId.of("UTC"));
    }

    private static Report open(String requirement, ZonedDateTime assessedAt) {
        Report report = new Report(new ReportMetadata("PCI DSS 4.0 - Requirement " + requirement + " Compliance Assessment Report",
                requirement, "123456789012", "eu-west-1", "vpc-1", "arn:aws:iam::123456789012:user/auditor", assessedAt));
        report.openSection(PermissionGate.SECTION_ID, PermissionGate.SECTION_TITLE, DisplayState.EXPANDED);
        report.appendItem(PermissionGate.SECTION_ID, CheckItem.pass("AWS API Access: ec2 describe-vpcs", "ok"));
        return report;
    }

    /** 2 passed, 1 failed, 1 manual: 66%. */
    static Report requirement1(ZonedDateTime assessedAt) {
        Report report = open("1", assessedAt);
        report.openSection("req-1.3", "Requirement 1.3", DisplayState.NONE);
        report.appendItem("req-1.3", CheckItem.pass("Flow logs: vpc-1", "active"));
        report.appendItem("req-1.3", CheckItem.pass("1.4.1 - Default VPC", "none in use"));
        report.appendItem("req-1.3", CheckItem.fail("1.3.1 - Admin ports", "<p>sg-1 allows 22 from 0.0.0.0/0</p>", "Restrict SSH."));
        report.appendItem("req-1.3", CheckItem.warn("1.3.3 - Wireless", "<p>manual</p>", "Verify manually."));
        report.finalizeReport(CounterSnapshot.of(2, 1, 1, 0, 0));
        return report;
    }

    /** 3 passed, 1 denied: 100%. */
    static Report requirement10(ZonedDateTime assessedAt) {
        Report report = open("10", assessedAt);
        report.openSection("req-10.2", "Requirement 10.2", DisplayState.NONE);
        report.appendItem("req-10.2", CheckItem.pass("10.2.1 - Trails", "multi-region trail"));
        report.appendItem("req-10.2", CheckItem.pass("10.3.2 - Log validation", "enabled"));
        report.appendItem("req-10.2", CheckItem.pass("10.5.1 - Retention", "365 days"));
        report.appendItem("req-10.2", CheckItem.denied("10.4.1 - Alarms", "<pre>AccessDenied</pre>", "Grant cloudwatch read access."));
        report.finalizeReport(CounterSnapshot.of(3, 0, 0, 0, 1));
        return report;
    }

    static Report aborted(String requirement, ZonedDateTime assessedAt) {
        Report report = open(requirement, assessedAt);
        report.appendItem(PermissionGate.SECTION_ID, CheckItem.denied("AWS API Access: wafv2 list-web-acls",
                "<pre>AccessDenied</pre>", "Grant wafv2 read access."));
        report.appendItem(PermissionGate.SECTION_ID, CheckItem.info(PermissionGate.ABORTED_TITLE, "User chose to abort."));
        report.finalizeReport(CounterSnapshot.of(1, 0, 0, 1, 1));
        return report;
    }
}
