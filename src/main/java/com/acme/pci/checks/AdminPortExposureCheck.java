/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: PCI DSS Assessment Tool
 */

package com.acme.pci.checks;

import com.acme.pci.AssessmentContext;
import com.acme.pci.checks.AwsEvidence.Exposure;
import com.acme.pci.engine.AssessmentRun;
import com.acme.pci.model.Enums.Verdict;
import com.acme.pci.probe.ApiCall;
import com.acme.pci.util.HtmlUtil;

import java.util.ArrayList;
import java.util.List;

public final class AdminPortExposureCheck implements Check {
    static final String TITLE = "1.3.1 - Inbound administrative access from the internet";
    static final String RECOMMENDATION =
            "Restrict inbound SSH (22) and RDP (3389) to known administrative networks or use AWS Systems Manager Session Manager instead.";

    @Override public String id() { return "admin-port-exposure"; }

    @Override
    public void run(AssessmentContext ctx, AssessmentRun out) {
        new ProbeCheck<>(id(), TITLE, describeSecurityGroups(ctx.targetVpcs), AwsEvidence.ADMIN_PORT_EXPOSURES,
                exposures -> exposures.isEmpty() ? Verdict.COMPLIANT : Verdict.NON_COMPLIANT,
                AdminPortExposureCheck::describe, RECOMMENDATION).run(ctx, out);
    }

    static ApiCall describeSecurityGroups(List<String> vpcs) {
        List<String> args = new ArrayList<>();
        if (!vpcs.isEmpty()) {
            args.add("--filters");
            args.add("Name=vpc-id,Values=" + String.join(",", vpcs));
        }
        return new ApiCall("ec2", "describe-security-groups", "Security Group Rules", args);
    }

    static String describe(List<Exposure> exposures) {
        if (exposures.isEmpty()) {
            return "<p>No security group in scope allows inbound SSH (22) or RDP (3389) from 0.0.0.0/0 or ::/0.</p>";
        }
        StringBuilder sb = new StringBuilder();
        sb.append("<p>").append(exposures.size()).append(" security group rule(s) allow administrative access from the internet.</p>")
                .append("<br><br><strong>Affected security groups:</strong><ul>");
        for (Exposure e : exposures) {
            sb.append("<li>").append(HtmlUtil.escape(e.groupId())).append(" (").append(HtmlUtil.escape(e.groupName()))
                    .append(") in ").append(HtmlUtil.escape(e.vpcId())).append(": ports ").append(HtmlUtil.escape(e.ports()))
                    .append(" open to ").append(HtmlUtil.escape(e.source())).append("</li>");
        }
        return sb.append("</ul>").toString();
    }
}
