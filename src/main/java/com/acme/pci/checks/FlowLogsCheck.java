package com.acme.pci.checks;

import com.acme.pci.AssessmentContext;
import com.acme.pci.engine.AssessmentRun;
import com.acme.pci.model.Enums.CheckKind;
import com.acme.pci.model.Enums.Verdict;
import com.acme.pci.model.ProbeResult;
import com.acme.pci.probe.ApiCall;
import com.acme.pci.util.HtmlUtil;

import java.util.Set;

public final class FlowLogsCheck implements Check {
    static final String TITLE = "1.2.7 - VPC Flow Logs";
    static final ApiCall DESCRIBE_FLOW_LOGS = ApiCall.of("ec2", "describe-flow-logs", "VPC Flow Logs");
    static final String RECOMMENDATION = "Enable VPC Flow Logs for every VPC in the CDE and ship them to a protected log destination.";

    @Override public String id() { return "vpc-flow-logs"; }

    @Override
    public void run(AssessmentContext ctx, AssessmentRun out) {
        if (ctx.targetVpcs.isEmpty()) {
            out.recordClassified(TITLE, null, CheckKind.AUTOMATED, Verdict.INCOMPLETE,
                    "<p>No target VPCs were identified, so flow logging could not be evaluated.</p>",
                    "Identify the CDE VPCs and re-run the assessment.");
            return;
        }

        ProbeResult r = ctx.probe.run(DESCRIBE_FLOW_LOGS);
        Evidence<Set<String>> ev = r.ok()
                ? AwsEvidence.ACTIVE_FLOW_LOG_RESOURCES.extract(r.payload())
                : Evidence.incomplete(r.error());

        for (String vpc : ctx.targetVpcs) {
            String title = TITLE + ": " + vpc;
            if (!ev.isComplete()) {
                out.recordClassified(title, r, CheckKind.AUTOMATED, Verdict.INCOMPLETE,
                        "<p>Flow log configuration could not be determined.</p>" + HtmlUtil.pre(ev.reason()),
                        r.isDenied() ? "Grant read access to ec2 describe-flow-logs and re-run the assessment." : RECOMMENDATION);
                continue;
            }
            boolean active = ev.fact().contains(vpc);
            out.recordClassified(title, r, CheckKind.AUTOMATED, active ? Verdict.COMPLIANT : Verdict.NON_COMPLIANT,
                    active ? "<p>VPC " + HtmlUtil.escape(vpc) + " has an active flow log.</p>"
                            : "<p>VPC " + HtmlUtil.escape(vpc) + " has no active flow log.</p>",
                    RECOMMENDATION);
        }
    }
}
