package com.acme.pci.checks;

import com.acme.pci.AssessmentContext;
import com.acme.pci.checks.AwsEvidence.Vpc;
import com.acme.pci.engine.AssessmentRun;
import com.acme.pci.model.Enums.CheckKind;
import com.acme.pci.model.Enums.Verdict;
import com.acme.pci.model.ProbeResult;
import com.acme.pci.probe.ApiCall;
import com.acme.pci.util.HtmlUtil;

import java.util.ArrayList;
import java.util.List;

public final class TargetVpcDiscoveryCheck implements Check {
    static final String TITLE = "VPC Environment Identification";
    static final ApiCall DESCRIBE_VPCS = ApiCall.of("ec2", "describe-vpcs", "VPC Configuration");

    @Override public String id() { return "target-vpcs"; }

    @Override
    public void run(AssessmentContext ctx, AssessmentRun out) {
        if (!ctx.allResources()) {
            ctx.targetVpcs = new ArrayList<>(ctx.requestedResources);
            out.recordClassified(TITLE, null, CheckKind.INFORMATIONAL, Verdict.COMPLIANT,
                    "<p>Assessment will be performed on " + ctx.targetVpcs.size() + " specified VPCs:</p>"
                            + HtmlUtil.pre(String.join(" ", ctx.targetVpcs))
                            + "<p>These VPCs were specified as potentially containing cardholder data environment components.</p>",
                    null);
            return;
        }

        ProbeResult r = ctx.probe.run(DESCRIBE_VPCS);
        Verdict verdict = Verdict.INCOMPLETE;
        String details;
        if (r.ok()) {
            Evidence<List<Vpc>> ev = AwsEvidence.VPCS.extract(r.payload());
            if (ev.isComplete() && !ev.fact().isEmpty()) {
                List<String> ids = new ArrayList<>();
                for (Vpc v : ev.fact()) ids.add(v.id());
                ctx.targetVpcs = ids;
                verdict = Verdict.COMPLIANT;
                details = "<p>All " + ids.size() + " VPCs will be assessed:</p>" + HtmlUtil.pre(String.join(" ", ids))
                        + "<p>For an accurate assessment, identify which of these VPCs are part of the CDE.</p>";
            } else {
                details = "<p>No VPCs were found in region " + HtmlUtil.escape(ctx.region) + ".</p>"
                        + (ev.isComplete() ? "" : "<p>" + HtmlUtil.escape(ev.reason()) + "</p>");
            }
        } else {
            details = "<p>Failed to retrieve VPC information; network checks will have no targets.</p>" + HtmlUtil.pre(r.error());
        }
        out.recordClassified(TITLE, r, CheckKind.INFORMATIONAL, verdict, details,
                "Verify AWS credentials and permissions to describe VPCs, or pass the CDE VPC ids explicitly.");
    }
}
