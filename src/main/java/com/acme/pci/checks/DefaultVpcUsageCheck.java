package com.acme.pci.checks;
import com.acme.pci.AssessmentContext;
import com.acme.pci.checks.AwsEvidence.Vpc;
import com.acme.pci.engine.AssessmentRun;
import com.acme.pci.model.Enums.CheckKind;
import com.acme.pci.model.Enums.Verdict;
import com.acme.pci.model.ProbeResult;
import com.acme.pci.util.HtmlUtil;

import java.util.ArrayList;
import java.util.List;

public final class DefaultVpcUsageCheck implements Check {
    static final String TITLE = "1.4.1 - Default VPC not used for the CDE";
    static final String RECOMMENDATION =
            "Move CDE workloads out of the default VPC into a dedicated VPC with explicitly managed network security controls.";

    @Override public String id() { return "default-vpc-usage"; }

    @Override
    public void run(AssessmentContext ctx, AssessmentRun out) {
        ProbeResult r = ctx.probe.run(TargetVpcDiscoveryCheck.DESCRIBE_VPCS);
        if (!r.ok()) {
            out.recordClassified(TITLE, r, CheckKind.AUTOMATED, Verdict.INCOMPLETE,
                    "<p>VPC attributes could not be retrieved.</p>" + HtmlUtil.pre(r.error()),
                    r.isDenied() ? "Grant read access to ec2 describe-vpcs and re-run the assessment." : RECOMMENDATION);
            return;
        }
        Evidence<List<Vpc>> ev = AwsEvidence.VPCS.extract(r.payload());
        if (!ev.isComplete()) {
            out.recordClassified(TITLE, r, CheckKind.AUTOMATED, Verdict.INCOMPLETE,
                    "<p>Evidence incomplete: " + HtmlUtil.escape(ev.reason()) + "</p>", RECOMMENDATION);
            return;
        }
        List<String> defaults = defaultVpcsInScope(ev.fact(), ctx.targetVpcs);
        String details = defaults.isEmpty()
                ? "<p>None of the assessed VPCs is a default VPC.</p>"
                : "<p>Default VPC in scope:</p>" + HtmlUtil.pre(String.join(" ", defaults));
        out.recordClassified(TITLE, r, CheckKind.AUTOMATED,
                defaults.isEmpty() ? Verdict.COMPLIANT : Verdict.NON_COMPLIANT, details, RECOMMENDATION);
    }

    static List<String> defaultVpcsInScope(List<Vpc> vpcs, List<String> targets) {
        List<String> out = new ArrayList<>();
        for (Vpc v : vpcs) {
            if (v.isDefault() && (targets.isEmpty() || targets.contains(v.id()))) out.add(v.id());
        }
        return out;
    }
}
