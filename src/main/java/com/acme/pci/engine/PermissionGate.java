package com.acme.pci.engine;

import com.acme.pci.model.CheckItem;
import com.acme.pci.model.CounterSnapshot;
import com.acme.pci.model.Enums.DisplayState;
import com.acme.pci.model.Enums.GateState;
import com.acme.pci.model.Enums.Outcome;
import com.acme.pci.model.ProbeResult;
import com.acme.pci.probe.ApiCall;
import com.acme.pci.probe.Probe;
import com.acme.pci.util.ComplianceCalculator;
import com.acme.pci.util.HtmlUtil;
import com.acme.pci.util.Prompter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

public final class PermissionGate {
    private static final Logger log = LoggerFactory.getLogger(PermissionGate.class);

    public static final int DEFAULT_THRESHOLD = 70;
    public static final String SECTION_ID = "permissions";
    public static final String SECTION_TITLE = "AWS Permissions Check";
    public static final String ABORTED_TITLE = "Assessment Aborted";

    private final Probe probe;
    private final Prompter prompter;
    private final int threshold;
    private final boolean assumeYes;
    private GateState state = GateState.PROBING;

    public PermissionGate(Probe probe, Prompter prompter, int threshold, boolean assumeYes) {
        if (threshold < 0 || threshold > 100) throw new IllegalArgumentException("threshold must be within 0..100, got " + threshold);
        this.probe = probe;
        this.prompter = prompter;
        this.threshold = threshold;
        this.assumeYes = assumeYes;
    }

    public GateState state() { return state; }

    public GateDecision evaluate(AssessmentRun run, List<ApiCall> capabilities) {
        state = GateState.PROBING;
        run.openSection(SECTION_ID, SECTION_TITLE, DisplayState.EXPANDED);
        for (ApiCall call : capabilities) {
            ProbeResult r = probe.run(call);
            CheckItem item = run.record(capabilityItem(call, r));
            log.info("Permission check: {} = {}", call.label(), item.outcome());
        }

        state = GateState.EVALUATING;
        CounterSnapshot counts = run.counters();
        int available = ComplianceCalculator.availablePercentage(counts);
        log.info("Permission check: {}/{} available, {} denied ({}%)",
                counts.passed(), counts.total(), counts.accessDenied(), available);

        if (available >= threshold) {
            run.record(CheckItem.pass("Permission Assessment",
                    "<p>Sufficient permissions detected. " + available + "% of required permissions are available.</p>"
                            + "<p>" + counts.passed() + " of " + counts.total() + " API calls succeeded.</p>"));
            run.closeSection();
            state = GateState.CONTINUE;
            return new GateDecision(state, available, threshold, false, counts);
        }

        run.record(CheckItem.warn("Permission Assessment",
                "<p>Insufficient permissions detected. Only " + available + "% of required permissions are available.</p>"
                        + "<p>Without these permissions the assessment may be incomplete.</p>",
                "Request additional permissions or continue with limited assessment capabilities."));
        log.warn("Only {}% of required permissions available (threshold {}%)", available, threshold);

        boolean proceed = assumeYes || prompter.confirm("Continue with limited assessment?");
        if (proceed) {
            log.info("Continuing with limited permissions");
            run.closeSection();
            state = GateState.CONTINUE;
            return new GateDecision(state, available, threshold, true, counts);
        }

        run.record(CheckItem.info(ABORTED_TITLE, "User chose to abort assessment due to insufficient permissions."));
        run.closeSection();
        run.finish();
        state = GateState.ABORTED;
        log.info("Assessment aborted at permission gate");
        return new GateDecision(state, available, threshold, true, counts);
    }

    static CheckItem capabilityItem(ApiCall call, ProbeResult r) {
        String title = "AWS API Access: " + call.label();
        Outcome outcome = OutcomeClassifier.classifyCapability(r);
        return switch (outcome) {
            case PASS -> CheckItem.pass(title, "Successfully verified access to this AWS API (" + call.description() + ").");
            case ACCESS_DENIED -> CheckItem.denied(title,
                    "Access Denied. Your AWS account does not have permission to perform this operation." + HtmlUtil.pre(r.error()),
                    "Ensure your AWS account has read permissions for " + call.label() + ".");
            default -> new CheckItem(title, outcome,
                    "The call failed for a reason other than authorization; verify access manually." + HtmlUtil.pre(r.error()),
                    "Re-run the check or confirm access to " + call.label() + " manually.");
        };
    }
}
