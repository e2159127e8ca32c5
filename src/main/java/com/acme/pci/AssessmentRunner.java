package com.acme.pci;

import com.acme.pci.checks.Check;
import com.acme.pci.checks.CheckExecutor;
import com.acme.pci.checks.CheckSection;
import com.acme.pci.checks.RequirementSuite;
import com.acme.pci.engine.AssessmentRun;
import com.acme.pci.engine.GateDecision;
import com.acme.pci.engine.PermissionGate;
import com.acme.pci.model.Report;
import com.acme.pci.model.ReportMetadata;
import com.acme.pci.model.ReportSummary;
import com.acme.pci.probe.CallerIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZonedDateTime;

/**
 * Gate first, then every section of the suite in order, then finalization.
 */
public final class AssessmentRunner {
    private static final Logger log = LoggerFactory.getLogger(AssessmentRunner.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_ABORTED = 3;

    public record RunResult(Report report, GateDecision gate, ReportSummary summary) {
        public int exitCode() { return gate.aborted() ? EXIT_ABORTED : EXIT_OK; }
    }

    private final PermissionGate gate;

    public AssessmentRunner(PermissionGate gate) {
        this.gate = gate;
    }

    public RunResult run(RequirementSuite suite, AssessmentContext ctx, CallerIdentity identity, ZonedDateTime assessedAt) {
        ReportMetadata metadata = new ReportMetadata(suite.reportTitle(), suite.requirement(),
                identity.account(), ctx.region, ctx.scopeLabel(), identity.arn(), assessedAt);
        AssessmentRun run = new AssessmentRun(metadata);

        GateDecision decision = gate.evaluate(run, suite.capabilities());
        if (decision.aborted()) {
            return new RunResult(run.report(), decision, run.report().summary());
        }
        run.resetCounters();

        for (CheckSection section : suite.sections()) {
            log.info("Running section {} ({} checks)", section.id(), section.checks().size());
            run.openSection(section.id(), section.title(), section.displayState());
            for (Check check : section.checks()) CheckExecutor.execute(check, ctx, run);
            run.closeSection();
        }

        ReportSummary summary = run.finish();
        log.info("Requirement {} finished: {}% compliant ({})", suite.requirement(), summary.percentage(), summary.counts());
        return new RunResult(run.report(), decision, summary);
    }
}
