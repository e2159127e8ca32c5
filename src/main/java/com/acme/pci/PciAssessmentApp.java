/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: PCI DSS Assessment Tool
 */

package com.acme.pci;

import com.acme.pci.checks.RequirementSuite;
import com.acme.pci.checks.Requirements;
import com.acme.pci.engine.PermissionGate;
import com.acme.pci.model.Report;
import com.acme.pci.probe.AwsCliProbe;
import com.acme.pci.probe.CallerIdentity;
import com.acme.pci.render.HtmlReportRenderer;
import com.acme.pci.render.JsonReportWriter;
import com.acme.pci.render.ReportRenderer;
import com.acme.pci.render.ReportWriter;
import com.acme.pci.render.TextSummaryRenderer;
import com.acme.pci.summary.ExecutiveSummary;
import com.acme.pci.summary.JsonReportReader;
import com.acme.pci.summary.RequirementResult;
import com.acme.pci.util.ConsolePrompter;
import com.acme.pci.util.Prompter;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

@CommandLine.Command(
        name = "pci-assessment",
        mixinStandardHelpOptions = true,
        version = "1.0.0",
        description = "Read-only PCI DSS 4.0 assessment of an AWS account. Writes HTML, text and JSON reports.",
        sortOptions = false
)
public class PciAssessmentApp implements java.util.concurrent.Callable<Integer> {

    @CommandLine.Option(names = "--requirement", defaultValue = "1", description = "PCI DSS requirement to assess (1, 10 or all). 'all' also writes an executive summary. Default: ${DEFAULT-VALUE}")
    private String requirement;

    @CommandLine.Option(names = "--region", description = "AWS region. Prompted when omitted.")
    private String region;

    @CommandLine.Option(names = "--scope", description = "Comma-separated resource ids (e.g. CDE VPC ids) or 'all'. Prompted when omitted.")
    private String scope;

    @CommandLine.Option(names = "--out-dir", description = "Report directory. Default: $PCI_OUTPUT_DIR or ./reports")
    private Path outDir;

    @CommandLine.Option(names = "--threshold", description = "Minimum permission coverage (%) to continue without asking. Default: $PCI_PERMISSION_THRESHOLD or 70")
    private Integer threshold;

    @CommandLine.Option(names = "--assume-yes", defaultValue = "false", description = "Continue with limited permissions without prompting.")
    private boolean assumeYes;

    @CommandLine.Option(names = "--no-json", defaultValue = "false", description = "Skip the JSON copy of the report.")
    private boolean noJson;

    @CommandLine.Option(names = "--executive-summary", defaultValue = "false", description = "Only build the executive summary from the newest JSON report of each requirement in the report directory.")
    private boolean summaryOnly;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    private final Prompter prompter;

    public PciAssessmentApp() {
        this(new ConsolePrompter());
    }

    PciAssessmentApp(Prompter prompter) {
        this.prompter = prompter;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new PciAssessmentApp()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AssessmentConfig config;
        List<RequirementSuite> suites;
        try {
            AssessmentConfig.Builder cb = AssessmentConfig.fromEnvironment().toBuilder();
            if (outDir != null) cb.outputDir(outDir);
            if (threshold != null) cb.threshold(threshold);
            config = cb.build();
            suites = summaryOnly ? List.of() : Requirements.forSelection(requirement);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
        }

        List<ReportRenderer> renderers = new ArrayList<>(List.of(new HtmlReportRenderer(), new TextSummaryRenderer()));
        if (!noJson) renderers.add(new JsonReportWriter());
        ReportWriter writer = new ReportWriter(config.getOutputDir(), renderers);

        if (summaryOnly) {
            List<RequirementResult> results = new JsonReportReader().latestResults(config.getOutputDir());
            if (results.isEmpty()) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "No requirement reports (pci_req<N>_report_<timestamp>.json) found in " + config.getOutputDir());
            }
            writeExecutiveSummary(results, writer);
            return AssessmentRunner.EXIT_OK;
        }

        String effectiveRegion = region;
        if (effectiveRegion == null || effectiveRegion.isBlank()) {
            String configured = new AwsCliProbe(config.getAwsCli(), null, config.getProbeTimeoutSeconds()).configuredRegion();
            String fallback = configured != null ? configured : config.getDefaultRegion();
            effectiveRegion = prompter.ask("Enter AWS region to test (press enter for default [" + fallback + "])", fallback);
        }
        String effectiveScope = scope != null ? scope : prompter.ask("Enter CDE resource IDs (comma-separated or 'all')", "all");

        AwsCliProbe probe = new AwsCliProbe(config.getAwsCli(), effectiveRegion, config.getProbeTimeoutSeconds());
        CallerIdentity identity = CallerIdentity.lookup(probe);

        int exitCode = AssessmentRunner.EXIT_OK;
        List<RequirementResult> results = new ArrayList<>();
        for (RequirementSuite suite : suites) {
            System.out.println("=============================================");
            System.out.println("  PCI DSS 4.0 - Requirement " + suite.requirement() + " Assessment");
            System.out.println("=============================================");

            AssessmentContext ctx = new AssessmentContext(suite.requirement(), effectiveRegion,
                    AssessmentContext.parseScope(effectiveScope), probe);
            PermissionGate gate = new PermissionGate(probe, prompter, config.getThreshold(), assumeYes);
            AssessmentRunner.RunResult result = new AssessmentRunner(gate).run(suite, ctx, identity, ZonedDateTime.now());
            List<Path> written = writer.write(result.report());

            System.out.println();
            if (result.gate().aborted()) {
                System.out.println("Assessment aborted: only " + result.gate().availablePercentage()
                        + "% of required permissions are available (threshold " + result.gate().threshold() + "%).");
            }
            System.out.print(TextSummaryRenderer.totals(result.summary()));
            for (Path p : written) System.out.println("Report: " + p);
            System.out.println();

            results.add(RequirementResult.of(result.report()));
            if (result.exitCode() != AssessmentRunner.EXIT_OK) exitCode = result.exitCode();
        }

        if (suites.size() > 1) writeExecutiveSummary(results, writer);
        return exitCode;
    }

    private static void writeExecutiveSummary(List<RequirementResult> results, ReportWriter writer) throws IOException {
        Report report = ExecutiveSummary.build(results, ZonedDateTime.now());
        List<Path> written = writer.write(report);

        System.out.println("=============================================");
        System.out.println("  " + ExecutiveSummary.TITLE);
        System.out.println("=============================================");
        System.out.print(TextSummaryRenderer.totals(report.summary()));
        for (Path p : written) System.out.println("Report: " + p);
        System.out.println();
    }
}
