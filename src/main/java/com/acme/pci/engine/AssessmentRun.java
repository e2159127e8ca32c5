package com.acme.pci.engine;

import com.acme.pci.model.CheckItem;
import com.acme.pci.model.CounterSnapshot;
import com.acme.pci.model.Enums.CheckKind;
import com.acme.pci.model.Enums.DisplayState;
import com.acme.pci.model.Enums.Outcome;
import com.acme.pci.model.Enums.Verdict;
import com.acme.pci.model.ProbeResult;
import com.acme.pci.model.Report;
import com.acme.pci.model.ReportMetadata;
import com.acme.pci.model.ReportSummary;
import com.acme.pci.model.Section;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class AssessmentRun {
    private static final Logger log = LoggerFactory.getLogger(AssessmentRun.class);

    private final Report report;
    private final Counters counters = new Counters();
    private Section current;

    public AssessmentRun(ReportMetadata metadata) {
        this.report = new Report(metadata);
    }

    public Report report() { return report; }
    public CounterSnapshot counters() { return counters.snapshot(); }

    public Section openSection(String id, String title, DisplayState displayState) {
        if (current != null && !current.isClosed()) {
            log.debug("Closing section '{}' before opening '{}'", current.id(), id);
            report.closeSection(current.id());
        }
        current = report.openSection(id, title, displayState);
        log.debug("Opened section id={} title={}", id, title);
        return current;
    }

    public void closeSection() {
        if (current == null) return;
        report.closeSection(current.id());
        current = null;
    }

    /** Appends to the currently open section and counts the item's outcome. */
    CheckItem record(CheckItem item) {
        if (current == null) throw new IllegalStateException("No open section to record '" + item.title() + "' into");
        return record(current.id(), item);
    }

    CheckItem record(String sectionId, CheckItem item) {
        report.appendItem(sectionId, item);
        counters.record(item.outcome());
        log.debug("[{}] {} ({})", item.outcome(), item.title(), sectionId);
        return item;
    }

    /**
     * Classifies the probe result and records the matching item. The recommendation is dropped
     * for PASS and INFO outcomes.
     */
    public CheckItem recordClassified(String title, ProbeResult probe, CheckKind kind, Verdict verdict,
                                      String details, String recommendation) {
        Outcome outcome = OutcomeClassifier.classify(probe, kind, verdict);
        return record(new CheckItem(title, outcome, details, recommendation));
    }

    /** Explicit phase boundary; nothing resets the counters implicitly. */
    public void resetCounters() {
        log.debug("Resetting counters (was {})", counters.snapshot());
        counters.reset();
    }

    public ReportSummary finish() {
        current = null;
        return report.finalizeReport(counters.snapshot());
    }
}
