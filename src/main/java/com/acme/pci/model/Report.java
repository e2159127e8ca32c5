package com.acme.pci.model;

import com.acme.pci.model.Enums.DisplayState;
import com.acme.pci.util.ComplianceCalculator;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class Report {
    private final ReportMetadata metadata;
    private final Map<String, Section> sections = new LinkedHashMap<>();
    private ReportSummary summary;

    public Report(ReportMetadata metadata) {
        if (metadata == null) throw new IllegalArgumentException("Report metadata is required");
        this.metadata = metadata;
    }

    public ReportMetadata metadata() { return metadata; }
    public List<Section> sections() { return List.copyOf(sections.values()); }
    public boolean isFinalized() { return summary != null; }
    public ReportSummary summary() { return summary; }

    public Section section(String id) {
        Section s = sections.get(id);
        if (s == null) throw new IllegalArgumentException("Unknown section '" + id + "'");
        return s;
    }

    public Section openSection(String id, String title, DisplayState initialDisplayState) {
        requireOpen();
        if (id == null || id.isBlank()) throw new IllegalArgumentException("Section id is required");
        if (sections.containsKey(id)) throw new IllegalArgumentException("Section '" + id + "' already exists");
        Section s = new Section(id, title, initialDisplayState);
        sections.put(id, s);
        return s;
    }

    public void appendItem(String sectionId, CheckItem item) {
        if (item == null) throw new IllegalArgumentException("CheckItem is required");
        requireOpen();
        section(sectionId).append(item);
    }

    public void closeSection(String sectionId) {
        section(sectionId).close();
    }

    // idempotent: a second call returns the first summary and ignores its argument
    public ReportSummary finalizeReport(CounterSnapshot counts) {
        if (summary != null) return summary;
        if (counts == null) throw new IllegalArgumentException("Counters are required to finalize a report");

        List<String> missing = new ArrayList<>();
        for (Section s : sections.values()) {
            for (CheckItem item : s.items()) {
                if (item.missingRecommendation()) missing.add(s.id() + "/" + item.title());
            }
        }
        if (!missing.isEmpty()) {
            throw new ReportIntegrityException("Report contains findings without a recommendation", missing);
        }

        for (Section s : sections.values()) s.close();
        int pct = ComplianceCalculator.percentage(counts);
        summary = new ReportSummary(counts, pct, ComplianceCalculator.band(pct), Instant.now());
        return summary;
    }

    private void requireOpen() {
        if (summary != null) throw new IllegalStateException("Report '" + metadata.title() + "' is already finalized");
    }
}
