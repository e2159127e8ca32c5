package com.acme.pci.render;

import com.acme.pci.model.CheckItem;
import com.acme.pci.model.CounterSnapshot;
import com.acme.pci.model.Report;
import com.acme.pci.model.ReportMetadata;
import com.acme.pci.model.ReportSummary;
import com.acme.pci.model.Section;
import com.acme.pci.util.ComplianceCalculator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class JsonReportWriter implements ReportRenderer {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    @Override public String extension() { return "json"; }

    @Override
    public String render(Report report) {
        ReportRenderer.requireFinalized(report);
        try {
            return MAPPER.writeValueAsString(toMap(report));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialize report '" + report.metadata().title() + "'", e);
        }
    }

    static Map<String, Object> toMap(Report report) {
        ReportMetadata md = report.metadata();
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("title", md.title());
        out.put("requirement", md.requirement());
        out.put("account", md.accountId());
        out.put("region", md.region());
        out.put("scope", md.scope());
        out.put("assessed_by", md.actor());
        out.put("assessed_at", md.assessedAt());

        List<Map<String, Object>> sectionsOut = new ArrayList<>();
        for (Section s : report.sections()) {
            Map<String, Object> so = new LinkedHashMap<>();
            so.put("id", s.id());
            so.put("title", s.title());
            so.put("display_state", s.displayState().toString());
            so.put("compliance_percentage", ComplianceCalculator.percentage(s.tally()));
            List<Map<String, Object>> itemsOut = new ArrayList<>();
            for (CheckItem item : s.items()) {
                Map<String, Object> io = new LinkedHashMap<>();
                io.put("title", item.title());
                io.put("outcome", item.outcome().toString());
                io.put("details", item.details());
                if (item.hasRecommendation()) io.put("recommendation", item.recommendation());
                itemsOut.add(io);
            }
            so.put("items", itemsOut);
            sectionsOut.add(so);
        }
        out.put("sections", sectionsOut);

        ReportSummary summary = report.summary();
        CounterSnapshot c = summary.counts();
        Map<String, Object> so = new LinkedHashMap<>();
        so.put("total", c.total());
        so.put("passed", c.passed());
        so.put("failed", c.failed());
        so.put("warning", c.warning());
        so.put("info", c.info());
        so.put("access_denied", c.accessDenied());
        so.put("compliance_percentage", summary.percentage());
        so.put("band", summary.band().toString());
        so.put("finalized_at", summary.finalizedAt());
        out.put("summary", so);
        return out;
    }
}
