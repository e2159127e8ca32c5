package com.acme.pci.summary;

import com.acme.pci.engine.PermissionGate;
import com.acme.pci.model.CheckItem;
import com.acme.pci.model.CounterSnapshot;
import com.acme.pci.model.Enums.Outcome;
import com.acme.pci.model.Enums.Rag;
import com.acme.pci.model.Report;
import com.acme.pci.model.ReportMetadata;
import com.acme.pci.model.ReportSummary;
import com.acme.pci.model.Section;
import com.acme.pci.render.ReportWriter;

import java.util.ArrayList;
import java.util.List;

public record RequirementResult(
        ReportMetadata metadata,
        CounterSnapshot counts,
        int percentage,
        Rag band,
        boolean aborted,
        List<CheckItem> failures,
        String baseName
) {
    public RequirementResult {
        failures = List.copyOf(failures);
    }

    public String requirement() { return metadata.requirement(); }

    public static RequirementResult of(Report report) {
        return of(report, ReportWriter.baseName(report));
    }

    public static RequirementResult of(Report report, String baseName) {
        if (!report.isFinalized()) {
            throw new IllegalStateException("Report '" + report.metadata().title() + "' is not finalized");
        }
        ReportSummary summary = report.summary();
        boolean aborted = false;
        List<CheckItem> failures = new ArrayList<>();
        for (Section s : report.sections()) {
            for (CheckItem item : s.items()) {
                if (PermissionGate.SECTION_ID.equals(s.id())) {
                    if (PermissionGate.ABORTED_TITLE.equals(item.title())) aborted = true;
                } else if (item.outcome() == Outcome.FAIL) {
                    failures.add(item);
                }
            }
        }
        return new RequirementResult(report.metadata(), summary.counts(), summary.percentage(), summary.band(),
                aborted, failures, baseName);
    }
}
