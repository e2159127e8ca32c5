package com.acme.pci.render;

import com.acme.pci.model.Report;

public interface ReportRenderer {

    String render(Report report);

    /** File extension without the dot. */
    String extension();

    static void requireFinalized(Report report) {
        if (report == null) throw new IllegalArgumentException("Report is required");
        if (!report.isFinalized()) {
            throw new IllegalStateException("Report '" + report.metadata().title() + "' must be finalized before rendering");
        }
    }
}
