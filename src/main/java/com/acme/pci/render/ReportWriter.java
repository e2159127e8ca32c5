package com.acme.pci.render;

import com.acme.pci.model.Report;
import com.acme.pci.model.ReportMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

public final class ReportWriter {
    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path outputDir;
    private final List<ReportRenderer> renderers;

    public ReportWriter(Path outputDir, List<ReportRenderer> renderers) {
        this.outputDir = outputDir;
        this.renderers = List.copyOf(renderers);
    }

    public static String baseName(Report report) {
        String stamp = FILE_STAMP.format(report.metadata().assessedAt());
        if (ReportMetadata.ALL_REQUIREMENTS.equals(report.metadata().requirement())) return "pci_executive_summary_" + stamp;
        return "pci_req" + report.metadata().requirement() + "_report_" + stamp;
    }

    public List<Path> write(Report report) throws IOException {
        ReportRenderer.requireFinalized(report);
        Files.createDirectories(outputDir);
        String base = baseName(report);
        List<Path> written = new ArrayList<>();
        for (ReportRenderer r : renderers) {
            Path p = outputDir.resolve(base + "." + r.extension());
            Files.writeString(p, r.render(report), StandardCharsets.UTF_8);
            log.info("Report written: {} ({} bytes)", p, Files.size(p));
            written.add(p);
        }
        return written;
    }
}
