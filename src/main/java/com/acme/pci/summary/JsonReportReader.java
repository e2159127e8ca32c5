package com.acme.pci.summary;

import com.acme.pci.model.CheckItem;
import com.acme.pci.model.CounterSnapshot;
import com.acme.pci.model.Enums.DisplayState;
import com.acme.pci.model.Enums.Outcome;
import com.acme.pci.model.Report;
import com.acme.pci.model.ReportMetadata;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

public final class JsonReportReader {
    private static final Logger log = LoggerFactory.getLogger(JsonReportReader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final Pattern REPORT_FILE = Pattern.compile("(pci_req(\\d+)_report_(\\d{8}_\\d{6}))\\.json");

    public Report read(Path file) throws IOException {
        JsonNode root = MAPPER.readTree(file.toFile());
        if (root == null || !root.isObject()) throw new IOException("Not a report document: " + file);

        Report report = new Report(new ReportMetadata(
                text(root, "title"),
                text(root, "requirement"),
                text(root, "account"),
                text(root, "region"),
                text(root, "scope"),
                text(root, "assessed_by"),
                timestamp(root.path("assessed_at"), file)));

        for (JsonNode s : root.path("sections")) {
            String id = text(s, "id");
            report.openSection(id, text(s, "title"), DisplayState.valueOf(s.path("display_state").asText("NONE")));
            for (JsonNode i : s.path("items")) {
                report.appendItem(id, new CheckItem(text(i, "title"), Outcome.valueOf(i.path("outcome").asText()),
                        text(i, "details"), text(i, "recommendation")));
            }
        }

        JsonNode summary = root.path("summary");
        report.finalizeReport(CounterSnapshot.of(
                summary.path("passed").asInt(),
                summary.path("failed").asInt(),
                summary.path("warning").asInt(),
                summary.path("info").asInt(),
                summary.path("access_denied").asInt()));
        return report;
    }

    /**
     * The newest report per requirement, ordered by requirement number. Files are matched by name;
     * the timestamp in the name decides which one is newest. Unreadable files are skipped.
     */
    public List<RequirementResult> latestResults(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) return List.of();

        Map<Integer, Matcher> newest = new TreeMap<>();
        try (Stream<Path> files = Files.list(dir)) {
            for (Path p : (Iterable<Path>) files::iterator) {
                Matcher m = REPORT_FILE.matcher(p.getFileName().toString());
                if (!m.matches()) continue;
                int requirement = Integer.parseInt(m.group(2));
                Matcher current = newest.get(requirement);
                if (current == null || m.group(3).compareTo(current.group(3)) > 0) newest.put(requirement, m);
            }
        }

        List<RequirementResult> results = new ArrayList<>();
        for (Matcher m : newest.values()) {
            Path p = dir.resolve(m.group(0));
            try {
                results.add(RequirementResult.of(read(p), m.group(1)));
                log.info("Loaded requirement {} report: {}", m.group(2), p);
            } catch (IOException | IllegalArgumentException | IllegalStateException e) {
                log.warn("Skipping unreadable report {}: {}", p, e.getMessage());
            }
        }
        return results;
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v == null || v.isNull() ? null : v.asText();
    }

    private static ZonedDateTime timestamp(JsonNode node, Path file) {
        if (!node.isTextual()) return null;
        try {
            return ZonedDateTime.parse(node.asText());
        } catch (DateTimeParseException e) {
            log.warn("Unparseable assessed_at '{}' in {}", node.asText(), file);
            return null;
        }
    }
}
