package com.acme.pci;

import com.acme.pci.probe.Probe;

import java.util.ArrayList;
import java.util.List;

public final class AssessmentContext {
    public final String requirement;
    public final String region;
    public final List<String> requestedResources;
    public final Probe probe;

    /** Set by the discovery check of a suite; later checks of the same run read it. */
    public List<String> targetVpcs = new ArrayList<>();

    public AssessmentContext(String requirement, String region, List<String> requestedResources, Probe probe) {
        this.requirement = requirement;
        this.region = region;
        this.requestedResources = requestedResources == null ? List.of() : List.copyOf(requestedResources);
        this.probe = probe;
    }

    public boolean allResources() { return requestedResources.isEmpty(); }

    public String scopeLabel() {
        if (allResources()) return "all";
        return String.join(", ", requestedResources);
    }

    /** Comma or whitespace separated ids; blank or "all" selects every resource. */
    public static List<String> parseScope(String raw) {
        if (raw == null || raw.isBlank() || raw.trim().equalsIgnoreCase("all")) return List.of();
        List<String> ids = new ArrayList<>();
        for (String part : raw.split("[,\\s]+")) {
            if (!part.isBlank()) ids.add(part.trim());
        }
        return ids;
    }
}
