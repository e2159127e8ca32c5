package com.acme.pci.checks;

import com.acme.pci.probe.ApiCall;

import java.util.List;

public record RequirementSuite(String requirement, String title, List<ApiCall> capabilities, List<CheckSection> sections) {
    public RequirementSuite {
        capabilities = List.copyOf(capabilities);
        sections = List.copyOf(sections);
    }

    public String reportTitle() {
        return "PCI DSS 4.0 - Requirement " + requirement + " Compliance Assessment Report";
    }
}
