package com.acme.pci.checks;

import com.acme.pci.model.Enums.DisplayState;

import java.util.List;

public record CheckSection(String id, String title, DisplayState displayState, List<Check> checks) {
    public CheckSection {
        checks = List.copyOf(checks);
    }
}
