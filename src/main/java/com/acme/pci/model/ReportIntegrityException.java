package com.acme.pci.model;

import java.util.List;

public class ReportIntegrityException extends IllegalStateException {
    private final List<String> offendingItems;

    public ReportIntegrityException(String message, List<String> offendingItems) {
        super(message + ": " + String.join(", ", offendingItems));
        this.offendingItems = List.copyOf(offendingItems);
    }

    public List<String> offendingItems() { return offendingItems; }
}
