package com.acme.pci.model;

public class SectionClosedException extends IllegalStateException {
    public SectionClosedException(String sectionId) {
        super("Section '" + sectionId + "' is closed; no further check items may be appended");
    }
}
