package com.acme.pci.checks;

/**
 * Turns a raw provider payload into a fact. Parsing problems are reported as incomplete
 * evidence, not thrown.
 */
@FunctionalInterface
public interface EvidenceExtractor<T> {
    Evidence<T> extract(String payload);
}
