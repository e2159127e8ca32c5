package com.acme.pci.model;

import com.acme.pci.model.Enums.Rag;

import java.time.Instant;

public record ReportSummary(CounterSnapshot counts, int percentage, Rag band, Instant finalizedAt) {}
