package com.acme.pci.model;

import com.acme.pci.model.Enums.ErrorCategory;

public record ProbeResult(boolean ok, ErrorCategory errorCategory, String payload, String error) {

    public static ProbeResult success(String payload) { return new ProbeResult(true, null, payload, null); }
    public static ProbeResult empty() { return new ProbeResult(true, ErrorCategory.EMPTY, "", null); }
    public static ProbeResult denied(String error) { return new ProbeResult(false, ErrorCategory.AUTHORIZATION, null, error); }
    public static ProbeResult error(String error) { return new ProbeResult(false, ErrorCategory.OTHER, null, error); }

    public boolean isDenied() { return errorCategory == ErrorCategory.AUTHORIZATION; }
    public boolean isEmpty() { return errorCategory == ErrorCategory.EMPTY || (ok && (payload == null || payload.isBlank())); }
}
