package com.acme.pci.probe;

import com.acme.pci.model.ProbeResult;

/**
 * Performs one provider call and reports what happened. Implementations never throw for
 * provider-side failures; those are returned as {@link ProbeResult} values.
 */
@FunctionalInterface
public interface Probe {
    ProbeResult run(ApiCall call);
}
