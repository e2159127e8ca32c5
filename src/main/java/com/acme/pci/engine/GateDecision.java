package com.acme.pci.engine;

import com.acme.pci.model.CounterSnapshot;
import com.acme.pci.model.Enums.GateState;

public record GateDecision(GateState state, int availablePercentage, int threshold, boolean prompted, CounterSnapshot counts) {
    public boolean aborted() { return state == GateState.ABORTED; }
}
