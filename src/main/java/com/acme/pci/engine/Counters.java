package com.acme.pci.engine;

import com.acme.pci.model.CounterSnapshot;
import com.acme.pci.model.Enums.Outcome;

public final class Counters {
    private int passed;
    private int failed;
    private int warning;
    private int info;
    private int accessDenied;

    void record(Outcome outcome) {
        switch (outcome) {
            case PASS -> passed++;
            case FAIL -> failed++;
            case WARNING -> warning++;
            case INFO -> info++;
            case ACCESS_DENIED -> accessDenied++;
        }
    }

    void reset() {
        passed = 0;
        failed = 0;
        warning = 0;
        info = 0;
        accessDenied = 0;
    }

    public int total() { return passed + failed + warning + info + accessDenied; }

    public CounterSnapshot snapshot() {
        return new CounterSnapshot(total(), passed, failed, warning, info, accessDenied);
    }
}
