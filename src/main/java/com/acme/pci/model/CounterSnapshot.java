package com.acme.pci.model;

import com.acme.pci.model.Enums.Outcome;

public record CounterSnapshot(int total, int passed, int failed, int warning, int info, int accessDenied) {

    public static final CounterSnapshot EMPTY = new CounterSnapshot(0, 0, 0, 0, 0, 0);

    public CounterSnapshot {
        if (passed < 0 || failed < 0 || warning < 0 || info < 0 || accessDenied < 0) {
            throw new IllegalArgumentException("Counts must be non-negative");
        }
        if (total != passed + failed + warning + info + accessDenied) {
            throw new IllegalArgumentException("total=" + total + " does not match the sum of outcome counts");
        }
    }

    public static CounterSnapshot of(int passed, int failed, int warning, int info, int accessDenied) {
        return new CounterSnapshot(passed + failed + warning + info + accessDenied, passed, failed, warning, info, accessDenied);
    }

    public CounterSnapshot plus(CounterSnapshot other) {
        return of(passed + other.passed, failed + other.failed, warning + other.warning,
                info + other.info, accessDenied + other.accessDenied);
    }

    public int count(Outcome o) {
        return switch (o) {
            case PASS -> passed;
            case FAIL -> failed;
            case WARNING -> warning;
            case INFO -> info;
            case ACCESS_DENIED -> accessDenied;
        };
    }
}
