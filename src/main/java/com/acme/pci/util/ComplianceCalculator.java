package com.acme.pci.util;

import com.acme.pci.model.CounterSnapshot;
import com.acme.pci.model.Enums.Rag;

public final class ComplianceCalculator {
    private ComplianceCalculator() {}

    public static final int AMBER_FROM = 70;
    public static final int GREEN_FROM = 90;

    // passed * 100 / (total - warning - accessDenied), 0 when nothing was adjudicated.
    public static int percentage(CounterSnapshot c) {
        return ratio(c.passed(), c.total() - c.warning() - c.accessDenied());
    }

    // passed * 100 / (total - accessDenied); the permission gate's coverage figure.
    public static int availablePercentage(CounterSnapshot c) {
        return ratio(c.passed(), c.total() - c.accessDenied());
    }

    public static Rag band(int percentage) {
        if (percentage < AMBER_FROM) return Rag.RED;
        if (percentage < GREEN_FROM) return Rag.AMBER;
        return Rag.GREEN;
    }

    static int ratio(int numerator, int denominator) {
        if (denominator <= 0) return 0;
        int pct = (numerator * 100) / denominator;
        return Math.max(0, Math.min(100, pct));
    }
}
