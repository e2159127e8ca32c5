package com.acme.pci.model;

import com.acme.pci.model.Enums.Outcome;

public record CheckItem(String title, Outcome outcome, String details, String recommendation) {

    public CheckItem {
        if (title == null || title.isBlank()) throw new IllegalArgumentException("CheckItem title is required");
        if (outcome == null) throw new IllegalArgumentException("CheckItem outcome is required for '" + title + "'");
        if (details == null) details = "";
        if (!outcome.needsRecommendation()) recommendation = null;
    }

    public static CheckItem pass(String t, String d) { return new CheckItem(t, Outcome.PASS, d, null); }
    public static CheckItem info(String t, String d) { return new CheckItem(t, Outcome.INFO, d, null); }
    public static CheckItem fail(String t, String d, String r) { return new CheckItem(t, Outcome.FAIL, d, r); }
    public static CheckItem warn(String t, String d, String r) { return new CheckItem(t, Outcome.WARNING, d, r); }
    public static CheckItem denied(String t, String d, String r) { return new CheckItem(t, Outcome.ACCESS_DENIED, d, r); }

    public boolean hasRecommendation() { return recommendation != null && !recommendation.isBlank(); }

    public boolean missingRecommendation() { return outcome.needsRecommendation() && !hasRecommendation(); }
}
