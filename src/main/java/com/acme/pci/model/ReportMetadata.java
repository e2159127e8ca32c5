package com.acme.pci.model;

import java.time.ZonedDateTime;

public record ReportMetadata(
        String title,
        String requirement,
        String accountId,
        String region,
        String scope,
        String actor,
        ZonedDateTime assessedAt
) {
    public static final String ALL_REQUIREMENTS = "all";
    public static final String UNKNOWN_IDENTITY = "Unknown (Check AWS CLI configuration)";

    public ReportMetadata {
        if (title == null || title.isBlank()) throw new IllegalArgumentException("Report title is required");
        if (accountId == null || accountId.isBlank()) accountId = UNKNOWN_IDENTITY;
        if (actor == null || actor.isBlank()) actor = UNKNOWN_IDENTITY;
        if (scope == null || scope.isBlank()) scope = "all";
        if (assessedAt == null) assessedAt = ZonedDateTime.now();
    }
}
