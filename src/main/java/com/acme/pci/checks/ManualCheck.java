package com.acme.pci.checks;

import com.acme.pci.AssessmentContext;
import com.acme.pci.engine.AssessmentRun;
import com.acme.pci.model.Enums.CheckKind;

public final class ManualCheck implements Check {
    static final String DEFAULT_GUIDANCE =
            "This check requires manual verification and cannot be automated. Please review the findings and validate compliance manually.";

    private final String id;
    private final String title;
    private final String description;
    private final String guidance;

    public ManualCheck(String id, String title, String description, String guidance) {
        if (description == null || description.isBlank()) throw new IllegalArgumentException("Manual check '" + id + "' needs a description");
        this.id = id;
        this.title = title;
        this.description = description;
        this.guidance = (guidance == null || guidance.isBlank()) ? DEFAULT_GUIDANCE : guidance;
    }

    public ManualCheck(String id, String title, String description) {
        this(id, title, description, null);
    }

    @Override public String id() { return id; }

    @Override
    public void run(AssessmentContext ctx, AssessmentRun out) {
        out.recordClassified(title, null, CheckKind.MANUAL, null, description, guidance);
    }
}
