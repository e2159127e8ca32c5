package com.acme.pci.model;

public final class Enums {
    private Enums() {}

    public enum Outcome {
        PASS("PASS", "pass"),
        FAIL("FAIL", "fail"),
        WARNING("WARNING", "warning"),
        INFO("INFO", "info"),
        ACCESS_DENIED("ACCESS DENIED", "access-denied");

        private final String badge;
        private final String cssClass;

        Outcome(String badge, String cssClass) {
            this.badge = badge;
            this.cssClass = cssClass;
        }

        public String badge() { return badge; }
        public String cssClass() { return cssClass; }

        // PASS and INFO items never carry a recommendation.
        public boolean needsRecommendation() { return this != PASS && this != INFO; }
    }

    public enum Determination {
        TARGET_COMPLIANT(Outcome.PASS),
        TARGET_NON_COMPLIANT(Outcome.FAIL),
        EVIDENCE_INCOMPLETE(Outcome.WARNING),
        MANUAL_VERIFICATION_REQUIRED(Outcome.WARNING),
        AUTHORIZATION_DENIED(Outcome.ACCESS_DENIED),
        INFORMATIONAL(Outcome.INFO);

        private final Outcome outcome;
        Determination(Outcome outcome) { this.outcome = outcome; }
        public Outcome outcome() { return outcome; }
    }

    public enum CheckKind { AUTOMATED, MANUAL, INFORMATIONAL }
    public enum Verdict { COMPLIANT, NON_COMPLIANT, INCOMPLETE }
    public enum ErrorCategory { AUTHORIZATION, OTHER, EMPTY }
    public enum DisplayState { EXPANDED, COLLAPSED, NONE }
    public enum Rag { GREEN, AMBER, RED }
    public enum GateState { PROBING, EVALUATING, CONTINUE, ABORTED }
}
