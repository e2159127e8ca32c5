package com.acme.pci.engine;

import com.acme.pci.model.Enums.CheckKind;
import com.acme.pci.model.Enums.Determination;
import com.acme.pci.model.Enums.Outcome;
import com.acme.pci.model.Enums.Verdict;
import com.acme.pci.model.ProbeResult;

/**
 * Maps a probe result to an outcome. Rules apply in priority order: authorization denial,
 * manual controls, then the evaluated verdict. Anything unclassified ends up as a warning,
 * never as a pass.
 */
public final class OutcomeClassifier {
    private OutcomeClassifier() {}

    public static Determination determine(ProbeResult probe, CheckKind kind, Verdict verdict) {
        if (probe != null && probe.isDenied()) return Determination.AUTHORIZATION_DENIED;
        if (kind == CheckKind.MANUAL) return Determination.MANUAL_VERIFICATION_REQUIRED;
        // no probe: the verdict rests on local evidence such as operator input
        if (probe == null || probe.ok()) {
            if (kind == CheckKind.INFORMATIONAL && verdict != Verdict.INCOMPLETE) return Determination.INFORMATIONAL;
            if (verdict == Verdict.COMPLIANT) return Determination.TARGET_COMPLIANT;
            if (verdict == Verdict.NON_COMPLIANT) return Determination.TARGET_NON_COMPLIANT;
            return Determination.EVIDENCE_INCOMPLETE;
        }
        return Determination.EVIDENCE_INCOMPLETE;
    }

    public static Outcome classify(ProbeResult probe, CheckKind kind, Verdict verdict) {
        return determine(probe, kind, verdict).outcome();
    }

    /** Capability probes pass on any successful call; the payload is not inspected. */
    public static Outcome classifyCapability(ProbeResult probe) {
        Verdict v = (probe != null && probe.ok()) ? Verdict.COMPLIANT : Verdict.INCOMPLETE;
        return classify(probe, CheckKind.AUTOMATED, v);
    }
}
