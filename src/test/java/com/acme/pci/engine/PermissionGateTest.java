package com.acme.pci.engine;

import com.acme.pci.model.CheckItem;
import com.acme.pci.model.Enums.GateState;
import com.acme.pci.model.Enums.Outcome;
import com.acme.pci.model.ProbeResult;
import com.acme.pci.model.Section;
import com.acme.pci.probe.ApiCall;
import com.acme.pci.probe.CapabilityCatalog;
import com.acme.pci.probe.ScriptedProbe;
import com.acme.pci.util.Prompter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class PermissionGateTest {

    private static final List<ApiCall> CAPS = CapabilityCatalog.REQUIREMENT_1;

    private Prompter prompter;
    private AssessmentRun run;

    @BeforeEach
    void setUp() {
        prompter = mock(Prompter.class);
        run = AssessmentRunTest.newRun();
    }

    /** 10 capabilities succeed, 2 are denied. */
    private static ScriptedProbe mostlyAllowed() {
        return new ScriptedProbe()
                .answer(CAPS.get(10).label(), ProbeResult.denied("An error occurred (AccessDeniedException) when calling ListWebACLs"))
                .answer(CAPS.get(11).label(), ProbeResult.denied("UnauthorizedOperation"))
                .otherwise(ProbeResult.success("{}"));
    }

    /** 3 succeed, 6 are denied and 3 fail for other reasons. */
    private static ScriptedProbe halfAvailable() {
        ScriptedProbe probe = new ScriptedProbe();
        for (int i = 0; i < CAPS.size(); i++) {
            ProbeResult r = i < 3 ? ProbeResult.success("{}")
                    : i < 9 ? ProbeResult.denied("AccessDenied")
                    : ProbeResult.error("Could not connect to the endpoint URL");
            probe.answer(CAPS.get(i).label(), r);
        }
        return probe;
    }

    @Test
    void sufficientPermissions_continueWithoutPrompting() {
        PermissionGate gate = new PermissionGate(mostlyAllowed(), prompter, 70, false);
        GateDecision d = gate.evaluate(run, CAPS);

        assertEquals(GateState.CONTINUE, d.state());
        assertEquals(100, d.availablePercentage());
        assertFalse(d.prompted());
        assertEquals(12, d.counts().total());
        assertEquals(10, d.counts().passed());
        assertEquals(2, d.counts().accessDenied());
        verifyNoInteractions(prompter);

        Section s = run.report().section(PermissionGate.SECTION_ID);
        assertTrue(s.isClosed());
        assertEquals(13, s.items().size());
        CheckItem last = s.items().get(12);
        assertEquals("Permission Assessment", last.title());
        assertEquals(Outcome.PASS, last.outcome());
        assertFalse(run.report().isFinalized());
    }

    @Test
    void eachCapability_isProbedOnceInCatalogOrder() {
        ScriptedProbe probe = mostlyAllowed();
        new PermissionGate(probe, prompter, 70, false).evaluate(run, CAPS);

        assertEquals(CAPS, probe.calls());
        List<CheckItem> items = run.report().section(PermissionGate.SECTION_ID).items();
        assertEquals("AWS API Access: ec2 describe-vpcs", items.get(0).title());
        assertEquals(Outcome.ACCESS_DENIED, items.get(10).outcome());
        assertTrue(items.get(10).hasRecommendation());
    }

    @Test
    void insufficientPermissions_promptAndContinueWhenConfirmed() {
        when(prompter.confirm(anyString())).thenReturn(true);
        PermissionGate gate = new PermissionGate(halfAvailable(), prompter, 70, false);
        GateDecision d = gate.evaluate(run, CAPS);

        assertEquals(50, d.availablePercentage());
        assertEquals(GateState.CONTINUE, d.state());
        assertTrue(d.prompted());
        verify(prompter, times(1)).confirm(anyString());

        List<CheckItem> items = run.report().section(PermissionGate.SECTION_ID).items();
        CheckItem assessment = items.get(items.size() - 1);
        assertEquals(Outcome.WARNING, assessment.outcome());
        assertTrue(assessment.details().contains("50%"));
        assertEquals(Outcome.WARNING, items.get(9).outcome());
        assertFalse(run.report().isFinalized());
    }

    @Test
    void declinedPrompt_finalizesReportWithOnlyTheGateSection() {
        when(prompter.confirm(anyString())).thenReturn(false);
        PermissionGate gate = new PermissionGate(halfAvailable(), prompter, 70, false);
        GateDecision d = gate.evaluate(run, CAPS);

        assertTrue(d.aborted());
        assertEquals(GateState.ABORTED, gate.state());
        assertTrue(run.report().isFinalized());
        assertEquals(1, run.report().sections().size());
        List<CheckItem> items = run.report().section(PermissionGate.SECTION_ID).items();
        CheckItem last = items.get(items.size() - 1);
        assertEquals("Assessment Aborted", last.title());
        assertEquals(Outcome.INFO, last.outcome());
        assertEquals(run.counters(), run.report().summary().counts());
    }

    @Test
    void assumeYes_skipsThePrompt() {
        GateDecision d = new PermissionGate(halfAvailable(), prompter, 70, true).evaluate(run, CAPS);

        assertEquals(GateState.CONTINUE, d.state());
        verifyNoInteractions(prompter);
    }

    @Test
    void coverageEqualToThreshold_continues() {
        GateDecision d = new PermissionGate(halfAvailable(), prompter, 50, false).evaluate(run, CAPS);

        assertEquals(GateState.CONTINUE, d.state());
        assertFalse(d.prompted());
        verifyNoInteractions(prompter);
    }

    @Test
    void threshold_mustBeAPercentage() {
        assertThrows(IllegalArgumentException.class, () -> new PermissionGate(mostlyAllowed(), prompter, 101, false));
        assertThrows(IllegalArgumentException.class, () -> new PermissionGate(mostlyAllowed(), prompter, -1, false));
    }
}
