package com.acme.pci.engine;

import com.acme.pci.model.CheckItem;
import com.acme.pci.model.CounterSnapshot;
import com.acme.pci.model.Enums.CheckKind;
import com.acme.pci.model.Enums.DisplayState;
import com.acme.pci.model.Enums.Outcome;
import com.acme.pci.model.Enums.Rag;
import com.acme.pci.model.Enums.Verdict;
import com.acme.pci.model.ProbeResult;
import com.acme.pci.model.ReportMetadata;
import com.acme.pci.model.ReportSummary;
import com.acme.pci.model.Section;
import com.acme.pci.model.SectionClosedException;
import com.acme.pci.util.ComplianceCalculator;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AssessmentRunTest {

    static AssessmentRun newRun() {
        return new AssessmentRun(new ReportMetadata("Run", "1", "111122223333", "us-east-1", "all", "tester", null));
    }

    @Test
    void totalAlwaysEqualsSumOfOutcomes() {
        Random random = new Random(42);
        AssessmentRun run = newRun();
        run.openSection("s", "S", DisplayState.EXPANDED);
        Outcome[] outcomes = Outcome.values();
        int[] expected = new int[outcomes.length];
        for (int i = 0; i < 500; i++) {
            Outcome o = outcomes[random.nextInt(outcomes.length)];
            run.record(new CheckItem("item " + i, o, "", "follow up"));
            expected[o.ordinal()]++;
            CounterSnapshot c = run.counters();
            assertEquals(c.passed() + c.failed() + c.warning() + c.info() + c.accessDenied(), c.total());
        }
        CounterSnapshot c = run.counters();
        for (Outcome o : outcomes) assertEquals(expected[o.ordinal()], c.count(o));
        assertEquals(500, run.report().section("s").items().size());
    }

    @Test
    void resetCounters_keepsRecordedItems() {
        AssessmentRun run = newRun();
        run.openSection("gate", "Gate", DisplayState.EXPANDED);
        run.record(CheckItem.pass("a", ""));
        run.record(CheckItem.denied("b", "", "grant"));
        run.resetCounters();

        assertEquals(CounterSnapshot.EMPTY, run.counters());
        assertEquals(2, run.report().section("gate").items().size());

        run.record(CheckItem.fail("c", "", "fix"));
        assertEquals(CounterSnapshot.of(0, 1, 0, 0, 0), run.counters());
    }

    @Test
    void openSection_closesThePreviousOne() {
        AssessmentRun run = newRun();
        Section first = run.openSection("one", "One", DisplayState.EXPANDED);
        run.record(CheckItem.pass("a", ""));
        run.openSection("two", "Two", DisplayState.NONE);

        assertTrue(first.isClosed());
        assertThrows(SectionClosedException.class, () -> run.record("one", CheckItem.pass("late", "")));
        assertEquals(CounterSnapshot.of(1, 0, 0, 0, 0), run.counters());
    }

    @Test
    void record_withoutOpenSection_fails() {
        AssessmentRun run = newRun();
        assertThrows(IllegalStateException.class, () -> run.record(CheckItem.pass("a", "")));
    }

    @Test
    void recordClassified_dropsRecommendationForPass() {
        AssessmentRun run = newRun();
        run.openSection("s", "S", DisplayState.EXPANDED);
        CheckItem item = run.recordClassified("Trail", ProbeResult.success("{}"), CheckKind.AUTOMATED,
                Verdict.COMPLIANT, "ok", "enable trail");

        assertEquals(Outcome.PASS, item.outcome());
        assertNull(item.recommendation());
    }

    @Test
    void finish_usesCurrentCounters() {
        AssessmentRun run = newRun();
        run.openSection("s", "S", DisplayState.EXPANDED);
        run.record(CheckItem.pass("a", ""));
        run.record(CheckItem.pass("b", ""));
        run.record(CheckItem.pass("c", ""));
        run.record(CheckItem.fail("d", "", "fix"));
        ReportSummary summary = run.finish();

        assertEquals(75, summary.percentage());
        assertTrue(run.report().isFinalized());
        assertEquals(summary, run.finish());
    }

    @Test
    void threePassOneFailOneWarning_isSeventyFivePercentAmber() {
        AssessmentRun run = newRun();
        Section section = run.openSection("req-1.3", "Requirement 1.3", DisplayState.COLLAPSED);
        run.record(CheckItem.pass("1.3.1 - Inbound", ""));
        run.record(CheckItem.pass("1.3.2 - Outbound", ""));
        run.record(CheckItem.pass("1.3.3 - Wireless", ""));
        run.record(CheckItem.fail("1.4.1 - Admin ports", "", "Restrict SSH."));
        run.record(CheckItem.warn("1.4.2 - Rulesets", "", "Review rulesets manually."));

        CounterSnapshot tally = section.tally();
        assertEquals(CounterSnapshot.of(3, 1, 1, 0, 0), tally);
        assertEquals(75, ComplianceCalculator.percentage(tally));

        ReportSummary summary = run.finish();
        assertEquals(75, summary.percentage());
        assertEquals(Rag.AMBER, summary.band());
    }
}
