package com.acme.pci.model;

import com.acme.pci.model.Enums.DisplayState;
import com.acme.pci.model.Enums.Rag;
import org.junit.jupiter.api.Test;

import java.time.ZonedDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReportTest {

    static Report newReport() {
        return new Report(new ReportMetadata("Test Report", "1", "123456789012", "us-east-1", "all",
                "arn:aws:iam::123456789012:user/assessor", ZonedDateTime.now()));
    }

    @Test
    void sections_keepInsertionOrder() {
        Report r = newReport();
        r.openSection("b", "B", DisplayState.EXPANDED);
        r.openSection("a", "A", DisplayState.NONE);
        r.openSection("c", "C", DisplayState.COLLAPSED);

        assertEquals(List.of("b", "a", "c"), r.sections().stream().map(Section::id).toList());
    }

    @Test
    void appendItem_toClosedSection_fails() {
        Report r = newReport();
        r.openSection("s1", "Section 1", DisplayState.EXPANDED);
        r.appendItem("s1", CheckItem.pass("one", "ok"));
        r.closeSection("s1");

        assertThrows(SectionClosedException.class, () -> r.appendItem("s1", CheckItem.pass("two", "ok")));
        assertThrows(SectionClosedException.class, () -> r.appendItem("s1", CheckItem.pass("two", "ok")));
        assertEquals(1, r.section("s1").items().size());
    }

    @Test
    void appendItem_toUnknownSection_fails() {
        Report r = newReport();
        assertThrows(IllegalArgumentException.class, () -> r.appendItem("missing", CheckItem.pass("x", "")));
    }

    @Test
    void openSection_rejectsDuplicateIds() {
        Report r = newReport();
        r.openSection("s1", "Section 1", DisplayState.EXPANDED);
        assertThrows(IllegalArgumentException.class, () -> r.openSection("s1", "Again", DisplayState.NONE));
    }

    @Test
    void finalizeReport_isIdempotent() {
        Report r = newReport();
        r.openSection("s1", "Section 1", DisplayState.EXPANDED);
        r.appendItem("s1", CheckItem.pass("one", "ok"));

        ReportSummary first = r.finalizeReport(CounterSnapshot.of(1, 0, 0, 0, 0));
        ReportSummary second = r.finalizeReport(CounterSnapshot.of(5, 5, 5, 0, 0));

        assertSame(first, second);
        assertEquals(1, second.counts().total());
        assertEquals(100, second.percentage());
        assertEquals(Rag.GREEN, second.band());
    }

    @Test
    void finalizeReport_closesOpenSectionsAndSealsReport() {
        Report r = newReport();
        r.openSection("s1", "Section 1", DisplayState.EXPANDED);
        r.finalizeReport(CounterSnapshot.EMPTY);

        assertTrue(r.isFinalized());
        assertTrue(r.section("s1").isClosed());
        assertThrows(IllegalStateException.class, () -> r.openSection("s2", "Late", DisplayState.NONE));
        assertThrows(IllegalStateException.class, () -> r.appendItem("s1", CheckItem.pass("late", "")));
    }

    @Test
    void finalizeReport_refusesFindingsWithoutRecommendation() {
        Report r = newReport();
        r.openSection("s1", "Section 1", DisplayState.EXPANDED);
        r.appendItem("s1", CheckItem.fail("Open SSH", "port 22 open", " "));
        r.appendItem("s1", CheckItem.warn("Manual", "verify", "Check the runbook"));

        ReportIntegrityException e = assertThrows(ReportIntegrityException.class,
                () -> r.finalizeReport(CounterSnapshot.of(0, 1, 1, 0, 0)));
        assertEquals(List.of("s1/Open SSH"), e.offendingItems());
        assertFalse(r.isFinalized());
    }
}
