package com.acme.pci.model;

import com.acme.pci.model.Enums.DisplayState;
import com.acme.pci.model.Enums.Outcome;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class Section {
    private final String id;
    private final String title;
    private final DisplayState displayState;
    private final List<CheckItem> items = new ArrayList<>();
    private boolean closed;

    Section(String id, String title, DisplayState displayState) {
        this.id = id;
        this.title = title;
        this.displayState = displayState == null ? DisplayState.NONE : displayState;
    }

    public String id() { return id; }
    public String title() { return title; }
    public DisplayState displayState() { return displayState; }
    public boolean isClosed() { return closed; }
    public List<CheckItem> items() { return Collections.unmodifiableList(items); }

    void append(CheckItem item) {
        if (closed) throw new SectionClosedException(id);
        items.add(item);
    }

    void close() { closed = true; }

    // Counts of this section's own items, used for the per-section compliance line.
    public CounterSnapshot tally() {
        int[] c = new int[Outcome.values().length];
        for (CheckItem item : items) c[item.outcome().ordinal()]++;
        return CounterSnapshot.of(c[Outcome.PASS.ordinal()], c[Outcome.FAIL.ordinal()], c[Outcome.WARNING.ordinal()],
                c[Outcome.INFO.ordinal()], c[Outcome.ACCESS_DENIED.ordinal()]);
    }
}
