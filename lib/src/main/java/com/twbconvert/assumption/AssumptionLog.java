package com.twbconvert.assumption;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Append-only assumption log shared by every stage of one conversion.
 *
 * <p>Appends may come from several translation tasks at once. Each entry is keyed by its category, the declaration
 * index of the entity that raised it and a per-entity sequence number, and {@link #entries()} sorts on that key, so
 * the reported order follows the source document rather than task completion order.</p>
 */
public final class AssumptionLog {

    private static final Comparator<Entry> ENTRY_ORDER =
            Comparator.comparing((Entry entry) -> entry.assumption.getCategory())
                    .thenComparingInt(entry -> entry.declarationIndex)
                    .thenComparingLong(entry -> entry.sequence);

    private final List<Entry> entries = new ArrayList<>();
    private long appendCounter;

    /**
     * Appends an assumption raised while processing the entity declared at {@code declarationIndex}. Entries of the
     * same entity keep their relative append order.
     */
    public synchronized void append(int declarationIndex, Assumption assumption) {
        Objects.requireNonNull(assumption, "assumption");
        entries.add(new Entry(declarationIndex, appendCounter++, assumption));
    }

    /** Appends every assumption of {@code batch} for one entity, preserving their order. */
    public synchronized void appendAll(int declarationIndex, List<Assumption> batch) {
        for (Assumption assumption : batch) {
            append(declarationIndex, assumption);
        }
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized boolean isEmpty() {
        return entries.isEmpty();
    }

    /** Snapshot of the log in deterministic order. */
    public synchronized List<Assumption> entries() {
        List<Entry> sorted = new ArrayList<>(entries);
        sorted.sort(ENTRY_ORDER);
        List<Assumption> out = new ArrayList<>(sorted.size());
        for (Entry entry : sorted) {
            out.add(entry.assumption);
        }
        return List.copyOf(out);
    }

    private static final class Entry {
        private final int declarationIndex;
        private final long sequence;
        private final Assumption assumption;

        private Entry(int declarationIndex, long sequence, Assumption assumption) {
            this.declarationIndex = declarationIndex;
            this.sequence = sequence;
            this.assumption = assumption;
        }
    }
}
