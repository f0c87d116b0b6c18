package com.twbconvert.formula.ast;

/** Character range of a node within its formula text; {@code end} is exclusive. */
public final class SourceSpan {
    private static final SourceSpan EMPTY = new SourceSpan(0, 0);

    private final int start;
    private final int end;

    public SourceSpan(int start, int end) {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span " + start + ".." + end);
        }
        this.start = start;
        this.end = end;
    }

    public static SourceSpan empty() {
        return EMPTY;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    /** The text this span covers in {@code formula}, clamped to the formula's bounds. */
    public String slice(String formula) {
        int from = Math.min(start, formula.length());
        int to = Math.min(end, formula.length());
        return formula.substring(from, to);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SourceSpan)) {
            return false;
        }
        SourceSpan other = (SourceSpan) obj;
        return start == other.start && end == other.end;
    }

    @Override
    public int hashCode() {
        return 31 * start + end;
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
