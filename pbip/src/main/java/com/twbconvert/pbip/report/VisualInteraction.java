package com.twbconvert.pbip.report;

import java.util.Objects;

/** How selecting data in {@code source} affects {@code target} on the same page. */
public final class VisualInteraction {

    public enum Type {
        DATA_FILTER("DataFilter"),
        HIGHLIGHT_FILTER("HighlightFilter"),
        NO_FILTER("NoFilter");

        private final String pbirName;

        Type(String pbirName) {
            this.pbirName = pbirName;
        }

        public String getPbirName() {
            return pbirName;
        }
    }

    private final String source;
    private final String target;
    private final Type type;

    public VisualInteraction(String source, String target, Type type) {
        this.source = Objects.requireNonNull(source, "source");
        this.target = Objects.requireNonNull(target, "target");
        this.type = Objects.requireNonNull(type, "type");
    }

    public String getSource() {
        return source;
    }

    public String getTarget() {
        return target;
    }

    public Type getType() {
        return type;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof VisualInteraction)) {
            return false;
        }
        VisualInteraction other = (VisualInteraction) obj;
        return source.equals(other.source) && target.equals(other.target) && type == other.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, target, type);
    }

    @Override
    public String toString() {
        return source + " -> " + target + " (" + type.getPbirName() + ")";
    }
}
