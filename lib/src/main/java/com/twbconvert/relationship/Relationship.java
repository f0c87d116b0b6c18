package com.twbconvert.relationship;

import java.util.Objects;

/**
 * A relationship of the target model. The "from" endpoint is the one side for {@link Cardinality#ONE_TO_MANY}; for
 * the other cardinalities it is the left table of the originating join.
 */
public final class Relationship {
    private final String fromTable;
    private final String fromColumn;
    private final String toTable;
    private final String toColumn;
    private final Cardinality cardinality;
    private final CrossFilterDirection direction;
    private final boolean active;

    public Relationship(
            String fromTable,
            String fromColumn,
            String toTable,
            String toColumn,
            Cardinality cardinality,
            CrossFilterDirection direction,
            boolean active) {
        this.fromTable = Objects.requireNonNull(fromTable, "fromTable");
        this.fromColumn = Objects.requireNonNull(fromColumn, "fromColumn");
        this.toTable = Objects.requireNonNull(toTable, "toTable");
        this.toColumn = Objects.requireNonNull(toColumn, "toColumn");
        this.cardinality = Objects.requireNonNull(cardinality, "cardinality");
        this.direction = Objects.requireNonNull(direction, "direction");
        this.active = active;
    }

    public String getFromTable() {
        return fromTable;
    }

    public String getFromColumn() {
        return fromColumn;
    }

    public String getToTable() {
        return toTable;
    }

    public String getToColumn() {
        return toColumn;
    }

    public Cardinality getCardinality() {
        return cardinality;
    }

    public CrossFilterDirection getDirection() {
        return direction;
    }

    public boolean isActive() {
        return active;
    }

    /** {@code From.Column -> To.Column}, used as the identity scope of the relationship. */
    public String describe() {
        return fromTable + "." + fromColumn + " -> " + toTable + "." + toColumn;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Relationship)) {
            return false;
        }
        Relationship other = (Relationship) obj;
        return active == other.active
                && fromTable.equals(other.fromTable)
                && fromColumn.equals(other.fromColumn)
                && toTable.equals(other.toTable)
                && toColumn.equals(other.toColumn)
                && cardinality == other.cardinality
                && direction == other.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(fromTable, fromColumn, toTable, toColumn, cardinality, direction, active);
    }

    @Override
    public String toString() {
        return describe() + " (" + cardinality + ", " + direction + (active ? "" : ", inactive") + ")";
    }
}
