package com.twbconvert.pbip.model;

import java.util.Objects;

/**
 * A relationship in TMDL orientation: {@code from} is the many side of a one-to-many relationship, the reverse of
 * {@link com.twbconvert.relationship.Relationship}.
 */
public final class ModelRelationship {
    private final String name;
    private final String fromTable;
    private final String fromColumn;
    private final String toTable;
    private final String toColumn;
    private final String fromCardinality;
    private final String toCardinality;
    private final boolean bothDirections;
    private final boolean active;

    public ModelRelationship(
            String name,
            String fromTable,
            String fromColumn,
            String toTable,
            String toColumn,
            String fromCardinality,
            String toCardinality,
            boolean bothDirections,
            boolean active) {
        this.name = Objects.requireNonNull(name, "name");
        this.fromTable = Objects.requireNonNull(fromTable, "fromTable");
        this.fromColumn = Objects.requireNonNull(fromColumn, "fromColumn");
        this.toTable = Objects.requireNonNull(toTable, "toTable");
        this.toColumn = Objects.requireNonNull(toColumn, "toColumn");
        this.fromCardinality = Objects.requireNonNull(fromCardinality, "fromCardinality");
        this.toCardinality = Objects.requireNonNull(toCardinality, "toCardinality");
        this.bothDirections = bothDirections;
        this.active = active;
    }

    public String getName() {
        return name;
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

    public String getFromCardinality() {
        return fromCardinality;
    }

    public String getToCardinality() {
        return toCardinality;
    }

    public boolean isBothDirections() {
        return bothDirections;
    }

    public boolean isActive() {
        return active;
    }
}
