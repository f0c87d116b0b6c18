package com.twbconvert.pbip.report;

import java.util.Objects;

/**
 * One field bound to a visual role. {@code targetId} is the lineage tag of the referenced model column or measure.
 */
public final class Projection {

    public enum Kind {
        COLUMN,
        MEASURE,
        AGGREGATION
    }

    private final String role;
    private final Kind kind;
    private final String entity;
    private final String property;
    private final AggregateFunction aggregation;
    private final String targetId;

    public Projection(
            String role, Kind kind, String entity, String property, AggregateFunction aggregation, String targetId) {
        this.role = Objects.requireNonNull(role, "role");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.entity = Objects.requireNonNull(entity, "entity");
        this.property = Objects.requireNonNull(property, "property");
        this.targetId = Objects.requireNonNull(targetId, "targetId");
        if ((kind == Kind.AGGREGATION) != (aggregation != null)) {
            throw new IllegalArgumentException("Aggregation function is required exactly for aggregation projections");
        }
        this.aggregation = aggregation;
    }

    public Projection withRole(String newRole) {
        return new Projection(newRole, kind, entity, property, aggregation, targetId);
    }

    public String getRole() {
        return role;
    }

    public Kind getKind() {
        return kind;
    }

    public String getEntity() {
        return entity;
    }

    public String getProperty() {
        return property;
    }

    public AggregateFunction getAggregation() {
        return aggregation;
    }

    public String getTargetId() {
        return targetId;
    }

    /** Aggregated values and measures; everything else groups. */
    public boolean isMeasureLike() {
        return kind != Kind.COLUMN;
    }

    public String queryRef() {
        String ref = entity + "." + property;
        return aggregation == null ? ref : aggregation.getQueryPrefix() + "(" + ref + ")";
    }

    public String nativeQueryRef() {
        return aggregation == null ? property : aggregation.getDisplayPrefix() + property;
    }

    @Override
    public String toString() {
        return role + ":" + queryRef();
    }
}
