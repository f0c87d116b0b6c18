package com.twbconvert.workbook;

import java.util.Locale;
import java.util.Objects;

/**
 * One field placed on a shelf or encoding, parsed from a column instance reference such as
 * {@code [federated.0abc].[sum:Sales:qk]}.
 */
public final class FieldUsage {
    public static final String MEASURE_NAMES = ":Measure Names";
    public static final String MEASURE_VALUES = "Multiple Values";

    private final String datasource;
    private final String derivation;
    private final String fieldName;
    private final String typeSuffix;

    public FieldUsage(String datasource, String derivation, String fieldName, String typeSuffix) {
        this.datasource = Objects.requireNonNull(datasource, "datasource");
        this.derivation = derivation == null ? "none" : derivation.toLowerCase(Locale.ROOT);
        this.fieldName = Objects.requireNonNull(fieldName, "fieldName");
        this.typeSuffix = typeSuffix == null ? "" : typeSuffix.toLowerCase(Locale.ROOT);
    }

    public String getDatasource() {
        return datasource;
    }

    /** Derivation prefix such as {@code none}, {@code sum}, {@code usr} or {@code yr}. */
    public String getDerivation() {
        return derivation;
    }

    public String getFieldName() {
        return fieldName;
    }

    /** {@code nk}, {@code ok}, {@code qk} or empty. */
    public String getTypeSuffix() {
        return typeSuffix;
    }

    public boolean isQuantitative() {
        return "qk".equals(typeSuffix);
    }

    public boolean isMeasureNames() {
        return MEASURE_NAMES.equals(fieldName);
    }

    public boolean isMeasureValues() {
        return MEASURE_VALUES.equals(fieldName);
    }

    /** Aggregation implied by the derivation, or {@link AggregationType#NONE} for row-level and date-part usages. */
    public AggregationType impliedAggregation() {
        switch (derivation) {
            case "sum":
                return AggregationType.SUM;
            case "avg":
                return AggregationType.AVG;
            case "min":
                return AggregationType.MIN;
            case "max":
                return AggregationType.MAX;
            case "cnt":
                return AggregationType.COUNT;
            case "ctd":
                return AggregationType.COUNTD;
            case "med":
                return AggregationType.MEDIAN;
            case "attr":
                return AggregationType.ATTR;
            default:
                return AggregationType.NONE;
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof FieldUsage)) {
            return false;
        }
        FieldUsage other = (FieldUsage) obj;
        return datasource.equals(other.datasource)
                && derivation.equals(other.derivation)
                && fieldName.equals(other.fieldName)
                && typeSuffix.equals(other.typeSuffix);
    }

    @Override
    public int hashCode() {
        return Objects.hash(datasource, derivation, fieldName, typeSuffix);
    }

    @Override
    public String toString() {
        return "[" + datasource + "].[" + derivation + ":" + fieldName + ":" + typeSuffix + "]";
    }
}
