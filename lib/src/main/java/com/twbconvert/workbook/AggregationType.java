package com.twbconvert.workbook;

import java.util.Locale;

/** Default aggregation declared on a column, and the aggregation implied by a shelf derivation. */
public enum AggregationType {
    NONE,
    SUM,
    AVG,
    MIN,
    MAX,
    COUNT,
    COUNTD,
    MEDIAN,
    ATTR;

    public static AggregationType fromTableau(String aggregation, ColumnRole role) {
        if (aggregation == null || aggregation.isBlank()) {
            return role == ColumnRole.MEASURE ? SUM : NONE;
        }
        switch (aggregation.trim().toLowerCase(Locale.ROOT)) {
            case "sum":
                return SUM;
            case "avg":
            case "average":
                return AVG;
            case "min":
                return MIN;
            case "max":
                return MAX;
            case "count":
            case "cnt":
                return COUNT;
            case "countd":
            case "ctd":
                return COUNTD;
            case "median":
            case "med":
                return MEDIAN;
            case "attr":
                return ATTR;
            default:
                return NONE;
        }
    }
}
