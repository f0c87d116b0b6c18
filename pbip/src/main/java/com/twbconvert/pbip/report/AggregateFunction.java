package com.twbconvert.pbip.report;

import com.twbconvert.workbook.AggregationType;

/** Aggregations a projection can apply to a column, with their PBIR function codes. */
public enum AggregateFunction {
    SUM(0, "Sum", "Sum of "),
    AVG(1, "Avg", "Average of "),
    DISTINCT_COUNT(2, "Count", "Count of "),
    MIN(3, "Min", "Min of "),
    MAX(4, "Max", "Max of "),
    COUNT(5, "CountNonNull", "Count of non-blank "),
    MEDIAN(6, "Median", "Median of ");

    private final int code;
    private final String queryPrefix;
    private final String displayPrefix;

    AggregateFunction(int code, String queryPrefix, String displayPrefix) {
        this.code = code;
        this.queryPrefix = queryPrefix;
        this.displayPrefix = displayPrefix;
    }

    public int getCode() {
        return code;
    }

    public String getQueryPrefix() {
        return queryPrefix;
    }

    public String getDisplayPrefix() {
        return displayPrefix;
    }

    /** The projection aggregation for a shelf derivation, or {@code null} when the field is projected as is. */
    public static AggregateFunction of(AggregationType type) {
        switch (type) {
            case SUM:
                return SUM;
            case AVG:
                return AVG;
            case COUNTD:
                return DISTINCT_COUNT;
            case MIN:
                return MIN;
            case MAX:
                return MAX;
            case COUNT:
                return COUNT;
            case MEDIAN:
                return MEDIAN;
            default:
                return null;
        }
    }
}
