package com.twbconvert.translate;

public enum FieldClassification {
    /** Row-level: emitted as a calculated column. */
    COLUMN,
    /** Aggregate: emitted as a measure. */
    MEASURE
}
