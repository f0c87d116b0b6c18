package com.twbconvert.translate.dax;

import java.util.Objects;

/** Reference to a measure. Rendered unqualified; the home table is kept for referential checks. */
public final class DaxMeasureRef implements DaxExpr {
    private final String table;
    private final String measure;

    public DaxMeasureRef(String table, String measure) {
        this.table = Objects.requireNonNull(table, "table");
        this.measure = Objects.requireNonNull(measure, "measure");
    }

    public String getTable() {
        return table;
    }

    public String getMeasure() {
        return measure;
    }
}
