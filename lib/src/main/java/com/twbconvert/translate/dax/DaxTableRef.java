package com.twbconvert.translate.dax;

import java.util.Objects;

public final class DaxTableRef implements DaxExpr {
    private final String table;

    public DaxTableRef(String table) {
        this.table = Objects.requireNonNull(table, "table");
    }

    public String getTable() {
        return table;
    }
}
