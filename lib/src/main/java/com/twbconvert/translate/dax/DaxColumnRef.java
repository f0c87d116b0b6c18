package com.twbconvert.translate.dax;

import java.util.Objects;

/** Fully qualified column reference, {@code 'Table'[Column]}. */
public final class DaxColumnRef implements DaxExpr {
    private final String table;
    private final String column;

    public DaxColumnRef(String table, String column) {
        this.table = Objects.requireNonNull(table, "table");
        this.column = Objects.requireNonNull(column, "column");
    }

    public String getTable() {
        return table;
    }

    public String getColumn() {
        return column;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof DaxColumnRef)) {
            return false;
        }
        DaxColumnRef other = (DaxColumnRef) obj;
        return table.equals(other.table) && column.equals(other.column);
    }

    @Override
    public int hashCode() {
        return Objects.hash(table, column);
    }
}
