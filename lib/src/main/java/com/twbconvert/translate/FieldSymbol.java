package com.twbconvert.translate;

import com.twbconvert.workbook.DataType;
import java.util.Objects;

/** What a field reference resolves to in the target model. */
public final class FieldSymbol {

    public enum Kind {
        COLUMN,
        CALCULATED_COLUMN,
        MEASURE,
        PARAMETER
    }

    private final Kind kind;
    private final String table;
    private final String name;
    private final DataType dataType;

    public FieldSymbol(Kind kind, String table, String name, DataType dataType) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.table = Objects.requireNonNull(table, "table");
        this.name = Objects.requireNonNull(name, "name");
        this.dataType = Objects.requireNonNull(dataType, "dataType");
    }

    public Kind getKind() {
        return kind;
    }

    public String getTable() {
        return table;
    }

    public String getName() {
        return name;
    }

    public DataType getDataType() {
        return dataType;
    }

    public boolean isRowLevel() {
        return kind == Kind.COLUMN || kind == Kind.CALCULATED_COLUMN;
    }

    @Override
    public String toString() {
        return kind + " " + table + "[" + name + "]";
    }
}
