package com.twbconvert.workbook;

import java.util.Locale;

/** Closed set of column data types. Anything Tableau declares outside this set is {@link #UNSUPPORTED}. */
public enum DataType {
    INTEGER,
    REAL,
    STRING,
    DATE,
    DATETIME,
    BOOLEAN,
    UNSUPPORTED;

    public boolean isNumeric() {
        return this == INTEGER || this == REAL;
    }

    public boolean isTemporal() {
        return this == DATE || this == DATETIME;
    }

    /**
     * Maps a Tableau {@code datatype} attribute. A missing attribute is treated as a string, matching how Tableau
     * renders undeclared fields.
     */
    public static DataType fromTableau(String datatype) {
        if (datatype == null || datatype.isBlank()) {
            return STRING;
        }
        switch (datatype.trim().toLowerCase(Locale.ROOT)) {
            case "string":
            case "str":
                return STRING;
            case "integer":
            case "int":
                return INTEGER;
            case "real":
            case "float":
            case "double":
                return REAL;
            case "date":
                return DATE;
            case "datetime":
                return DATETIME;
            case "boolean":
            case "bool":
                return BOOLEAN;
            default:
                return UNSUPPORTED;
        }
    }
}
