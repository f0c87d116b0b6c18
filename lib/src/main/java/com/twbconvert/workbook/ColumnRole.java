package com.twbconvert.workbook;

public enum ColumnRole {
    DIMENSION,
    MEASURE;

    public static ColumnRole fromTableau(String role, DataType dataType) {
        if ("measure".equalsIgnoreCase(role)) {
            return MEASURE;
        }
        if ("dimension".equalsIgnoreCase(role)) {
            return DIMENSION;
        }
        return dataType.isNumeric() ? MEASURE : DIMENSION;
    }
}
