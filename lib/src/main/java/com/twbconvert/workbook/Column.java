package com.twbconvert.workbook;

import java.util.Objects;

public final class Column {
    private final String name;
    private final String internalName;
    private final String sourceColumn;
    private final DataType dataType;
    private final ColumnRole role;
    private final AggregationType defaultAggregation;
    private final boolean uniqueKey;

    public Column(
            String name,
            String internalName,
            String sourceColumn,
            DataType dataType,
            ColumnRole role,
            AggregationType defaultAggregation,
            boolean uniqueKey) {
        this.name = Objects.requireNonNull(name, "name");
        this.internalName = Objects.requireNonNull(internalName, "internalName");
        this.sourceColumn = sourceColumn == null ? name : sourceColumn;
        this.dataType = Objects.requireNonNull(dataType, "dataType");
        this.role = Objects.requireNonNull(role, "role");
        this.defaultAggregation = Objects.requireNonNull(defaultAggregation, "defaultAggregation");
        this.uniqueKey = uniqueKey;
    }

    /** Display name, used as the target column name. */
    public String getName() {
        return name;
    }

    /** Name used by formulas and shelves, without brackets. */
    public String getInternalName() {
        return internalName;
    }

    public String getSourceColumn() {
        return sourceColumn;
    }

    public DataType getDataType() {
        return dataType;
    }

    public ColumnRole getRole() {
        return role;
    }

    public AggregationType getDefaultAggregation() {
        return defaultAggregation;
    }

    public boolean isUniqueKey() {
        return uniqueKey;
    }

    /** True when {@code reference} names this column by display, internal or source name. */
    public boolean answersTo(String reference) {
        return name.equals(reference) || internalName.equals(reference) || sourceColumn.equals(reference);
    }
}
