package com.twbconvert.workbook;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

public final class Table {
    private final String name;
    private final String datasourceName;
    private final String sourceObject;
    private final List<Column> columns;

    public Table(String name, String datasourceName, String sourceObject, List<Column> columns) {
        this.name = Objects.requireNonNull(name, "name");
        this.datasourceName = Objects.requireNonNull(datasourceName, "datasourceName");
        this.sourceObject = sourceObject == null ? name : sourceObject;
        this.columns = List.copyOf(columns);
    }

    public String getName() {
        return name;
    }

    public String getDatasourceName() {
        return datasourceName;
    }

    /** The physical object the table reads from, for example {@code Orders$} for an Excel sheet. */
    public String getSourceObject() {
        return sourceObject;
    }

    public List<Column> getColumns() {
        return columns;
    }

    /** Looks a column up by display or internal name first, then by source column name. */
    public Optional<Column> findColumn(String reference) {
        for (Column column : columns) {
            if (column.getName().equals(reference) || column.getInternalName().equals(reference)) {
                return Optional.of(column);
            }
        }
        for (Column column : columns) {
            if (column.answersTo(reference)) {
                return Optional.of(column);
            }
        }
        return Optional.empty();
    }
}
