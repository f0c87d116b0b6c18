package com.twbconvert.workbook;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class Worksheet {
    private final String name;
    private final List<String> datasourceNames;
    private final List<FieldUsage> rows;
    private final List<FieldUsage> columns;
    private final String markClass;
    private final List<Encoding> encodings;
    private final List<WorksheetFilter> filters;
    private final List<String> measureNameMembers;
    private final Map<String, TableCalcAddressing> tableCalcAddressing;
    private final String title;

    public Worksheet(
            String name,
            List<String> datasourceNames,
            List<FieldUsage> rows,
            List<FieldUsage> columns,
            String markClass,
            List<Encoding> encodings,
            List<WorksheetFilter> filters,
            List<String> measureNameMembers,
            Map<String, TableCalcAddressing> tableCalcAddressing,
            String title) {
        this.name = Objects.requireNonNull(name, "name");
        this.datasourceNames = List.copyOf(datasourceNames);
        this.rows = List.copyOf(rows);
        this.columns = List.copyOf(columns);
        this.markClass = markClass == null ? "Automatic" : markClass;
        this.encodings = List.copyOf(encodings);
        this.filters = List.copyOf(filters);
        this.measureNameMembers = List.copyOf(measureNameMembers);
        this.tableCalcAddressing = Map.copyOf(tableCalcAddressing);
        this.title = title;
    }

    public String getName() {
        return name;
    }

    public List<String> getDatasourceNames() {
        return datasourceNames;
    }

    public List<FieldUsage> getRows() {
        return rows;
    }

    public List<FieldUsage> getColumns() {
        return columns;
    }

    public String getMarkClass() {
        return markClass;
    }

    public List<Encoding> getEncodings() {
        return encodings;
    }

    public List<WorksheetFilter> getFilters() {
        return filters;
    }

    public List<String> getMeasureNameMembers() {
        return measureNameMembers;
    }

    /** Declared table-calculation addressing keyed by field name. */
    public Map<String, TableCalcAddressing> getTableCalcAddressing() {
        return tableCalcAddressing;
    }

    /** Formatted title text, or {@code null} when the sheet shows its name. */
    public String getTitle() {
        return title;
    }

    public boolean usesMeasureNames() {
        for (FieldUsage usage : rows) {
            if (usage.isMeasureNames()) {
                return true;
            }
        }
        for (FieldUsage usage : columns) {
            if (usage.isMeasureNames()) {
                return true;
            }
        }
        return false;
    }
}
