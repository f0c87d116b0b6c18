package com.twbconvert.workbook;

import java.util.List;
import java.util.Optional;

/** Normalized, immutable view of a workbook. Produced once by the extractor and never mutated. */
public final class WorkbookModel {
    private final List<Datasource> datasources;
    private final List<Table> tables;
    private final List<CalculatedField> calculatedFields;
    private final List<Parameter> parameters;
    private final List<JoinEdge> joinEdges;
    private final List<Worksheet> worksheets;
    private final List<Dashboard> dashboards;
    private final List<FilterAction> filterActions;

    public WorkbookModel(
            List<Datasource> datasources,
            List<Table> tables,
            List<CalculatedField> calculatedFields,
            List<Parameter> parameters,
            List<JoinEdge> joinEdges,
            List<Worksheet> worksheets,
            List<Dashboard> dashboards,
            List<FilterAction> filterActions) {
        this.datasources = List.copyOf(datasources);
        this.tables = List.copyOf(tables);
        this.calculatedFields = List.copyOf(calculatedFields);
        this.parameters = List.copyOf(parameters);
        this.joinEdges = List.copyOf(joinEdges);
        this.worksheets = List.copyOf(worksheets);
        this.dashboards = List.copyOf(dashboards);
        this.filterActions = List.copyOf(filterActions);
    }

    public List<Datasource> getDatasources() {
        return datasources;
    }

    public List<Table> getTables() {
        return tables;
    }

    public List<CalculatedField> getCalculatedFields() {
        return calculatedFields;
    }

    public List<Parameter> getParameters() {
        return parameters;
    }

    public List<JoinEdge> getJoinEdges() {
        return joinEdges;
    }

    public List<Worksheet> getWorksheets() {
        return worksheets;
    }

    public List<Dashboard> getDashboards() {
        return dashboards;
    }

    public List<FilterAction> getFilterActions() {
        return filterActions;
    }

    public Optional<Datasource> findDatasource(String name) {
        for (Datasource datasource : datasources) {
            if (datasource.getName().equals(name) || datasource.getCaption().equals(name)) {
                return Optional.of(datasource);
            }
        }
        return Optional.empty();
    }

    public Optional<Table> findTable(String name) {
        for (Table table : tables) {
            if (table.getName().equals(name)) {
                return Optional.of(table);
            }
        }
        return Optional.empty();
    }

    public Optional<Worksheet> findWorksheet(String name) {
        for (Worksheet worksheet : worksheets) {
            if (worksheet.getName().equals(name)) {
                return Optional.of(worksheet);
            }
        }
        return Optional.empty();
    }

    public List<Table> tablesOf(String datasourceName) {
        return tables.stream().filter(t -> t.getDatasourceName().equals(datasourceName)).toList();
    }
}
