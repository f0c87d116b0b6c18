package com.twbconvert.translate;

import com.twbconvert.extract.WorkbookExtractor;
import com.twbconvert.formula.ast.FieldRefNode;
import com.twbconvert.workbook.CalculatedField;
import com.twbconvert.workbook.Column;
import com.twbconvert.workbook.Datasource;
import com.twbconvert.workbook.FieldKey;
import com.twbconvert.workbook.Parameter;
import com.twbconvert.workbook.Table;
import com.twbconvert.workbook.WorkbookModel;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves formula references to target-model objects. Physical columns and parameters are known up front;
 * calculated fields become resolvable once they have been translated and {@link #register registered}, which the
 * level-by-level translation order guarantees before any dependent is translated.
 */
public final class SymbolTable {
    /** Table that holds one measure per workbook parameter. */
    public static final String PARAMETERS_TABLE = "Parameters";

    private final WorkbookModel model;
    private final Map<FieldKey, FieldSymbol> calculated = new ConcurrentHashMap<>();

    public SymbolTable(WorkbookModel model) {
        this.model = Objects.requireNonNull(model, "model");
    }

    public WorkbookModel getModel() {
        return model;
    }

    public void register(FieldKey key, FieldSymbol symbol) {
        calculated.put(key, symbol);
    }

    public Optional<FieldSymbol> resolve(FieldRefNode reference, String datasource) {
        return resolve(reference.getQualifier(), reference.getName(), datasource);
    }

    /**
     * @param qualifier datasource (name or caption) or {@code Parameters}; {@code null} means the referencing
     *     field's own datasource
     */
    public Optional<FieldSymbol> resolve(String qualifier, String name, String datasource) {
        if (WorkbookExtractor.PARAMETERS_DATASOURCE.equals(qualifier)) {
            return parameter(name);
        }
        String datasourceName = datasource;
        if (qualifier != null) {
            Optional<Datasource> qualified = model.findDatasource(qualifier);
            if (qualified.isEmpty()) {
                return Optional.empty();
            }
            datasourceName = qualified.get().getName();
        }
        for (CalculatedField field : model.getCalculatedFields()) {
            if (field.getDatasourceName().equals(datasourceName) && field.answersTo(name)) {
                return Optional.ofNullable(calculated.get(field.getKey()));
            }
        }
        for (Table table : model.tablesOf(datasourceName)) {
            Optional<Column> column = table.findColumn(name);
            if (column.isPresent()) {
                return Optional.of(
                        new FieldSymbol(
                                FieldSymbol.Kind.COLUMN,
                                table.getName(),
                                column.get().getName(),
                                column.get().getDataType()));
            }
        }
        return qualifier == null ? parameter(name) : Optional.empty();
    }

    private Optional<FieldSymbol> parameter(String name) {
        for (Parameter parameter : model.getParameters()) {
            if (parameter.answersTo(name)) {
                return Optional.of(
                        new FieldSymbol(
                                FieldSymbol.Kind.PARAMETER,
                                PARAMETERS_TABLE,
                                parameter.getName(),
                                parameter.getDataType()));
            }
        }
        return Optional.empty();
    }
}
