package com.twbconvert.workbook;

import java.util.Objects;

/**
 * A named formula declared on a datasource. Only the unparsed formula text lives here; the parsed tree, the
 * reference set and the column/measure classification are derived by later stages and never written back.
 */
public final class CalculatedField {
    private final FieldKey key;
    private final String name;
    private final String formula;
    private final DataType dataType;
    private final ColumnRole declaredRole;
    private final String owningTable;
    private final String formatString;
    private final TableCalcAddressing addressing;
    private final int declarationIndex;

    public CalculatedField(
            FieldKey key,
            String name,
            String formula,
            DataType dataType,
            ColumnRole declaredRole,
            String owningTable,
            String formatString,
            TableCalcAddressing addressing,
            int declarationIndex) {
        this.key = Objects.requireNonNull(key, "key");
        this.name = Objects.requireNonNull(name, "name");
        this.formula = Objects.requireNonNull(formula, "formula");
        this.dataType = Objects.requireNonNull(dataType, "dataType");
        this.declaredRole = Objects.requireNonNull(declaredRole, "declaredRole");
        this.owningTable = Objects.requireNonNull(owningTable, "owningTable");
        this.formatString = formatString;
        this.addressing = addressing == null ? TableCalcAddressing.none() : addressing;
        this.declarationIndex = declarationIndex;
    }

    public FieldKey getKey() {
        return key;
    }

    /** Display name (the caption when the workbook declares one). */
    public String getName() {
        return name;
    }

    public String getInternalName() {
        return key.getName();
    }

    public String getDatasourceName() {
        return key.getDatasource();
    }

    public String getFormula() {
        return formula;
    }

    public DataType getDataType() {
        return dataType;
    }

    public ColumnRole getDeclaredRole() {
        return declaredRole;
    }

    public String getOwningTable() {
        return owningTable;
    }

    /** Tableau default-format string, or {@code null}. */
    public String getFormatString() {
        return formatString;
    }

    public TableCalcAddressing getAddressing() {
        return addressing;
    }

    /** Position of this field among all calculated fields of the workbook, in document order. */
    public int getDeclarationIndex() {
        return declarationIndex;
    }

    public boolean answersTo(String reference) {
        return name.equals(reference) || key.getName().equals(reference);
    }

    /** Copy that is emitted under {@code targetName}; the internal name is unchanged. */
    public CalculatedField withName(String targetName) {
        return new CalculatedField(
                key, targetName, formula, dataType, declaredRole, owningTable, formatString, addressing, declarationIndex);
    }
}
