package com.twbconvert.translate;

import com.twbconvert.assumption.Assumption;
import com.twbconvert.translate.dax.DaxExpr;
import com.twbconvert.translate.dax.DaxWriter;
import com.twbconvert.workbook.DataType;
import com.twbconvert.workbook.FieldKey;
import java.util.List;
import java.util.Objects;

/** The DAX form of one calculated field or parameter, ready to be emitted into a table. */
public final class TranslatedExpression {
    private final FieldKey key;
    private final String name;
    private final String table;
    private final FieldClassification classification;
    private final DaxExpr dax;
    private final String daxText;
    private final DataType resultType;
    private final String formatString;
    private final List<Assumption> assumptions;
    private final int declarationIndex;

    public TranslatedExpression(
            FieldKey key,
            String name,
            String table,
            FieldClassification classification,
            DaxExpr dax,
            DataType resultType,
            String formatString,
            List<Assumption> assumptions,
            int declarationIndex) {
        this.key = Objects.requireNonNull(key, "key");
        this.name = Objects.requireNonNull(name, "name");
        this.table = Objects.requireNonNull(table, "table");
        this.classification = Objects.requireNonNull(classification, "classification");
        this.dax = Objects.requireNonNull(dax, "dax");
        this.daxText = DaxWriter.write(dax);
        this.resultType = Objects.requireNonNull(resultType, "resultType");
        this.formatString = formatString;
        this.assumptions = List.copyOf(assumptions);
        this.declarationIndex = declarationIndex;
    }

    public FieldKey getKey() {
        return key;
    }

    public String getName() {
        return name;
    }

    /** Table the column or measure is emitted into. */
    public String getTable() {
        return table;
    }

    public FieldClassification getClassification() {
        return classification;
    }

    public boolean isMeasure() {
        return classification == FieldClassification.MEASURE;
    }

    public DaxExpr getDax() {
        return dax;
    }

    public String getDaxText() {
        return daxText;
    }

    public Confidence getConfidence() {
        return assumptions.isEmpty() ? Confidence.EXACT : Confidence.CLOSEST_MATCH;
    }

    public DataType getResultType() {
        return resultType;
    }

    /** Source default-format string, or {@code null}. */
    public String getFormatString() {
        return formatString;
    }

    public List<Assumption> getAssumptions() {
        return assumptions;
    }

    public int getDeclarationIndex() {
        return declarationIndex;
    }

    @Override
    public String toString() {
        return table + "[" + name + "] = " + daxText + " (" + classification + ", " + getConfidence() + ")";
    }
}
