package com.twbconvert.pbip.model;

import com.twbconvert.translate.dax.DaxExpr;
import java.util.Objects;

/**
 * A column of an emitted table. Physical columns carry a {@code sourceColumn}; calculated columns carry a DAX
 * expression instead.
 */
public final class ModelColumn {
    private final String name;
    private final String dataType;
    private final String summarizeBy;
    private final String sourceColumn;
    private final DaxExpr expression;
    private final String formatString;
    private final String lineageTag;
    private final boolean hidden;

    public ModelColumn(
            String name,
            String dataType,
            String summarizeBy,
            String sourceColumn,
            DaxExpr expression,
            String formatString,
            String lineageTag,
            boolean hidden) {
        this.name = Objects.requireNonNull(name, "name");
        this.dataType = Objects.requireNonNull(dataType, "dataType");
        this.summarizeBy = Objects.requireNonNull(summarizeBy, "summarizeBy");
        this.lineageTag = Objects.requireNonNull(lineageTag, "lineageTag");
        if ((sourceColumn == null) == (expression == null)) {
            throw new IllegalArgumentException("Column " + name + " needs exactly one of sourceColumn and expression");
        }
        this.sourceColumn = sourceColumn;
        this.expression = expression;
        this.formatString = formatString;
        this.hidden = hidden;
    }

    public String getName() {
        return name;
    }

    public String getDataType() {
        return dataType;
    }

    public String getSummarizeBy() {
        return summarizeBy;
    }

    public String getSourceColumn() {
        return sourceColumn;
    }

    public DaxExpr getExpression() {
        return expression;
    }

    public String getFormatString() {
        return formatString;
    }

    public String getLineageTag() {
        return lineageTag;
    }

    public boolean isHidden() {
        return hidden;
    }

    public boolean isCalculated() {
        return expression != null;
    }
}
