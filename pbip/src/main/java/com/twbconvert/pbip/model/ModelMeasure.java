package com.twbconvert.pbip.model;

import com.twbconvert.translate.dax.DaxExpr;
import java.util.Objects;

public final class ModelMeasure {
    private final String name;
    private final DaxExpr expression;
    private final String formatString;
    private final String lineageTag;

    public ModelMeasure(String name, DaxExpr expression, String formatString, String lineageTag) {
        this.name = Objects.requireNonNull(name, "name");
        this.expression = Objects.requireNonNull(expression, "expression");
        this.formatString = formatString;
        this.lineageTag = Objects.requireNonNull(lineageTag, "lineageTag");
    }

    public String getName() {
        return name;
    }

    public DaxExpr getExpression() {
        return expression;
    }

    /** {@code null} when the measure keeps the model default. */
    public String getFormatString() {
        return formatString;
    }

    public String getLineageTag() {
        return lineageTag;
    }
}
