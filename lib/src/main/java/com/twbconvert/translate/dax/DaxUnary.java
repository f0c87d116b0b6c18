package com.twbconvert.translate.dax;

import java.util.Objects;

/** Arithmetic negation. Logical negation is the {@code NOT} function. */
public final class DaxUnary implements DaxExpr {
    private final DaxExpr operand;

    public DaxUnary(DaxExpr operand) {
        this.operand = Objects.requireNonNull(operand, "operand");
    }

    public DaxExpr getOperand() {
        return operand;
    }
}
