package com.twbconvert.translate.dax;

import java.util.Objects;

public final class DaxBinary implements DaxExpr {
    private final DaxOperator operator;
    private final DaxExpr left;
    private final DaxExpr right;

    public DaxBinary(DaxOperator operator, DaxExpr left, DaxExpr right) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
    }

    public DaxOperator getOperator() {
        return operator;
    }

    public DaxExpr getLeft() {
        return left;
    }

    public DaxExpr getRight() {
        return right;
    }
}
