package com.twbconvert.formula.ast;

import java.util.List;
import java.util.Objects;

public final class BinaryOpNode implements ExprNode {
    private final BinaryOperator operator;
    private final ExprNode left;
    private final ExprNode right;
    private final SourceSpan span;

    public BinaryOpNode(BinaryOperator operator, ExprNode left, ExprNode right, SourceSpan span) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
        this.span = Objects.requireNonNull(span, "span");
    }

    public BinaryOperator getOperator() {
        return operator;
    }

    public ExprNode getLeft() {
        return left;
    }

    public ExprNode getRight() {
        return right;
    }

    @Override
    public SourceSpan getSpan() {
        return span;
    }

    @Override
    public List<ExprNode> children() {
        return List.of(left, right);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitBinaryOp(this);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.getSymbol() + " " + right + ")";
    }
}
