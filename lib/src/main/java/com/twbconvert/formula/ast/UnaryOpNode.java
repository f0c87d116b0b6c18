package com.twbconvert.formula.ast;

import java.util.List;
import java.util.Objects;

public final class UnaryOpNode implements ExprNode {

    public enum Operator {
        NEGATE,
        NOT
    }

    private final Operator operator;
    private final ExprNode operand;
    private final SourceSpan span;

    public UnaryOpNode(Operator operator, ExprNode operand, SourceSpan span) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.operand = Objects.requireNonNull(operand, "operand");
        this.span = Objects.requireNonNull(span, "span");
    }

    public Operator getOperator() {
        return operator;
    }

    public ExprNode getOperand() {
        return operand;
    }

    @Override
    public SourceSpan getSpan() {
        return span;
    }

    @Override
    public List<ExprNode> children() {
        return List.of(operand);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitUnaryOp(this);
    }

    @Override
    public String toString() {
        return operator + "(" + operand + ")";
    }
}
