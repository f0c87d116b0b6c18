package com.twbconvert.formula.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An aggregate such as {@code SUM([Sales])}. {@code PERCENTILE} carries its fraction as an extra argument; every
 * other aggregate has exactly one operand.
 */
public final class AggregationNode implements ExprNode {
    private final String function;
    private final ExprNode operand;
    private final List<ExprNode> extraArguments;
    private final SourceSpan span;

    public AggregationNode(String function, ExprNode operand, List<ExprNode> extraArguments, SourceSpan span) {
        this.function = Objects.requireNonNull(function, "function");
        this.operand = Objects.requireNonNull(operand, "operand");
        this.extraArguments = List.copyOf(extraArguments);
        this.span = Objects.requireNonNull(span, "span");
    }

    public String getFunction() {
        return function;
    }

    public ExprNode getOperand() {
        return operand;
    }

    public List<ExprNode> getExtraArguments() {
        return extraArguments;
    }

    @Override
    public SourceSpan getSpan() {
        return span;
    }

    @Override
    public List<ExprNode> children() {
        List<ExprNode> children = new ArrayList<>();
        children.add(operand);
        children.addAll(extraArguments);
        return Collections.unmodifiableList(children);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitAggregation(this);
    }

    @Override
    public String toString() {
        return function + "(" + operand + ")";
    }
}
