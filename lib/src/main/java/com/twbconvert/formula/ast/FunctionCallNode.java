package com.twbconvert.formula.ast;

import java.util.List;
import java.util.Objects;

/** Call of a row-level function. Aggregations and table calculations have their own node kinds. */
public final class FunctionCallNode implements ExprNode {
    private final String name;
    private final List<ExprNode> arguments;
    private final SourceSpan span;

    public FunctionCallNode(String name, List<ExprNode> arguments, SourceSpan span) {
        this.name = Objects.requireNonNull(name, "name");
        this.arguments = List.copyOf(arguments);
        this.span = Objects.requireNonNull(span, "span");
    }

    /** Upper-case function name. */
    public String getName() {
        return name;
    }

    public List<ExprNode> getArguments() {
        return arguments;
    }

    @Override
    public SourceSpan getSpan() {
        return span;
    }

    @Override
    public List<ExprNode> children() {
        return arguments;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }

    @Override
    public String toString() {
        return name + arguments;
    }
}
