package com.twbconvert.formula.ast;

import com.twbconvert.workbook.TableCalcAddressing;
import java.util.List;
import java.util.Objects;

/**
 * A table calculation. The addressing is not part of the formula text; the parser receives it from the worksheet or
 * field that declares the calculation.
 */
public final class WindowFunctionNode implements ExprNode {
    private final String function;
    private final List<ExprNode> arguments;
    private final TableCalcAddressing addressing;
    private final SourceSpan span;

    public WindowFunctionNode(
            String function, List<ExprNode> arguments, TableCalcAddressing addressing, SourceSpan span) {
        this.function = Objects.requireNonNull(function, "function");
        this.arguments = List.copyOf(arguments);
        this.addressing = Objects.requireNonNull(addressing, "addressing");
        this.span = Objects.requireNonNull(span, "span");
    }

    public String getFunction() {
        return function;
    }

    public List<ExprNode> getArguments() {
        return arguments;
    }

    public TableCalcAddressing getAddressing() {
        return addressing;
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
        return visitor.visitWindowFunction(this);
    }

    @Override
    public String toString() {
        return function + arguments;
    }
}
