package com.twbconvert.formula.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * {@code IF/ELSEIF/ELSE} when {@link #getCaseOperand()} is {@code null}, {@code CASE/WHEN} otherwise. Branch order
 * is source order.
 */
public final class ConditionalNode implements ExprNode {
    private final ExprNode caseOperand;
    private final List<ConditionalBranch> branches;
    private final ExprNode elseResult;
    private final SourceSpan span;

    public ConditionalNode(
            ExprNode caseOperand, List<ConditionalBranch> branches, ExprNode elseResult, SourceSpan span) {
        if (branches.isEmpty()) {
            throw new IllegalArgumentException("A conditional needs at least one branch");
        }
        this.caseOperand = caseOperand;
        this.branches = List.copyOf(branches);
        this.elseResult = elseResult;
        this.span = Objects.requireNonNull(span, "span");
    }

    public ExprNode getCaseOperand() {
        return caseOperand;
    }

    public boolean isCase() {
        return caseOperand != null;
    }

    public List<ConditionalBranch> getBranches() {
        return branches;
    }

    /** The ELSE result, or {@code null} when absent. */
    public ExprNode getElseResult() {
        return elseResult;
    }

    @Override
    public SourceSpan getSpan() {
        return span;
    }

    @Override
    public List<ExprNode> children() {
        List<ExprNode> children = new ArrayList<>();
        if (caseOperand != null) {
            children.add(caseOperand);
        }
        for (ConditionalBranch branch : branches) {
            children.add(branch.getCondition());
            children.add(branch.getResult());
        }
        if (elseResult != null) {
            children.add(elseResult);
        }
        return Collections.unmodifiableList(children);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitConditional(this);
    }
}
