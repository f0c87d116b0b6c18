package com.twbconvert.formula.ast;

import java.util.Objects;

/** One {@code IF/ELSEIF ... THEN} or {@code WHEN ... THEN} arm. */
public final class ConditionalBranch {
    private final ExprNode condition;
    private final ExprNode result;

    public ConditionalBranch(ExprNode condition, ExprNode result) {
        this.condition = Objects.requireNonNull(condition, "condition");
        this.result = Objects.requireNonNull(result, "result");
    }

    /** The test for IF arms, the compared value for CASE arms. */
    public ExprNode getCondition() {
        return condition;
    }

    public ExprNode getResult() {
        return result;
    }
}
