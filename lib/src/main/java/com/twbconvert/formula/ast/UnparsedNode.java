package com.twbconvert.formula.ast;

import java.util.List;
import java.util.Objects;

/** Stands in for a formula that failed to parse, so the field can still be emitted as a placeholder. */
public final class UnparsedNode implements ExprNode {
    private final String text;
    private final String reason;
    private final SourceSpan span;

    public UnparsedNode(String text, String reason) {
        this.text = Objects.requireNonNull(text, "text");
        this.reason = Objects.requireNonNull(reason, "reason");
        this.span = new SourceSpan(0, text.length());
    }

    public String getText() {
        return text;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public SourceSpan getSpan() {
        return span;
    }

    @Override
    public List<ExprNode> children() {
        return List.of();
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitUnparsed(this);
    }
}
