package com.twbconvert.formula.ast;

import java.util.List;
import java.util.Objects;

public final class LiteralNode implements ExprNode {

    public enum Kind {
        NUMBER,
        STRING,
        DATE,
        BOOLEAN,
        NULL
    }

    private final Kind kind;
    private final String value;
    private final SourceSpan span;

    /**
     * @param value unquoted literal text: digits for numbers, the unescaped string, the date text between
     *     {@code #} marks, {@code true}/{@code false}, or empty for null
     */
    public LiteralNode(Kind kind, String value, SourceSpan span) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.value = Objects.requireNonNull(value, "value");
        this.span = Objects.requireNonNull(span, "span");
    }

    public Kind getKind() {
        return kind;
    }

    public String getValue() {
        return value;
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
        return visitor.visitLiteral(this);
    }

    @Override
    public String toString() {
        return kind + "(" + value + ")";
    }
}
