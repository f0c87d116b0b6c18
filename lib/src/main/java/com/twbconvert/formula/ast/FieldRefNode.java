package com.twbconvert.formula.ast;

import java.util.List;
import java.util.Objects;

/** A bracketed field reference, optionally qualified as {@code [Datasource].[Field]}. */
public final class FieldRefNode implements ExprNode {
    private final String qualifier;
    private final String name;
    private final SourceSpan span;

    public FieldRefNode(String qualifier, String name, SourceSpan span) {
        this.qualifier = qualifier;
        this.name = Objects.requireNonNull(name, "name");
        this.span = Objects.requireNonNull(span, "span");
    }

    /** Datasource or {@code Parameters} qualifier, or {@code null} for an unqualified reference. */
    public String getQualifier() {
        return qualifier;
    }

    public String getName() {
        return name;
    }

    public boolean isQualified() {
        return qualifier != null;
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
        return visitor.visitFieldRef(this);
    }

    @Override
    public String toString() {
        return qualifier == null ? "[" + name + "]" : "[" + qualifier + "].[" + name + "]";
    }
}
