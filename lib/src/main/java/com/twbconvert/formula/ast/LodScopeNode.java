package com.twbconvert.formula.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** A level-of-detail expression. {@code { expr }} is represented as FIXED with no dimensions. */
public final class LodScopeNode implements ExprNode {
    private final LodKind kind;
    private final List<ExprNode> dimensions;
    private final ExprNode body;
    private final SourceSpan span;

    public LodScopeNode(LodKind kind, List<ExprNode> dimensions, ExprNode body, SourceSpan span) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.dimensions = List.copyOf(dimensions);
        this.body = Objects.requireNonNull(body, "body");
        this.span = Objects.requireNonNull(span, "span");
    }

    public LodKind getKind() {
        return kind;
    }

    public List<ExprNode> getDimensions() {
        return dimensions;
    }

    public ExprNode getBody() {
        return body;
    }

    @Override
    public SourceSpan getSpan() {
        return span;
    }

    @Override
    public List<ExprNode> children() {
        List<ExprNode> children = new ArrayList<>(dimensions);
        children.add(body);
        return Collections.unmodifiableList(children);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitLodScope(this);
    }

    @Override
    public String toString() {
        return "{" + kind + " " + dimensions + " : " + body + "}";
    }
}
