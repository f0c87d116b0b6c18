package com.twbconvert.formula.ast;

import java.util.List;

/**
 * Node of a parsed calculation. The set of node kinds is closed; consumers dispatch through {@link ExprVisitor},
 * so adding a kind breaks every rule table that does not handle it.
 */
public sealed interface ExprNode
        permits LiteralNode,
                FieldRefNode,
                FunctionCallNode,
                BinaryOpNode,
                UnaryOpNode,
                ConditionalNode,
                AggregationNode,
                LodScopeNode,
                WindowFunctionNode,
                UnparsedNode {

    SourceSpan getSpan();

    /** Direct sub-expressions in source order. */
    List<ExprNode> children();

    <R> R accept(ExprVisitor<R> visitor);
}
