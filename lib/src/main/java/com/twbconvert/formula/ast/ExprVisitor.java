package com.twbconvert.formula.ast;

public interface ExprVisitor<R> {
    R visitLiteral(LiteralNode node);

    R visitFieldRef(FieldRefNode node);

    R visitFunctionCall(FunctionCallNode node);

    R visitBinaryOp(BinaryOpNode node);

    R visitUnaryOp(UnaryOpNode node);

    R visitConditional(ConditionalNode node);

    R visitAggregation(AggregationNode node);

    R visitLodScope(LodScopeNode node);

    R visitWindowFunction(WindowFunctionNode node);

    R visitUnparsed(UnparsedNode node);
}
