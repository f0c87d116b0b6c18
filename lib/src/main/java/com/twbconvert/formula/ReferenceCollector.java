package com.twbconvert.formula;

import com.twbconvert.formula.ast.AggregationNode;
import com.twbconvert.formula.ast.BinaryOpNode;
import com.twbconvert.formula.ast.ConditionalNode;
import com.twbconvert.formula.ast.ExprNode;
import com.twbconvert.formula.ast.ExprVisitor;
import com.twbconvert.formula.ast.FieldRefNode;
import com.twbconvert.formula.ast.FunctionCallNode;
import com.twbconvert.formula.ast.LiteralNode;
import com.twbconvert.formula.ast.LodScopeNode;
import com.twbconvert.formula.ast.UnaryOpNode;
import com.twbconvert.formula.ast.UnparsedNode;
import com.twbconvert.formula.ast.WindowFunctionNode;
import java.util.ArrayList;
import java.util.List;

/** Static extraction of the field references of a formula, in source order, duplicates included. */
public final class ReferenceCollector implements ExprVisitor<Void> {
    private final List<FieldRefNode> references = new ArrayList<>();

    private ReferenceCollector() {}

    public static List<FieldRefNode> collect(ExprNode root) {
        ReferenceCollector collector = new ReferenceCollector();
        root.accept(collector);
        return List.copyOf(collector.references);
    }

    private Void visitChildren(ExprNode node) {
        for (ExprNode child : node.children()) {
            child.accept(this);
        }
        return null;
    }

    @Override
    public Void visitLiteral(LiteralNode node) {
        return null;
    }

    @Override
    public Void visitFieldRef(FieldRefNode node) {
        references.add(node);
        return null;
    }

    @Override
    public Void visitFunctionCall(FunctionCallNode node) {
        return visitChildren(node);
    }

    @Override
    public Void visitBinaryOp(BinaryOpNode node) {
        return visitChildren(node);
    }

    @Override
    public Void visitUnaryOp(UnaryOpNode node) {
        return visitChildren(node);
    }

    @Override
    public Void visitConditional(ConditionalNode node) {
        return visitChildren(node);
    }

    @Override
    public Void visitAggregation(AggregationNode node) {
        return visitChildren(node);
    }

    @Override
    public Void visitLodScope(LodScopeNode node) {
        return visitChildren(node);
    }

    @Override
    public Void visitWindowFunction(WindowFunctionNode node) {
        return visitChildren(node);
    }

    @Override
    public Void visitUnparsed(UnparsedNode node) {
        return null;
    }
}
