package com.twbconvert.translate;

import com.twbconvert.formula.ast.AggregationNode;
import com.twbconvert.formula.ast.BinaryOpNode;
import com.twbconvert.formula.ast.ConditionalNode;
import com.twbconvert.formula.ast.ExprNode;
import com.twbconvert.formula.ast.ExprVisitor;
import com.twbconvert.formula.ast.FieldRefNode;
import com.twbconvert.formula.ast.FunctionCallNode;
import com.twbconvert.formula.ast.LiteralNode;
import com.twbconvert.formula.ast.LodKind;
import com.twbconvert.formula.ast.LodScopeNode;
import com.twbconvert.formula.ast.UnaryOpNode;
import com.twbconvert.formula.ast.UnparsedNode;
import com.twbconvert.formula.ast.WindowFunctionNode;
import com.twbconvert.workbook.ColumnRole;

/**
 * Decides whether a calculated field is a measure. A field is aggregate when it contains an aggregation or table
 * calculation outside any FIXED scope, an INCLUDE or EXCLUDE scope outside FIXED, or a reference to a field that is
 * already a measure. A FIXED scope evaluates to one value per row and so yields a column.
 */
final class FieldClassifier implements ExprVisitor<Boolean> {
    private final SymbolTable symbols;
    private final String datasource;
    private int fixedDepth;

    private FieldClassifier(SymbolTable symbols, String datasource) {
        this.symbols = symbols;
        this.datasource = datasource;
    }

    static FieldClassification classify(
            ExprNode root, SymbolTable symbols, String datasource, ColumnRole declaredRole) {
        if (root instanceof UnparsedNode) {
            return declaredRole == ColumnRole.MEASURE ? FieldClassification.MEASURE : FieldClassification.COLUMN;
        }
        boolean aggregate = root.accept(new FieldClassifier(symbols, datasource));
        return aggregate ? FieldClassification.MEASURE : FieldClassification.COLUMN;
    }

    private boolean anyChild(ExprNode node) {
        for (ExprNode child : node.children()) {
            if (child.accept(this)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Boolean visitLiteral(LiteralNode node) {
        return false;
    }

    @Override
    public Boolean visitFieldRef(FieldRefNode node) {
        if (fixedDepth > 0) {
            return false;
        }
        return symbols.resolve(node, datasource).map(s -> s.getKind() == FieldSymbol.Kind.MEASURE).orElse(false);
    }

    @Override
    public Boolean visitFunctionCall(FunctionCallNode node) {
        return anyChild(node);
    }

    @Override
    public Boolean visitBinaryOp(BinaryOpNode node) {
        return anyChild(node);
    }

    @Override
    public Boolean visitUnaryOp(UnaryOpNode node) {
        return anyChild(node);
    }

    @Override
    public Boolean visitConditional(ConditionalNode node) {
        return anyChild(node);
    }

    @Override
    public Boolean visitAggregation(AggregationNode node) {
        return fixedDepth == 0 || anyChild(node);
    }

    @Override
    public Boolean visitLodScope(LodScopeNode node) {
        if (node.getKind() != LodKind.FIXED) {
            return fixedDepth == 0 || anyChild(node);
        }
        fixedDepth++;
        try {
            return anyChild(node);
        } finally {
            fixedDepth--;
        }
    }

    @Override
    public Boolean visitWindowFunction(WindowFunctionNode node) {
        return fixedDepth == 0 || anyChild(node);
    }

    @Override
    public Boolean visitUnparsed(UnparsedNode node) {
        return false;
    }
}
