package com.twbconvert.translate;

import com.twbconvert.formula.ast.AggregationNode;
import com.twbconvert.formula.ast.BinaryOpNode;
import com.twbconvert.formula.ast.BinaryOperator;
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
import com.twbconvert.workbook.DataType;
import java.util.Locale;

/** Static result type of an expression, as far as it can be told without evaluating it. */
final class TypeInference implements ExprVisitor<DataType> {
    private final SymbolTable symbols;
    private final String datasource;

    TypeInference(SymbolTable symbols, String datasource) {
        this.symbols = symbols;
        this.datasource = datasource;
    }

    DataType infer(ExprNode node) {
        return node.accept(this);
    }

    @Override
    public DataType visitLiteral(LiteralNode node) {
        switch (node.getKind()) {
            case NUMBER:
                return node.getValue().contains(".") || node.getValue().toLowerCase(Locale.ROOT).contains("e")
                        ? DataType.REAL
                        : DataType.INTEGER;
            case STRING:
                return DataType.STRING;
            case DATE:
                return node.getValue().contains(":") ? DataType.DATETIME : DataType.DATE;
            case BOOLEAN:
                return DataType.BOOLEAN;
            default:
                return DataType.UNSUPPORTED;
        }
    }

    @Override
    public DataType visitFieldRef(FieldRefNode node) {
        return symbols.resolve(node, datasource).map(FieldSymbol::getDataType).orElse(DataType.UNSUPPORTED);
    }

    @Override
    public DataType visitFunctionCall(FunctionCallNode node) {
        String name = node.getName();
        if (FunctionRules.isStringFunction(name)) {
            return DataType.STRING;
        }
        if (FunctionRules.isBooleanFunction(name)) {
            return DataType.BOOLEAN;
        }
        if (FunctionRules.isDateFunction(name)) {
            return DataType.DATE;
        }
        if ("NOW".equals(name)) {
            return DataType.DATETIME;
        }
        ExprNode passThrough = FunctionRules.argument(node, FunctionRules.passThroughArgument(name));
        if (passThrough != null) {
            return passThrough.accept(this);
        }
        switch (name) {
            case "LEN":
            case "YEAR":
            case "MONTH":
            case "DAY":
            case "QUARTER":
            case "DATEDIFF":
            case "DATEPART":
            case "FIND":
            case "INT":
            case "DIV":
            case "ASCII":
                return DataType.INTEGER;
            default:
                return DataType.REAL;
        }
    }

    @Override
    public DataType visitBinaryOp(BinaryOpNode node) {
        BinaryOperator operator = node.getOperator();
        if (operator.isComparison() || operator.isLogical()) {
            return DataType.BOOLEAN;
        }
        DataType left = node.getLeft().accept(this);
        DataType right = node.getRight().accept(this);
        if (operator == BinaryOperator.ADD && (left == DataType.STRING || right == DataType.STRING)) {
            return DataType.STRING;
        }
        if (left.isTemporal() && right.isTemporal() && operator == BinaryOperator.SUBTRACT) {
            return DataType.REAL;
        }
        if (left.isTemporal()) {
            return left;
        }
        if (operator == BinaryOperator.DIVIDE || operator == BinaryOperator.POWER) {
            return DataType.REAL;
        }
        if (left == DataType.INTEGER && right == DataType.INTEGER) {
            return DataType.INTEGER;
        }
        return DataType.REAL;
    }

    @Override
    public DataType visitUnaryOp(UnaryOpNode node) {
        return node.getOperator() == UnaryOpNode.Operator.NOT ? DataType.BOOLEAN : node.getOperand().accept(this);
    }

    @Override
    public DataType visitConditional(ConditionalNode node) {
        DataType type = node.getBranches().get(0).getResult().accept(this);
        if (type == DataType.UNSUPPORTED && node.getElseResult() != null) {
            return node.getElseResult().accept(this);
        }
        return type;
    }

    @Override
    public DataType visitAggregation(AggregationNode node) {
        switch (node.getFunction()) {
            case "COUNT":
            case "COUNTD":
                return DataType.INTEGER;
            case "AVG":
            case "MEDIAN":
            case "STDEV":
            case "STDEVP":
            case "VAR":
            case "VARP":
            case "PERCENTILE":
                return DataType.REAL;
            default:
                return node.getOperand().accept(this);
        }
    }

    @Override
    public DataType visitLodScope(LodScopeNode node) {
        return node.getBody().accept(this);
    }

    @Override
    public DataType visitWindowFunction(WindowFunctionNode node) {
        switch (node.getFunction()) {
            case "INDEX":
            case "SIZE":
            case "FIRST":
            case "LAST":
            case "RANK":
            case "RANK_DENSE":
            case "RANK_MODIFIED":
            case "RANK_UNIQUE":
                return DataType.INTEGER;
            case "RANK_PERCENTILE":
            case "RUNNING_AVG":
            case "WINDOW_AVG":
                return DataType.REAL;
            default:
                return node.getArguments().isEmpty() ? DataType.REAL : node.getArguments().get(0).accept(this);
        }
    }

    @Override
    public DataType visitUnparsed(UnparsedNode node) {
        return DataType.UNSUPPORTED;
    }
}
