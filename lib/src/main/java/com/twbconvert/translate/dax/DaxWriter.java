package com.twbconvert.translate.dax;

import java.util.List;

/** Renders a {@link DaxExpr} tree as single-line DAX text. Output depends only on the tree. */
public final class DaxWriter {
    private static final int UNARY_PRECEDENCE = 6;
    private static final int ATOM_PRECEDENCE = 8;

    private DaxWriter() {}

    public static String write(DaxExpr expr) {
        StringBuilder out = new StringBuilder();
        write(expr, out);
        return out.toString();
    }

    private static void write(DaxExpr expr, StringBuilder out) {
        if (expr instanceof DaxLiteral literal) {
            writeLiteral(literal, out);
        } else if (expr instanceof DaxColumnRef column) {
            out.append(DaxNames.column(column.getTable(), column.getColumn()));
        } else if (expr instanceof DaxMeasureRef measure) {
            out.append(DaxNames.bracket(measure.getMeasure()));
        } else if (expr instanceof DaxTableRef table) {
            out.append(DaxNames.table(table.getTable()));
        } else if (expr instanceof DaxCall call) {
            writeCall(call.getFunction(), call.getArguments(), out);
        } else if (expr instanceof DaxContextOverride override) {
            out.append("CALCULATE(");
            write(override.getInner(), out);
            for (DaxExpr modifier : override.getModifiers()) {
                out.append(", ");
                write(modifier, out);
            }
            out.append(')');
        } else if (expr instanceof DaxUnary unary) {
            out.append('-');
            writeOperand(unary.getOperand(), UNARY_PRECEDENCE, false, out);
        } else if (expr instanceof DaxBinary binary) {
            int precedence = binary.getOperator().getPrecedence();
            writeOperand(binary.getLeft(), precedence, binary.getOperator() == DaxOperator.POWER, out);
            out.append(' ').append(binary.getOperator().getSymbol()).append(' ');
            writeOperand(binary.getRight(), precedence, binary.getOperator() != DaxOperator.POWER, out);
        } else {
            throw new IllegalStateException("Unknown DAX node " + expr.getClass().getName());
        }
    }

    private static void writeLiteral(DaxLiteral literal, StringBuilder out) {
        switch (literal.getKind()) {
            case STRING:
                out.append(DaxNames.string(literal.getValue()));
                break;
            case BOOLEAN:
                out.append(literal.getValue()).append("()");
                break;
            default:
                out.append(literal.getValue());
                break;
        }
    }

    private static void writeCall(String function, List<DaxExpr> arguments, StringBuilder out) {
        out.append(function).append('(');
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            DaxExpr argument = arguments.get(i);
            if (argument instanceof DaxLiteral literal && literal.getKind() == DaxLiteral.Kind.OMITTED) {
                continue;
            }
            write(argument, out);
        }
        out.append(')');
    }

    /** Parenthesizes a child that binds looser than its parent, or as tightly on the non-associative side. */
    private static void writeOperand(DaxExpr operand, int parentPrecedence, boolean parenthesizeEqual, StringBuilder out) {
        int precedence = precedenceOf(operand);
        boolean parens = precedence < parentPrecedence || (parenthesizeEqual && precedence == parentPrecedence);
        if (parens) {
            out.append('(');
        }
        write(operand, out);
        if (parens) {
            out.append(')');
        }
    }

    private static int precedenceOf(DaxExpr expr) {
        if (expr instanceof DaxBinary binary) {
            return binary.getOperator().getPrecedence();
        }
        if (expr instanceof DaxUnary) {
            return UNARY_PRECEDENCE;
        }
        if (expr instanceof DaxLiteral literal
                && literal.getKind() == DaxLiteral.Kind.NUMBER
                && literal.getValue().startsWith("-")) {
            return UNARY_PRECEDENCE;
        }
        return ATOM_PRECEDENCE;
    }
}
