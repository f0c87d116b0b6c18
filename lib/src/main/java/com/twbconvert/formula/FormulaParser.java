package com.twbconvert.formula;

import com.twbconvert.formula.ast.AggregationNode;
import com.twbconvert.formula.ast.BinaryOpNode;
import com.twbconvert.formula.ast.BinaryOperator;
import com.twbconvert.formula.ast.ConditionalBranch;
import com.twbconvert.formula.ast.ConditionalNode;
import com.twbconvert.formula.ast.ExprNode;
import com.twbconvert.formula.ast.FieldRefNode;
import com.twbconvert.formula.ast.FunctionCallNode;
import com.twbconvert.formula.ast.LiteralNode;
import com.twbconvert.formula.ast.LodKind;
import com.twbconvert.formula.ast.LodScopeNode;
import com.twbconvert.formula.ast.SourceSpan;
import com.twbconvert.formula.ast.UnaryOpNode;
import com.twbconvert.formula.ast.WindowFunctionNode;
import com.twbconvert.formula.grammar.TableauFormulaBaseVisitor;
import com.twbconvert.formula.grammar.TableauFormulaLexer;
import com.twbconvert.formula.grammar.TableauFormulaParser;
import com.twbconvert.workbook.TableCalcAddressing;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.antlr.v4.runtime.tree.TerminalNode;

/**
 * Parses Tableau calculation text into an {@link ExprNode} tree. Instances hold no state and may be shared across
 * threads.
 */
public final class FormulaParser {
    private static final Logger LOGGER = Logger.getLogger(FormulaParser.class.getName());

    public ExprNode parse(String formula) throws ExpressionSyntaxException {
        return parse(formula, TableCalcAddressing.none());
    }

    /**
     * @param addressing table-calculation addressing attached to every window function in the formula
     */
    public ExprNode parse(String formula, TableCalcAddressing addressing) throws ExpressionSyntaxException {
        Objects.requireNonNull(formula, "formula");
        Objects.requireNonNull(addressing, "addressing");

        TableauFormulaLexer lexer = new TableauFormulaLexer(CharStreams.fromString(formula));
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        TableauFormulaParser parser = new TableauFormulaParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(ThrowingErrorListener.INSTANCE);
        if (DebugFlags.isParserTraceEnabled()) {
            parser.addErrorListener(DebugFlags.diagnosticListener());
        }

        try {
            if (DebugFlags.isTokenDebugEnabled()) {
                tokens.fill();
                DebugFlags.captureTokens(tokens, lexer);
                tokens.seek(0);
            }
            TableauFormulaParser.FormulaContext context = parser.formula();
            return new AstBuildingVisitor(addressing).visit(context);
        } catch (ThrowingErrorListener.PositionedCancellation ex) {
            int offset = offsetOf(formula, ex.getLine(), ex.getCharPositionInLine());
            throw new ExpressionSyntaxException(ex.getMessage(), formula, offset, ex);
        } catch (ParseCancellationException ex) {
            throw new ExpressionSyntaxException(String.valueOf(ex.getMessage()), formula, 0, ex);
        } finally {
            logDebugOutput(formula);
        }
    }

    /** Drains what the debug listeners captured for this parse; the capture buffers are per thread. */
    private static void logDebugOutput(String formula) {
        List<String> tokens = DebugFlags.drainCapturedTokens();
        List<String> diagnostics = DebugFlags.drainCapturedDiagnostics();
        if (tokens.isEmpty() && diagnostics.isEmpty()) {
            return;
        }
        StringBuilder dump = new StringBuilder("Parser debug output for: ").append(formula);
        for (String token : tokens) {
            dump.append(System.lineSeparator()).append("  [tokens] ").append(token);
        }
        for (String diagnostic : diagnostics) {
            dump.append(System.lineSeparator()).append("  [parser] ").append(diagnostic);
        }
        LOGGER.info(dump.toString());
    }

    static int offsetOf(String text, int line, int charPositionInLine) {
        int offset = 0;
        int currentLine = 1;
        while (currentLine < line && offset < text.length()) {
            if (text.charAt(offset) == '\n') {
                currentLine++;
            }
            offset++;
        }
        return Math.min(offset + Math.max(charPositionInLine, 0), text.length());
    }

    static String unbracket(String field) {
        String inner = field.substring(1, field.length() - 1);
        return inner.replace("]]", "]");
    }

    private static String unquote(String literal) {
        char quote = literal.charAt(0);
        String inner = literal.substring(1, literal.length() - 1);
        String doubled = String.valueOf(quote) + quote;
        return inner.replace(doubled, String.valueOf(quote));
    }

    private static final class AstBuildingVisitor extends TableauFormulaBaseVisitor<ExprNode> {
        private final TableCalcAddressing addressing;

        AstBuildingVisitor(TableCalcAddressing addressing) {
            this.addressing = addressing;
        }

        private static SourceSpan span(ParserRuleContext ctx) {
            Token start = ctx.getStart();
            Token stop = ctx.getStop();
            int begin = start.getStartIndex();
            int end = stop == null || stop.getStopIndex() < begin ? begin : stop.getStopIndex() + 1;
            return new SourceSpan(begin, end);
        }

        private List<ExprNode> visitAll(List<TableauFormulaParser.ExprContext> contexts) {
            List<ExprNode> nodes = new ArrayList<>(contexts.size());
            for (TableauFormulaParser.ExprContext context : contexts) {
                nodes.add(visit(context));
            }
            return nodes;
        }

        @Override
        public ExprNode visitFormula(TableauFormulaParser.FormulaContext ctx) {
            return visit(ctx.expr());
        }

        @Override
        public ExprNode visitParenExpr(TableauFormulaParser.ParenExprContext ctx) {
            return visit(ctx.expr());
        }

        @Override
        public ExprNode visitLodExpression(TableauFormulaParser.LodExpressionContext ctx) {
            return visit(ctx.lodExpr());
        }

        @Override
        public ExprNode visitScopedLod(TableauFormulaParser.ScopedLodContext ctx) {
            List<ExprNode> parts = visitAll(ctx.expr());
            ExprNode body = parts.get(parts.size() - 1);
            List<ExprNode> dimensions = parts.subList(0, parts.size() - 1);
            LodKind kind = LodKind.valueOf(ctx.kind.getText().toUpperCase(Locale.ROOT));
            return new LodScopeNode(kind, dimensions, body, span(ctx));
        }

        @Override
        public ExprNode visitTableLod(TableauFormulaParser.TableLodContext ctx) {
            return new LodScopeNode(LodKind.FIXED, List.of(), visit(ctx.expr()), span(ctx));
        }

        @Override
        public ExprNode visitIfExpr(TableauFormulaParser.IfExprContext ctx) {
            List<ConditionalBranch> branches = new ArrayList<>();
            branches.add(new ConditionalBranch(visit(ctx.expr(0)), visit(ctx.expr(1))));
            for (TableauFormulaParser.ElseIfClauseContext clause : ctx.elseIfClause()) {
                branches.add(new ConditionalBranch(visit(clause.expr(0)), visit(clause.expr(1))));
            }
            ExprNode elseResult = ctx.expr().size() > 2 ? visit(ctx.expr(2)) : null;
            return new ConditionalNode(null, branches, elseResult, span(ctx));
        }

        @Override
        public ExprNode visitCaseExpr(TableauFormulaParser.CaseExprContext ctx) {
            ExprNode operand = visit(ctx.expr(0));
            List<ConditionalBranch> branches = new ArrayList<>();
            for (TableauFormulaParser.WhenClauseContext clause : ctx.whenClause()) {
                branches.add(new ConditionalBranch(visit(clause.expr(0)), visit(clause.expr(1))));
            }
            ExprNode elseResult = ctx.expr().size() > 1 ? visit(ctx.expr(1)) : null;
            return new ConditionalNode(operand, branches, elseResult, span(ctx));
        }

        @Override
        public ExprNode visitFunctionCall(TableauFormulaParser.FunctionCallContext ctx) {
            String name = ctx.IDENTIFIER().getText().toUpperCase(Locale.ROOT);
            List<ExprNode> arguments =
                    ctx.argumentList() == null ? List.of() : visitAll(ctx.argumentList().expr());
            SourceSpan span = span(ctx);
            if (FunctionCatalog.isAggregate(name, arguments.size())) {
                return new AggregationNode(name, arguments.get(0), arguments.subList(1, arguments.size()), span);
            }
            if (FunctionCatalog.isTableCalculation(name)) {
                return new WindowFunctionNode(name, arguments, addressing, span);
            }
            return new FunctionCallNode(name, arguments, span);
        }

        @Override
        public ExprNode visitFieldExpr(TableauFormulaParser.FieldExprContext ctx) {
            List<TerminalNode> parts = ctx.fieldReference().FIELD();
            SourceSpan span = span(ctx);
            if (parts.size() == 2) {
                return new FieldRefNode(unbracket(parts.get(0).getText()), unbracket(parts.get(1).getText()), span);
            }
            return new FieldRefNode(null, unbracket(parts.get(0).getText()), span);
        }

        @Override
        public ExprNode visitLiteralExpr(TableauFormulaParser.LiteralExprContext ctx) {
            TableauFormulaParser.LiteralContext literal = ctx.literal();
            String text = literal.getText();
            SourceSpan span = span(ctx);
            if (literal.NUMBER() != null) {
                return new LiteralNode(LiteralNode.Kind.NUMBER, text, span);
            }
            if (literal.STRING() != null) {
                return new LiteralNode(LiteralNode.Kind.STRING, unquote(text), span);
            }
            if (literal.DATE_LITERAL() != null) {
                return new LiteralNode(LiteralNode.Kind.DATE, text.substring(1, text.length() - 1).trim(), span);
            }
            if (literal.TRUE() != null || literal.FALSE() != null) {
                return new LiteralNode(LiteralNode.Kind.BOOLEAN, text.toLowerCase(Locale.ROOT), span);
            }
            return new LiteralNode(LiteralNode.Kind.NULL, "", span);
        }

        @Override
        public ExprNode visitPowerExpr(TableauFormulaParser.PowerExprContext ctx) {
            return binary(BinaryOperator.POWER, ctx.expr(0), ctx.expr(1), ctx);
        }

        @Override
        public ExprNode visitSignExpr(TableauFormulaParser.SignExprContext ctx) {
            ExprNode operand = visit(ctx.expr());
            if (ctx.op.getType() == TableauFormulaParser.PLUS) {
                return operand;
            }
            return new UnaryOpNode(UnaryOpNode.Operator.NEGATE, operand, span(ctx));
        }

        @Override
        public ExprNode visitMultiplicativeExpr(TableauFormulaParser.MultiplicativeExprContext ctx) {
            BinaryOperator operator;
            switch (ctx.op.getType()) {
                case TableauFormulaParser.STAR:
                    operator = BinaryOperator.MULTIPLY;
                    break;
                case TableauFormulaParser.SLASH:
                    operator = BinaryOperator.DIVIDE;
                    break;
                default:
                    operator = BinaryOperator.MODULO;
                    break;
            }
            return binary(operator, ctx.expr(0), ctx.expr(1), ctx);
        }

        @Override
        public ExprNode visitAdditiveExpr(TableauFormulaParser.AdditiveExprContext ctx) {
            BinaryOperator operator =
                    ctx.op.getType() == TableauFormulaParser.PLUS ? BinaryOperator.ADD : BinaryOperator.SUBTRACT;
            return binary(operator, ctx.expr(0), ctx.expr(1), ctx);
        }

        @Override
        public ExprNode visitComparisonExpr(TableauFormulaParser.ComparisonExprContext ctx) {
            BinaryOperator operator;
            switch (ctx.op.getType()) {
                case TableauFormulaParser.EQ:
                case TableauFormulaParser.EQEQ:
                    operator = BinaryOperator.EQUALS;
                    break;
                case TableauFormulaParser.NEQ:
                case TableauFormulaParser.LTGT:
                    operator = BinaryOperator.NOT_EQUALS;
                    break;
                case TableauFormulaParser.LT:
                    operator = BinaryOperator.LESS;
                    break;
                case TableauFormulaParser.LTE:
                    operator = BinaryOperator.LESS_OR_EQUAL;
                    break;
                case TableauFormulaParser.GT:
                    operator = BinaryOperator.GREATER;
                    break;
                default:
                    operator = BinaryOperator.GREATER_OR_EQUAL;
                    break;
            }
            return binary(operator, ctx.expr(0), ctx.expr(1), ctx);
        }

        @Override
        public ExprNode visitNotExpr(TableauFormulaParser.NotExprContext ctx) {
            return new UnaryOpNode(UnaryOpNode.Operator.NOT, visit(ctx.expr()), span(ctx));
        }

        @Override
        public ExprNode visitAndExpr(TableauFormulaParser.AndExprContext ctx) {
            return binary(BinaryOperator.AND, ctx.expr(0), ctx.expr(1), ctx);
        }

        @Override
        public ExprNode visitOrExpr(TableauFormulaParser.OrExprContext ctx) {
            return binary(BinaryOperator.OR, ctx.expr(0), ctx.expr(1), ctx);
        }

        private ExprNode binary(
                BinaryOperator operator,
                TableauFormulaParser.ExprContext left,
                TableauFormulaParser.ExprContext right,
                ParserRuleContext ctx) {
            return new BinaryOpNode(operator, visit(left), visit(right), span(ctx));
        }
    }
}
