package com.twbconvert.formula;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.twbconvert.formula.ast.AggregationNode;
import com.twbconvert.formula.ast.BinaryOpNode;
import com.twbconvert.formula.ast.BinaryOperator;
import com.twbconvert.formula.ast.ConditionalNode;
import com.twbconvert.formula.ast.ExprNode;
import com.twbconvert.formula.ast.FieldRefNode;
import com.twbconvert.formula.ast.FunctionCallNode;
import com.twbconvert.formula.ast.LiteralNode;
import com.twbconvert.formula.ast.LodKind;
import com.twbconvert.formula.ast.LodScopeNode;
import com.twbconvert.formula.ast.UnaryOpNode;
import com.twbconvert.formula.ast.WindowFunctionNode;
import com.twbconvert.workbook.TableCalcAddressing;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import org.junit.jupiter.api.Test;

class FormulaParserTest {
    private final FormulaParser parser = new FormulaParser();

    @Test
    void ratioOfSumsBuildsDivisionOfAggregates() throws Exception {
        ExprNode root = parser.parse("SUM([Profit])/SUM([Sales])");

        BinaryOpNode division = assertInstanceOf(BinaryOpNode.class, root);
        assertEquals(BinaryOperator.DIVIDE, division.getOperator());
        AggregationNode left = assertInstanceOf(AggregationNode.class, division.getLeft());
        assertEquals("SUM", left.getFunction());
        assertEquals("[Profit]", left.getOperand().toString());
        assertEquals("SUM([Sales])", division.getRight().toString());
    }

    @Test
    void keywordsAndFunctionNamesAreCaseInsensitive() throws Exception {
        ExprNode root = parser.parse("if [Profit] > 0 then \"Up\" elseif [Profit] < 0 then 'Down' else \"Flat\" end");

        ConditionalNode conditional = assertInstanceOf(ConditionalNode.class, root);
        assertEquals(2, conditional.getBranches().size());
        LiteralNode otherwise = assertInstanceOf(LiteralNode.class, conditional.getElseResult());
        assertEquals("Flat", otherwise.getValue());

        assertInstanceOf(AggregationNode.class, parser.parse("sum([Sales])"));
    }

    @Test
    void multiplicationBindsTighterThanAddition() throws Exception {
        BinaryOpNode root = assertInstanceOf(BinaryOpNode.class, parser.parse("[A] + [B] * 2"));

        assertEquals(BinaryOperator.ADD, root.getOperator());
        assertEquals("([B] * NUMBER(2))", root.getRight().toString());
    }

    @Test
    void qualifiedReferenceKeepsItsQualifier() throws Exception {
        FieldRefNode reference = assertInstanceOf(FieldRefNode.class, parser.parse("[Parameters].[Parameter 1]"));

        assertEquals("Parameters", reference.getQualifier());
        assertEquals("Parameter 1", reference.getName());
        assertTrue(reference.isQualified());
    }

    @Test
    void escapedClosingBracketIsUndoubled() throws Exception {
        FieldRefNode reference = assertInstanceOf(FieldRefNode.class, parser.parse("[Sales [USD]]]"));

        assertEquals("Sales [USD]", reference.getName());
        assertNull(reference.getQualifier());
    }

    @Test
    void fixedLodCarriesDimensionsAndBody() throws Exception {
        LodScopeNode lod = assertInstanceOf(LodScopeNode.class, parser.parse("{FIXED [Region], [Segment] : SUM([Sales])}"));

        assertEquals(LodKind.FIXED, lod.getKind());
        assertEquals(2, lod.getDimensions().size());
        assertInstanceOf(AggregationNode.class, lod.getBody());
    }

    @Test
    void twoArgumentMaxIsARowLevelFunction() throws Exception {
        FunctionCallNode call = assertInstanceOf(FunctionCallNode.class, parser.parse("MAX([Sales], 0)"));

        assertEquals("MAX", call.getName());
        assertEquals(2, call.getArguments().size());
    }

    @Test
    void windowFunctionReceivesTheFieldAddressing() throws Exception {
        TableCalcAddressing addressing = new TableCalcAddressing(List.of("Order Date"), List.of(), false);

        WindowFunctionNode window =
                assertInstanceOf(WindowFunctionNode.class, parser.parse("RUNNING_SUM(SUM([Sales]))", addressing));

        assertEquals("RUNNING_SUM", window.getFunction());
        assertEquals(List.of("Order Date"), window.getAddressing().getOrderingFields());
    }

    @Test
    void commentsAndDateLiteralsAreRecognised() throws Exception {
        ExprNode root = parser.parse("// cutoff\n[Order Date] >= #2024-01-01#");

        BinaryOpNode comparison = assertInstanceOf(BinaryOpNode.class, root);
        LiteralNode date = assertInstanceOf(LiteralNode.class, comparison.getRight());
        assertEquals(LiteralNode.Kind.DATE, date.getKind());
        assertEquals("2024-01-01", date.getValue());
    }

    @Test
    void unbalancedParenthesisReportsOffset() {
        ExpressionSyntaxException ex =
                assertThrows(ExpressionSyntaxException.class, () -> parser.parse("SUM([Sales]"));

        assertEquals("SUM([Sales]", ex.getFormula());
        assertEquals(11, ex.getOffset());
    }

    @Test
    void unaryMinusBindsTighterThanPower() throws Exception {
        BinaryOpNode power = assertInstanceOf(BinaryOpNode.class, parser.parse("-[Sales]^2"));

        assertEquals(BinaryOperator.POWER, power.getOperator());
        UnaryOpNode negation = assertInstanceOf(UnaryOpNode.class, power.getLeft());
        assertEquals(UnaryOpNode.Operator.NEGATE, negation.getOperator());
        assertEquals("NUMBER(2)", power.getRight().toString());
    }

    @Test
    void parserDebugOutputIsLoggedAndDrainedAfterEachParse() throws Exception {
        Logger logger = Logger.getLogger(FormulaParser.class.getName());
        List<LogRecord> records = new ArrayList<>();
        Handler handler =
                new Handler() {
                    @Override
                    public void publish(LogRecord record) {
                        records.add(record);
                    }

                    @Override
                    public void flush() {}

                    @Override
                    public void close() {}
                };
        logger.addHandler(handler);
        System.setProperty("twbconvert.debugTokens", "true");
        System.setProperty("twbconvert.debugParser", "true");
        try {
            parser.parse("SUM([Sales]) * 2");
        } finally {
            System.clearProperty("twbconvert.debugTokens");
            System.clearProperty("twbconvert.debugParser");
            logger.removeHandler(handler);
        }

        assertEquals(1, records.size());
        assertEquals(Level.INFO, records.get(0).getLevel());
        String message = records.get(0).getMessage();
        assertTrue(message.contains("SUM([Sales]) * 2"), message);
        assertTrue(message.contains("[tokens] "), message);
        assertTrue(DebugFlags.drainCapturedTokens().isEmpty());
        assertTrue(DebugFlags.drainCapturedDiagnostics().isEmpty());
    }
}
