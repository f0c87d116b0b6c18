package com.twbconvert.translate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.twbconvert.assumption.Assumption;
import com.twbconvert.assumption.AssumptionLog;
import com.twbconvert.dependency.DependencyResolver;
import com.twbconvert.dependency.ResolutionResult;
import com.twbconvert.extract.WorkbookExtractor;
import com.twbconvert.formula.FormulaParser;
import com.twbconvert.formula.ast.ExprNode;
import com.twbconvert.testing.TestWorkbooks;
import com.twbconvert.workbook.AggregationType;
import com.twbconvert.workbook.CalculatedField;
import com.twbconvert.workbook.Column;
import com.twbconvert.workbook.ColumnRole;
import com.twbconvert.workbook.DataConnection;
import com.twbconvert.workbook.DataType;
import com.twbconvert.workbook.Datasource;
import com.twbconvert.workbook.FieldKey;
import com.twbconvert.workbook.Parameter;
import com.twbconvert.workbook.Table;
import com.twbconvert.workbook.WorkbookModel;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class CalculatedFieldTranslatorTest {
    private final FormulaParser parser = new FormulaParser();
    private final CalculatedFieldTranslator translator = new CalculatedFieldTranslator(parser);

    @Test
    void translatesSuperstoreFieldsAndParameters() throws Exception {
        WorkbookModel model = new WorkbookExtractor().extract(TestWorkbooks.load("superstore.twb")).getModel();
        AssumptionLog log = new AssumptionLog();

        TranslationResult result = translate(model, log, Runnable::run);

        assertEquals(4, result.getFields().size());
        TranslatedExpression ratio =
                result.find(new FieldKey("federated.0a1b2c3", "Calculation_1001")).orElseThrow();
        assertEquals("DIVIDE(SUM(Orders[Profit]), SUM(Orders[Sales]))", ratio.getDaxText());
        assertEquals("p0.0%", ratio.getFormatString());

        TranslatedExpression running =
                result.find(new FieldKey("federated.0a1b2c3", "Calculation_1004")).orElseThrow();
        assertTrue(running.getDaxText().startsWith("CALCULATE(SUM(Orders[Sales]), FILTER("), running.getDaxText());

        assertEquals(1, result.getParameters().size());
        TranslatedExpression target = result.getParameters().get(0);
        assertEquals("Sales Target", target.getName());
        assertEquals(SymbolTable.PARAMETERS_TABLE, target.getTable());
        assertEquals("50000.0", target.getDaxText());
        assertTrue(target.isMeasure());
        assertTrue(log.isEmpty());
    }

    @Test
    void dependentFieldSeesMeasureOfEarlierLevel() throws Exception {
        WorkbookModel model =
                model(
                        List.of(
                                calc("Calculation_2", "Double Sales", "[Total Sales] * 2", 0),
                                calc("Calculation_1", "Total Sales", "SUM([Amount])", 1)),
                        List.of());

        TranslationResult result = translate(model, new AssumptionLog(), Runnable::run);

        assertEquals(List.of("Total Sales", "Double Sales"), names(result.getFields()));
        assertEquals("[Total Sales] * 2", result.getFields().get(1).getDaxText());
        assertTrue(result.getFields().get(1).isMeasure());
    }

    @Test
    void captionQualifiedReferenceIsOrderedAfterItsTarget() throws Exception {
        WorkbookModel model =
                model(
                        List.of(
                                calc("Calc_A", "Total", "SUM([Amount])", 0),
                                calc("Calc_B", "Twice Total", "[Shop].[Calc_A] * 2", 1)),
                        List.of());
        AssumptionLog log = new AssumptionLog();

        TranslationResult result = translate(model, log, Runnable::run);

        assertEquals("[Total] * 2", result.find(new FieldKey("ds.shop", "Calc_B")).orElseThrow().getDaxText());
        assertTrue(log.isEmpty());
    }

    @Test
    void parallelTranslationMatchesSequentialTranslation() throws Exception {
        WorkbookModel model = new WorkbookExtractor().extract(TestWorkbooks.load("superstore.twb")).getModel();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            TranslationResult sequential = translate(model, new AssumptionLog(), Runnable::run);
            TranslationResult parallel = translate(model, new AssumptionLog(), pool);

            assertEquals(daxTexts(sequential.getFields()), daxTexts(parallel.getFields()));
        } finally {
            pool.shutdown();
        }
    }

    @Test
    void collidingNameIsQualifiedWithDatasourceCaption() {
        WorkbookModel model =
                model(
                        List.of(
                                calc("Calculation_1", "Amount (Shop)", "[Amount] * 2", 0),
                                calc("Calculation_2", "Amount", "[Amount] * 1.1", 1)),
                        List.of());
        AssumptionLog log = new AssumptionLog();

        Map<FieldKey, String> names = CalculatedFieldTranslator.assignTargetNames(model, log);

        assertEquals("Amount (Shop)", names.get(new FieldKey("ds.shop", "Calculation_1")));
        assertEquals("Amount (Shop) 2", names.get(new FieldKey("ds.shop", "Calculation_2")));
        List<Assumption> entries = log.entries();
        assertEquals(1, entries.size());
        assertEquals("Amount (Shop) 2", entries.get(0).getTargetText());
    }

    @Test
    void parameterNameTakesPrecedenceOverCalculatedField() {
        WorkbookModel model =
                model(
                        List.of(calc("Calculation_1", "Target", "SUM([Amount])", 0)),
                        List.of(new Parameter("Target", "Parameter 1", DataType.REAL, "10", "range")));

        Map<FieldKey, String> names = CalculatedFieldTranslator.assignTargetNames(model, new AssumptionLog());

        assertEquals("Target (Shop)", names.get(new FieldKey("ds.shop", "Calculation_1")));
    }

    private TranslationResult translate(WorkbookModel model, AssumptionLog log, Executor executor)
            throws Exception {
        Map<FieldKey, ExprNode> parsed = new HashMap<>();
        for (CalculatedField field : model.getCalculatedFields()) {
            parsed.put(field.getKey(), parser.parse(field.getFormula(), field.getAddressing()));
        }
        ResolutionResult resolution = new DependencyResolver().resolve(model, parsed);
        return translator.translate(model, resolution, parsed, log, executor);
    }

    private static WorkbookModel model(List<CalculatedField> calcs, List<Parameter> parameters) {
        Table sales =
                new Table(
                        "Sales",
                        "ds.shop",
                        "Sales",
                        List.of(
                                new Column(
                                        "Amount",
                                        "Amount",
                                        null,
                                        DataType.REAL,
                                        ColumnRole.MEASURE,
                                        AggregationType.SUM,
                                        false)));
        return new WorkbookModel(
                List.of(new Datasource("ds.shop", "Shop", DataConnection.unknown())),
                List.of(sales),
                calcs,
                parameters,
                List.of(),
                List.of(),
                List.of(),
                List.of());
    }

    private static CalculatedField calc(String internalName, String caption, String formula, int index) {
        return new CalculatedField(
                new FieldKey("ds.shop", internalName),
                caption,
                formula,
                DataType.REAL,
                ColumnRole.MEASURE,
                "Sales",
                null,
                null,
                index);
    }

    private static List<String> names(List<TranslatedExpression> fields) {
        return fields.stream().map(TranslatedExpression::getName).collect(Collectors.toList());
    }

    private static List<String> daxTexts(List<TranslatedExpression> fields) {
        return fields.stream().map(TranslatedExpression::getDaxText).collect(Collectors.toList());
    }
}
