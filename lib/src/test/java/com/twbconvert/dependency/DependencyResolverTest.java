package com.twbconvert.dependency;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.twbconvert.extract.WorkbookExtractor;
import com.twbconvert.formula.ExpressionSyntaxException;
import com.twbconvert.formula.FormulaParser;
import com.twbconvert.formula.ast.ExprNode;
import com.twbconvert.testing.TestWorkbooks;
import com.twbconvert.workbook.CalculatedField;
import com.twbconvert.workbook.ColumnRole;
import com.twbconvert.workbook.DataConnection;
import com.twbconvert.workbook.DataType;
import com.twbconvert.workbook.Datasource;
import com.twbconvert.workbook.FieldKey;
import com.twbconvert.workbook.WorkbookModel;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DependencyResolverTest {
    private final FormulaParser parser = new FormulaParser();
    private final DependencyResolver resolver = new DependencyResolver();

    @Test
    void ordersDependenciesBeforeDependents() throws Exception {
        List<CalculatedField> fields =
                List.of(
                        field("Total", "[Base] + [Extra]", 0),
                        field("Base", "SUM([Sales])", 1),
                        field("Extra", "[Base] * 0.1", 2));

        ResolutionResult result = resolver.resolve(fields, parse(fields));

        assertEquals(List.of("Base", "Extra", "Total"), names(result.getOrder()));
        assertEquals(3, result.getLevels().size());
        assertEquals(List.of("Base"), names(result.getLevels().get(0)));
        assertTrue(result.getCycles().isEmpty());
    }

    @Test
    void independentFieldsShareALevelInDeclarationOrder() throws Exception {
        List<CalculatedField> fields =
                List.of(field("Second", "MAX([Sales])", 0), field("First", "MIN([Sales])", 1));

        ResolutionResult result = resolver.resolve(fields, parse(fields));

        assertEquals(1, result.getLevels().size());
        assertEquals(List.of("Second", "First"), names(result.getLevels().get(0)));
    }

    @Test
    void cycleExcludesMembersAndEveryDependent() throws Exception {
        List<CalculatedField> fields =
                new WorkbookExtractor()
                        .extract(TestWorkbooks.load("edge_cases.twb"))
                        .getModel()
                        .getCalculatedFields();

        ResolutionResult result = resolver.resolve(fields, parse(fields));

        assertEquals(1, result.getCycles().size());
        CyclicDependencyException cycle = result.getCycles().get(0);
        assertEquals(List.of("Loop A", "Loop B"), cycle.getCycleNames());
        assertTrue(cycle.getMessage().contains("Loop A"));

        FieldKey afterLoop = new FieldKey("federated.edge01", "Calculation_C");
        assertTrue(result.isExcluded(afterLoop));
        assertSame(cycle, result.getExclusions().get(afterLoop));
        assertEquals(3, result.getExclusions().size());

        assertEquals(List.of("Double Sales", "Broken"), names(result.getOrder()));
        assertFalse(result.isExcluded(new FieldKey("federated.edge01", "Calculation_D")));
    }

    @Test
    void selfReferenceIsACycle() throws Exception {
        List<CalculatedField> fields = List.of(field("Echo", "[Echo] + 1", 0));

        ResolutionResult result = resolver.resolve(fields, parse(fields));

        assertEquals(List.of("Echo"), result.getCycles().get(0).getCycleNames());
        assertTrue(result.getOrder().isEmpty());
    }

    @Test
    void graphExposesEdgesByKey() throws Exception {
        List<CalculatedField> fields = List.of(field("Base", "SUM([Sales])", 0), field("Twice", "[Base] * 2", 1));

        DependencyGraph graph = resolver.resolve(fields, parse(fields)).getGraph();

        assertEquals(List.of(new FieldKey("ds", "Base")), graph.dependenciesOf(new FieldKey("ds", "Twice")));
        assertEquals(List.of(1), graph.dependentsOf(0));
    }

    @Test
    void qualifierMayBeTheDatasourceCaption() throws Exception {
        List<CalculatedField> fields =
                List.of(shopField("Calc_A", "SUM([Amount])", 0), shopField("Calc_B", "[Shop].[Calc_A] * 2", 1));
        WorkbookModel model =
                new WorkbookModel(
                        List.of(new Datasource("ds.shop", "Shop", DataConnection.unknown())),
                        List.of(),
                        fields,
                        List.of(),
                        List.of(),
                        List.of(),
                        List.of(),
                        List.of());

        ResolutionResult result = resolver.resolve(model, parse(fields));

        assertEquals(2, result.getLevels().size());
        assertEquals(
                List.of(new FieldKey("ds.shop", "Calc_A")),
                result.getGraph().dependenciesOf(new FieldKey("ds.shop", "Calc_B")));
    }

    private Map<FieldKey, ExprNode> parse(List<CalculatedField> fields) {
        Map<FieldKey, ExprNode> parsed = new HashMap<>();
        for (CalculatedField field : fields) {
            try {
                parsed.put(field.getKey(), parser.parse(field.getFormula()));
            } catch (ExpressionSyntaxException e) {
                // unparsable fields reference nothing
            }
        }
        return parsed;
    }

    private static CalculatedField field(String name, String formula, int index) {
        return new CalculatedField(
                new FieldKey("ds", name),
                name,
                formula,
                DataType.REAL,
                ColumnRole.MEASURE,
                "Orders",
                null,
                null,
                index);
    }

    private static CalculatedField shopField(String name, String formula, int index) {
        return new CalculatedField(
                new FieldKey("ds.shop", name),
                name,
                formula,
                DataType.REAL,
                ColumnRole.MEASURE,
                "Sales",
                null,
                null,
                index);
    }

    private static List<String> names(List<CalculatedField> fields) {
        List<String> names = new ArrayList<>();
        for (CalculatedField field : fields) {
            names.add(field.getName());
        }
        return names;
    }
}
