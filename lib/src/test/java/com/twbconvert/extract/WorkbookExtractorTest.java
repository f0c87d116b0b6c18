package com.twbconvert.extract;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.twbconvert.testing.TestWorkbooks;
import com.twbconvert.workbook.AggregationType;
import com.twbconvert.workbook.CalculatedField;
import com.twbconvert.workbook.Column;
import com.twbconvert.workbook.Dashboard;
import com.twbconvert.workbook.DataType;
import com.twbconvert.workbook.FilterAction;
import com.twbconvert.workbook.JoinEdge;
import com.twbconvert.workbook.Table;
import com.twbconvert.workbook.WorkbookModel;
import com.twbconvert.workbook.Worksheet;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class WorkbookExtractorTest {
    private final WorkbookExtractor extractor = new WorkbookExtractor();

    @Test
    void extractsTablesAndColumnsPerRelation() throws Exception {
        WorkbookModel model = extractor.extract(TestWorkbooks.load("superstore.twb")).getModel();

        assertEquals(List.of("Orders", "OrderLines"), names(model.getTables()));
        Table orders = model.findTable("Orders").orElseThrow();
        Column sales = orders.findColumn("Sales").orElseThrow();
        assertEquals(DataType.REAL, sales.getDataType());
        assertEquals(AggregationType.SUM, sales.getDefaultAggregation());
        assertTrue(orders.findColumn("Order ID").orElseThrow().isUniqueKey());

        Column lineOrderId = model.findTable("OrderLines").orElseThrow().findColumn("Order ID").orElseThrow();
        assertEquals("Order ID (OrderLines)", lineOrderId.getInternalName());
    }

    @Test
    void extractsCalculationsAndParametersInDeclarationOrder() throws Exception {
        WorkbookModel model = extractor.extract(TestWorkbooks.load("superstore.twb")).getModel();

        List<CalculatedField> calcs = model.getCalculatedFields();
        assertEquals(4, calcs.size());
        assertEquals("Profit Ratio", calcs.get(0).getName());
        assertEquals("SUM([Profit])/SUM([Sales])", calcs.get(0).getFormula());
        assertEquals("Calculation_1001", calcs.get(0).getKey().getName());
        assertEquals("Running Sales", calcs.get(3).getName());
        assertEquals(List.of("Order Date"), calcs.get(3).getAddressing().getOrderingFields());
        for (int i = 0; i < calcs.size(); i++) {
            assertEquals(i, calcs.get(i).getDeclarationIndex());
        }

        assertEquals(1, model.getParameters().size());
        assertEquals("Sales Target", model.getParameters().get(0).getName());
        assertTrue(model.getParameters().get(0).answersTo("Parameter 1"));
    }

    @Test
    void extractsJoinFromObjectGraphWithUniquenessHint() throws Exception {
        WorkbookModel model = extractor.extract(TestWorkbooks.load("superstore.twb")).getModel();

        assertEquals(1, model.getJoinEdges().size());
        JoinEdge edge = model.getJoinEdges().get(0);
        assertEquals("Orders", edge.getLeftTable());
        assertEquals("OrderLines", edge.getRightTable());
        assertEquals(Boolean.TRUE, edge.getLeftUnique());
    }

    @Test
    void extractsWorksheetsDashboardsAndActions() throws Exception {
        WorkbookModel model = extractor.extract(TestWorkbooks.load("superstore.twb")).getModel();

        assertEquals(4, model.getWorksheets().size());
        Worksheet bars = model.findWorksheet("Sales by Region").orElseThrow();
        assertEquals("Bar", bars.getMarkClass());
        assertEquals("Sales", bars.getRows().get(0).getFieldName());
        assertEquals("Region", bars.getColumns().get(0).getFieldName());
        assertEquals(1, bars.getFilters().size());
        assertEquals("Sales over time", model.findWorksheet("Sales Trend").orElseThrow().getTitle());

        assertEquals(1, model.getDashboards().size());
        Dashboard overview = model.getDashboards().get(0);
        assertEquals(Integer.valueOf(1000), overview.getDeclaredWidth());
        assertEquals(6, overview.getZones().size());

        assertEquals(1, model.getFilterActions().size());
        FilterAction action = model.getFilterActions().get(0);
        assertEquals(FilterAction.Kind.FILTER, action.getKind());
        assertEquals("Sales by Region", action.getSourceWorksheet());
        assertEquals(List.of("Profit Ratio KPI"), action.getExcludedSheets());
    }

    @Test
    void splitsCompoundJoinClauseIntoEdges() throws Exception {
        WorkbookModel model = extractor.extract(TestWorkbooks.load("edge_cases.twb")).getModel();

        assertEquals(2, model.getJoinEdges().size());
        assertEquals("Missing Column", model.getJoinEdges().get(1).getRightColumn());
        assertFalse(model.getCalculatedFields().isEmpty());
    }

    @Test
    void rejectsDocumentWithoutWorkbookRoot() throws Exception {
        MalformedDocumentException e =
                assertThrows(
                        MalformedDocumentException.class,
                        () -> extractor.extract(TestWorkbooks.parse("<dashboard name='x' />")));
        assertTrue(e.getMessage().contains("<dashboard>"));
    }

    @Test
    void rejectsWorkbookWithoutRequiredSections() throws Exception {
        assertThrows(
                MalformedDocumentException.class,
                () -> extractor.extract(TestWorkbooks.parse("<workbook><datasources /></workbook>")));
    }

    @Test
    void rejectsDuplicateWorksheetNames() throws Exception {
        String xml =
                "<workbook><datasources /><worksheets>"
                        + "<worksheet name='Sheet 1' /><worksheet name='Sheet 1' />"
                        + "</worksheets><dashboards /></workbook>";

        DuplicateNameException e =
                assertThrows(DuplicateNameException.class, () -> extractor.extract(TestWorkbooks.parse(xml)));
        assertTrue(e.getMessage().contains("Sheet 1"));
    }

    private static List<String> names(List<Table> tables) {
        return tables.stream().map(Table::getName).collect(Collectors.toList());
    }
}
