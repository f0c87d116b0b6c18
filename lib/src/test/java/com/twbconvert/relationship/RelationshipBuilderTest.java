package com.twbconvert.relationship;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.twbconvert.assumption.Assumption;
import com.twbconvert.assumption.AssumptionCategory;
import com.twbconvert.assumption.AssumptionLog;
import com.twbconvert.extract.WorkbookExtractor;
import com.twbconvert.testing.TestWorkbooks;
import com.twbconvert.workbook.AggregationType;
import com.twbconvert.workbook.Column;
import com.twbconvert.workbook.ColumnRole;
import com.twbconvert.workbook.DataConnection;
import com.twbconvert.workbook.DataType;
import com.twbconvert.workbook.Datasource;
import com.twbconvert.workbook.JoinEdge;
import com.twbconvert.workbook.Table;
import com.twbconvert.workbook.WorkbookModel;
import java.util.List;
import org.junit.jupiter.api.Test;

class RelationshipBuilderTest {
    private final RelationshipBuilder builder = new RelationshipBuilder();

    @Test
    void uniqueHintMakesOneToManyFromTheUniqueSide() throws Exception {
        WorkbookModel model = new WorkbookExtractor().extract(TestWorkbooks.load("superstore.twb")).getModel();
        AssumptionLog log = new AssumptionLog();

        RelationshipResult result = builder.build(model, log);

        assertEquals(1, result.getRelationships().size());
        Relationship relationship = result.getRelationships().get(0);
        assertEquals("Orders", relationship.getFromTable());
        assertEquals("Order ID", relationship.getFromColumn());
        assertEquals("OrderLines", relationship.getToTable());
        assertEquals("Order ID (OrderLines)", relationship.getToColumn());
        assertEquals(Cardinality.ONE_TO_MANY, relationship.getCardinality());
        assertEquals(CrossFilterDirection.SINGLE, relationship.getDirection());
        assertTrue(relationship.isActive());
        assertTrue(result.getFailures().isEmpty());
        assertTrue(log.isEmpty());
    }

    @Test
    void unknownUniquenessIsManyToManyAndMissingColumnFails() throws Exception {
        WorkbookModel model = new WorkbookExtractor().extract(TestWorkbooks.load("edge_cases.twb")).getModel();
        AssumptionLog log = new AssumptionLog();

        RelationshipResult result = builder.build(model, log);

        assertEquals(1, result.getRelationships().size());
        assertEquals(Cardinality.MANY_TO_MANY, result.getRelationships().get(0).getCardinality());
        List<Assumption> entries = log.entries();
        assertEquals(1, entries.size());
        assertEquals(AssumptionCategory.RELATIONSHIP, entries.get(0).getCategory());

        assertEquals(1, result.getFailures().size());
        UnresolvedJoinReferenceException failure = result.getFailures().get(0);
        assertEquals("Missing Column", failure.getEdge().getRightColumn());
        assertTrue(failure.getMessage().contains("Missing Column"));
    }

    @Test
    void uniqueRightSideFlipsDirection() {
        WorkbookModel model =
                model(List.of(edge("Sales", "Product ID", "Products", "Product ID", null, null, false)));

        Relationship relationship = builder.build(model, new AssumptionLog()).getRelationships().get(0);

        assertEquals("Products", relationship.getFromTable());
        assertEquals("Sales", relationship.getToTable());
        assertEquals(Cardinality.ONE_TO_MANY, relationship.getCardinality());
    }

    @Test
    void secondPathBetweenTablesIsInactiveAndDuplicatesCollapse() {
        WorkbookModel model =
                model(
                        List.of(
                                edge("Sales", "Product ID", "Products", "Product ID", null, null, false),
                                edge("Products", "Product ID", "Sales", "Product ID", null, null, false),
                                edge("Sales", "Region", "Products", "Region", true, true, true)));
        AssumptionLog log = new AssumptionLog();

        List<Relationship> relationships = builder.build(model, log).getRelationships();

        assertEquals(2, relationships.size());
        assertTrue(relationships.get(0).isActive());
        Relationship second = relationships.get(1);
        assertFalse(second.isActive());
        assertEquals(Cardinality.ONE_TO_ONE, second.getCardinality());
        assertEquals(CrossFilterDirection.BOTH, second.getDirection());
        assertEquals(1, log.size());
    }

    @Test
    void selfJoinIsDroppedWithAssumption() {
        WorkbookModel model = model(List.of(edge("Sales", "Region", "Sales", "Product ID", null, null, false)));
        AssumptionLog log = new AssumptionLog();

        RelationshipResult result = builder.build(model, log);

        assertTrue(result.getRelationships().isEmpty());
        assertEquals(1, log.size());
    }

    private static WorkbookModel model(List<JoinEdge> edges) {
        Table sales =
                new Table(
                        "Sales",
                        "ds",
                        "Sales",
                        List.of(column("Product ID", false), column("Region", false)));
        Table products =
                new Table(
                        "Products",
                        "ds",
                        "Products",
                        List.of(column("Product ID", true), column("Region", false)));
        return new WorkbookModel(
                List.of(new Datasource("ds", "Shop", DataConnection.unknown())),
                List.of(sales, products),
                List.of(),
                List.of(),
                edges,
                List.of(),
                List.of(),
                List.of());
    }

    private static Column column(String name, boolean unique) {
        return new Column(name, name, null, DataType.STRING, ColumnRole.DIMENSION, AggregationType.NONE, unique);
    }

    private static JoinEdge edge(
            String leftTable,
            String leftColumn,
            String rightTable,
            String rightColumn,
            Boolean leftUnique,
            Boolean rightUnique,
            boolean bidirectional) {
        return new JoinEdge(
                "ds", leftTable, leftColumn, rightTable, rightColumn, "inner", leftUnique, rightUnique, bidirectional);
    }
}
