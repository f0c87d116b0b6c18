package com.twbconvert.pbip.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.twbconvert.pbip.ConversionOptions;
import com.twbconvert.pbip.ConversionPipeline;
import com.twbconvert.pbip.artifact.EmittedArtifactSet;
import com.twbconvert.relationship.Cardinality;
import com.twbconvert.relationship.CrossFilterDirection;
import com.twbconvert.relationship.Relationship;
import com.twbconvert.testing.TestWorkbooks;
import com.twbconvert.workbook.AggregationType;
import com.twbconvert.workbook.Column;
import com.twbconvert.workbook.ColumnRole;
import com.twbconvert.workbook.DataConnection;
import com.twbconvert.workbook.DataType;
import com.twbconvert.workbook.Table;
import java.util.List;
import org.junit.jupiter.api.Test;

class ModelEmitterTest {
    private static final String DEFINITION = "Workbook.SemanticModel/definition/";

    private static EmittedArtifactSet superstore() throws Exception {
        return new ConversionPipeline()
                .convert(TestWorkbooks.load("superstore.twb"), ConversionOptions.defaults())
                .getArtifacts();
    }

    @Test
    void ordersTableCarriesColumnsMeasuresAndExcelPartition() throws Exception {
        String orders = superstore().find(DEFINITION + "tables/Orders.tmdl").orElseThrow().getContent();

        assertTrue(orders.startsWith("table Orders\n\tlineageTag: "), orders);
        assertTrue(orders.contains("\tmeasure 'Profit Ratio' = DIVIDE(SUM(Orders[Profit]), SUM(Orders[Sales]))\n"
                + "\t\tformatString: 0.0%\n"), orders);
        assertTrue(orders.contains(
                "\tcolumn 'Margin Flag' = IF(Orders[Profit] > 0, \"Positive\", \"Negative\")\n\t\tdataType: string\n"),
                orders);
        assertTrue(orders.contains("\tcolumn Sales\n\t\tdataType: double\n"), orders);
        assertTrue(orders.contains("\t\tsummarizeBy: sum\n\t\tsourceColumn: Sales\n"), orders);
        assertTrue(orders.contains("Excel.Workbook(File.Contents(\"C:/Data/Superstore.xlsx\"), null, true)"), orders);
        assertTrue(orders.contains("Source{[Item=\"Orders\",Kind=\"Sheet\"]}[Data]"), orders);
        assertFalse(orders.contains("\r"));
    }

    @Test
    void parametersTableHasHiddenPlaceholderColumn() throws Exception {
        EmittedArtifactSet artifacts = superstore();
        String parameters = artifacts.find(DEFINITION + "tables/Parameters.tmdl").orElseThrow().getContent();

        assertTrue(parameters.contains("\tmeasure 'Sales Target' = 50000.0\n"), parameters);
        assertTrue(parameters.contains("\tcolumn Placeholder\n\t\tdataType: string\n\t\tisHidden\n"), parameters);
        assertTrue(parameters.contains("#table(type table [Placeholder = text], {})"), parameters);
        ModelTable table = artifacts.getModel().findTable("Parameters").orElseThrow();
        assertTrue(table.findColumn("Placeholder").orElseThrow().isHidden());
    }

    @Test
    void relationshipFileStartsFromTheManySide() throws Exception {
        String relationships = superstore().find(DEFINITION + "relationships.tmdl").orElseThrow().getContent();

        assertTrue(relationships.contains("\tfromColumn: OrderLines.'Order ID (OrderLines)'\n"
                + "\ttoColumn: Orders.'Order ID'\n"), relationships);
        assertFalse(relationships.contains("toCardinality"));
        assertFalse(relationships.contains("isActive"));
    }

    @Test
    void modelDocumentReferencesEveryTable() throws Exception {
        String model = superstore().find(DEFINITION + "model.tmdl").orElseThrow().getContent();

        assertTrue(model.contains("annotation PBI_QueryOrder = [\"Orders\",\"OrderLines\",\"Parameters\"]"), model);
        assertTrue(model.contains("ref table Orders\nref table OrderLines\nref table Parameters\n"), model);
        assertTrue(model.endsWith("ref cultureInfo en-US\n"), model);
    }

    @Test
    void mapsManyToManyAndInactiveRelationships() {
        List<ModelRelationship> relationships = new ModelEmitter()
                .buildRelationships(
                        List.of(
                                new Relationship(
                                        "Customers", "Id", "Orders", "Customer",
                                        Cardinality.MANY_TO_MANY, CrossFilterDirection.BOTH, false)));

        ModelRelationship relationship = relationships.get(0);
        assertEquals("Orders", relationship.getFromTable());
        assertEquals("Customers", relationship.getToTable());
        assertEquals("many", relationship.getFromCardinality());
        assertEquals("many", relationship.getToCardinality());
        String text = TmdlWriter.relationships(relationships);
        assertTrue(text.contains("\ttoCardinality: many\n"), text);
        assertTrue(text.contains("\tcrossFilteringBehavior: bothDirections\n"), text);
        assertTrue(text.contains("\tisActive: false\n"), text);
    }

    @Test
    void unsupportedConnectionGetsAnEmptyTypedTable() {
        Table table = new Table(
                "Accounts",
                "ds",
                "dbo.Accounts",
                List.of(new Column("Account Id", "Account Id", "Account Id", DataType.INTEGER, ColumnRole.DIMENSION,
                        AggregationType.NONE, true)));

        ModelPartition partition = PartitionBuilder.build(table, new DataConnection("sqlserver", null, "db1", "crm"));

        assertEquals("    Source = #table(type table [#\"Account Id\" = number], {})", partition.getSource().get(1));
    }

    @Test
    void translatesTypesAndFormats() {
        assertEquals("int64", ModelEmitter.dataType(DataType.INTEGER));
        assertEquals("dateTime", ModelEmitter.dataType(DataType.DATE));
        assertEquals("string", ModelEmitter.dataType(DataType.UNSUPPORTED));
        assertEquals("0.0%", FormatStrings.fromTableau("p0.0%"));
        assertEquals("#,##0", FormatStrings.fromTableau("n#,##0"));
        assertEquals("$#,##0.00", FormatStrings.fromTableau("C1033$#,##0.00"));
        assertNull(FormatStrings.fromTableau(""));
        assertEquals("none", ModelEmitter.summarizeBy(new Column("Region", "Region", "Region", DataType.STRING,
                ColumnRole.DIMENSION, AggregationType.COUNT, false)));
    }

    @Test
    void quotesNamesThatAreNotPlainIdentifiers() {
        assertEquals("Orders", TmdlWriter.quote("Orders"));
        assertEquals("'Order ID'", TmdlWriter.quote("Order ID"));
        assertEquals("'Bob''s'", TmdlWriter.quote("Bob's"));
    }
}
