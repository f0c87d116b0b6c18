package com.twbconvert.pbip.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.twbconvert.pbip.ConversionOptions;
import com.twbconvert.pbip.TargetSchemaVersion;
import com.twbconvert.pbip.artifact.Artifact;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class ReportWriterTest {
    private static final String ROOT = "Workbook.Report/";

    private static final Projection SALES =
            new Projection("Y", Projection.Kind.AGGREGATION, "Orders", "Sales", AggregateFunction.SUM, "tag-sales");
    private static final Projection REGION =
            new Projection("Category", Projection.Kind.COLUMN, "Orders", "Region", null, "tag-region");
    private static final Projection RATIO =
            new Projection("Values", Projection.Kind.MEASURE, "Orders", "Profit Ratio", null, "tag-ratio");

    private static Map<String, Artifact> render(ReportSpec report, ConversionOptions options) {
        return new ReportWriter()
                .render(report, options)
                .stream()
                .collect(Collectors.toMap(Artifact::getPath, Function.identity()));
    }

    private static ReportSpec report() {
        VisualSpec bars = new VisualSpec(
                "v1", "Sales by Region", "columnChart", List.of(SALES, REGION),
                List.of(REGION.withRole("Filter")), Position.of(0, 80, 500, 360, 0), "Sales by Region", null);
        VisualSpec card = new VisualSpec(
                "v2", "Profit Ratio KPI", "card", List.of(RATIO), List.of(), Position.of(500, 80, 500, 360, 1),
                "Bob's KPI", null);
        VisualSpec title = new VisualSpec(
                "v3", null, "textbox", List.of(), List.of(), Position.of(0, 0, 1000, 80, 2), null, "Overview");
        PageSpec page = new PageSpec(
                "p1", "Overview", "Overview", 1000, 800, List.of(bars, card, title),
                List.of(new VisualInteraction("v1", "v2", VisualInteraction.Type.NO_FILTER)));
        return new ReportSpec(List.of(page), "p1");
    }

    @Test
    void writesOneDocumentPerPageAndVisual() {
        Map<String, Artifact> documents = render(report(), ConversionOptions.defaults());

        assertEquals(
                List.of(
                        ROOT + "definition.pbir",
                        ROOT + "definition/pages/p1/page.json",
                        ROOT + "definition/pages/p1/visuals/v1/visual.json",
                        ROOT + "definition/pages/p1/visuals/v2/visual.json",
                        ROOT + "definition/pages/p1/visuals/v3/visual.json",
                        ROOT + "definition/pages/pages.json",
                        ROOT + "definition/report.json",
                        ROOT + "definition/version.json"),
                documents.keySet().stream().sorted().collect(Collectors.toList()));
        JsonNode pbir = documents.get(ROOT + "definition.pbir").getJson();
        assertEquals("../Workbook.SemanticModel", pbir.at("/datasetReference/byPath/path").asText());
        JsonNode pages = documents.get(ROOT + "definition/pages/pages.json").getJson();
        assertEquals("p1", pages.get("activePageName").asText());
        assertEquals("p1", pages.at("/pageOrder/0").asText());
    }

    @Test
    void aggregationProjectionCarriesFunctionCode() {
        JsonNode visual = render(report(), ConversionOptions.defaults())
                .get(ROOT + "definition/pages/p1/visuals/v1/visual.json")
                .getJson();

        JsonNode y = visual.at("/visual/query/queryState/Y/projections/0");
        assertEquals(0, y.at("/field/Aggregation/Function").asInt());
        assertEquals("Orders", y.at("/field/Aggregation/Expression/Column/Expression/SourceRef/Entity").asText());
        assertEquals("Sum(Orders.Sales)", y.get("queryRef").asText());
        assertEquals("Sum of Sales", y.get("nativeQueryRef").asText());
        assertFalse(y.has("active"));
        JsonNode category = visual.at("/visual/query/queryState/Category/projections/0");
        assertEquals("Region", category.at("/field/Column/Property").asText());
        assertTrue(category.get("active").asBoolean());
        assertEquals(500.0, visual.at("/position/width").asDouble());
    }

    @Test
    void filtersAreCategoricalForColumns() {
        JsonNode filter = render(report(), ConversionOptions.defaults())
                .get(ROOT + "definition/pages/p1/visuals/v1/visual.json")
                .getJson()
                .at("/filterConfig/filters/0");

        assertEquals("Categorical", filter.get("type").asText());
        assertEquals("Region", filter.at("/field/Column/Property").asText());
        assertEquals(20, filter.get("name").asText().length());
    }

    @Test
    void titlesAreQuotedLiteralsAndTextboxesCarryText() {
        Map<String, Artifact> documents = render(report(), ConversionOptions.defaults());

        JsonNode card = documents.get(ROOT + "definition/pages/p1/visuals/v2/visual.json").getJson();
        assertEquals("'Bob''s KPI'",
                card.at("/visual/visualContainerObjects/title/0/properties/text/expr/Literal/Value").asText());
        assertEquals("Profit Ratio", card.at("/visual/query/queryState/Values/projections/0/field/Measure/Property")
                .asText());

        JsonNode textbox = documents.get(ROOT + "definition/pages/p1/visuals/v3/visual.json").getJson();
        assertEquals("Overview",
                textbox.at("/visual/objects/general/0/properties/paragraphs/0/textRuns/0/value").asText());
        assertFalse(textbox.at("/visual").has("drillFilterOtherVisuals"));
    }

    @Test
    void pageCarriesSizeAndInteractions() {
        JsonNode page = render(report(), ConversionOptions.defaults())
                .get(ROOT + "definition/pages/p1/page.json")
                .getJson();

        assertEquals(1000, page.get("width").asInt());
        assertEquals(800, page.get("height").asInt());
        assertEquals("v2", page.at("/visualInteractions/0/target").asText());
        assertEquals(VisualInteraction.Type.NO_FILTER.getPbirName(), page.at("/visualInteractions/0/type").asText());
    }

    @Test
    void themeIsWrittenOnlyWhenConfigured() {
        JsonNode plain = render(report(), ConversionOptions.defaults()).get(ROOT + "definition/report.json").getJson();
        assertFalse(plain.has("themeCollection"));

        TargetSchemaVersion defaults = TargetSchemaVersion.defaults();
        ConversionOptions themed = ConversionOptions.builder()
                .schemaVersion(new TargetSchemaVersion(
                        defaults.getReportVersion(),
                        defaults.getPageVersion(),
                        defaults.getVisualContainerVersion(),
                        defaults.getCompatibilityLevel(),
                        defaults.getCulture(),
                        "CY24SU06"))
                .build();
        JsonNode report = render(report(), themed).get(ROOT + "definition/report.json").getJson();
        assertEquals("CY24SU06", report.at("/themeCollection/baseTheme/name").asText());
    }
}
