package com.twbconvert.pbip.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.twbconvert.assumption.Assumption;
import com.twbconvert.assumption.AssumptionCategory;
import com.twbconvert.pbip.ConversionOptions;
import com.twbconvert.pbip.ConversionPipeline;
import com.twbconvert.pbip.ConversionResult;
import com.twbconvert.pbip.LayoutHints;
import com.twbconvert.pbip.StableIdentifiers;
import com.twbconvert.testing.TestWorkbooks;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class ReportMapperTest {

    private static ConversionResult convert(String workbook, ConversionOptions options) throws Exception {
        return new ConversionPipeline().convert(TestWorkbooks.load(workbook), options);
    }

    private static List<String> projections(VisualSpec visual) {
        return visual.getProjections().stream().map(Projection::toString).collect(Collectors.toList());
    }

    @Test
    void dashboardBecomesAPageWithZonesInOrder() throws Exception {
        ReportSpec report = convert("superstore.twb", ConversionOptions.defaults()).getArtifacts().getReport();

        PageSpec overview = report.getPages().get(0);
        assertEquals(StableIdentifiers.pageName("dashboard:Overview"), overview.getName());
        assertEquals(overview.getName(), report.getActivePage());
        assertEquals("Overview", overview.getDisplayName());
        assertEquals(1000, overview.getWidth());
        assertEquals(800, overview.getHeight());
        assertEquals(
                List.of("textbox", "columnChart", "lineChart", "card", "slicer"),
                overview.getVisuals().stream().map(VisualSpec::getVisualType).collect(Collectors.toList()));
        assertEquals("Overview", overview.getVisuals().get(0).getText());
    }

    @Test
    void zoneRectanglesAreScaledToThePage() throws Exception {
        PageSpec overview =
                convert("superstore.twb", ConversionOptions.defaults()).getArtifacts().getReport().getPages().get(0);

        VisualSpec bars = overview.getVisuals().get(1);
        assertEquals(StableIdentifiers.visualName(overview.getName(), "zone:3"), bars.getName());
        assertEquals(Position.of(0, 80, 500, 360, 1), bars.getPosition());
        assertEquals(Position.of(800, 440, 200, 360, 4), overview.getVisuals().get(4).getPosition());
    }

    @Test
    void shelvesBecomeRolesAndFilters() throws Exception {
        PageSpec overview =
                convert("superstore.twb", ConversionOptions.defaults()).getArtifacts().getReport().getPages().get(0);

        VisualSpec bars = overview.getVisuals().get(1);
        assertEquals(List.of("Y:Sum(Orders.Sales)", "Category:Orders.Region"), projections(bars));
        assertEquals("Filter:Orders.Region", bars.getFilters().get(0).toString());
        assertEquals(List.of("Values:Orders.Profit Ratio"), projections(overview.getVisuals().get(3)));
        assertEquals(Projection.Kind.MEASURE, overview.getVisuals().get(3).getProjections().get(0).getKind());

        VisualSpec trend = overview.getVisuals().get(2);
        assertEquals("Sales over time", trend.getTitle());
        assertEquals(List.of("Y:Sum(Orders.Sales)", "Category:Orders.Order Date"), projections(trend));

        VisualSpec slicer = overview.getVisuals().get(4);
        assertEquals("Region", slicer.getTitle());
        assertEquals(List.of("Values:Orders.Region"), projections(slicer));
    }

    @Test
    void filterActionBecomesVisualInteractions() throws Exception {
        PageSpec overview =
                convert("superstore.twb", ConversionOptions.defaults()).getArtifacts().getReport().getPages().get(0);

        String bars = overview.getVisuals().get(1).getName();
        assertEquals(
                List.of(
                        new VisualInteraction(bars, overview.getVisuals().get(2).getName(),
                                VisualInteraction.Type.DATA_FILTER),
                        new VisualInteraction(bars, overview.getVisuals().get(3).getName(),
                                VisualInteraction.Type.NO_FILTER)),
                overview.getInteractions());
    }

    @Test
    void unplacedWorksheetGetsItsOwnPageAtTheHintedPosition() throws Exception {
        ConversionOptions options = ConversionOptions.builder()
                .layoutHints(LayoutHints.builder().put("Order Detail", 10, 20, 300, 200).build())
                .build();

        ReportSpec report = convert("superstore.twb", options).getArtifacts().getReport();

        assertEquals(2, report.getPages().size());
        PageSpec detail = report.getPages().get(1);
        assertEquals("Order Detail", detail.getDisplayName());
        assertNull(detail.getSourceDashboard());
        assertEquals(1280, detail.getWidth());
        VisualSpec table = detail.getVisuals().get(0);
        assertEquals("tableEx", table.getVisualType());
        assertEquals(Position.of(10, 20, 300, 200, 0), table.getPosition());
    }

    @Test
    void layoutHintDoesNotMoveADashboardZone() throws Exception {
        ConversionOptions options = ConversionOptions.builder()
                .layoutHints(LayoutHints.builder().put("Sales by Region", 10, 20, 300, 200).build())
                .build();

        ReportSpec report = convert("superstore.twb", options).getArtifacts().getReport();

        VisualSpec bars = report.getPages().get(0).getVisuals().get(1);
        assertEquals(Position.of(0, 80, 500, 360, 1), bars.getPosition());
    }

    @Test
    void automaticMarkIsChosenFromTheFieldsAndLogged() throws Exception {
        List<Assumption> assumptions = convert("superstore.twb", ConversionOptions.defaults()).getAssumptions();

        assertTrue(
                assumptions.stream()
                        .anyMatch(a -> a.getCategory() == AssumptionCategory.REPORT
                                && "Sales Trend".equals(a.getLocation())
                                && "Automatic".equals(a.getSourceText())
                                && "lineChart".equals(a.getTargetText())),
                assumptions.toString());
    }

    @Test
    void geographicDimensionFallsBackToMapAndSkipsUnresolvedFields() throws Exception {
        ConversionResult result = convert("edge_cases.twb", ConversionOptions.defaults());

        VisualSpec byCity = result.getArtifacts().getReport().getPages().get(0).getVisuals().get(0);
        assertEquals("map", byCity.getVisualType());
        assertEquals(List.of("Size:Orders.Double Sales", "Category:Customers.City"), projections(byCity));
    }
}
