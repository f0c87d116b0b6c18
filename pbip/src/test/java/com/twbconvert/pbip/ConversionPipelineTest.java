package com.twbconvert.pbip;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.twbconvert.assumption.Assumption;
import com.twbconvert.assumption.AssumptionCategory;
import com.twbconvert.dependency.CyclicDependencyException;
import com.twbconvert.extract.DuplicateNameException;
import com.twbconvert.extract.MalformedDocumentException;
import com.twbconvert.formula.ExpressionSyntaxException;
import com.twbconvert.pbip.artifact.EmittedArtifactSet;
import com.twbconvert.pbip.model.ModelTable;
import com.twbconvert.pbip.report.UnresolvedFieldProjectionException;
import com.twbconvert.pbip.validation.SchemaValidator;
import com.twbconvert.relationship.UnresolvedJoinReferenceException;
import com.twbconvert.testing.TestWorkbooks;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class ConversionPipelineTest {
    private final ConversionPipeline pipeline = new ConversionPipeline();

    @Test
    void superstoreConvertsWithoutEntityIssues() throws Exception {
        ConversionResult result = convert("superstore.twb", ConversionOptions.defaults());

        assertTrue(result.getIssues().isEmpty(), result.getIssues().toString());
        EmittedArtifactSet artifacts = result.getArtifacts();
        assertTrue(artifacts.find("Workbook.SemanticModel/definition/tables/Orders.tmdl").isPresent());
        assertTrue(artifacts.find("Workbook.SemanticModel/definition/tables/OrderLines.tmdl").isPresent());
        assertTrue(artifacts.find("Workbook.SemanticModel/definition/tables/Parameters.tmdl").isPresent());
        assertTrue(artifacts.find("Workbook.SemanticModel/definition/relationships.tmdl").isPresent());
        assertTrue(artifacts.find("Workbook.Report/definition.pbir").isPresent());
        assertEquals(2, artifacts.getReport().getPages().size());
    }

    @Test
    void renderingIsByteIdenticalAcrossRuns() throws Exception {
        Map<String, String> first = convert("superstore.twb", ConversionOptions.defaults()).getArtifacts().render();
        Map<String, String> second = convert("superstore.twb", ConversionOptions.defaults()).getArtifacts().render();

        assertEquals(first, second);
    }

    @Test
    void parallelRunMatchesSequentialRun() throws Exception {
        Map<String, String> sequential =
                convert("superstore.twb", ConversionOptions.defaults()).getArtifacts().render();
        ExecutorService pool = Executors.newFixedThreadPool(3);
        try {
            ConversionOptions options = ConversionOptions.builder().executor(pool).build();
            ConversionResult parallel = convert("superstore.twb", options);

            assertEquals(sequential, parallel.getArtifacts().render());
        } finally {
            pool.shutdown();
        }
        ConversionResult ownPool = convert("superstore.twb", ConversionOptions.builder().parallelism(4).build());
        assertEquals(sequential, ownPool.getArtifacts().render());
    }

    @Test
    void emittedSetPassesEverySchemaRule() throws Exception {
        for (String workbook : List.of("superstore.twb", "edge_cases.twb")) {
            EmittedArtifactSet artifacts = convert(workbook, ConversionOptions.defaults()).getArtifacts();

            assertTrue(SchemaValidator.defaultRules().check(artifacts).isEmpty(), workbook);
        }
    }

    @Test
    void edgeCasesAreIsolatedPerEntity() throws Exception {
        ConversionResult result = convert("edge_cases.twb", ConversionOptions.defaults());

        List<EntityIssue> issues = result.getIssues();
        EntityIssue parse = only(issues, EntityIssue.Stage.PARSING);
        assertEquals("Broken", parse.getEntity());
        assertInstanceOf(ExpressionSyntaxException.class, parse.getCause());

        List<EntityIssue> cycles = of(issues, EntityIssue.Stage.DEPENDENCY);
        assertEquals(
                List.of("Loop A", "Loop B", "After Loop"),
                cycles.stream().map(EntityIssue::getEntity).collect(Collectors.toList()));
        CyclicDependencyException cycle = assertInstanceOf(CyclicDependencyException.class, cycles.get(0).getCause());
        assertEquals(List.of("Loop A", "Loop B"), cycle.getCycleNames());

        EntityIssue join = only(issues, EntityIssue.Stage.RELATIONSHIP);
        assertInstanceOf(UnresolvedJoinReferenceException.class, join.getCause());

        EntityIssue projection = only(issues, EntityIssue.Stage.REPORT);
        assertEquals("By City", projection.getEntity());
        UnresolvedFieldProjectionException unresolved =
                assertInstanceOf(UnresolvedFieldProjectionException.class, projection.getCause());
        assertEquals("Calculation_A", unresolved.getField());
    }

    @Test
    void fieldsOutsideTheCycleAreStillEmitted() throws Exception {
        EmittedArtifactSet artifacts = convert("edge_cases.twb", ConversionOptions.defaults()).getArtifacts();

        ModelTable orders = artifacts.getModel().findTable("Orders").orElseThrow();
        assertTrue(orders.findMeasure("Double Sales").isPresent());
        assertTrue(orders.findMeasure("Broken").isPresent());
        assertTrue(orders.findMeasure("Loop A").isEmpty());
        assertTrue(orders.findMeasure("After Loop").isEmpty());

        String tmdl = artifacts.find("Workbook.SemanticModel/definition/tables/Orders.tmdl").orElseThrow().getContent();
        assertTrue(tmdl.contains("measure Broken = BLANK()"), tmdl);
    }

    @Test
    void assumptionsComeOutInCategoryOrder() throws Exception {
        List<Assumption> assumptions = convert("edge_cases.twb", ConversionOptions.defaults()).getAssumptions();

        List<AssumptionCategory> categories = new ArrayList<>();
        for (Assumption assumption : assumptions) {
            categories.add(assumption.getCategory());
        }
        List<AssumptionCategory> sorted = new ArrayList<>(categories);
        sorted.sort(null);
        assertEquals(sorted, categories);
        assertTrue(categories.contains(AssumptionCategory.PARSING));
        assertTrue(categories.contains(AssumptionCategory.RELATIONSHIP));
        assertTrue(categories.contains(AssumptionCategory.REPORT));
        assertTrue(
                assumptions.stream()
                        .anyMatch(a -> a.getReason().contains("[Loop A, Loop B]")
                                && a.getLocation().endsWith("/After Loop")));
    }

    @Test
    void projectNameDrivesFolderNames() throws Exception {
        ConversionOptions options = ConversionOptions.builder().projectName("Sales").build();

        EmittedArtifactSet artifacts = convert("superstore.twb", options).getArtifacts();

        assertTrue(artifacts.paths().stream().allMatch(p -> p.startsWith("Sales.SemanticModel/")
                || p.startsWith("Sales.Report/")));
        String pbir = artifacts.find("Sales.Report/definition.pbir").orElseThrow().getContent();
        assertTrue(pbir.contains("../Sales.SemanticModel"), pbir);
    }

    @Test
    void malformedAndDuplicateDocumentsAbortTheRun() {
        assertThrows(
                MalformedDocumentException.class,
                () -> pipeline.convert(TestWorkbooks.parse("<workbook />"), ConversionOptions.defaults()));
        assertThrows(
                DuplicateNameException.class,
                () -> pipeline.convert(
                        TestWorkbooks.parse(
                                "<workbook><datasources /><worksheets /><dashboards>"
                                        + "<dashboard name='A' /><dashboard name='A' />"
                                        + "</dashboards></workbook>"),
                        ConversionOptions.defaults()));
    }

    @Test
    void emptyWorkbookGetsOneBlankPage() throws Exception {
        ConversionResult result =
                pipeline.convert(
                        TestWorkbooks.parse("<workbook><datasources /><worksheets /><dashboards /></workbook>"),
                        ConversionOptions.defaults());

        assertEquals(1, result.getArtifacts().getReport().getPages().size());
        assertEquals("Page 1", result.getArtifacts().getReport().getPages().get(0).getDisplayName());
        assertTrue(result.getArtifacts().getModel().getTables().isEmpty());
    }

    private ConversionResult convert(String workbook, ConversionOptions options) throws Exception {
        return pipeline.convert(TestWorkbooks.load(workbook), options);
    }

    private static List<EntityIssue> of(List<EntityIssue> issues, EntityIssue.Stage stage) {
        return issues.stream().filter(issue -> issue.getStage() == stage).collect(Collectors.toList());
    }

    private static EntityIssue only(List<EntityIssue> issues, EntityIssue.Stage stage) {
        List<EntityIssue> matching = of(issues, stage);
        assertEquals(1, matching.size(), issues.toString());
        return matching.get(0);
    }
}
