package com.twbconvert.pbip.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.twbconvert.pbip.ConversionOptions;
import com.twbconvert.pbip.ConversionPipeline;
import com.twbconvert.pbip.artifact.Artifact;
import com.twbconvert.pbip.artifact.EmittedArtifactSet;
import com.twbconvert.pbip.model.ModelRelationship;
import com.twbconvert.pbip.model.SemanticModelSpec;
import com.twbconvert.pbip.report.PageSpec;
import com.twbconvert.pbip.report.Position;
import com.twbconvert.pbip.report.ReportSpec;
import com.twbconvert.pbip.report.VisualSpec;
import com.twbconvert.testing.TestWorkbooks;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SchemaValidatorTest {
    private final SchemaValidator validator = SchemaValidator.defaultRules();
    private EmittedArtifactSet valid;

    @BeforeEach
    void convertSuperstore() throws Exception {
        valid = new ConversionPipeline()
                .convert(TestWorkbooks.load("superstore.twb"), ConversionOptions.defaults())
                .getArtifacts();
    }

    private static List<String> rules(List<SchemaViolation> violations) {
        return violations.stream().map(SchemaViolation::getRule).distinct().collect(Collectors.toList());
    }

    @Test
    void acceptsTheEmittedSet() throws Exception {
        assertTrue(validator.check(valid).isEmpty());
        validator.validate(valid);
    }

    @Test
    void reportsMissingDocument() {
        List<Artifact> documents = new ArrayList<>(valid.getDocuments().values());
        documents.removeIf(document -> document.getPath().endsWith("/definition/model.tmdl"));

        List<SchemaViolation> violations =
                validator.check(new EmittedArtifactSet(valid.getModel(), valid.getReport(), documents));

        assertEquals(
                List.of(new SchemaViolation("required-documents", "definition/model.tmdl", "required document is missing")),
                violations);
    }

    @Test
    void reportsRelationshipToUnknownColumn() {
        SemanticModelSpec model = valid.getModel();
        List<ModelRelationship> relationships = new ArrayList<>(model.getRelationships());
        relationships.add(new ModelRelationship(
                "0c3b0d2e-0000-3000-8000-000000000001", "OrderLines", "Nope", "Orders", "Order ID",
                "many", "one", false, false));
        EmittedArtifactSet broken = new EmittedArtifactSet(
                new SemanticModelSpec(model.getCulture(), model.getTables(), relationships),
                valid.getReport(),
                new ArrayList<>(valid.getDocuments().values()));

        List<SchemaViolation> violations = validator.check(broken);

        assertEquals(List.of("model-references"), rules(violations));
        assertEquals("column OrderLines[Nope] is not defined", violations.get(0).getMessage());
    }

    @Test
    void reportsNegativePositionAndRejectsTheSet() {
        ReportSpec report = valid.getReport();
        PageSpec page = report.getPages().get(0);
        List<VisualSpec> visuals = new ArrayList<>(page.getVisuals());
        VisualSpec first = visuals.get(0);
        visuals.set(0, new VisualSpec(
                first.getName(), first.getSourceWorksheet(), first.getVisualType(), first.getProjections(),
                first.getFilters(), new Position(-5, 0, 0, 100, 100, 0), first.getTitle(), first.getText()));
        List<PageSpec> pages = new ArrayList<>(report.getPages());
        pages.set(0, new PageSpec(page.getName(), page.getDisplayName(), page.getSourceDashboard(), page.getWidth(),
                page.getHeight(), visuals, page.getInteractions()));
        EmittedArtifactSet broken = new EmittedArtifactSet(
                valid.getModel(), new ReportSpec(pages, report.getActivePage()),
                new ArrayList<>(valid.getDocuments().values()));

        SchemaValidationException e = assertThrows(SchemaValidationException.class, () -> validator.validate(broken));

        assertEquals(List.of("positions"), rules(e.getViolations()));
        assertEquals(page.getName() + "/" + first.getName(), e.getViolations().get(0).getPath());
        assertTrue(e.getMessage().startsWith("1 schema violation(s)"), e.getMessage());
    }

    @Test
    void rereadsVisualDocumentsAgainstTheModel() {
        List<Artifact> documents = new ArrayList<>();
        for (Artifact document : valid.getDocuments().values()) {
            if (document.getPath().endsWith("/visual.json")
                    && document.getJson().at("/visual/visualType").asText().equals("card")) {
                ObjectNode json = document.getJson().deepCopy();
                ((ObjectNode) json.at("/visual/query/queryState/Values/projections/0/field/Measure"))
                        .put("Property", "Gone");
                documents.add(Artifact.json(document.getPath(), json));
            } else {
                documents.add(document);
            }
        }

        List<SchemaViolation> violations =
                validator.check(new EmittedArtifactSet(valid.getModel(), valid.getReport(), documents));

        assertEquals(List.of("visual-documents"), rules(violations));
    }

    @Test
    void runsOnlyTheConfiguredRules() {
        SchemaValidator positionsOnly = new SchemaValidator(List.of(new PositionRule()));
        List<Artifact> documents = new ArrayList<>(valid.getDocuments().values());
        documents.removeIf(document -> document.getPath().endsWith("/definition/model.tmdl"));

        assertTrue(positionsOnly.check(new EmittedArtifactSet(valid.getModel(), valid.getReport(), documents)).isEmpty());
    }
}
