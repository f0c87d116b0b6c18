package com.twbconvert.pbip.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.twbconvert.pbip.ConversionOptions;
import com.twbconvert.pbip.StableIdentifiers;
import com.twbconvert.pbip.TargetSchemaVersion;
import com.twbconvert.pbip.artifact.Artifact;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Renders a {@link ReportSpec} as PBIR JSON documents under the report folder. */
public final class ReportWriter {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public List<Artifact> render(ReportSpec report, ConversionOptions options) {
        String root = options.getReportFolder() + "/";
        TargetSchemaVersion schema = options.getSchemaVersion();
        List<Artifact> documents = new ArrayList<>();
        documents.add(Artifact.json(root + "definition.pbir", definition(options)));
        documents.add(Artifact.json(root + "definition/version.json", version(schema)));
        documents.add(Artifact.json(root + "definition/report.json", report(schema)));
        documents.add(Artifact.json(root + "definition/pages/pages.json", pages(report, schema)));
        for (PageSpec page : report.getPages()) {
            String pageRoot = root + "definition/pages/" + page.getName() + "/";
            documents.add(Artifact.json(pageRoot + "page.json", page(page, schema)));
            for (VisualSpec visual : page.getVisuals()) {
                documents.add(
                        Artifact.json(pageRoot + "visuals/" + visual.getName() + "/visual.json", visual(visual, schema)));
            }
        }
        return documents;
    }

    private static ObjectNode definition(ConversionOptions options) {
        ObjectNode definition = MAPPER.createObjectNode();
        definition.put("version", "4.0");
        definition.putObject("datasetReference").putObject("byPath").put("path", "../" + options.getModelFolder());
        return definition;
    }

    private static ObjectNode version(TargetSchemaVersion schema) {
        ObjectNode version = MAPPER.createObjectNode();
        version.put("$schema", schema.versionMetadataSchema());
        version.put("version", "2.0.0");
        return version;
    }

    private static ObjectNode report(TargetSchemaVersion schema) {
        ObjectNode report = MAPPER.createObjectNode();
        report.put("$schema", schema.reportSchema());
        if (schema.getBaseTheme() != null) {
            ObjectNode baseTheme = report.putObject("themeCollection").putObject("baseTheme");
            baseTheme.put("name", schema.getBaseTheme());
            ObjectNode atImport = baseTheme.putObject("reportVersionAtImport");
            atImport.put("visual", schema.getVisualContainerVersion());
            atImport.put("report", schema.getReportVersion());
            atImport.put("page", schema.getPageVersion());
            baseTheme.put("type", "SharedResources");
        }
        ObjectNode settings = report.putObject("settings");
        settings.put("useStylableVisualContainerHeader", true);
        settings.put("exportDataMode", "AllowSummarized");
        settings.put("defaultDrillFilterOtherVisuals", true);
        settings.put("allowChangeFilterTypes", true);
        settings.put("useEnhancedTooltips", true);
        settings.put("useDefaultAggregateDisplayName", true);
        return report;
    }

    private static ObjectNode pages(ReportSpec report, TargetSchemaVersion schema) {
        ObjectNode pages = MAPPER.createObjectNode();
        pages.put("$schema", schema.pagesMetadataSchema());
        ArrayNode order = pages.putArray("pageOrder");
        for (PageSpec page : report.getPages()) {
            order.add(page.getName());
        }
        pages.put("activePageName", report.getActivePage());
        return pages;
    }

    private static ObjectNode page(PageSpec page, TargetSchemaVersion schema) {
        ObjectNode json = MAPPER.createObjectNode();
        json.put("$schema", schema.pageSchema());
        json.put("name", page.getName());
        json.put("displayName", page.getDisplayName());
        json.put("displayOption", "FitToPage");
        json.put("height", page.getHeight());
        json.put("width", page.getWidth());
        if (!page.getInteractions().isEmpty()) {
            ArrayNode interactions = json.putArray("visualInteractions");
            for (VisualInteraction interaction : page.getInteractions()) {
                ObjectNode entry = interactions.addObject();
                entry.put("source", interaction.getSource());
                entry.put("target", interaction.getTarget());
                entry.put("type", interaction.getType().getPbirName());
            }
        }
        return json;
    }

    private static ObjectNode visual(VisualSpec visual, TargetSchemaVersion schema) {
        ObjectNode json = MAPPER.createObjectNode();
        json.put("$schema", schema.visualContainerSchema());
        json.put("name", visual.getName());
        Position position = visual.getPosition();
        ObjectNode rectangle = json.putObject("position");
        rectangle.put("x", position.getX());
        rectangle.put("y", position.getY());
        rectangle.put("z", position.getZ());
        rectangle.put("height", position.getHeight());
        rectangle.put("width", position.getWidth());
        rectangle.put("tabOrder", position.getTabOrder());

        ObjectNode body = json.putObject("visual");
        body.put("visualType", visual.getVisualType());
        if (!visual.getProjections().isEmpty()) {
            ObjectNode queryState = body.putObject("query").putObject("queryState");
            Map<String, List<Projection>> byRole = new LinkedHashMap<>();
            for (Projection projection : visual.getProjections()) {
                byRole.computeIfAbsent(projection.getRole(), r -> new ArrayList<>()).add(projection);
            }
            for (Map.Entry<String, List<Projection>> role : byRole.entrySet()) {
                ArrayNode projections = queryState.putObject(role.getKey()).putArray("projections");
                for (Projection projection : role.getValue()) {
                    ObjectNode entry = projections.addObject();
                    entry.set("field", field(projection));
                    entry.put("queryRef", projection.queryRef());
                    entry.put("nativeQueryRef", projection.nativeQueryRef());
                    if (projection.getKind() != Projection.Kind.AGGREGATION) {
                        entry.put("active", true);
                    }
                }
            }
        }
        if (visual.getText() != null) {
            ObjectNode textRun = body.putObject("objects")
                    .putArray("general")
                    .addObject()
                    .putObject("properties")
                    .putArray("paragraphs")
                    .addObject()
                    .putArray("textRuns")
                    .addObject();
            textRun.put("value", visual.getText());
            textRun.putObject("textStyle").put("fontSize", "14pt");
        }
        if (visual.getTitle() != null) {
            ObjectNode properties = body.putObject("visualContainerObjects")
                    .putArray("title")
                    .addObject()
                    .putObject("properties");
            properties.set("show", literal("true"));
            properties.set("text", literal("'" + visual.getTitle().replace("'", "''") + "'"));
        }
        if (!"textbox".equals(visual.getVisualType())) {
            body.put("drillFilterOtherVisuals", true);
        }
        if (!visual.getFilters().isEmpty()) {
            ArrayNode filters = json.putObject("filterConfig").putArray("filters");
            for (Projection filter : visual.getFilters()) {
                ObjectNode entry = filters.addObject();
                entry.put("name", StableIdentifiers.reportName("filter", visual.getName(), filter.queryRef()));
                entry.set("field", field(filter));
                entry.put("type", filter.isMeasureLike() ? "Advanced" : "Categorical");
            }
        }
        return json;
    }

    static ObjectNode field(Projection projection) {
        ObjectNode field = MAPPER.createObjectNode();
        switch (projection.getKind()) {
            case MEASURE:
                field.set("Measure", reference(projection));
                break;
            case AGGREGATION:
                ObjectNode aggregation = field.putObject("Aggregation");
                aggregation.putObject("Expression").set("Column", reference(projection));
                aggregation.put("Function", projection.getAggregation().getCode());
                break;
            default:
                field.set("Column", reference(projection));
                break;
        }
        return field;
    }

    private static ObjectNode reference(Projection projection) {
        ObjectNode reference = MAPPER.createObjectNode();
        reference.putObject("Expression").putObject("SourceRef").put("Entity", projection.getEntity());
        reference.put("Property", projection.getProperty());
        return reference;
    }

    private static ObjectNode literal(String value) {
        ObjectNode literal = MAPPER.createObjectNode();
        literal.putObject("expr").putObject("Literal").put("Value", value);
        return literal;
    }
}
