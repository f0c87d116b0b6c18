package com.twbconvert.pbip.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.twbconvert.pbip.artifact.Artifact;
import com.twbconvert.pbip.artifact.EmittedArtifactSet;
import com.twbconvert.pbip.model.ModelTable;
import com.twbconvert.pbip.model.SemanticModelSpec;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Re-reads each serialized {@code visual.json} and checks every {@code Column} and {@code Measure} field reference
 * it contains against the model, independently of the {@link com.twbconvert.pbip.report.ReportSpec} it was rendered
 * from.
 */
final class VisualDocumentRule implements SchemaRule {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String VISUAL_DOCUMENT = "/visual.json";

    @Override
    public String name() {
        return "visual-documents";
    }

    @Override
    public List<SchemaViolation> check(EmittedArtifactSet artifacts) {
        List<SchemaViolation> violations = new ArrayList<>();
        for (Artifact document : artifacts.getDocuments().values()) {
            if (!document.getPath().endsWith(VISUAL_DOCUMENT)) {
                continue;
            }
            JsonNode root;
            try {
                root = MAPPER.readTree(document.getContent());
            } catch (JsonProcessingException e) {
                violations.add(new SchemaViolation(name(), document.getPath(), "not valid JSON: " + e.getOriginalMessage()));
                continue;
            }
            String folder = folderName(document.getPath());
            if (!folder.equals(root.path("name").asText())) {
                violations.add(new SchemaViolation(
                        name(), document.getPath(), "visual name does not match its folder " + folder));
            }
            if (root.path("visual").path("visualType").asText().isEmpty()) {
                violations.add(new SchemaViolation(name(), document.getPath(), "visual has no visualType"));
            }
            walk(artifacts.getModel(), root, document.getPath(), violations);
        }
        return violations;
    }

    private void walk(SemanticModelSpec model, JsonNode node, String path, List<SchemaViolation> violations) {
        if (node.isArray()) {
            for (JsonNode element : node) {
                walk(model, element, path, violations);
            }
            return;
        }
        if (!node.isObject()) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            JsonNode value = field.getValue();
            if (("Column".equals(key) || "Measure".equals(key)) && value.has("Property")) {
                checkReference(model, key, value, path, violations);
            }
            walk(model, value, path, violations);
        }
    }

    private void checkReference(
            SemanticModelSpec model, String kind, JsonNode reference, String path, List<SchemaViolation> violations) {
        String entity = reference.path("Expression").path("SourceRef").path("Entity").asText();
        String property = reference.path("Property").asText();
        Optional<ModelTable> table = model.findTable(entity);
        boolean defined = table.isPresent()
                && ("Measure".equals(kind)
                        ? table.get().findMeasure(property).isPresent()
                        : table.get().findColumn(property).isPresent());
        if (!defined) {
            violations.add(new SchemaViolation(
                    name(), path, kind + " " + entity + "." + property + " is not defined in the model"));
        }
    }

    private static String folderName(String path) {
        String parent = path.substring(0, path.length() - VISUAL_DOCUMENT.length());
        return parent.substring(parent.lastIndexOf('/') + 1);
    }
}
