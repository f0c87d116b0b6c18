package com.twbconvert.pbip.validation;

import com.twbconvert.pbip.artifact.EmittedArtifactSet;
import com.twbconvert.pbip.model.ModelTable;
import com.twbconvert.pbip.report.PageSpec;
import com.twbconvert.pbip.report.VisualSpec;
import java.util.ArrayList;
import java.util.List;

/** Every fixed document, and one document per table, page and visual, is present exactly once. */
final class RequiredDocumentsRule implements SchemaRule {
    private static final List<String> FIXED =
            List.of(
                    "/definition.pbism",
                    "/definition/database.tmdl",
                    "/definition/model.tmdl",
                    "/definition.pbir",
                    "/definition/version.json",
                    "/definition/report.json",
                    "/definition/pages/pages.json");

    @Override
    public String name() {
        return "required-documents";
    }

    @Override
    public List<SchemaViolation> check(EmittedArtifactSet artifacts) {
        List<String> paths = artifacts.paths();
        List<SchemaViolation> violations = new ArrayList<>();
        for (String suffix : FIXED) {
            expectOnce(paths, suffix, violations);
        }
        if (!artifacts.getModel().getRelationships().isEmpty()) {
            expectOnce(paths, "/definition/relationships.tmdl", violations);
        }
        expectOnce(paths, "/definition/cultures/" + artifacts.getModel().getCulture() + ".tmdl", violations);
        for (ModelTable table : artifacts.getModel().getTables()) {
            expectOnce(paths, "/definition/tables/" + table.getFileName() + ".tmdl", violations);
        }
        for (PageSpec page : artifacts.getReport().getPages()) {
            String pageRoot = "/definition/pages/" + page.getName() + "/";
            expectOnce(paths, pageRoot + "page.json", violations);
            for (VisualSpec visual : page.getVisuals()) {
                expectOnce(paths, pageRoot + "visuals/" + visual.getName() + "/visual.json", violations);
            }
        }
        return violations;
    }

    private void expectOnce(List<String> paths, String suffix, List<SchemaViolation> violations) {
        long count = paths.stream().filter(path -> path.endsWith(suffix)).count();
        if (count == 0) {
            violations.add(new SchemaViolation(name(), suffix.substring(1), "required document is missing"));
        } else if (count > 1) {
            violations.add(new SchemaViolation(name(), suffix.substring(1), "document is emitted " + count + " times"));
        }
    }
}
