package com.twbconvert.pbip.validation;

import com.twbconvert.pbip.artifact.EmittedArtifactSet;
import com.twbconvert.pbip.model.ModelColumn;
import com.twbconvert.pbip.model.ModelMeasure;
import com.twbconvert.pbip.model.ModelRelationship;
import com.twbconvert.pbip.model.ModelTable;
import com.twbconvert.pbip.report.PageSpec;
import com.twbconvert.pbip.report.VisualSpec;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Identifiers are defined exactly once. Lineage tags are unique across the model; table names, measure names and
 * relationship names are unique model-wide; column and measure names are unique within their table; page names
 * are unique in the report and visual names within their page. Names compare case-insensitively, as in the target
 * engine.
 */
final class UniqueIdentifiersRule implements SchemaRule {

    @Override
    public String name() {
        return "unique-identifiers";
    }

    @Override
    public List<SchemaViolation> check(EmittedArtifactSet artifacts) {
        List<SchemaViolation> violations = new ArrayList<>();
        Set<String> lineageTags = new HashSet<>();
        Set<String> tables = new HashSet<>();
        Set<String> measures = new HashSet<>();
        for (ModelTable table : artifacts.getModel().getTables()) {
            unique(tables, table.getName(), "model", "table", violations);
            unique(lineageTags, table.getLineageTag(), table.getName(), "lineage tag", violations);
            Set<String> members = new HashSet<>();
            for (ModelColumn column : table.getColumns()) {
                unique(members, column.getName(), table.getName(), "column", violations);
                unique(lineageTags, column.getLineageTag(), table.getName() + "." + column.getName(), "lineage tag", violations);
            }
            for (ModelMeasure measure : table.getMeasures()) {
                unique(members, measure.getName(), table.getName(), "column or measure", violations);
                unique(measures, measure.getName(), table.getName(), "measure", violations);
                unique(lineageTags, measure.getLineageTag(), table.getName() + "." + measure.getName(), "lineage tag", violations);
            }
        }
        Set<String> relationships = new HashSet<>();
        for (ModelRelationship relationship : artifacts.getModel().getRelationships()) {
            unique(relationships, relationship.getName(), "relationships", "relationship", violations);
        }
        Set<String> pages = new HashSet<>();
        for (PageSpec page : artifacts.getReport().getPages()) {
            unique(pages, page.getName(), "report", "page", violations);
            Set<String> visuals = new HashSet<>();
            for (VisualSpec visual : page.getVisuals()) {
                unique(visuals, visual.getName(), page.getName(), "visual", violations);
            }
        }
        return violations;
    }

    private void unique(Set<String> seen, String identifier, String scope, String kind, List<SchemaViolation> violations) {
        if (!seen.add(identifier.toLowerCase(Locale.ROOT))) {
            violations.add(new SchemaViolation(name(), scope, kind + " '" + identifier + "' is defined more than once"));
        }
    }
}
