package com.twbconvert.pbip.validation;

import com.twbconvert.pbip.artifact.EmittedArtifactSet;
import com.twbconvert.pbip.model.ModelColumn;
import com.twbconvert.pbip.model.ModelMeasure;
import com.twbconvert.pbip.model.ModelTable;
import com.twbconvert.pbip.model.SemanticModelSpec;
import com.twbconvert.pbip.report.PageSpec;
import com.twbconvert.pbip.report.Projection;
import com.twbconvert.pbip.report.ReportSpec;
import com.twbconvert.pbip.report.VisualInteraction;
import com.twbconvert.pbip.report.VisualSpec;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Projections and filters point at an existing column or measure with a matching lineage tag, the active page is
 * one of the pages, and interactions connect two distinct visuals on their own page.
 */
final class ReportReferencesRule implements SchemaRule {

    @Override
    public String name() {
        return "report-references";
    }

    @Override
    public List<SchemaViolation> check(EmittedArtifactSet artifacts) {
        SemanticModelSpec model = artifacts.getModel();
        ReportSpec report = artifacts.getReport();
        List<SchemaViolation> violations = new ArrayList<>();
        if (report.getPages().stream().noneMatch(page -> page.getName().equals(report.getActivePage()))) {
            violations.add(new SchemaViolation(
                    name(), "pages.json", "active page " + report.getActivePage() + " is not in the page order"));
        }
        for (PageSpec page : report.getPages()) {
            for (VisualSpec visual : page.getVisuals()) {
                String location = page.getName() + "/" + visual.getName();
                for (Projection projection : visual.getProjections()) {
                    checkProjection(model, projection, location, violations);
                }
                for (Projection filter : visual.getFilters()) {
                    checkProjection(model, filter, location, violations);
                }
            }
            for (VisualInteraction interaction : page.getInteractions()) {
                if (page.findVisual(interaction.getSource()).isEmpty()) {
                    violations.add(new SchemaViolation(
                            name(), page.getName(), "interaction source " + interaction.getSource() + " is not on the page"));
                }
                if (page.findVisual(interaction.getTarget()).isEmpty()) {
                    violations.add(new SchemaViolation(
                            name(), page.getName(), "interaction target " + interaction.getTarget() + " is not on the page"));
                }
                if (interaction.getSource().equals(interaction.getTarget())) {
                    violations.add(new SchemaViolation(
                            name(), page.getName(), "visual " + interaction.getSource() + " interacts with itself"));
                }
            }
        }
        return violations;
    }

    private void checkProjection(
            SemanticModelSpec model, Projection projection, String location, List<SchemaViolation> violations) {
        Optional<ModelTable> table = model.findTable(projection.getEntity());
        if (table.isEmpty()) {
            violations.add(new SchemaViolation(
                    name(), location, projection.queryRef() + " refers to an undefined table"));
            return;
        }
        Optional<String> lineageTag;
        if (projection.getKind() == Projection.Kind.MEASURE) {
            lineageTag = table.get().findMeasure(projection.getProperty()).map(ModelMeasure::getLineageTag);
        } else {
            lineageTag = table.get().findColumn(projection.getProperty()).map(ModelColumn::getLineageTag);
        }
        if (lineageTag.isEmpty()) {
            violations.add(new SchemaViolation(
                    name(), location, projection.queryRef() + " refers to an undefined "
                            + (projection.getKind() == Projection.Kind.MEASURE ? "measure" : "column")));
        } else if (!lineageTag.get().equals(projection.getTargetId())) {
            violations.add(new SchemaViolation(
                    name(), location, projection.queryRef() + " carries a stale target identifier"));
        }
    }
}
