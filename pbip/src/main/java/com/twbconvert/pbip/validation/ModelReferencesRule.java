package com.twbconvert.pbip.validation;

import com.twbconvert.pbip.artifact.EmittedArtifactSet;
import com.twbconvert.pbip.model.ModelColumn;
import com.twbconvert.pbip.model.ModelMeasure;
import com.twbconvert.pbip.model.ModelRelationship;
import com.twbconvert.pbip.model.ModelTable;
import com.twbconvert.pbip.model.SemanticModelSpec;
import com.twbconvert.translate.dax.DaxBinary;
import com.twbconvert.translate.dax.DaxCall;
import com.twbconvert.translate.dax.DaxColumnRef;
import com.twbconvert.translate.dax.DaxContextOverride;
import com.twbconvert.translate.dax.DaxExpr;
import com.twbconvert.translate.dax.DaxMeasureRef;
import com.twbconvert.translate.dax.DaxTableRef;
import com.twbconvert.translate.dax.DaxUnary;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Relationship endpoints and every table, column and measure named inside a DAX expression exist in the model. */
final class ModelReferencesRule implements SchemaRule {

    @Override
    public String name() {
        return "model-references";
    }

    @Override
    public List<SchemaViolation> check(EmittedArtifactSet artifacts) {
        SemanticModelSpec model = artifacts.getModel();
        List<SchemaViolation> violations = new ArrayList<>();
        for (ModelRelationship relationship : model.getRelationships()) {
            String location = "relationship " + relationship.getName();
            requireColumn(model, relationship.getFromTable(), relationship.getFromColumn(), location, violations);
            requireColumn(model, relationship.getToTable(), relationship.getToColumn(), location, violations);
        }
        for (ModelTable table : model.getTables()) {
            for (ModelColumn column : table.getColumns()) {
                if (column.isCalculated()) {
                    walk(model, column.getExpression(), table.getName() + "." + column.getName(), violations);
                }
            }
            for (ModelMeasure measure : table.getMeasures()) {
                walk(model, measure.getExpression(), table.getName() + "." + measure.getName(), violations);
            }
        }
        return violations;
    }

    private void walk(SemanticModelSpec model, DaxExpr expr, String location, List<SchemaViolation> violations) {
        if (expr instanceof DaxColumnRef) {
            DaxColumnRef ref = (DaxColumnRef) expr;
            requireColumn(model, ref.getTable(), ref.getColumn(), location, violations);
        } else if (expr instanceof DaxMeasureRef) {
            DaxMeasureRef ref = (DaxMeasureRef) expr;
            Optional<ModelTable> table = model.findTable(ref.getTable());
            if (table.isEmpty() || table.get().findMeasure(ref.getMeasure()).isEmpty()) {
                violations.add(new SchemaViolation(
                        name(), location, "measure [" + ref.getMeasure() + "] is not defined on " + ref.getTable()));
            }
        } else if (expr instanceof DaxTableRef) {
            String table = ((DaxTableRef) expr).getTable();
            if (model.findTable(table).isEmpty()) {
                violations.add(new SchemaViolation(name(), location, "table '" + table + "' is not defined"));
            }
        } else if (expr instanceof DaxCall) {
            for (DaxExpr argument : ((DaxCall) expr).getArguments()) {
                walk(model, argument, location, violations);
            }
        } else if (expr instanceof DaxBinary) {
            walk(model, ((DaxBinary) expr).getLeft(), location, violations);
            walk(model, ((DaxBinary) expr).getRight(), location, violations);
        } else if (expr instanceof DaxUnary) {
            walk(model, ((DaxUnary) expr).getOperand(), location, violations);
        } else if (expr instanceof DaxContextOverride) {
            DaxContextOverride override = (DaxContextOverride) expr;
            walk(model, override.getInner(), location, violations);
            for (DaxExpr modifier : override.getModifiers()) {
                walk(model, modifier, location, violations);
            }
        }
    }

    private void requireColumn(
            SemanticModelSpec model, String table, String column, String location, List<SchemaViolation> violations) {
        Optional<ModelTable> owner = model.findTable(table);
        if (owner.isEmpty()) {
            violations.add(new SchemaViolation(name(), location, "table '" + table + "' is not defined"));
        } else if (owner.get().findColumn(column).isEmpty()) {
            violations.add(new SchemaViolation(name(), location, "column " + table + "[" + column + "] is not defined"));
        }
    }
}
