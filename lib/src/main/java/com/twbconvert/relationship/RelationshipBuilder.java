package com.twbconvert.relationship;

import com.twbconvert.assumption.Assumption;
import com.twbconvert.assumption.AssumptionCategory;
import com.twbconvert.assumption.AssumptionLog;
import com.twbconvert.workbook.Column;
import com.twbconvert.workbook.JoinEdge;
import com.twbconvert.workbook.Table;
import com.twbconvert.workbook.WorkbookModel;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Turns the workbook's join edges into target relationships.
 *
 * <p>A side is unique when its explicit hint says so, or, without a hint, when the column is a declared unique key.
 * Exactly one unique side gives one-to-many from that side, two give one-to-one from the left table and none gives
 * many-to-many, which is recorded as an assumption. Edges repeating an already related column pair are collapsed.
 * Only the first relationship between two tables stays active.</p>
 */
public final class RelationshipBuilder {
    private static final Logger LOGGER = Logger.getLogger(RelationshipBuilder.class.getName());

    public RelationshipResult build(WorkbookModel model, AssumptionLog log) {
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(log, "log");

        List<Relationship> relationships = new ArrayList<>();
        List<UnresolvedJoinReferenceException> failures = new ArrayList<>();
        Set<String> columnPairs = new HashSet<>();
        Set<String> tablePairs = new HashSet<>();

        List<JoinEdge> edges = model.getJoinEdges();
        for (int index = 0; index < edges.size(); index++) {
            JoinEdge edge = edges.get(index);
            Endpoint left;
            Endpoint right;
            try {
                left = resolve(model, edge, edge.getLeftTable(), edge.getLeftColumn());
                right = resolve(model, edge, edge.getRightTable(), edge.getRightColumn());
            } catch (UnresolvedJoinReferenceException e) {
                LOGGER.warning(e.getMessage());
                failures.add(e);
                continue;
            }
            if (left.table.getName().equals(right.table.getName())) {
                log.append(
                        index,
                        new Assumption(
                                AssumptionCategory.RELATIONSHIP,
                                edge.getDatasourceName(),
                                edge.describe(),
                                "",
                                "Self join has no relationship counterpart and was dropped"));
                continue;
            }
            if (!columnPairs.add(pairKey(left.qualifiedName(), right.qualifiedName()))) {
                LOGGER.fine(() -> "Collapsed duplicate join " + edge.describe());
                continue;
            }

            boolean leftUnique = edge.getLeftUnique() != null ? edge.getLeftUnique() : left.column.isUniqueKey();
            boolean rightUnique = edge.getRightUnique() != null ? edge.getRightUnique() : right.column.isUniqueKey();
            Endpoint from = left;
            Endpoint to = right;
            Cardinality cardinality;
            if (leftUnique && rightUnique) {
                cardinality = Cardinality.ONE_TO_ONE;
            } else if (leftUnique || rightUnique) {
                cardinality = Cardinality.ONE_TO_MANY;
                if (rightUnique) {
                    from = right;
                    to = left;
                }
            } else {
                cardinality = Cardinality.MANY_TO_MANY;
            }
            CrossFilterDirection direction =
                    edge.isBidirectional() ? CrossFilterDirection.BOTH : CrossFilterDirection.SINGLE;
            boolean active = tablePairs.add(pairKey(left.table.getName(), right.table.getName()));

            Relationship relationship =
                    new Relationship(
                            from.table.getName(),
                            from.column.getName(),
                            to.table.getName(),
                            to.column.getName(),
                            cardinality,
                            direction,
                            active);
            if (cardinality == Cardinality.MANY_TO_MANY) {
                log.append(
                        index,
                        new Assumption(
                                AssumptionCategory.RELATIONSHIP,
                                edge.getDatasourceName(),
                                edge.describe(),
                                relationship.describe(),
                                "Neither side is known to be unique; emitted as many-to-many"));
            }
            if (!active) {
                log.append(
                        index,
                        new Assumption(
                                AssumptionCategory.RELATIONSHIP,
                                edge.getDatasourceName(),
                                edge.describe(),
                                relationship.describe(),
                                "Tables are already related; emitted as an inactive relationship"));
            }
            relationships.add(relationship);
        }
        LOGGER.fine(() -> "Built " + relationships.size() + " relationship(s), " + failures.size() + " unresolved");
        return new RelationshipResult(relationships, failures);
    }

    private static Endpoint resolve(WorkbookModel model, JoinEdge edge, String tableName, String columnName)
            throws UnresolvedJoinReferenceException {
        Optional<Table> table = model.findTable(tableName);
        if (table.isEmpty()) {
            throw new UnresolvedJoinReferenceException(edge, "table '" + tableName + "'");
        }
        Optional<Column> column = table.get().findColumn(columnName);
        if (column.isEmpty()) {
            throw new UnresolvedJoinReferenceException(edge, "column '" + tableName + "." + columnName + "'");
        }
        return new Endpoint(table.get(), column.get());
    }

    private static String pairKey(String a, String b) {
        return a.compareTo(b) <= 0 ? a + "\u0000" + b : b + "\u0000" + a;
    }

    private static final class Endpoint {
        final Table table;
        final Column column;

        Endpoint(Table table, Column column) {
            this.table = table;
            this.column = column;
        }

        String qualifiedName() {
            return table.getName() + "." + column.getName();
        }
    }
}
