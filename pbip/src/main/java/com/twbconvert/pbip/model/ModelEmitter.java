package com.twbconvert.pbip.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.twbconvert.assumption.Assumption;
import com.twbconvert.assumption.AssumptionCategory;
import com.twbconvert.assumption.AssumptionLog;
import com.twbconvert.pbip.ConversionOptions;
import com.twbconvert.pbip.StableIdentifiers;
import com.twbconvert.pbip.artifact.Artifact;
import com.twbconvert.relationship.Cardinality;
import com.twbconvert.relationship.CrossFilterDirection;
import com.twbconvert.relationship.Relationship;
import com.twbconvert.translate.SymbolTable;
import com.twbconvert.translate.TranslatedExpression;
import com.twbconvert.translate.TranslationResult;
import com.twbconvert.workbook.AggregationType;
import com.twbconvert.workbook.Column;
import com.twbconvert.workbook.ColumnRole;
import com.twbconvert.workbook.DataConnection;
import com.twbconvert.workbook.DataType;
import com.twbconvert.workbook.Datasource;
import com.twbconvert.workbook.Table;
import com.twbconvert.workbook.WorkbookModel;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Builds the typed semantic model and renders it as the TMDL document set of a {@code .SemanticModel} folder.
 *
 * <p>Every workbook table becomes one table file holding its physical columns, the calculated columns and measures
 * whose home is that table, and an import partition. Parameters become measures of a separate table. Lineage tags
 * and relationship names come from {@link StableIdentifiers}.</p>
 */
public final class ModelEmitter {
    private static final Logger LOGGER = Logger.getLogger(ModelEmitter.class.getName());
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String PLACEHOLDER_COLUMN = "Placeholder";

    public List<ModelTable> buildTables(WorkbookModel model, TranslationResult translation, AssumptionLog log) {
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(translation, "translation");
        Objects.requireNonNull(log, "log");

        Map<String, List<TranslatedExpression>> byTable = new LinkedHashMap<>();
        for (TranslatedExpression expression : translation.getFields()) {
            byTable.computeIfAbsent(expression.getTable(), t -> new ArrayList<>()).add(expression);
        }

        List<ModelTable> tables = new ArrayList<>();
        Set<String> fileNames = new HashSet<>();
        List<Table> sourceTables = model.getTables();
        for (int index = 0; index < sourceTables.size(); index++) {
            Table table = sourceTables.get(index);
            List<TranslatedExpression> derived = byTable.remove(table.getName());
            DataConnection connection = model.findDatasource(table.getDatasourceName())
                    .map(Datasource::getConnection)
                    .orElse(DataConnection.unknown());
            ModelPartition partition = table.getColumns().isEmpty()
                    ? PartitionBuilder.empty(table.getName(), List.of(placeholder()))
                    : PartitionBuilder.build(table, connection);
            if (!PartitionBuilder.isSupported(connection) && !table.getColumns().isEmpty()) {
                log.append(
                        index,
                        new Assumption(
                                AssumptionCategory.MODEL,
                                table.getName(),
                                connection.getConnectionClass(),
                                String.join(" ", partition.getSource()),
                                "Connection has no M source mapping; the table is emitted without rows"));
            }
            tables.add(
                    table(
                            table.getName(),
                            physicalColumns(table),
                            derived == null ? List.of() : derived,
                            partition,
                            fileNames));
        }

        if (!translation.getParameters().isEmpty()) {
            tables.add(
                    table(
                            SymbolTable.PARAMETERS_TABLE,
                            List.of(),
                            translation.getParameters(),
                            PartitionBuilder.empty(SymbolTable.PARAMETERS_TABLE, List.of(placeholder())),
                            fileNames));
        }
        if (!byTable.isEmpty()) {
            throw new IllegalStateException("Translated fields refer to unknown tables " + byTable.keySet());
        }
        LOGGER.fine(() -> "Built " + tables.size() + " model table(s)");
        return tables;
    }

    public List<ModelRelationship> buildRelationships(List<Relationship> relationships) {
        List<ModelRelationship> result = new ArrayList<>(relationships.size());
        for (Relationship relationship : relationships) {
            // TMDL puts the many side first.
            String fromCardinality = relationship.getCardinality() == Cardinality.ONE_TO_ONE ? "one" : "many";
            String toCardinality = relationship.getCardinality() == Cardinality.MANY_TO_MANY ? "many" : "one";
            result.add(
                    new ModelRelationship(
                            StableIdentifiers.relationshipName(
                                    relationship.getToTable(),
                                    relationship.getToColumn(),
                                    relationship.getFromTable(),
                                    relationship.getFromColumn()),
                            relationship.getToTable(),
                            relationship.getToColumn(),
                            relationship.getFromTable(),
                            relationship.getFromColumn(),
                            fromCardinality,
                            toCardinality,
                            relationship.getDirection() == CrossFilterDirection.BOTH,
                            relationship.isActive()));
        }
        return result;
    }

    /** Renders every model document, with paths relative to the project root. */
    public List<Artifact> render(SemanticModelSpec spec, ConversionOptions options) {
        String root = options.getModelFolder() + "/";
        List<Artifact> documents = new ArrayList<>();
        documents.add(Artifact.json(root + "definition.pbism", pbism()));
        documents.add(
                Artifact.tmdl(
                        root + "definition/database.tmdl",
                        TmdlWriter.database(options.getSchemaVersion().getCompatibilityLevel())));
        documents.add(Artifact.tmdl(root + "definition/model.tmdl", TmdlWriter.model(spec)));
        if (!spec.getRelationships().isEmpty()) {
            documents.add(
                    Artifact.tmdl(
                            root + "definition/relationships.tmdl", TmdlWriter.relationships(spec.getRelationships())));
        }
        documents.add(
                Artifact.tmdl(
                        root + "definition/cultures/" + spec.getCulture() + ".tmdl",
                        TmdlWriter.culture(spec.getCulture())));
        for (ModelTable table : spec.getTables()) {
            documents.add(Artifact.tmdl(root + "definition/tables/" + table.getFileName() + ".tmdl", TmdlWriter.table(table)));
        }
        return documents;
    }

    private static ObjectNode pbism() {
        ObjectNode pbism = MAPPER.createObjectNode();
        pbism.put("version", "4.2");
        pbism.putObject("settings");
        return pbism;
    }

    private static ModelTable table(
            String name,
            List<ModelColumn> physical,
            List<TranslatedExpression> derived,
            ModelPartition partition,
            Set<String> fileNames) {
        List<ModelColumn> columns = new ArrayList<>(physical);
        List<ModelMeasure> measures = new ArrayList<>();
        for (TranslatedExpression expression : derived) {
            String formatString = FormatStrings.fromTableau(expression.getFormatString());
            if (expression.isMeasure()) {
                measures.add(
                        new ModelMeasure(
                                expression.getName(),
                                expression.getDax(),
                                formatString,
                                StableIdentifiers.measureTag(name, expression.getName())));
            } else {
                columns.add(
                        new ModelColumn(
                                expression.getName(),
                                dataType(expression.getResultType()),
                                "none",
                                null,
                                expression.getDax(),
                                formatString,
                                StableIdentifiers.columnTag(name, expression.getName()),
                                false));
            }
        }
        if (physical.isEmpty()) {
            columns.add(0, placeholderColumn(name));
        }
        return new ModelTable(
                name, fileName(name, fileNames), StableIdentifiers.tableTag(name), columns, measures, partition);
    }

    private static List<ModelColumn> physicalColumns(Table table) {
        List<ModelColumn> columns = new ArrayList<>();
        for (Column column : table.getColumns()) {
            columns.add(
                    new ModelColumn(
                            column.getName(),
                            dataType(column.getDataType()),
                            summarizeBy(column),
                            column.getSourceColumn(),
                            null,
                            null,
                            StableIdentifiers.columnTag(table.getName(), column.getName()),
                            false));
        }
        return columns;
    }

    private static Column placeholder() {
        return new Column(
                PLACEHOLDER_COLUMN,
                PLACEHOLDER_COLUMN,
                PLACEHOLDER_COLUMN,
                DataType.STRING,
                ColumnRole.DIMENSION,
                AggregationType.NONE,
                false);
    }

    private static ModelColumn placeholderColumn(String table) {
        return new ModelColumn(
                PLACEHOLDER_COLUMN,
                "string",
                "none",
                PLACEHOLDER_COLUMN,
                null,
                null,
                StableIdentifiers.columnTag(table, PLACEHOLDER_COLUMN),
                true);
    }

    static String dataType(DataType type) {
        switch (type) {
            case INTEGER:
                return "int64";
            case REAL:
                return "double";
            case DATE:
            case DATETIME:
                return "dateTime";
            case BOOLEAN:
                return "boolean";
            default:
                return "string";
        }
    }

    static String summarizeBy(Column column) {
        if (column.getRole() != ColumnRole.MEASURE || !column.getDataType().isNumeric()) {
            return "none";
        }
        switch (column.getDefaultAggregation()) {
            case SUM:
                return "sum";
            case AVG:
                return "average";
            case MIN:
                return "min";
            case MAX:
                return "max";
            case COUNT:
                return "count";
            case COUNTD:
                return "distinctCount";
            default:
                return "none";
        }
    }

    /** File name safe on every platform; a clash after sanitizing gets a hash suffix. */
    private static String fileName(String table, Set<String> taken) {
        String sanitized = table.replaceAll("[\\\\/:*?\"<>|]", "_").trim();
        if (sanitized.isEmpty()) {
            sanitized = "_";
        }
        String candidate = sanitized;
        if (!taken.add(candidate.toLowerCase(Locale.ROOT))) {
            candidate = sanitized + "_" + StableIdentifiers.reportName("file", "", table).substring(0, 8);
            taken.add(candidate.toLowerCase(Locale.ROOT));
        }
        return candidate;
    }
}
