package com.twbconvert.pbip.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.twbconvert.translate.dax.DaxWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/** Renders the typed semantic model as TMDL text, tab indented with LF line endings. */
final class TmdlWriter {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Pattern PLAIN_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final StringBuilder out = new StringBuilder();

    private TmdlWriter line(int depth, String text) {
        for (int i = 0; i < depth; i++) {
            out.append('\t');
        }
        out.append(text).append('\n');
        return this;
    }

    private TmdlWriter blank() {
        out.append('\n');
        return this;
    }

    private String text() {
        return out.toString();
    }

    /** Object name as TMDL expects it: bare when it is a plain identifier, otherwise single-quoted. */
    static String quote(String name) {
        if (PLAIN_NAME.matcher(name).matches()) {
            return name;
        }
        return "'" + name.replace("'", "''") + "'";
    }

    static String database(int compatibilityLevel) {
        return new TmdlWriter().line(0, "database").line(1, "compatibilityLevel: " + compatibilityLevel).text();
    }

    static String culture(String culture) {
        return new TmdlWriter()
                .line(0, "cultureInfo " + culture)
                .blank()
                .line(1, "linguisticMetadata =")
                .line(3, "{")
                .line(3, "  \"Version\": \"1.0.0\",")
                .line(3, "  \"Language\": \"" + culture + "\"")
                .line(3, "}")
                .line(2, "contentType: json")
                .text();
    }

    static String model(SemanticModelSpec spec) {
        List<String> order = new ArrayList<>();
        for (ModelTable table : spec.getTables()) {
            order.add(table.getName());
        }
        String queryOrder;
        try {
            queryOrder = MAPPER.writeValueAsString(order);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize query order", e);
        }
        TmdlWriter writer = new TmdlWriter()
                .line(0, "model Model")
                .line(1, "culture: " + spec.getCulture())
                .line(1, "defaultPowerBIDataSourceVersion: powerBI_V3")
                .line(1, "sourceQueryCulture: " + spec.getCulture())
                .line(1, "dataAccessOptions")
                .line(2, "legacyRedirects")
                .line(2, "returnErrorValuesAsNull")
                .blank()
                .line(0, "annotation PBI_QueryOrder = " + queryOrder)
                .blank();
        for (ModelTable table : spec.getTables()) {
            writer.line(0, "ref table " + quote(table.getName()));
        }
        return writer.blank().line(0, "ref cultureInfo " + spec.getCulture()).text();
    }

    static String relationships(List<ModelRelationship> relationships) {
        TmdlWriter writer = new TmdlWriter();
        for (ModelRelationship relationship : relationships) {
            writer.line(0, "relationship " + relationship.getName());
            if (!"one".equals(relationship.getToCardinality())) {
                writer.line(1, "toCardinality: " + relationship.getToCardinality());
            }
            if (!"many".equals(relationship.getFromCardinality())) {
                writer.line(1, "fromCardinality: " + relationship.getFromCardinality());
            }
            if (relationship.isBothDirections()) {
                writer.line(1, "crossFilteringBehavior: bothDirections");
            }
            if (!relationship.isActive()) {
                writer.line(1, "isActive: false");
            }
            writer.line(1, "fromColumn: " + quote(relationship.getFromTable()) + "." + quote(relationship.getFromColumn()))
                    .line(1, "toColumn: " + quote(relationship.getToTable()) + "." + quote(relationship.getToColumn()))
                    .blank();
        }
        return writer.text();
    }

    static String table(ModelTable table) {
        TmdlWriter writer = new TmdlWriter()
                .line(0, "table " + quote(table.getName()))
                .line(1, "lineageTag: " + table.getLineageTag())
                .blank();
        for (ModelMeasure measure : table.getMeasures()) {
            writer.line(1, "measure " + quote(measure.getName()) + " = " + DaxWriter.write(measure.getExpression()));
            if (measure.getFormatString() != null) {
                writer.line(2, "formatString: " + measure.getFormatString());
            }
            writer.line(2, "lineageTag: " + measure.getLineageTag()).blank();
        }
        for (ModelColumn column : table.getColumns()) {
            if (column.isCalculated()) {
                writer.line(1, "column " + quote(column.getName()) + " = " + DaxWriter.write(column.getExpression()));
            } else {
                writer.line(1, "column " + quote(column.getName()));
            }
            writer.line(2, "dataType: " + column.getDataType());
            if (column.getFormatString() != null) {
                writer.line(2, "formatString: " + column.getFormatString());
            }
            if (column.isHidden()) {
                writer.line(2, "isHidden");
            }
            writer.line(2, "lineageTag: " + column.getLineageTag()).line(2, "summarizeBy: " + column.getSummarizeBy());
            if (!column.isCalculated()) {
                writer.line(2, "sourceColumn: " + column.getSourceColumn());
            }
            writer.blank().line(2, "annotation SummarizationSetBy = Automatic").blank();
        }
        ModelPartition partition = table.getPartition();
        writer.line(1, "partition " + quote(partition.getName()) + " = m")
                .line(2, "mode: import")
                .line(2, "source =");
        for (String source : partition.getSource()) {
            writer.line(4, source);
        }
        return writer.blank().line(1, "annotation PBI_ResultType = Table").text();
    }
}
