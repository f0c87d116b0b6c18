package com.twbconvert.pbip.model;

import com.twbconvert.workbook.Column;
import com.twbconvert.workbook.DataConnection;
import com.twbconvert.workbook.DataType;
import com.twbconvert.workbook.Table;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Builds the M source of a table's import partition from its datasource connection. Excel and text-file connections
 * are read from the referenced file; any other connection gets an empty, typed {@code #table}.
 */
final class PartitionBuilder {
    private static final Pattern M_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private PartitionBuilder() {}

    static boolean isSupported(DataConnection connection) {
        String connectionClass = connection.getConnectionClass().toLowerCase(Locale.ROOT);
        return connection.getFilename() != null
                && (connectionClass.startsWith("excel") || "textscan".equals(connectionClass));
    }

    static ModelPartition build(Table table, DataConnection connection) {
        if (!isSupported(connection)) {
            return empty(table.getName(), table.getColumns());
        }
        List<String> lines = new ArrayList<>();
        lines.add("let");
        String connectionClass = connection.getConnectionClass().toLowerCase(Locale.ROOT);
        if (connectionClass.startsWith("excel")) {
            String sheet = table.getSourceObject().replaceAll("\\$$", "");
            lines.add("    Source = Excel.Workbook(File.Contents(" + text(connection.getFilename()) + "), null, true),");
            lines.add("    Data = Source{[Item=" + text(sheet) + ",Kind=\"Sheet\"]}[Data],");
        } else {
            lines.add("    Source = Csv.Document(File.Contents(" + text(csvPath(connection, table)) + "),"
                    + " [Delimiter=\",\", Encoding=65001, QuoteStyle=QuoteStyle.Csv]),");
            lines.add("    Data = Source,");
        }
        lines.add("    Promoted = Table.PromoteHeaders(Data, [PromoteAllScalars=true]),");
        lines.add("    Typed = Table.TransformColumnTypes(Promoted, {" + columnTypes(table.getColumns()) + "})");
        lines.add("in");
        lines.add("    Typed");
        return new ModelPartition(table.getName(), lines);
    }

    /** A partition with no rows whose row type lists {@code columns}. */
    static ModelPartition empty(String name, List<Column> columns) {
        StringBuilder type = new StringBuilder("#table(type table [");
        for (int i = 0; i < columns.size(); i++) {
            if (i > 0) {
                type.append(", ");
            }
            type.append(identifier(columns.get(i).getSourceColumn()))
                    .append(" = ")
                    .append(primitiveType(columns.get(i).getDataType()));
        }
        type.append("], {})");
        return new ModelPartition(name, List.of("let", "    Source = " + type, "in", "    Source"));
    }

    private static String csvPath(DataConnection connection, Table table) {
        String filename = connection.getFilename();
        if (filename.toLowerCase(Locale.ROOT).endsWith(".csv") || filename.toLowerCase(Locale.ROOT).endsWith(".txt")) {
            return filename;
        }
        String file = table.getSourceObject().replace('#', '.');
        String separator = filename.contains("\\") ? "\\" : "/";
        return filename.endsWith(separator) ? filename + file : filename + separator + file;
    }

    private static String columnTypes(List<Column> columns) {
        StringBuilder builder = new StringBuilder();
        for (Column column : columns) {
            if (builder.length() > 0) {
                builder.append(", ");
            }
            builder.append('{')
                    .append(text(column.getSourceColumn()))
                    .append(", ")
                    .append(typeOf(column.getDataType()))
                    .append('}');
        }
        return builder.toString();
    }

    private static String typeOf(DataType type) {
        switch (type) {
            case INTEGER:
                return "Int64.Type";
            case REAL:
                return "type number";
            case DATE:
                return "type date";
            case DATETIME:
                return "type datetime";
            case BOOLEAN:
                return "type logical";
            default:
                return "type text";
        }
    }

    private static String primitiveType(DataType type) {
        switch (type) {
            case INTEGER:
            case REAL:
                return "number";
            case DATE:
                return "date";
            case DATETIME:
                return "datetime";
            case BOOLEAN:
                return "logical";
            default:
                return "text";
        }
    }

    static String text(String value) {
        return "\"" + value.replace("\"", "\"\"") + "\"";
    }

    static String identifier(String name) {
        return M_IDENTIFIER.matcher(name).matches() ? name : "#" + text(name);
    }
}
