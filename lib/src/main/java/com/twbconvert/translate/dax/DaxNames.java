package com.twbconvert.translate.dax;

import java.util.regex.Pattern;

/** Quoting rules for identifiers and string literals in DAX and TMDL. */
public final class DaxNames {
    private static final Pattern PLAIN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private DaxNames() {}

    /** {@code Orders} or {@code 'Order Lines'}. */
    public static String table(String name) {
        if (PLAIN.matcher(name).matches()) {
            return name;
        }
        return "'" + name.replace("'", "''") + "'";
    }

    /** {@code [Sales]}, with closing brackets doubled. */
    public static String bracket(String name) {
        return "[" + name.replace("]", "]]") + "]";
    }

    public static String column(String table, String column) {
        return table(table) + bracket(column);
    }

    public static String string(String value) {
        return "\"" + value.replace("\"", "\"\"") + "\"";
    }
}
