package com.twbconvert.pbip.model;

import java.util.regex.Pattern;

/**
 * Converts Tableau {@code default-format} values to Power BI format strings. Tableau prefixes the format with a type
 * code ({@code p} percentage, {@code c} currency, {@code n} number, {@code *} custom, {@code C1033} locale currency)
 * that Power BI does not use.
 */
final class FormatStrings {
    private static final Pattern TYPE_CODE = Pattern.compile("^(?:C\\d+|[pcn*])");

    private FormatStrings() {}

    static String fromTableau(String format) {
        if (format == null || format.isBlank()) {
            return null;
        }
        String stripped = TYPE_CODE.matcher(format).replaceFirst("");
        return stripped.isBlank() ? null : stripped;
    }
}
