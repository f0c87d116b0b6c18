package com.twbconvert.extract;

import com.twbconvert.workbook.FieldUsage;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses shelf text and column instance references. A shelf may hold several instances combined with operators,
 * for example {@code ([ds].[sum:Sales:qk] / [ds].[sum:Profit:qk])}; every instance is returned in order.
 */
public final class ShelfParser {
    private static final Pattern INSTANCE = Pattern.compile("\\[([^\\]]+)\\]\\.\\[([^\\]]+)\\]");

    private ShelfParser() {}

    public static List<FieldUsage> parseShelf(String text) {
        List<FieldUsage> usages = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return usages;
        }
        Matcher matcher = INSTANCE.matcher(text);
        while (matcher.find()) {
            usages.add(parseInstance(matcher.group(1), matcher.group(2)));
        }
        return usages;
    }

    /** Parses a single {@code [datasource].[instance]} reference, or returns {@code null} if it is not one. */
    public static FieldUsage parseReference(String reference) {
        if (reference == null) {
            return null;
        }
        Matcher matcher = INSTANCE.matcher(reference.trim());
        if (!matcher.matches()) {
            return null;
        }
        return parseInstance(matcher.group(1), matcher.group(2));
    }

    static FieldUsage parseInstance(String datasource, String instance) {
        if (instance.startsWith(":")) {
            return new FieldUsage(datasource, "none", instance, "");
        }
        int first = instance.indexOf(':');
        int last = instance.lastIndexOf(':');
        if (first < 0 || first == last) {
            return new FieldUsage(datasource, "none", instance, "");
        }
        return new FieldUsage(
                datasource,
                instance.substring(0, first),
                instance.substring(first + 1, last),
                instance.substring(last + 1));
    }
}
