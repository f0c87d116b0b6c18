package com.twbconvert.formula;

import java.util.Locale;
import java.util.Set;

/** Which function names the parser lifts into aggregation and table-calculation nodes. */
public final class FunctionCatalog {
    private static final Set<String> AGGREGATES =
            Set.of(
                    "SUM", "AVG", "MIN", "MAX", "COUNT", "COUNTD", "MEDIAN", "STDEV", "STDEVP", "VAR", "VARP",
                    "PERCENTILE", "ATTR");

    private static final Set<String> TABLE_CALCULATIONS =
            Set.of(
                    "RUNNING_SUM", "RUNNING_AVG", "RUNNING_MIN", "RUNNING_MAX", "RUNNING_COUNT",
                    "WINDOW_SUM", "WINDOW_AVG", "WINDOW_MIN", "WINDOW_MAX", "WINDOW_COUNT", "WINDOW_MEDIAN",
                    "RANK", "RANK_DENSE", "RANK_MODIFIED", "RANK_UNIQUE", "RANK_PERCENTILE",
                    "INDEX", "SIZE", "TOTAL", "LOOKUP", "PREVIOUS_VALUE", "FIRST", "LAST");

    private FunctionCatalog() {}

    /**
     * True when a call with this name and arity is an aggregate. {@code MIN} and {@code MAX} with two arguments are
     * the row-level comparison functions.
     */
    public static boolean isAggregate(String name, int arity) {
        String upper = name.toUpperCase(Locale.ROOT);
        if (!AGGREGATES.contains(upper)) {
            return false;
        }
        if ("PERCENTILE".equals(upper)) {
            return arity == 2;
        }
        return arity == 1;
    }

    public static boolean isTableCalculation(String name) {
        return TABLE_CALCULATIONS.contains(name.toUpperCase(Locale.ROOT));
    }
}
