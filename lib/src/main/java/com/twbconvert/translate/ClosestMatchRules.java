package com.twbconvert.translate;

/**
 * The approximations the translator is allowed to make, with the reason recorded for each. Every approximation in
 * the translator goes through one of these entries; there is no scoring or fuzzy matching.
 *
 * <table>
 *   <caption>Closest-match table</caption>
 *   <tr><th>Source shape</th><th>Emitted DAX</th></tr>
 *   <tr><td>unresolvable field reference</td><td>{@code BLANK()}</td></tr>
 *   <tr><td>row-level field in an aggregate expression</td><td>{@code SELECTEDVALUE(col)}</td></tr>
 *   <tr><td>row-level field of another table inside an iterator</td><td>{@code RELATED(col)}</td></tr>
 *   <tr><td>{@code ATTR(col)}</td><td>{@code SELECTEDVALUE(col)}; over an expression {@code MAXX}</td></tr>
 *   <tr><td>aggregate of a measure</td><td>the measure</td></tr>
 *   <tr><td>INCLUDE without an enclosing aggregate</td><td>{@code SUMX} over the dimension values</td></tr>
 *   <tr><td>LOD dimension that is not a column</td><td>the dimension is dropped</td></tr>
 *   <tr><td>table calculation without an ordering field</td><td>the inner aggregate</td></tr>
 *   <tr><td>table calculation partitioned by a field that is not a column</td><td>the unpartitioned window</td></tr>
 *   <tr><td>{@code RUNNING_AVG}</td><td>{@code AVERAGEX} over the running window</td></tr>
 *   <tr><td>{@code LOOKUP}, {@code PREVIOUS_VALUE}</td><td>the current value</td></tr>
 *   <tr><td>{@code FIRST}, {@code LAST}</td><td>offsets computed from a dense {@code RANKX}</td></tr>
 *   <tr><td>{@code WINDOW_*} with start/end offsets</td><td>the whole window</td></tr>
 *   <tr><td>{@code RANK_MODIFIED}, {@code RANK_UNIQUE}, {@code RANK_PERCENTILE}</td><td>{@code RANKX}</td></tr>
 *   <tr><td>unknown function or unsupported argument shape</td><td>{@code BLANK()} or the nearest function</td></tr>
 *   <tr><td>formula that failed to parse</td><td>{@code BLANK()}</td></tr>
 * </table>
 */
public final class ClosestMatchRules {
    static final String UNRESOLVED_REFERENCE = "Field reference could not be resolved to a column, measure or parameter";
    static final String ROW_LEVEL_IN_AGGREGATE =
            "Row-level field used in an aggregate expression; SELECTEDVALUE is blank when several values are in context";
    static final String RELATED_COLUMN =
            "Column of another table read through RELATED; assumes that table is on the one side of a relationship";
    static final String ATTR = "ATTR shows * for mixed values; the DAX form returns blank or the largest value instead";
    static final String AGGREGATE_OF_MEASURE = "Aggregation of an aggregate field; the measure is used as is";
    static final String INCLUDE_WITHOUT_AGGREGATE =
            "INCLUDE outside an aggregation is re-aggregated by the view; SUM over the included dimensions is assumed";
    static final String LOD_DIMENSION = "Level of detail dimension is not a column and was dropped";
    static final String WINDOW_WITHOUT_ORDERING =
            "Table calculation has no ordering field; the inner aggregate is emitted without the window";
    static final String PARTITION_FIELD = "Partition field is not a column; the window is not restarted for it";
    static final String RUNNING_AVG = "RUNNING_AVG averages per-mark aggregates; AVERAGEX over the running window is used";
    static final String LOOKUP = "Relative offsets have no counterpart; the current value is used";
    static final String FIRST_LAST = "FIRST and LAST are computed from a dense rank over the ordering field";
    static final String WINDOW_OFFSETS = "Window start and end offsets were ignored; the whole partition is used";
    static final String RANK_VARIANT = "Rank variant has no direct counterpart; RANKX with skipped ties is used";
    static final String UNKNOWN_FUNCTION = "Function has no DAX counterpart";
    static final String UNSUPPORTED_ARGUMENTS = "Function arguments have no DAX counterpart in this shape";
    static final String DATE_LITERAL = "Date literal is not in yyyy-mm-dd form; DATEVALUE parses it at refresh time";
    static final String UNPARSED = "Formula could not be parsed";

    private ClosestMatchRules() {}
}
