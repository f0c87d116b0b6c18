package com.twbconvert.translate;

import com.twbconvert.formula.ast.ExprNode;
import com.twbconvert.formula.ast.FunctionCallNode;
import com.twbconvert.translate.dax.DaxBinary;
import com.twbconvert.translate.dax.DaxCall;
import com.twbconvert.translate.dax.DaxExpr;
import com.twbconvert.translate.dax.DaxLiteral;
import com.twbconvert.translate.dax.DaxOperator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Row-level function rules keyed by Tableau function name. Aggregations and table calculations are separate node
 * kinds and are handled by the translator itself.
 */
final class FunctionRules {
    private static final Map<String, FunctionRule> RULES = new HashMap<>();
    private static final Map<String, String> DATE_INTERVALS =
            Map.of(
                    "year", "YEAR",
                    "quarter", "QUARTER",
                    "month", "MONTH",
                    "week", "WEEK",
                    "day", "DAY",
                    "hour", "HOUR",
                    "minute", "MINUTE",
                    "second", "SECOND");

    static {
        // math
        rename("ABS", "ABS", 1, 1);
        rename("SQRT", "SQRT", 1, 1);
        rename("EXP", "EXP", 1, 1);
        rename("LN", "LN", 1, 1);
        rename("POWER", "POWER", 2, 2);
        rename("SIGN", "SIGN", 1, 1);
        rename("PI", "PI", 0, 0);
        rename("SIN", "SIN", 1, 1);
        rename("COS", "COS", 1, 1);
        rename("TAN", "TAN", 1, 1);
        rename("ASIN", "ASIN", 1, 1);
        rename("ACOS", "ACOS", 1, 1);
        rename("ATAN", "ATAN", 1, 1);
        rename("DEGREES", "DEGREES", 1, 1);
        rename("RADIANS", "RADIANS", 1, 1);
        rename("DIV", "QUOTIENT", 2, 2);
        rename("MIN", "MIN", 2, 2);
        rename("MAX", "MAX", 2, 2);
        rename("INT", "TRUNC", 1, 1);
        RULES.put("ROUND", (call, args, ctx) -> withDefault(call, args, ctx, "ROUND", DaxLiteral.number(0)));
        RULES.put("CEILING", (call, args, ctx) -> withDefault(call, args, ctx, "CEILING", DaxLiteral.number(1)));
        RULES.put("FLOOR", (call, args, ctx) -> withDefault(call, args, ctx, "FLOOR", DaxLiteral.number(1)));
        RULES.put("LOG", (call, args, ctx) -> withDefault(call, args, ctx, "LOG", DaxLiteral.number(10)));
        RULES.put("FLOAT", (call, args, ctx) -> convert(call, args, ctx, "DOUBLE"));
        RULES.put("STR", (call, args, ctx) -> convert(call, args, ctx, "STRING"));

        // logical and null handling
        RULES.put("IIF", FunctionRules::iif);
        rename("IFNULL", "COALESCE", 2, 2);
        rename("ISNULL", "ISBLANK", 1, 1);
        RULES.put(
                "ZN",
                (call, args, ctx) ->
                        args.size() == 1
                                ? DaxCall.of("COALESCE", args.get(0), DaxLiteral.number(0))
                                : unsupported(call, args, ctx));

        // strings
        rename("LEN", "LEN", 1, 1);
        rename("LEFT", "LEFT", 2, 2);
        rename("RIGHT", "RIGHT", 2, 2);
        rename("UPPER", "UPPER", 1, 1);
        rename("LOWER", "LOWER", 1, 1);
        rename("TRIM", "TRIM", 1, 1);
        rename("REPLACE", "SUBSTITUTE", 3, 3);
        rename("CONTAINS", "CONTAINSSTRING", 2, 2);
        rename("CHAR", "UNICHAR", 1, 1);
        RULES.put("MID", FunctionRules::mid);
        RULES.put("FIND", FunctionRules::find);
        RULES.put("STARTSWITH", (call, args, ctx) -> affix(call, args, ctx, "LEFT"));
        RULES.put("ENDSWITH", (call, args, ctx) -> affix(call, args, ctx, "RIGHT"));
        RULES.put("LTRIM", FunctionRules::oneSidedTrim);
        RULES.put("RTRIM", FunctionRules::oneSidedTrim);
        RULES.put("ASCII", FunctionRules::ascii);
        RULES.put("SPLIT", FunctionRules::split);

        // dates
        rename("YEAR", "YEAR", 1, 1);
        rename("MONTH", "MONTH", 1, 1);
        rename("DAY", "DAY", 1, 1);
        rename("QUARTER", "QUARTER", 1, 1);
        rename("TODAY", "TODAY", 0, 0);
        rename("NOW", "NOW", 0, 0);
        rename("MAKEDATE", "DATE", 3, 3);
        RULES.put("DATEDIFF", FunctionRules::dateDiff);
        RULES.put("DATEADD", FunctionRules::dateAdd);
        RULES.put("DATETRUNC", FunctionRules::dateTrunc);
        RULES.put("DATEPART", FunctionRules::datePart);
        RULES.put("DATENAME", FunctionRules::dateName);
        RULES.put(
                "DATE",
                (call, args, ctx) ->
                        args.size() == 1
                                ? ctx.closestMatch(
                                        call,
                                        DaxCall.of("DATEVALUE", args.get(0)),
                                        "DATE conversion is done with DATEVALUE and follows the model culture")
                                : unsupported(call, args, ctx));
    }

    private FunctionRules() {}

    static Optional<FunctionRule> lookup(String name) {
        return Optional.ofNullable(RULES.get(name.toUpperCase(Locale.ROOT)));
    }

    private static void rename(String tableauName, String daxName, int minArity, int maxArity) {
        RULES.put(
                tableauName,
                (call, args, ctx) ->
                        args.size() >= minArity && args.size() <= maxArity
                                ? new DaxCall(daxName, args)
                                : unsupported(call, args, ctx));
    }

    private static DaxExpr unsupported(FunctionCallNode call, List<DaxExpr> args, RuleContext ctx) {
        return ctx.closestMatch(call, DaxCall.blank(), ClosestMatchRules.UNSUPPORTED_ARGUMENTS);
    }

    /** Functions whose second argument is optional in Tableau but required in DAX. */
    private static DaxExpr withDefault(
            FunctionCallNode call, List<DaxExpr> args, RuleContext ctx, String daxName, DaxExpr secondArgument) {
        if (args.size() == 1) {
            return DaxCall.of(daxName, args.get(0), secondArgument);
        }
        if (args.size() == 2) {
            return new DaxCall(daxName, args);
        }
        return unsupported(call, args, ctx);
    }

    private static DaxExpr convert(FunctionCallNode call, List<DaxExpr> args, RuleContext ctx, String type) {
        if (args.size() != 1) {
            return unsupported(call, args, ctx);
        }
        return DaxCall.of("CONVERT", args.get(0), DaxLiteral.keyword(type));
    }

    private static DaxExpr iif(FunctionCallNode call, List<DaxExpr> args, RuleContext ctx) {
        if (args.size() == 3) {
            return new DaxCall("IF", args);
        }
        if (args.size() == 4) {
            return ctx.closestMatch(
                    call,
                    DaxCall.of("IF", args.get(0), args.get(1), args.get(2)),
                    "IIF unknown-result branch was dropped; unknown tests take the false branch");
        }
        return unsupported(call, args, ctx);
    }

    private static DaxExpr mid(FunctionCallNode call, List<DaxExpr> args, RuleContext ctx) {
        if (args.size() == 2) {
            return DaxCall.of("MID", args.get(0), args.get(1), DaxCall.of("LEN", args.get(0)));
        }
        if (args.size() == 3) {
            return new DaxCall("MID", args);
        }
        return unsupported(call, args, ctx);
    }

    /** Tableau {@code FIND(string, substring[, start])} returns 0 when not found. */
    private static DaxExpr find(FunctionCallNode call, List<DaxExpr> args, RuleContext ctx) {
        if (args.size() == 2) {
            return DaxCall.of("FIND", args.get(1), args.get(0), DaxLiteral.number(1), DaxLiteral.number(0));
        }
        if (args.size() == 3) {
            return DaxCall.of("FIND", args.get(1), args.get(0), args.get(2), DaxLiteral.number(0));
        }
        return unsupported(call, args, ctx);
    }

    private static DaxExpr affix(FunctionCallNode call, List<DaxExpr> args, RuleContext ctx, String side) {
        if (args.size() != 2) {
            return unsupported(call, args, ctx);
        }
        DaxExpr part = DaxCall.of(side, args.get(0), DaxCall.of("LEN", args.get(1)));
        return new DaxBinary(DaxOperator.EQUALS, part, args.get(1));
    }

    private static DaxExpr oneSidedTrim(FunctionCallNode call, List<DaxExpr> args, RuleContext ctx) {
        if (args.size() != 1) {
            return unsupported(call, args, ctx);
        }
        return ctx.closestMatch(
                call, DaxCall.of("TRIM", args.get(0)), "DAX only trims both sides; inner runs of spaces also collapse");
    }

    private static DaxExpr ascii(FunctionCallNode call, List<DaxExpr> args, RuleContext ctx) {
        if (args.size() != 1) {
            return unsupported(call, args, ctx);
        }
        return ctx.closestMatch(
                call, DaxCall.of("UNICODE", args.get(0)), "ASCII is mapped to UNICODE, equal for ASCII characters");
    }

    private static DaxExpr split(FunctionCallNode call, List<DaxExpr> args, RuleContext ctx) {
        if (args.size() != 3) {
            return unsupported(call, args, ctx);
        }
        DaxExpr path = DaxCall.of("SUBSTITUTE", args.get(0), args.get(1), DaxLiteral.string("|"));
        return ctx.closestMatch(
                call,
                DaxCall.of("PATHITEM", path, args.get(2)),
                "SPLIT is emulated with PATHITEM; negative tokens and strings containing | differ");
    }

    private static Optional<String> interval(FunctionCallNode call, RuleContext ctx) {
        if (call.getArguments().isEmpty()) {
            return Optional.empty();
        }
        return ctx.literalText(call.getArguments().get(0));
    }

    private static DaxExpr dateDiff(FunctionCallNode call, List<DaxExpr> args, RuleContext ctx) {
        Optional<String> part = interval(call, ctx);
        if (args.size() < 3 || part.isEmpty() || !DATE_INTERVALS.containsKey(part.get())) {
            return unsupported(call, args, ctx);
        }
        DaxExpr diff = DaxCall.of("DATEDIFF", args.get(1), args.get(2), DaxLiteral.keyword(DATE_INTERVALS.get(part.get())));
        if (args.size() > 3) {
            return ctx.closestMatch(call, diff, "Week start argument was ignored");
        }
        return diff;
    }

    private static DaxExpr dateAdd(FunctionCallNode call, List<DaxExpr> args, RuleContext ctx) {
        Optional<String> part = interval(call, ctx);
        if (args.size() != 3 || part.isEmpty()) {
            return unsupported(call, args, ctx);
        }
        DaxExpr amount = args.get(1);
        DaxExpr date = args.get(2);
        switch (part.get()) {
            case "year":
                return DaxCall.of("EDATE", date, new DaxBinary(DaxOperator.MULTIPLY, amount, DaxLiteral.number(12)));
            case "quarter":
                return DaxCall.of("EDATE", date, new DaxBinary(DaxOperator.MULTIPLY, amount, DaxLiteral.number(3)));
            case "month":
                return DaxCall.of("EDATE", date, amount);
            case "week":
                return new DaxBinary(DaxOperator.ADD, date, new DaxBinary(DaxOperator.MULTIPLY, amount, DaxLiteral.number(7)));
            case "day":
                return new DaxBinary(DaxOperator.ADD, date, amount);
            default:
                return unsupported(call, args, ctx);
        }
    }

    private static DaxExpr dateTrunc(FunctionCallNode call, List<DaxExpr> args, RuleContext ctx) {
        Optional<String> part = interval(call, ctx);
        if (args.size() < 2 || part.isEmpty()) {
            return unsupported(call, args, ctx);
        }
        DaxExpr date = args.get(1);
        DaxExpr year = DaxCall.of("YEAR", date);
        DaxExpr truncated;
        switch (part.get()) {
            case "year":
                truncated = DaxCall.of("DATE", year, DaxLiteral.number(1), DaxLiteral.number(1));
                break;
            case "quarter":
                DaxExpr quarterStart =
                        new DaxBinary(
                                DaxOperator.ADD,
                                new DaxBinary(
                                        DaxOperator.MULTIPLY,
                                        new DaxBinary(DaxOperator.SUBTRACT, DaxCall.of("QUARTER", date), DaxLiteral.number(1)),
                                        DaxLiteral.number(3)),
                                DaxLiteral.number(1));
                truncated = DaxCall.of("DATE", year, quarterStart, DaxLiteral.number(1));
                break;
            case "month":
                truncated = DaxCall.of("DATE", year, DaxCall.of("MONTH", date), DaxLiteral.number(1));
                break;
            case "day":
                truncated = DaxCall.of("DATE", year, DaxCall.of("MONTH", date), DaxCall.of("DAY", date));
                break;
            default:
                return unsupported(call, args, ctx);
        }
        if (args.size() > 2) {
            return ctx.closestMatch(call, truncated, "Week start argument was ignored");
        }
        return truncated;
    }

    private static DaxExpr datePart(FunctionCallNode call, List<DaxExpr> args, RuleContext ctx) {
        Optional<String> part = interval(call, ctx);
        if (args.size() < 2 || part.isEmpty()) {
            return unsupported(call, args, ctx);
        }
        DaxExpr date = args.get(1);
        switch (part.get()) {
            case "year":
                return DaxCall.of("YEAR", date);
            case "quarter":
                return DaxCall.of("QUARTER", date);
            case "month":
                return DaxCall.of("MONTH", date);
            case "day":
                return DaxCall.of("DAY", date);
            case "weekday":
                return DaxCall.of("WEEKDAY", date);
            case "week":
                return DaxCall.of("WEEKNUM", date);
            case "hour":
                return DaxCall.of("HOUR", date);
            case "minute":
                return DaxCall.of("MINUTE", date);
            case "second":
                return DaxCall.of("SECOND", date);
            default:
                return unsupported(call, args, ctx);
        }
    }

    private static DaxExpr dateName(FunctionCallNode call, List<DaxExpr> args, RuleContext ctx) {
        Optional<String> part = interval(call, ctx);
        if (args.size() < 2 || part.isEmpty()) {
            return unsupported(call, args, ctx);
        }
        String format;
        switch (part.get()) {
            case "year":
                format = "yyyy";
                break;
            case "month":
                format = "MMMM";
                break;
            case "day":
                format = "d";
                break;
            case "weekday":
                format = "dddd";
                break;
            case "quarter":
                return DaxCall.of("FORMAT", DaxCall.of("QUARTER", args.get(1)), DaxLiteral.string("0"));
            default:
                return unsupported(call, args, ctx);
        }
        return DaxCall.of("FORMAT", args.get(1), DaxLiteral.string(format));
    }

    static boolean isStringFunction(String name) {
        switch (name) {
            case "LEFT":
            case "RIGHT":
            case "MID":
            case "UPPER":
            case "LOWER":
            case "TRIM":
            case "LTRIM":
            case "RTRIM":
            case "REPLACE":
            case "STR":
            case "DATENAME":
            case "SPLIT":
            case "CHAR":
                return true;
            default:
                return false;
        }
    }

    static boolean isDateFunction(String name) {
        switch (name) {
            case "TODAY":
            case "DATEADD":
            case "DATETRUNC":
            case "MAKEDATE":
            case "DATE":
                return true;
            default:
                return false;
        }
    }

    static boolean isBooleanFunction(String name) {
        switch (name) {
            case "CONTAINS":
            case "STARTSWITH":
            case "ENDSWITH":
            case "ISNULL":
                return true;
            default:
                return false;
        }
    }

    /** Functions whose result has the type of their first value argument. */
    static int passThroughArgument(String name) {
        switch (name) {
            case "IIF":
                return 1;
            case "IFNULL":
            case "ZN":
            case "MIN":
            case "MAX":
            case "ABS":
            case "ROUND":
                return 0;
            default:
                return -1;
        }
    }

    static ExprNode argument(FunctionCallNode call, int index) {
        return index >= 0 && index < call.getArguments().size() ? call.getArguments().get(index) : null;
    }
}
