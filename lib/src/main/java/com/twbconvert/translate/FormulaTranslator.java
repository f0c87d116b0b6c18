package com.twbconvert.translate;

import com.twbconvert.assumption.Assumption;
import com.twbconvert.assumption.AssumptionCategory;
import com.twbconvert.formula.ReferenceCollector;
import com.twbconvert.formula.ast.AggregationNode;
import com.twbconvert.formula.ast.BinaryOpNode;
import com.twbconvert.formula.ast.ConditionalBranch;
import com.twbconvert.formula.ast.ConditionalNode;
import com.twbconvert.formula.ast.ExprNode;
import com.twbconvert.formula.ast.ExprVisitor;
import com.twbconvert.formula.ast.FieldRefNode;
import com.twbconvert.formula.ast.FunctionCallNode;
import com.twbconvert.formula.ast.LiteralNode;
import com.twbconvert.formula.ast.LodKind;
import com.twbconvert.formula.ast.LodScopeNode;
import com.twbconvert.formula.ast.UnaryOpNode;
import com.twbconvert.formula.ast.UnparsedNode;
import com.twbconvert.formula.ast.WindowFunctionNode;
import com.twbconvert.translate.dax.DaxBinary;
import com.twbconvert.translate.dax.DaxCall;
import com.twbconvert.translate.dax.DaxColumnRef;
import com.twbconvert.translate.dax.DaxContextOverride;
import com.twbconvert.translate.dax.DaxExpr;
import com.twbconvert.translate.dax.DaxLiteral;
import com.twbconvert.translate.dax.DaxMeasureRef;
import com.twbconvert.translate.dax.DaxOperator;
import com.twbconvert.translate.dax.DaxTableRef;
import com.twbconvert.translate.dax.DaxUnary;
import com.twbconvert.translate.dax.DaxWriter;
import com.twbconvert.workbook.CalculatedField;
import com.twbconvert.workbook.DataType;
import com.twbconvert.workbook.TableCalcAddressing;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Translates one parsed calculation into DAX. Each node kind has one rule; function calls are further dispatched by
 * name through {@link FunctionRules}. A node without an exact rule takes its {@link ClosestMatchRules} entry and
 * records exactly one assumption naming the node's source text.
 *
 * <p>Instances are safe to share between threads as long as the {@link SymbolTable} only gains entries for fields
 * that no concurrently translated field references.</p>
 */
public final class FormulaTranslator {
    private static final Pattern ISO_DATE =
            Pattern.compile("(\\d{4})-(\\d{1,2})-(\\d{1,2})(?:[ T](\\d{1,2}):(\\d{2})(?::(\\d{2}))?)?");

    private static final Map<String, String> SIMPLE_AGGREGATES =
            Map.ofEntries(
                    Map.entry("SUM", "SUM"),
                    Map.entry("AVG", "AVERAGE"),
                    Map.entry("MIN", "MIN"),
                    Map.entry("MAX", "MAX"),
                    Map.entry("COUNT", "COUNT"),
                    Map.entry("COUNTD", "DISTINCTCOUNT"),
                    Map.entry("MEDIAN", "MEDIAN"),
                    Map.entry("STDEV", "STDEV.S"),
                    Map.entry("STDEVP", "STDEV.P"),
                    Map.entry("VAR", "VAR.S"),
                    Map.entry("VARP", "VAR.P"),
                    Map.entry("PERCENTILE", "PERCENTILE.INC"));

    private static final Map<String, String> ITERATORS =
            Map.ofEntries(
                    Map.entry("SUM", "SUMX"),
                    Map.entry("AVG", "AVERAGEX"),
                    Map.entry("MIN", "MINX"),
                    Map.entry("MAX", "MAXX"),
                    Map.entry("COUNT", "COUNTX"),
                    Map.entry("MEDIAN", "MEDIANX"),
                    Map.entry("STDEV", "STDEVX.S"),
                    Map.entry("STDEVP", "STDEVX.P"),
                    Map.entry("VAR", "VARX.S"),
                    Map.entry("VARP", "VARX.P"),
                    Map.entry("ATTR", "MAXX"));

    private static final Map<String, String> WINDOW_ITERATORS =
            Map.of(
                    "WINDOW_SUM", "SUMX",
                    "WINDOW_AVG", "AVERAGEX",
                    "WINDOW_MIN", "MINX",
                    "WINDOW_MAX", "MAXX",
                    "WINDOW_COUNT", "COUNTX",
                    "WINDOW_MEDIAN", "MEDIANX");

    private final SymbolTable symbols;

    public FormulaTranslator(SymbolTable symbols) {
        this.symbols = Objects.requireNonNull(symbols, "symbols");
    }

    public TranslatedExpression translate(CalculatedField field, ExprNode root) {
        return translate(field, root, null, field.getDeclarationIndex());
    }

    /**
     * @param forced classification to use instead of the inferred one, or {@code null}
     */
    public TranslatedExpression translate(
            CalculatedField field, ExprNode root, FieldClassification forced, int declarationIndex) {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(root, "root");
        FieldClassification classification =
                forced != null
                        ? forced
                        : FieldClassifier.classify(root, symbols, field.getDatasourceName(), field.getDeclaredRole());
        Translation translation = new Translation(field);
        String home = translation.homeTable(root);
        if (classification == FieldClassification.COLUMN) {
            translation.rowTable = home;
        }
        DaxExpr dax = root.accept(translation);

        DataType resultType = field.getDataType();
        if (resultType == DataType.UNSUPPORTED) {
            resultType = translation.typeOf(root);
        }
        if (resultType == DataType.UNSUPPORTED) {
            resultType = DataType.STRING;
        }
        return new TranslatedExpression(
                field.getKey(),
                field.getName(),
                home,
                classification,
                dax,
                resultType,
                field.getFormatString(),
                translation.assumptions,
                declarationIndex);
    }

    private final class Translation implements ExprVisitor<DaxExpr>, RuleContext {
        private final CalculatedField field;
        private final String datasource;
        private final TypeInference types;
        private final List<Assumption> assumptions = new ArrayList<>();
        /** Table whose row context is active, or {@code null} under a pure filter context. */
        private String rowTable;

        Translation(CalculatedField field) {
            this.field = field;
            this.datasource = field.getDatasourceName();
            this.types = new TypeInference(symbols, datasource);
        }

        String homeTable(ExprNode root) {
            for (FieldRefNode reference : ReferenceCollector.collect(root)) {
                Optional<FieldSymbol> symbol = symbols.resolve(reference, datasource);
                if (symbol.isPresent() && symbol.get().isRowLevel()) {
                    return symbol.get().getTable();
                }
            }
            return field.getOwningTable();
        }

        @Override
        public DaxExpr closestMatch(ExprNode node, DaxExpr approximation, String reason) {
            assumptions.add(
                    new Assumption(
                            AssumptionCategory.TRANSLATION,
                            field.getName(),
                            node.getSpan().slice(field.getFormula()),
                            DaxWriter.write(approximation),
                            reason));
            return approximation;
        }

        @Override
        public Optional<String> literalText(ExprNode node) {
            if (node instanceof LiteralNode literal && literal.getKind() == LiteralNode.Kind.STRING) {
                return Optional.of(literal.getValue().toLowerCase(Locale.ROOT));
            }
            return Optional.empty();
        }

        @Override
        public DataType typeOf(ExprNode node) {
            return types.infer(node);
        }

        private DaxExpr withRowTable(String table, Supplier<DaxExpr> body) {
            String saved = rowTable;
            rowTable = table;
            try {
                return body.get();
            } finally {
                rowTable = saved;
            }
        }

        private List<DaxExpr> translateAll(List<ExprNode> nodes) {
            List<DaxExpr> result = new ArrayList<>(nodes.size());
            for (ExprNode node : nodes) {
                result.add(node.accept(this));
            }
            return result;
        }

        private Optional<FieldSymbol> rowLevelSymbol(ExprNode node) {
            if (node instanceof FieldRefNode reference) {
                return symbols.resolve(reference, datasource).filter(FieldSymbol::isRowLevel);
            }
            return Optional.empty();
        }

        // ------------------------------------------------------------ leaves

        @Override
        public DaxExpr visitLiteral(LiteralNode node) {
            switch (node.getKind()) {
                case NUMBER:
                    return DaxLiteral.number(node.getValue());
                case STRING:
                    return DaxLiteral.string(node.getValue());
                case BOOLEAN:
                    return DaxLiteral.bool(Boolean.parseBoolean(node.getValue()));
                case DATE:
                    return dateLiteral(node);
                default:
                    return DaxCall.blank();
            }
        }

        private DaxExpr dateLiteral(LiteralNode node) {
            Matcher matcher = ISO_DATE.matcher(node.getValue());
            if (!matcher.matches()) {
                return closestMatch(
                        node, DaxCall.of("DATEVALUE", DaxLiteral.string(node.getValue())), ClosestMatchRules.DATE_LITERAL);
            }
            DaxExpr date =
                    DaxCall.of(
                            "DATE",
                            DaxLiteral.number(Long.parseLong(matcher.group(1))),
                            DaxLiteral.number(Long.parseLong(matcher.group(2))),
                            DaxLiteral.number(Long.parseLong(matcher.group(3))));
            if (matcher.group(4) == null) {
                return date;
            }
            DaxExpr time =
                    DaxCall.of(
                            "TIME",
                            DaxLiteral.number(Long.parseLong(matcher.group(4))),
                            DaxLiteral.number(Long.parseLong(matcher.group(5))),
                            DaxLiteral.number(matcher.group(6) == null ? 0 : Long.parseLong(matcher.group(6))));
            return new DaxBinary(DaxOperator.ADD, date, time);
        }

        @Override
        public DaxExpr visitFieldRef(FieldRefNode node) {
            Optional<FieldSymbol> resolved = symbols.resolve(node, datasource);
            if (resolved.isEmpty()) {
                return closestMatch(node, DaxCall.blank(), ClosestMatchRules.UNRESOLVED_REFERENCE);
            }
            FieldSymbol symbol = resolved.get();
            if (!symbol.isRowLevel()) {
                return new DaxMeasureRef(symbol.getTable(), symbol.getName());
            }
            DaxColumnRef column = new DaxColumnRef(symbol.getTable(), symbol.getName());
            if (rowTable == null) {
                return closestMatch(
                        node, DaxCall.of("SELECTEDVALUE", column), ClosestMatchRules.ROW_LEVEL_IN_AGGREGATE);
            }
            if (rowTable.equals(symbol.getTable())) {
                return column;
            }
            return closestMatch(node, DaxCall.of("RELATED", column), ClosestMatchRules.RELATED_COLUMN);
        }

        @Override
        public DaxExpr visitUnparsed(UnparsedNode node) {
            return closestMatch(node, DaxCall.blank(), ClosestMatchRules.UNPARSED + ": " + node.getReason());
        }

        // ------------------------------------------------------------ operators

        @Override
        public DaxExpr visitBinaryOp(BinaryOpNode node) {
            DaxExpr left = node.getLeft().accept(this);
            DaxExpr right = node.getRight().accept(this);
            switch (node.getOperator()) {
                case ADD:
                    boolean text = typeOf(node.getLeft()) == DataType.STRING || typeOf(node.getRight()) == DataType.STRING;
                    return new DaxBinary(text ? DaxOperator.CONCATENATE : DaxOperator.ADD, left, right);
                case SUBTRACT:
                    return new DaxBinary(DaxOperator.SUBTRACT, left, right);
                case MULTIPLY:
                    return new DaxBinary(DaxOperator.MULTIPLY, left, right);
                case DIVIDE:
                    return DaxCall.of("DIVIDE", left, right);
                case MODULO:
                    return DaxCall.of("MOD", left, right);
                case POWER:
                    return new DaxBinary(DaxOperator.POWER, left, right);
                case EQUALS:
                    return new DaxBinary(DaxOperator.EQUALS, left, right);
                case NOT_EQUALS:
                    return new DaxBinary(DaxOperator.NOT_EQUALS, left, right);
                case LESS:
                    return new DaxBinary(DaxOperator.LESS, left, right);
                case LESS_OR_EQUAL:
                    return new DaxBinary(DaxOperator.LESS_OR_EQUAL, left, right);
                case GREATER:
                    return new DaxBinary(DaxOperator.GREATER, left, right);
                case GREATER_OR_EQUAL:
                    return new DaxBinary(DaxOperator.GREATER_OR_EQUAL, left, right);
                case AND:
                    return new DaxBinary(DaxOperator.AND, left, right);
                case OR:
                    return new DaxBinary(DaxOperator.OR, left, right);
                default:
                    throw new IllegalStateException("Unhandled operator " + node.getOperator());
            }
        }

        @Override
        public DaxExpr visitUnaryOp(UnaryOpNode node) {
            DaxExpr operand = node.getOperand().accept(this);
            if (node.getOperator() == UnaryOpNode.Operator.NOT) {
                return DaxCall.of("NOT", operand);
            }
            return new DaxUnary(operand);
        }

        @Override
        public DaxExpr visitConditional(ConditionalNode node) {
            DaxExpr otherwise = node.getElseResult() == null ? DaxCall.blank() : node.getElseResult().accept(this);
            if (node.isCase()) {
                List<DaxExpr> arguments = new ArrayList<>();
                arguments.add(node.getCaseOperand().accept(this));
                for (ConditionalBranch branch : node.getBranches()) {
                    arguments.add(branch.getCondition().accept(this));
                    arguments.add(branch.getResult().accept(this));
                }
                arguments.add(otherwise);
                return new DaxCall("SWITCH", arguments);
            }
            List<DaxExpr> conditions = new ArrayList<>();
            List<DaxExpr> results = new ArrayList<>();
            for (ConditionalBranch branch : node.getBranches()) {
                conditions.add(branch.getCondition().accept(this));
                results.add(branch.getResult().accept(this));
            }
            DaxExpr chain = otherwise;
            for (int i = conditions.size() - 1; i >= 0; i--) {
                chain = DaxCall.of("IF", conditions.get(i), results.get(i), chain);
            }
            return chain;
        }

        @Override
        public DaxExpr visitFunctionCall(FunctionCallNode node) {
            List<DaxExpr> arguments = translateAll(node.getArguments());
            Optional<FunctionRule> rule = FunctionRules.lookup(node.getName());
            if (rule.isEmpty()) {
                return closestMatch(
                        node, DaxCall.blank(), ClosestMatchRules.UNKNOWN_FUNCTION + ": " + node.getName());
            }
            return rule.get().apply(node, arguments, this);
        }

        // ------------------------------------------------------------ aggregation

        @Override
        public DaxExpr visitAggregation(AggregationNode node) {
            String function = node.getFunction();
            ExprNode operand = node.getOperand();
            List<DaxExpr> extra = translateAll(node.getExtraArguments());

            if (operand instanceof LodScopeNode lod && lod.getKind() == LodKind.INCLUDE) {
                return includeUnderAggregation(node, lod, extra);
            }

            Optional<FieldSymbol> column = rowLevelSymbol(operand);
            if (column.isPresent()) {
                DaxColumnRef ref = new DaxColumnRef(column.get().getTable(), column.get().getName());
                if ("ATTR".equals(function)) {
                    return closestMatch(node, DaxCall.of("SELECTEDVALUE", ref), ClosestMatchRules.ATTR);
                }
                String daxFunction = SIMPLE_AGGREGATES.get(function);
                if ("COUNT".equals(function) && !column.get().getDataType().isNumeric()) {
                    daxFunction = "COUNTA";
                }
                List<DaxExpr> arguments = new ArrayList<>();
                arguments.add(ref);
                arguments.addAll(extra);
                return new DaxCall(daxFunction, arguments);
            }

            if (operand instanceof FieldRefNode reference) {
                Optional<FieldSymbol> measure = symbols.resolve(reference, datasource);
                if (measure.isPresent()) {
                    return closestMatch(
                            node,
                            new DaxMeasureRef(measure.get().getTable(), measure.get().getName()),
                            ClosestMatchRules.AGGREGATE_OF_MEASURE);
                }
            }

            String table = homeTable(operand);
            DaxExpr expression = withRowTable(table, () -> operand.accept(this));
            DaxExpr iterated = iterate(function, new DaxTableRef(table), expression, extra);
            if ("ATTR".equals(function)) {
                return closestMatch(node, iterated, ClosestMatchRules.ATTR);
            }
            return iterated;
        }

        private DaxExpr iterate(String function, DaxExpr table, DaxExpr expression, List<DaxExpr> extra) {
            if ("COUNTD".equals(function)) {
                return DaxCall.of(
                        "COUNTROWS",
                        DaxCall.of(
                                "DISTINCT",
                                DaxCall.of("SELECTCOLUMNS", table, DaxLiteral.string("@value"), expression)));
            }
            if ("PERCENTILE".equals(function)) {
                List<DaxExpr> arguments = new ArrayList<>(List.of(table, expression));
                arguments.addAll(extra);
                return new DaxCall("PERCENTILEX.INC", arguments);
            }
            return DaxCall.of(ITERATORS.get(function), table, expression);
        }

        private DaxExpr includeUnderAggregation(AggregationNode node, LodScopeNode lod, List<DaxExpr> extra) {
            Dimensions dimensions = dimensionsOf(lod);
            DaxExpr body = withRowTable(null, () -> lod.getBody().accept(this));
            DaxExpr value = new DaxContextOverride(DaxContextOverride.Origin.INCLUDE, body, List.of());
            DaxExpr result = iterate(node.getFunction(), groupingTable(dimensions.columns, lod), value, extra);
            if ("ATTR".equals(node.getFunction())) {
                return closestMatch(node, result, ClosestMatchRules.ATTR);
            }
            if (!dimensions.complete) {
                return closestMatch(lod, result, ClosestMatchRules.LOD_DIMENSION);
            }
            return result;
        }

        // ------------------------------------------------------------ level of detail

        @Override
        public DaxExpr visitLodScope(LodScopeNode node) {
            Dimensions dimensions = dimensionsOf(node);
            DaxExpr body = withRowTable(null, () -> node.getBody().accept(this));
            DaxExpr result;
            String reason = dimensions.complete ? null : ClosestMatchRules.LOD_DIMENSION;
            switch (node.getKind()) {
                case FIXED:
                    result = fixed(body, dimensions.columns);
                    break;
                case EXCLUDE:
                    List<DaxExpr> modifiers =
                            dimensions.columns.isEmpty()
                                    ? List.of()
                                    : List.of(new DaxCall("REMOVEFILTERS", new ArrayList<>(dimensions.columns)));
                    result = new DaxContextOverride(DaxContextOverride.Origin.EXCLUDE, body, modifiers);
                    break;
                default:
                    result =
                            DaxCall.of(
                                    "SUMX",
                                    groupingTable(dimensions.columns, node),
                                    new DaxContextOverride(DaxContextOverride.Origin.INCLUDE, body, List.of()));
                    reason = ClosestMatchRules.INCLUDE_WITHOUT_AGGREGATE;
                    break;
            }
            return reason == null ? result : closestMatch(node, result, reason);
        }

        private DaxExpr fixed(DaxExpr body, List<DaxColumnRef> dimensions) {
            List<DaxExpr> modifiers = new ArrayList<>();
            if (dimensions.isEmpty()) {
                modifiers.add(DaxCall.of("REMOVEFILTERS"));
            } else if (dimensions.stream().map(DaxColumnRef::getTable).distinct().count() == 1) {
                List<DaxExpr> allExcept = new ArrayList<>();
                allExcept.add(new DaxTableRef(dimensions.get(0).getTable()));
                allExcept.addAll(dimensions);
                modifiers.add(new DaxCall("ALLEXCEPT", allExcept));
            } else {
                modifiers.add(DaxCall.of("REMOVEFILTERS"));
                for (DaxColumnRef dimension : dimensions) {
                    modifiers.add(DaxCall.of("VALUES", dimension));
                }
            }
            return new DaxContextOverride(DaxContextOverride.Origin.FIXED, body, modifiers);
        }

        private DaxExpr groupingTable(List<DaxColumnRef> dimensions, LodScopeNode scope) {
            if (dimensions.isEmpty()) {
                return new DaxTableRef(homeTable(scope.getBody()));
            }
            if (dimensions.size() == 1) {
                return DaxCall.of("VALUES", dimensions.get(0));
            }
            List<DaxExpr> arguments = new ArrayList<>();
            arguments.add(new DaxTableRef(dimensions.get(0).getTable()));
            arguments.addAll(dimensions);
            return new DaxCall("SUMMARIZE", arguments);
        }

        private Dimensions dimensionsOf(LodScopeNode node) {
            List<DaxColumnRef> columns = new ArrayList<>();
            boolean complete = true;
            for (ExprNode dimension : node.getDimensions()) {
                Optional<FieldSymbol> symbol = rowLevelSymbol(dimension);
                if (symbol.isPresent()) {
                    columns.add(new DaxColumnRef(symbol.get().getTable(), symbol.get().getName()));
                } else {
                    complete = false;
                }
            }
            return new Dimensions(columns, complete);
        }

        // ------------------------------------------------------------ table calculations

        @Override
        public DaxExpr visitWindowFunction(WindowFunctionNode node) {
            String function = node.getFunction();
            List<ExprNode> arguments = node.getArguments();
            DaxExpr inner = arguments.isEmpty() ? null : withRowTable(null, () -> arguments.get(0).accept(this));

            if ("TOTAL".equals(function)) {
                if (inner == null) {
                    return closestMatch(node, DaxCall.blank(), ClosestMatchRules.UNSUPPORTED_ARGUMENTS);
                }
                return new DaxContextOverride(
                        DaxContextOverride.Origin.WINDOW, inner, List.of(DaxCall.of("ALLSELECTED")));
            }

            Optional<DaxColumnRef> ordering = orderingColumn(node.getAddressing());
            boolean needsArgument = !"INDEX".equals(function)
                    && !"SIZE".equals(function)
                    && !"FIRST".equals(function)
                    && !"LAST".equals(function);
            if (needsArgument && inner == null) {
                return closestMatch(node, DaxCall.blank(), ClosestMatchRules.UNSUPPORTED_ARGUMENTS);
            }
            if (ordering.isEmpty()) {
                DaxExpr fallback = inner != null ? inner : DaxLiteral.number(1);
                return closestMatch(node, fallback, ClosestMatchRules.WINDOW_WITHOUT_ORDERING);
            }
            DaxExpr result = windowed(node, inner, ordering.get());
            List<String> unresolved = unresolvedPartitions(node.getAddressing());
            if (!unresolved.isEmpty()) {
                return closestMatch(
                        node, result, ClosestMatchRules.PARTITION_FIELD + ": " + String.join(", ", unresolved));
            }
            return result;
        }

        private DaxExpr windowed(WindowFunctionNode node, DaxExpr inner, DaxColumnRef order) {
            String function = node.getFunction();
            List<ExprNode> arguments = node.getArguments();
            boolean descending = node.getAddressing().isDescending();
            DaxExpr window = DaxCall.of("ALLSELECTED", order);

            switch (function) {
                case "RUNNING_SUM":
                case "RUNNING_MIN":
                case "RUNNING_MAX":
                case "RUNNING_COUNT":
                    return new DaxContextOverride(
                            DaxContextOverride.Origin.WINDOW, inner, List.of(runningFilter(order, descending)));
                case "RUNNING_AVG":
                    return closestMatch(
                            node,
                            DaxCall.of("AVERAGEX", runningFilter(order, descending), transition(inner)),
                            ClosestMatchRules.RUNNING_AVG);
                case "WINDOW_SUM":
                case "WINDOW_AVG":
                case "WINDOW_MIN":
                case "WINDOW_MAX":
                case "WINDOW_COUNT":
                case "WINDOW_MEDIAN":
                    DaxExpr aggregate = DaxCall.of(WINDOW_ITERATORS.get(function), window, transition(inner));
                    if (arguments.size() > 1) {
                        return closestMatch(node, aggregate, ClosestMatchRules.WINDOW_OFFSETS);
                    }
                    return aggregate;
                case "RANK":
                case "RANK_DENSE":
                    return rank(node, window, inner, "RANK_DENSE".equals(function) ? "Dense" : "Skip");
                case "RANK_MODIFIED":
                case "RANK_UNIQUE":
                case "RANK_PERCENTILE":
                    return closestMatch(node, rank(node, window, inner, "Skip"), ClosestMatchRules.RANK_VARIANT);
                case "INDEX":
                    return index(window, order, descending);
                case "SIZE":
                    return DaxCall.of("COUNTROWS", window);
                case "FIRST":
                    return closestMatch(
                            node,
                            new DaxBinary(DaxOperator.SUBTRACT, DaxLiteral.number(1), index(window, order, descending)),
                            ClosestMatchRules.FIRST_LAST);
                case "LAST":
                    return closestMatch(
                            node,
                            new DaxBinary(
                                    DaxOperator.SUBTRACT,
                                    DaxCall.of("COUNTROWS", window),
                                    index(window, order, descending)),
                            ClosestMatchRules.FIRST_LAST);
                default:
                    return closestMatch(node, inner, ClosestMatchRules.LOOKUP);
            }
        }

        private DaxExpr runningFilter(DaxColumnRef order, boolean descending) {
            DaxOperator comparison = descending ? DaxOperator.GREATER_OR_EQUAL : DaxOperator.LESS_OR_EQUAL;
            DaxExpr bound = DaxCall.of(descending ? "MIN" : "MAX", order);
            return DaxCall.of(
                    "FILTER", DaxCall.of("ALLSELECTED", order), new DaxBinary(comparison, order, bound));
        }

        private DaxExpr transition(DaxExpr inner) {
            return new DaxContextOverride(DaxContextOverride.Origin.CONTEXT_TRANSITION, inner, List.of());
        }

        private DaxExpr rank(WindowFunctionNode node, DaxExpr window, DaxExpr inner, String ties) {
            boolean ascending =
                    node.getArguments().size() > 1
                            && literalText(node.getArguments().get(1)).map("asc"::equals).orElse(false);
            return DaxCall.of(
                    "RANKX",
                    window,
                    transition(inner),
                    DaxLiteral.omitted(),
                    DaxLiteral.keyword(ascending ? "ASC" : "DESC"),
                    DaxLiteral.keyword(ties));
        }

        private DaxExpr index(DaxExpr window, DaxColumnRef order, boolean descending) {
            return DaxCall.of(
                    "RANKX",
                    window,
                    transition(DaxCall.of("MAX", order)),
                    DaxLiteral.omitted(),
                    DaxLiteral.keyword(descending ? "DESC" : "ASC"),
                    DaxLiteral.keyword("Dense"));
        }

        /** ALLSELECTED over the ordering column keeps the filters of partition columns; other names cannot be kept. */
        private List<String> unresolvedPartitions(TableCalcAddressing addressing) {
            List<String> unresolved = new ArrayList<>();
            for (String name : addressing.getPartitionFields()) {
                if (symbols.resolve(null, name, datasource).filter(FieldSymbol::isRowLevel).isEmpty()) {
                    unresolved.add(name);
                }
            }
            return unresolved;
        }

        private Optional<DaxColumnRef> orderingColumn(TableCalcAddressing addressing) {
            for (String name : addressing.getOrderingFields()) {
                Optional<FieldSymbol> symbol =
                        symbols.resolve(null, name, datasource).filter(FieldSymbol::isRowLevel);
                if (symbol.isPresent()) {
                    return Optional.of(new DaxColumnRef(symbol.get().getTable(), symbol.get().getName()));
                }
            }
            return Optional.empty();
        }
    }

    private static final class Dimensions {
        final List<DaxColumnRef> columns;
        final boolean complete;

        Dimensions(List<DaxColumnRef> columns, boolean complete) {
            this.columns = columns;
            this.complete = complete;
        }
    }
}
