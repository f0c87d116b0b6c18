package com.twbconvert.translate;

import com.twbconvert.assumption.Assumption;
import com.twbconvert.assumption.AssumptionCategory;
import com.twbconvert.assumption.AssumptionLog;
import com.twbconvert.dependency.ResolutionResult;
import com.twbconvert.formula.ExpressionSyntaxException;
import com.twbconvert.formula.FormulaParser;
import com.twbconvert.formula.ast.ExprNode;
import com.twbconvert.formula.ast.LiteralNode;
import com.twbconvert.formula.ast.SourceSpan;
import com.twbconvert.workbook.CalculatedField;
import com.twbconvert.workbook.Column;
import com.twbconvert.workbook.ColumnRole;
import com.twbconvert.workbook.Datasource;
import com.twbconvert.workbook.FieldKey;
import com.twbconvert.workbook.Parameter;
import com.twbconvert.workbook.Table;
import com.twbconvert.workbook.TableCalcAddressing;
import com.twbconvert.workbook.WorkbookModel;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives {@link FormulaTranslator} over every translatable calculated field, one dependency level at a time.
 *
 * <p>Fields of one level only reference fields of lower levels, so a level is translated concurrently on the
 * supplied executor and its symbols are registered before the next level starts. Parameters are translated last
 * into measures of the {@link SymbolTable#PARAMETERS_TABLE} table.</p>
 */
public final class CalculatedFieldTranslator {
    private static final Logger LOGGER = Logger.getLogger(CalculatedFieldTranslator.class.getName());

    private final FormulaParser parser;

    public CalculatedFieldTranslator() {
        this(new FormulaParser());
    }

    public CalculatedFieldTranslator(FormulaParser parser) {
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    /**
     * @param parsed the parsed formula of every field in {@code resolution}'s order
     * @param executor runs the translations of one level; {@code Runnable::run} translates on the calling thread
     */
    public TranslationResult translate(
            WorkbookModel model,
            ResolutionResult resolution,
            Map<FieldKey, ExprNode> parsed,
            AssumptionLog log,
            Executor executor) {
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(resolution, "resolution");
        Objects.requireNonNull(parsed, "parsed");
        Objects.requireNonNull(log, "log");
        Objects.requireNonNull(executor, "executor");

        SymbolTable symbols = new SymbolTable(model);
        FormulaTranslator translator = new FormulaTranslator(symbols);
        Map<FieldKey, String> targetNames = assignTargetNames(model, log);
        Map<FieldKey, TranslatedExpression> translated = new HashMap<>();

        int levelIndex = 0;
        for (List<CalculatedField> level : resolution.getLevels()) {
            List<CompletableFuture<TranslatedExpression>> pending = new ArrayList<>(level.size());
            for (CalculatedField field : level) {
                ExprNode root = parsed.get(field.getKey());
                if (root == null) {
                    throw new IllegalStateException("No parsed formula for " + field.getKey());
                }
                CalculatedField target = field.withName(targetNames.get(field.getKey()));
                pending.add(CompletableFuture.supplyAsync(() -> translator.translate(target, root), executor));
            }
            for (CompletableFuture<TranslatedExpression> future : pending) {
                TranslatedExpression expression = join(future);
                symbols.register(expression.getKey(), symbolOf(expression));
                log.appendAll(expression.getDeclarationIndex(), expression.getAssumptions());
                translated.put(expression.getKey(), expression);
            }
            final int current = levelIndex++;
            LOGGER.fine(() -> "Translated level " + current + ": " + level.size() + " field(s)");
        }
        final int levels = levelIndex;
        LOGGER.fine(() -> "Translated " + translated.size() + " calculated field(s) in " + levels + " level(s)");

        List<TranslatedExpression> fields = new ArrayList<>(translated.size());
        for (CalculatedField field : resolution.getOrder()) {
            fields.add(translated.get(field.getKey()));
        }

        List<TranslatedExpression> parameters = new ArrayList<>();
        int declarationIndex = model.getCalculatedFields().size();
        for (Parameter parameter : model.getParameters()) {
            TranslatedExpression expression = translateParameter(parameter, declarationIndex, translator, log);
            log.appendAll(declarationIndex, expression.getAssumptions());
            parameters.add(expression);
            declarationIndex++;
        }
        return new TranslationResult(fields, parameters, symbols);
    }

    /**
     * Measure and calculated-column names share one namespace in the target model. A calculated field whose caption
     * is already taken by a parameter, an earlier calculated field or a column of its datasource is emitted as
     * {@code Caption (Datasource)}, numbered further if that is taken too.
     */
    static Map<FieldKey, String> assignTargetNames(WorkbookModel model, AssumptionLog log) {
        Set<String> taken = new HashSet<>();
        for (Parameter parameter : model.getParameters()) {
            taken.add(parameter.getName().toLowerCase(Locale.ROOT));
        }
        Map<FieldKey, String> names = new LinkedHashMap<>();
        for (CalculatedField field : model.getCalculatedFields()) {
            Set<String> columns = new HashSet<>();
            for (Table table : model.tablesOf(field.getDatasourceName())) {
                for (Column column : table.getColumns()) {
                    columns.add(column.getName().toLowerCase(Locale.ROOT));
                }
            }
            String name = field.getName();
            if (taken.contains(name.toLowerCase(Locale.ROOT)) || columns.contains(name.toLowerCase(Locale.ROOT))) {
                String caption = model.findDatasource(field.getDatasourceName())
                        .map(Datasource::getCaption)
                        .orElse(field.getDatasourceName());
                String base = field.getName() + " (" + caption + ")";
                name = base;
                for (int n = 2; taken.contains(name.toLowerCase(Locale.ROOT))
                        || columns.contains(name.toLowerCase(Locale.ROOT)); n++) {
                    name = base + " " + n;
                }
                log.append(
                        field.getDeclarationIndex(),
                        new Assumption(
                                AssumptionCategory.TRANSLATION,
                                field.getName(),
                                field.getName(),
                                name,
                                "Name is already used in the model; the field was renamed"));
            }
            taken.add(name.toLowerCase(Locale.ROOT));
            names.put(field.getKey(), name);
        }
        return names;
    }

    private TranslatedExpression translateParameter(
            Parameter parameter, int declarationIndex, FormulaTranslator translator, AssumptionLog log) {
        String value = parameter.getValue() == null ? "" : parameter.getValue();
        CalculatedField field =
                new CalculatedField(
                        new FieldKey(SymbolTable.PARAMETERS_TABLE, parameter.getInternalName()),
                        parameter.getName(),
                        value,
                        parameter.getDataType(),
                        ColumnRole.MEASURE,
                        SymbolTable.PARAMETERS_TABLE,
                        null,
                        TableCalcAddressing.none(),
                        declarationIndex);
        ExprNode root;
        try {
            root = value.isEmpty()
                    ? new LiteralNode(LiteralNode.Kind.NULL, "", SourceSpan.empty())
                    : parser.parse(value);
        } catch (ExpressionSyntaxException e) {
            LOGGER.log(Level.FINE, "Parameter value is not an expression: " + parameter.getName(), e);
            log.append(
                    declarationIndex,
                    new Assumption(
                            AssumptionCategory.PARSING,
                            parameter.getName(),
                            value,
                            "\"" + value + "\"",
                            "Parameter value could not be parsed and is emitted as text"));
            root = new LiteralNode(LiteralNode.Kind.STRING, value, new SourceSpan(0, value.length()));
        }
        return translator.translate(field, root, FieldClassification.MEASURE, declarationIndex);
    }

    private static FieldSymbol symbolOf(TranslatedExpression expression) {
        FieldSymbol.Kind kind = expression.isMeasure() ? FieldSymbol.Kind.MEASURE : FieldSymbol.Kind.CALCULATED_COLUMN;
        return new FieldSymbol(kind, expression.getTable(), expression.getName(), expression.getResultType());
    }

    private static TranslatedExpression join(CompletableFuture<TranslatedExpression> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (e.getCause() instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }
}
