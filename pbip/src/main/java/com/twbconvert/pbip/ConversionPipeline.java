package com.twbconvert.pbip;

import com.twbconvert.Version;
import com.twbconvert.assumption.Assumption;
import com.twbconvert.assumption.AssumptionCategory;
import com.twbconvert.assumption.AssumptionLog;
import com.twbconvert.dependency.CyclicDependencyException;
import com.twbconvert.dependency.DependencyResolver;
import com.twbconvert.dependency.ResolutionResult;
import com.twbconvert.extract.DuplicateNameException;
import com.twbconvert.extract.ExtractionResult;
import com.twbconvert.extract.MalformedDocumentException;
import com.twbconvert.extract.WorkbookExtractor;
import com.twbconvert.formula.ExpressionSyntaxException;
import com.twbconvert.formula.FormulaParser;
import com.twbconvert.formula.ast.ExprNode;
import com.twbconvert.formula.ast.UnparsedNode;
import com.twbconvert.pbip.artifact.Artifact;
import com.twbconvert.pbip.artifact.EmittedArtifactSet;
import com.twbconvert.pbip.model.ModelEmitter;
import com.twbconvert.pbip.model.ModelTable;
import com.twbconvert.pbip.model.SemanticModelSpec;
import com.twbconvert.pbip.report.ReportMapper;
import com.twbconvert.pbip.report.ReportMappingResult;
import com.twbconvert.pbip.report.ReportWriter;
import com.twbconvert.pbip.report.UnresolvedFieldProjectionException;
import com.twbconvert.pbip.validation.SchemaValidationException;
import com.twbconvert.pbip.validation.SchemaValidator;
import com.twbconvert.relationship.RelationshipBuilder;
import com.twbconvert.relationship.RelationshipResult;
import com.twbconvert.relationship.UnresolvedJoinReferenceException;
import com.twbconvert.translate.CalculatedFieldTranslator;
import com.twbconvert.translate.TranslationResult;
import com.twbconvert.workbook.CalculatedField;
import com.twbconvert.workbook.FieldKey;
import com.twbconvert.workbook.WorkbookModel;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Logger;
import org.w3c.dom.Document;

/**
 * Converts one parsed workbook into a validated PBIP artifact set.
 *
 * <p>Stages run in order: extraction, formula parsing, dependency resolution, level-by-level translation, table
 * emission, then relationship building and report mapping side by side, rendering and validation. A failure that
 * concerns a single field, join or projection is recorded as an {@link EntityIssue} and the run continues; the
 * checked exceptions thrown here abort it.</p>
 */
public final class ConversionPipeline {
    private static final Logger LOGGER = Logger.getLogger(ConversionPipeline.class.getName());

    private final WorkbookExtractor extractor;
    private final FormulaParser parser;
    private final DependencyResolver resolver;
    private final CalculatedFieldTranslator translator;
    private final RelationshipBuilder relationshipBuilder;
    private final ModelEmitter modelEmitter;
    private final ReportMapper reportMapper;
    private final ReportWriter reportWriter;
    private final SchemaValidator validator;

    public ConversionPipeline() {
        this(SchemaValidator.defaultRules());
    }

    public ConversionPipeline(SchemaValidator validator) {
        this.extractor = new WorkbookExtractor();
        this.parser = new FormulaParser();
        this.resolver = new DependencyResolver();
        this.translator = new CalculatedFieldTranslator(parser);
        this.relationshipBuilder = new RelationshipBuilder();
        this.modelEmitter = new ModelEmitter();
        this.reportMapper = new ReportMapper();
        this.reportWriter = new ReportWriter();
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    public ConversionResult convert(Document document, ConversionOptions options)
            throws MalformedDocumentException, DuplicateNameException, SchemaValidationException {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(options, "options");
        LOGGER.fine(() -> Version.GENERATOR + " converting project " + options.getProjectName());

        ExtractionResult extraction = extractor.extract(document);
        WorkbookModel model = extraction.getModel();
        AssumptionLog log = new AssumptionLog();
        List<Assumption> extracted = extraction.getAssumptions();
        for (int i = 0; i < extracted.size(); i++) {
            log.append(i, extracted.get(i));
        }
        List<EntityIssue> issues = new ArrayList<>();

        Map<FieldKey, ExprNode> parsed = parseAll(model, log, issues);
        ResolutionResult resolution = resolver.resolve(model, parsed);
        for (CalculatedField field : model.getCalculatedFields()) {
            CyclicDependencyException cycle = resolution.getExclusions().get(field.getKey());
            if (cycle != null) {
                issues.add(new EntityIssue(EntityIssue.Stage.DEPENDENCY, field.getName(), cycle));
                log.append(
                        field.getDeclarationIndex(),
                        new Assumption(
                                AssumptionCategory.TRANSLATION,
                                field.getDatasourceName() + "/" + field.getName(),
                                field.getFormula(),
                                "",
                                "Field is part of or depends on the cycle " + cycle.getCycleNames()
                                        + " and was left out"));
            }
        }

        ExecutorService owned = null;
        Executor executor = options.getExecutor();
        if (executor == null) {
            if (options.getParallelism() > 1) {
                owned = Executors.newFixedThreadPool(options.getParallelism());
                executor = owned;
            } else {
                executor = Runnable::run;
            }
        }
        try {
            TranslationResult translation = translator.translate(model, resolution, parsed, log, executor);
            List<ModelTable> tables = modelEmitter.buildTables(model, translation, log);

            CompletableFuture<RelationshipResult> relationships =
                    CompletableFuture.supplyAsync(() -> relationshipBuilder.build(model, log), executor);
            CompletableFuture<ReportMappingResult> report =
                    CompletableFuture.supplyAsync(
                            () -> reportMapper.map(model, translation, tables, options, log), executor);
            RelationshipResult relationshipResult = join(relationships);
            ReportMappingResult reportResult = join(report);

            for (UnresolvedJoinReferenceException failure : relationshipResult.getFailures()) {
                issues.add(new EntityIssue(EntityIssue.Stage.RELATIONSHIP, failure.getEdge().describe(), failure));
            }
            for (UnresolvedFieldProjectionException failure : reportResult.getFailures()) {
                issues.add(new EntityIssue(EntityIssue.Stage.REPORT, failure.getWorksheet(), failure));
            }

            SemanticModelSpec semanticModel =
                    new SemanticModelSpec(
                            options.getSchemaVersion().getCulture(),
                            tables,
                            modelEmitter.buildRelationships(relationshipResult.getRelationships()));
            List<Artifact> documents = new ArrayList<>(modelEmitter.render(semanticModel, options));
            documents.addAll(reportWriter.render(reportResult.getReport(), options));
            EmittedArtifactSet artifacts = new EmittedArtifactSet(semanticModel, reportResult.getReport(), documents);

            validator.validate(artifacts);
            List<Assumption> assumptions = log.entries();
            LOGGER.fine(() -> "Emitted " + artifacts.getDocuments().size() + " document(s) with "
                    + assumptions.size() + " assumption(s) and " + issues.size() + " entity issue(s)");
            return new ConversionResult(artifacts, assumptions, issues);
        } finally {
            if (owned != null) {
                owned.shutdown();
            }
        }
    }

    private Map<FieldKey, ExprNode> parseAll(WorkbookModel model, AssumptionLog log, List<EntityIssue> issues) {
        Map<FieldKey, ExprNode> parsed = new HashMap<>();
        for (CalculatedField field : model.getCalculatedFields()) {
            try {
                parsed.put(field.getKey(), parser.parse(field.getFormula(), field.getAddressing()));
            } catch (ExpressionSyntaxException e) {
                LOGGER.warning(() -> "Cannot parse " + field.getName() + ": " + e.getMessage());
                issues.add(new EntityIssue(EntityIssue.Stage.PARSING, field.getName(), e));
                log.append(
                        field.getDeclarationIndex(),
                        new Assumption(
                                AssumptionCategory.PARSING,
                                field.getDatasourceName() + "/" + field.getName(),
                                field.getFormula(),
                                "BLANK()",
                                "Formula does not parse (" + e.getMessage() + "); the field evaluates to blank"));
                parsed.put(field.getKey(), new UnparsedNode(field.getFormula(), e.getMessage()));
            }
        }
        return parsed;
    }

    private static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }
}
