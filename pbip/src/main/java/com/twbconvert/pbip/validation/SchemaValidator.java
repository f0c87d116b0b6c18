package com.twbconvert.pbip.validation;

import com.twbconvert.pbip.artifact.EmittedArtifactSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Runs a list of schema rules over the staged artifact set and aggregates their violations. Any violation fails the
 * whole set.
 */
public final class SchemaValidator {
    private static final Logger LOGGER = Logger.getLogger(SchemaValidator.class.getName());

    private final List<SchemaRule> rules;

    public SchemaValidator(List<SchemaRule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
    }

    /** Convenience factory that wires in the default rule set. */
    public static SchemaValidator defaultRules() {
        return new SchemaValidator(
                List.of(
                        new RequiredDocumentsRule(),
                        new UniqueIdentifiersRule(),
                        new ModelReferencesRule(),
                        new ReportReferencesRule(),
                        new PositionRule(),
                        new VisualDocumentRule()));
    }

    /** All violations from all rules, in rule order. */
    public List<SchemaViolation> check(EmittedArtifactSet artifacts) {
        Objects.requireNonNull(artifacts, "artifacts");
        List<SchemaViolation> violations = new ArrayList<>();
        for (SchemaRule rule : rules) {
            List<SchemaViolation> found = rule.check(artifacts);
            if (!found.isEmpty()) {
                LOGGER.fine(() -> rule.name() + " reported " + found.size() + " violation(s)");
            }
            violations.addAll(found);
        }
        return violations;
    }

    /**
     * @throws SchemaValidationException listing every violation, if there is at least one
     */
    public void validate(EmittedArtifactSet artifacts) throws SchemaValidationException {
        List<SchemaViolation> violations = check(artifacts);
        if (!violations.isEmpty()) {
            LOGGER.warning(() -> "Artifact set rejected with " + violations.size() + " violation(s)");
            throw new SchemaValidationException(violations);
        }
    }
}
