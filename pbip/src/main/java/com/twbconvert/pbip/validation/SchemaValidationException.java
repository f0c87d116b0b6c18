package com.twbconvert.pbip.validation;

import com.twbconvert.ConversionException;
import java.util.List;

/** The staged artifact set broke at least one structural rule; nothing may be released. */
public final class SchemaValidationException extends ConversionException {
    private static final long serialVersionUID = 1L;

    private final transient List<SchemaViolation> violations;

    public SchemaValidationException(List<SchemaViolation> violations) {
        super(message(violations));
        this.violations = List.copyOf(violations);
    }

    public List<SchemaViolation> getViolations() {
        return violations;
    }

    private static String message(List<SchemaViolation> violations) {
        StringBuilder message = new StringBuilder()
                .append(violations.size())
                .append(" schema violation(s)");
        for (SchemaViolation violation : violations) {
            message.append(System.lineSeparator()).append("  ").append(violation);
        }
        return message.toString();
    }
}
