package com.twbconvert.pbip;

import com.twbconvert.ConversionException;
import java.util.Objects;

/**
 * An entity that was left out of the output or degraded, together with the exception that caused it. The rest of
 * the conversion is unaffected.
 */
public final class EntityIssue {

    public enum Stage {
        PARSING,
        DEPENDENCY,
        RELATIONSHIP,
        REPORT
    }

    private final Stage stage;
    private final String entity;
    private final ConversionException cause;

    public EntityIssue(Stage stage, String entity, ConversionException cause) {
        this.stage = Objects.requireNonNull(stage, "stage");
        this.entity = Objects.requireNonNull(entity, "entity");
        this.cause = Objects.requireNonNull(cause, "cause");
    }

    public Stage getStage() {
        return stage;
    }

    /** Display name of the affected field, join or worksheet. */
    public String getEntity() {
        return entity;
    }

    public ConversionException getCause() {
        return cause;
    }

    public String getMessage() {
        return cause.getMessage();
    }

    @Override
    public String toString() {
        return stage + " " + entity + ": " + cause.getMessage();
    }
}
