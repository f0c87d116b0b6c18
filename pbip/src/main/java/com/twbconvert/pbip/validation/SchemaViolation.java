package com.twbconvert.pbip.validation;

import java.util.Objects;

public final class SchemaViolation {
    private final String rule;
    private final String path;
    private final String message;

    public SchemaViolation(String rule, String path, String message) {
        this.rule = Objects.requireNonNull(rule, "rule");
        this.path = Objects.requireNonNull(path, "path");
        this.message = Objects.requireNonNull(message, "message");
    }

    public String getRule() {
        return rule;
    }

    /** Artifact path, or the logical location when the violation spans documents. */
    public String getPath() {
        return path;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SchemaViolation)) {
            return false;
        }
        SchemaViolation other = (SchemaViolation) obj;
        return rule.equals(other.rule) && path.equals(other.path) && message.equals(other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rule, path, message);
    }

    @Override
    public String toString() {
        return "[" + rule + "] " + path + ": " + message;
    }
}
