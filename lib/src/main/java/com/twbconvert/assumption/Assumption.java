package com.twbconvert.assumption;

import java.util.Objects;

/**
 * A non-exact conversion decision: what the source said, what was emitted instead and why. Assumptions are the
 * user-facing traceability report of a run.
 */
public final class Assumption {
    private final AssumptionCategory category;
    private final String location;
    private final String sourceText;
    private final String targetText;
    private final String reason;

    public Assumption(
            AssumptionCategory category, String location, String sourceText, String targetText, String reason) {
        this.category = Objects.requireNonNull(category, "category");
        this.location = Objects.requireNonNull(location, "location");
        this.sourceText = sourceText == null ? "" : sourceText;
        this.targetText = targetText == null ? "" : targetText;
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public AssumptionCategory getCategory() {
        return category;
    }

    public String getLocation() {
        return location;
    }

    public String getSourceText() {
        return sourceText;
    }

    public String getTargetText() {
        return targetText;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Assumption)) {
            return false;
        }
        Assumption other = (Assumption) obj;
        return category == other.category
                && location.equals(other.location)
                && sourceText.equals(other.sourceText)
                && targetText.equals(other.targetText)
                && reason.equals(other.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(category, location, sourceText, targetText, reason);
    }

    @Override
    public String toString() {
        return location + ": " + reason + " [" + sourceText + " -> " + targetText + "]";
    }
}
