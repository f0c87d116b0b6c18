package com.twbconvert.pbip;

import com.twbconvert.assumption.Assumption;
import com.twbconvert.pbip.artifact.EmittedArtifactSet;
import java.util.List;
import java.util.Objects;

public final class ConversionResult {
    private final EmittedArtifactSet artifacts;
    private final List<Assumption> assumptions;
    private final List<EntityIssue> issues;

    public ConversionResult(EmittedArtifactSet artifacts, List<Assumption> assumptions, List<EntityIssue> issues) {
        this.artifacts = Objects.requireNonNull(artifacts, "artifacts");
        this.assumptions = List.copyOf(assumptions);
        this.issues = List.copyOf(issues);
    }

    /** The validated document set, ready for a writer. */
    public EmittedArtifactSet getArtifacts() {
        return artifacts;
    }

    public List<Assumption> getAssumptions() {
        return assumptions;
    }

    public List<EntityIssue> getIssues() {
        return issues;
    }
}
