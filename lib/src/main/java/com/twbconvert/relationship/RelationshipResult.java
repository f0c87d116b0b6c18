package com.twbconvert.relationship;

import java.util.List;

public final class RelationshipResult {
    private final List<Relationship> relationships;
    private final List<UnresolvedJoinReferenceException> failures;

    public RelationshipResult(List<Relationship> relationships, List<UnresolvedJoinReferenceException> failures) {
        this.relationships = List.copyOf(relationships);
        this.failures = List.copyOf(failures);
    }

    /** Relationships in join-edge order. */
    public List<Relationship> getRelationships() {
        return relationships;
    }

    public List<UnresolvedJoinReferenceException> getFailures() {
        return failures;
    }
}
