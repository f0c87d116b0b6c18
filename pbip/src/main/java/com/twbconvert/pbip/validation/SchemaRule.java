package com.twbconvert.pbip.validation;

import com.twbconvert.pbip.artifact.EmittedArtifactSet;
import java.util.List;

/**
 * A single structural check over the staged artifact set. Rules are deterministic and report violations in the
 * order they find them, so two runs over the same set give the same list.
 */
public interface SchemaRule {

    /** Short name used to tag this rule's violations. */
    String name();

    /**
     * @param artifacts every staged model and report document together with the specs they were rendered from
     * @return the violations found, possibly empty, never {@code null}
     */
    List<SchemaViolation> check(EmittedArtifactSet artifacts);
}
