package com.twbconvert.relationship;

/** Multiplicity of the "from" side followed by the "to" side. */
public enum Cardinality {
    ONE_TO_ONE,
    ONE_TO_MANY,
    MANY_TO_MANY
}
