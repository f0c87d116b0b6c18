package com.twbconvert.formula.ast;

public enum LodKind {
    FIXED,
    INCLUDE,
    EXCLUDE
}
