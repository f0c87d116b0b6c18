package com.twbconvert.translate.dax;

/** Node of an emitted DAX expression. Rendered to text by {@link DaxWriter}. */
public sealed interface DaxExpr
        permits DaxLiteral, DaxColumnRef, DaxMeasureRef, DaxTableRef, DaxCall, DaxBinary, DaxUnary, DaxContextOverride {}
