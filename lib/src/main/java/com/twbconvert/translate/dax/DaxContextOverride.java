package com.twbconvert.translate.dax;

import java.util.List;
import java.util.Objects;

/**
 * {@code CALCULATE(inner, modifiers...)}: evaluation of an expression under a rewritten filter context. Level of
 * detail scopes and table calculations are expressed with this node so their context semantics stay inspectable
 * after translation.
 */
public final class DaxContextOverride implements DaxExpr {

    public enum Origin {
        FIXED,
        INCLUDE,
        EXCLUDE,
        WINDOW,
        CONTEXT_TRANSITION
    }

    private final Origin origin;
    private final DaxExpr inner;
    private final List<DaxExpr> modifiers;

    public DaxContextOverride(Origin origin, DaxExpr inner, List<DaxExpr> modifiers) {
        this.origin = Objects.requireNonNull(origin, "origin");
        this.inner = Objects.requireNonNull(inner, "inner");
        this.modifiers = List.copyOf(modifiers);
    }

    public Origin getOrigin() {
        return origin;
    }

    public DaxExpr getInner() {
        return inner;
    }

    /** Filter arguments in order: REMOVEFILTERS, ALLEXCEPT, VALUES, FILTER and similar. */
    public List<DaxExpr> getModifiers() {
        return modifiers;
    }
}
