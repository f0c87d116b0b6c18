package com.twbconvert.translate.dax;

import java.util.List;
import java.util.Objects;

public final class DaxCall implements DaxExpr {
    private final String function;
    private final List<DaxExpr> arguments;

    public DaxCall(String function, List<DaxExpr> arguments) {
        this.function = Objects.requireNonNull(function, "function");
        this.arguments = List.copyOf(arguments);
    }

    public static DaxCall of(String function, DaxExpr... arguments) {
        return new DaxCall(function, List.of(arguments));
    }

    public static DaxCall blank() {
        return new DaxCall("BLANK", List.of());
    }

    public String getFunction() {
        return function;
    }

    public List<DaxExpr> getArguments() {
        return arguments;
    }

    public boolean isBlank() {
        return "BLANK".equals(function) && arguments.isEmpty();
    }
}
