package com.twbconvert.translate.dax;

import java.util.Objects;

public final class DaxLiteral implements DaxExpr {

    public enum Kind {
        NUMBER,
        STRING,
        BOOLEAN,
        /** A bare keyword argument such as {@code DESC} or {@code Dense}. */
        KEYWORD,
        /** An omitted optional argument, rendered as nothing between commas. */
        OMITTED
    }

    private static final DaxLiteral OMITTED_ARGUMENT = new DaxLiteral(Kind.OMITTED, "");

    private final Kind kind;
    private final String value;

    private DaxLiteral(Kind kind, String value) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.value = Objects.requireNonNull(value, "value");
    }

    public static DaxLiteral number(String value) {
        return new DaxLiteral(Kind.NUMBER, value);
    }

    public static DaxLiteral number(long value) {
        return new DaxLiteral(Kind.NUMBER, Long.toString(value));
    }

    public static DaxLiteral string(String value) {
        return new DaxLiteral(Kind.STRING, value);
    }

    public static DaxLiteral bool(boolean value) {
        return new DaxLiteral(Kind.BOOLEAN, value ? "TRUE" : "FALSE");
    }

    public static DaxLiteral keyword(String value) {
        return new DaxLiteral(Kind.KEYWORD, value);
    }

    public static DaxLiteral omitted() {
        return OMITTED_ARGUMENT;
    }

    public Kind getKind() {
        return kind;
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof DaxLiteral)) {
            return false;
        }
        DaxLiteral other = (DaxLiteral) obj;
        return kind == other.kind && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }
}
