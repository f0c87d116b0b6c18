package com.twbconvert.extract;

import com.twbconvert.ConversionException;

public final class DuplicateNameException extends ConversionException {
    private static final long serialVersionUID = 1L;

    private final String kind;
    private final String name;

    public DuplicateNameException(String kind, String name, String scope) {
        super("Duplicate " + kind + " name '" + name + "' in " + scope);
        this.kind = kind;
        this.name = name;
    }

    public String getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }
}
