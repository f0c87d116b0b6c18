package com.twbconvert.workbook;

import java.util.Objects;

/** A workbook parameter: a single user-selectable value referenced as {@code [Parameters].[Name]}. */
public final class Parameter {
    private final String name;
    private final String internalName;
    private final DataType dataType;
    private final String value;
    private final String domainType;

    public Parameter(String name, String internalName, DataType dataType, String value, String domainType) {
        this.name = Objects.requireNonNull(name, "name");
        this.internalName = Objects.requireNonNull(internalName, "internalName");
        this.dataType = Objects.requireNonNull(dataType, "dataType");
        this.value = value == null ? "" : value;
        this.domainType = domainType == null ? "any" : domainType;
    }

    public String getName() {
        return name;
    }

    public String getInternalName() {
        return internalName;
    }

    public DataType getDataType() {
        return dataType;
    }

    /** Current value as formula text, for example {@code 10} or {@code "East"}. */
    public String getValue() {
        return value;
    }

    public String getDomainType() {
        return domainType;
    }

    public boolean answersTo(String reference) {
        return name.equals(reference) || internalName.equals(reference);
    }
}
