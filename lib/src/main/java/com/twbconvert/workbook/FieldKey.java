package com.twbconvert.workbook;

import java.util.Objects;

/** Identifies a field within the workbook: the owning datasource plus the field's internal name. */
public final class FieldKey implements Comparable<FieldKey> {
    private final String datasource;
    private final String name;

    public FieldKey(String datasource, String name) {
        this.datasource = Objects.requireNonNull(datasource, "datasource");
        this.name = Objects.requireNonNull(name, "name");
    }

    public String getDatasource() {
        return datasource;
    }

    public String getName() {
        return name;
    }

    @Override
    public int compareTo(FieldKey other) {
        int cmp = datasource.compareTo(other.datasource);
        return cmp != 0 ? cmp : name.compareTo(other.name);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof FieldKey)) {
            return false;
        }
        FieldKey other = (FieldKey) obj;
        return datasource.equals(other.datasource) && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(datasource, name);
    }

    @Override
    public String toString() {
        return datasource + "/" + name;
    }
}
