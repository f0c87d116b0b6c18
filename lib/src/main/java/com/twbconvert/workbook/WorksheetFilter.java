package com.twbconvert.workbook;

import java.util.List;
import java.util.Objects;

public final class WorksheetFilter {
    private final FieldUsage usage;
    private final String filterClass;
    private final List<String> members;

    public WorksheetFilter(FieldUsage usage, String filterClass, List<String> members) {
        this.usage = Objects.requireNonNull(usage, "usage");
        this.filterClass = filterClass == null ? "categorical" : filterClass;
        this.members = List.copyOf(members);
    }

    public FieldUsage getUsage() {
        return usage;
    }

    /** {@code categorical}, {@code quantitative} or {@code relative-date}. */
    public String getFilterClass() {
        return filterClass;
    }

    public List<String> getMembers() {
        return members;
    }
}
