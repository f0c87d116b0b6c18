package com.twbconvert.workbook;

import java.util.List;
import java.util.Objects;

public final class FilterAction {

    public enum Kind {
        FILTER,
        HIGHLIGHT
    }

    private final String name;
    private final Kind kind;
    private final String sourceDashboard;
    private final String sourceWorksheet;
    private final String targetDashboard;
    private final List<String> excludedSheets;

    public FilterAction(
            String name,
            Kind kind,
            String sourceDashboard,
            String sourceWorksheet,
            String targetDashboard,
            List<String> excludedSheets) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.sourceDashboard = sourceDashboard;
        this.sourceWorksheet = sourceWorksheet;
        this.targetDashboard = targetDashboard;
        this.excludedSheets = List.copyOf(excludedSheets);
    }

    public String getName() {
        return name;
    }

    public Kind getKind() {
        return kind;
    }

    public String getSourceDashboard() {
        return sourceDashboard;
    }

    /** Source worksheet, or {@code null} when every sheet of the dashboard triggers the action. */
    public String getSourceWorksheet() {
        return sourceWorksheet;
    }

    public String getTargetDashboard() {
        return targetDashboard;
    }

    public List<String> getExcludedSheets() {
        return excludedSheets;
    }
}
