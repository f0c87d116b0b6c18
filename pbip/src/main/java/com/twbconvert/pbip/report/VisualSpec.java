package com.twbconvert.pbip.report;

import java.util.List;
import java.util.Objects;

/**
 * A visual on a page. Worksheet visuals carry their projections; textboxes carry {@code text} and no projections.
 */
public final class VisualSpec {
    private final String name;
    private final String sourceWorksheet;
    private final String visualType;
    private final List<Projection> projections;
    private final List<Projection> filters;
    private final Position position;
    private final String title;
    private final String text;

    public VisualSpec(
            String name,
            String sourceWorksheet,
            String visualType,
            List<Projection> projections,
            List<Projection> filters,
            Position position,
            String title,
            String text) {
        this.name = Objects.requireNonNull(name, "name");
        this.sourceWorksheet = sourceWorksheet;
        this.visualType = Objects.requireNonNull(visualType, "visualType");
        this.projections = List.copyOf(projections);
        this.filters = List.copyOf(filters);
        this.position = Objects.requireNonNull(position, "position");
        this.title = title;
        this.text = text;
    }

    public String getName() {
        return name;
    }

    /** Worksheet the visual was mapped from, or {@code null} for textboxes. */
    public String getSourceWorksheet() {
        return sourceWorksheet;
    }

    public String getVisualType() {
        return visualType;
    }

    public List<Projection> getProjections() {
        return projections;
    }

    public List<Projection> getFilters() {
        return filters;
    }

    public Position getPosition() {
        return position;
    }

    public String getTitle() {
        return title;
    }

    public String getText() {
        return text;
    }
}
