package com.twbconvert.workbook;

import java.util.Objects;

/** A zone of a dashboard, with its rectangle in the dashboard's source coordinate space. */
public final class DashboardZone {
    private final String id;
    private final ZoneType type;
    private final String worksheetName;
    private final String filterParameter;
    private final double x;
    private final double y;
    private final double width;
    private final double height;
    private final String text;

    public DashboardZone(
            String id,
            ZoneType type,
            String worksheetName,
            String filterParameter,
            double x,
            double y,
            double width,
            double height,
            String text) {
        this.id = Objects.requireNonNull(id, "id");
        this.type = Objects.requireNonNull(type, "type");
        this.worksheetName = worksheetName;
        this.filterParameter = filterParameter;
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
        this.text = text;
    }

    public String getId() {
        return id;
    }

    public ZoneType getType() {
        return type;
    }

    public String getWorksheetName() {
        return worksheetName;
    }

    /** Column instance reference filtered by a filter zone, for example {@code [ds].[none:Region:nk]}. */
    public String getFilterParameter() {
        return filterParameter;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    public String getText() {
        return text;
    }
}
