package com.twbconvert.pbip.report;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

public final class PageSpec {
    private final String name;
    private final String displayName;
    private final String sourceDashboard;
    private final int width;
    private final int height;
    private final List<VisualSpec> visuals;
    private final List<VisualInteraction> interactions;

    public PageSpec(
            String name,
            String displayName,
            String sourceDashboard,
            int width,
            int height,
            List<VisualSpec> visuals,
            List<VisualInteraction> interactions) {
        this.name = Objects.requireNonNull(name, "name");
        this.displayName = Objects.requireNonNull(displayName, "displayName");
        this.sourceDashboard = sourceDashboard;
        this.width = width;
        this.height = height;
        this.visuals = List.copyOf(visuals);
        this.interactions = List.copyOf(interactions);
    }

    public String getName() {
        return name;
    }

    public String getDisplayName() {
        return displayName;
    }

    /** Dashboard the page was mapped from; {@code null} for a page holding a worksheet that no dashboard shows. */
    public String getSourceDashboard() {
        return sourceDashboard;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public List<VisualSpec> getVisuals() {
        return visuals;
    }

    public List<VisualInteraction> getInteractions() {
        return interactions;
    }

    public Optional<VisualSpec> findVisual(String visualName) {
        return visuals.stream().filter(v -> v.getName().equals(visualName)).findFirst();
    }
}
