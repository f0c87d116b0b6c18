package com.twbconvert.workbook;

import java.util.List;
import java.util.Objects;

public final class Dashboard {
    private final String name;
    private final Integer declaredWidth;
    private final Integer declaredHeight;
    private final List<DashboardZone> zones;

    public Dashboard(String name, Integer declaredWidth, Integer declaredHeight, List<DashboardZone> zones) {
        this.name = Objects.requireNonNull(name, "name");
        this.declaredWidth = declaredWidth;
        this.declaredHeight = declaredHeight;
        this.zones = List.copyOf(zones);
    }

    public String getName() {
        return name;
    }

    /** Declared pixel width, or {@code null} when the dashboard uses automatic sizing. */
    public Integer getDeclaredWidth() {
        return declaredWidth;
    }

    public Integer getDeclaredHeight() {
        return declaredHeight;
    }

    /** Zones in document order; the first zone is the root layout container when one exists. */
    public List<DashboardZone> getZones() {
        return zones;
    }
}
