package com.twbconvert.pbip.report;

import java.util.Objects;

/** A visual's rectangle in page pixels, with its stacking order and tab order. */
public final class Position {
    private final double x;
    private final double y;
    private final double z;
    private final double width;
    private final double height;
    private final int tabOrder;

    public Position(double x, double y, double z, double width, double height, int tabOrder) {
        this.x = x;
        this.y = y;
        this.z = z;
        this.width = width;
        this.height = height;
        this.tabOrder = tabOrder;
    }

    /** Rounds to two decimals and clamps every coordinate to zero or more. */
    public static Position of(double x, double y, double width, double height, int order) {
        return new Position(clamp(x), clamp(y), order, clamp(width), clamp(height), order);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value) || value < 0) {
            return 0;
        }
        return Math.round(value * 100) / 100.0;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public double getZ() {
        return z;
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    public int getTabOrder() {
        return tabOrder;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Position)) {
            return false;
        }
        Position other = (Position) obj;
        return Double.compare(x, other.x) == 0
                && Double.compare(y, other.y) == 0
                && Double.compare(z, other.z) == 0
                && Double.compare(width, other.width) == 0
                && Double.compare(height, other.height) == 0
                && tabOrder == other.tabOrder;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, z, width, height, tabOrder);
    }

    @Override
    public String toString() {
        return "Position[x=" + x + ", y=" + y + ", z=" + z + ", width=" + width + ", height=" + height
                + ", tabOrder=" + tabOrder + "]";
    }
}
