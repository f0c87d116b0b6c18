package com.twbconvert.pbip;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Suggested rectangles per worksheet, in page coordinates, supplied by a layout-analysis collaborator. A hint is only
 * consulted when the workbook declares no layout for the worksheet.
 */
public final class LayoutHints {
    private static final LayoutHints NONE = new LayoutHints(Map.of());

    private final Map<String, Rectangle> byWorksheet;

    public LayoutHints(Map<String, Rectangle> byWorksheet) {
        this.byWorksheet = Map.copyOf(Objects.requireNonNull(byWorksheet, "byWorksheet"));
    }

    public static LayoutHints none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Rectangle> forWorksheet(String worksheet) {
        return Optional.ofNullable(byWorksheet.get(worksheet));
    }

    public boolean isEmpty() {
        return byWorksheet.isEmpty();
    }

    public static final class Builder {
        private final Map<String, Rectangle> hints = new LinkedHashMap<>();

        private Builder() {}

        public Builder put(String worksheet, double x, double y, double width, double height) {
            hints.put(Objects.requireNonNull(worksheet, "worksheet"), new Rectangle(x, y, width, height));
            return this;
        }

        public LayoutHints build() {
            return new LayoutHints(hints);
        }
    }

    public static final class Rectangle {
        private final double x;
        private final double y;
        private final double width;
        private final double height;

        public Rectangle(double x, double y, double width, double height) {
            this.x = x;
            this.y = y;
            this.width = width;
            this.height = height;
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
    }
}
