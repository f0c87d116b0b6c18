package com.twbconvert.pbip;

import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.ExecutorService;

/**
 * Settings of one conversion. {@link #fromProperties(Properties)} reads the {@code twbconvert.*} keys; a system
 * property with the same key takes precedence over the supplied value.
 */
public final class ConversionOptions {
    public static final String PROJECT_NAME = "twbconvert.projectName";
    public static final String PAGE_WIDTH = "twbconvert.pageWidth";
    public static final String PAGE_HEIGHT = "twbconvert.pageHeight";
    public static final String CULTURE = "twbconvert.culture";
    public static final String PARALLELISM = "twbconvert.parallelism";
    public static final String BASE_THEME = "twbconvert.baseTheme";

    private static final String DEFAULT_PROJECT_NAME = "Workbook";
    private static final int DEFAULT_PAGE_WIDTH = 1280;
    private static final int DEFAULT_PAGE_HEIGHT = 720;

    private final String projectName;
    private final int pageWidth;
    private final int pageHeight;
    private final int parallelism;
    private final TargetSchemaVersion schemaVersion;
    private final LayoutHints layoutHints;
    private final ExecutorService executor;

    private ConversionOptions(Builder builder) {
        this.projectName = builder.projectName;
        this.pageWidth = builder.pageWidth;
        this.pageHeight = builder.pageHeight;
        this.parallelism = builder.parallelism;
        this.schemaVersion = builder.schemaVersion;
        this.layoutHints = builder.layoutHints;
        this.executor = builder.executor;
    }

    public static ConversionOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ConversionOptions fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");
        Builder builder = builder();
        String projectName = setting(properties, PROJECT_NAME);
        if (projectName != null) {
            builder.projectName(projectName);
        }
        String width = setting(properties, PAGE_WIDTH);
        if (width != null) {
            builder.pageWidth(parsePositive(PAGE_WIDTH, width));
        }
        String height = setting(properties, PAGE_HEIGHT);
        if (height != null) {
            builder.pageHeight(parsePositive(PAGE_HEIGHT, height));
        }
        String parallelism = setting(properties, PARALLELISM);
        if (parallelism != null) {
            builder.parallelism(parsePositive(PARALLELISM, parallelism));
        }
        TargetSchemaVersion schema = TargetSchemaVersion.defaults();
        String culture = setting(properties, CULTURE);
        String theme = setting(properties, BASE_THEME);
        builder.schemaVersion(
                new TargetSchemaVersion(
                        schema.getReportVersion(),
                        schema.getPageVersion(),
                        schema.getVisualContainerVersion(),
                        schema.getCompatibilityLevel(),
                        culture != null ? culture : schema.getCulture(),
                        theme));
        return builder.build();
    }

    private static String setting(Properties properties, String key) {
        String value = System.getProperty(key);
        if (value == null) {
            value = properties.getProperty(key);
        }
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static int parsePositive(String key, String value) {
        int parsed;
        try {
            parsed = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer: " + value, e);
        }
        if (parsed <= 0) {
            throw new IllegalArgumentException(
                    String.format(Locale.ROOT, "%s must be positive: %d", key, parsed));
        }
        return parsed;
    }

    /** Base name of the {@code <name>.SemanticModel} and {@code <name>.Report} folders. */
    public String getProjectName() {
        return projectName;
    }

    public String getModelFolder() {
        return projectName + ".SemanticModel";
    }

    public String getReportFolder() {
        return projectName + ".Report";
    }

    /** Page width used when a dashboard declares no size. */
    public int getPageWidth() {
        return pageWidth;
    }

    public int getPageHeight() {
        return pageHeight;
    }

    public int getParallelism() {
        return parallelism;
    }

    public TargetSchemaVersion getSchemaVersion() {
        return schemaVersion;
    }

    public LayoutHints getLayoutHints() {
        return layoutHints;
    }

    /** Caller-owned executor, or {@code null} to let the pipeline size its own from {@link #getParallelism()}. */
    public ExecutorService getExecutor() {
        return executor;
    }

    public static final class Builder {
        private String projectName = DEFAULT_PROJECT_NAME;
        private int pageWidth = DEFAULT_PAGE_WIDTH;
        private int pageHeight = DEFAULT_PAGE_HEIGHT;
        private int parallelism = 1;
        private TargetSchemaVersion schemaVersion = TargetSchemaVersion.defaults();
        private LayoutHints layoutHints = LayoutHints.none();
        private ExecutorService executor;

        private Builder() {}

        public Builder projectName(String projectName) {
            this.projectName = Objects.requireNonNull(projectName, "projectName");
            return this;
        }

        public Builder pageWidth(int pageWidth) {
            this.pageWidth = pageWidth;
            return this;
        }

        public Builder pageHeight(int pageHeight) {
            this.pageHeight = pageHeight;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder schemaVersion(TargetSchemaVersion schemaVersion) {
            this.schemaVersion = Objects.requireNonNull(schemaVersion, "schemaVersion");
            return this;
        }

        public Builder layoutHints(LayoutHints layoutHints) {
            this.layoutHints = Objects.requireNonNull(layoutHints, "layoutHints");
            return this;
        }

        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public ConversionOptions build() {
            if (projectName.isBlank()) {
                throw new IllegalArgumentException("projectName must not be blank");
            }
            if (pageWidth <= 0 || pageHeight <= 0 || parallelism <= 0) {
                throw new IllegalArgumentException("page size and parallelism must be positive");
            }
            return new ConversionOptions(this);
        }
    }
}
