package com.twbconvert.pbip;

import java.util.Objects;

/**
 * Structural versions of the emitted document set. The defaults match what Power BI Desktop writes for PBIR
 * projects with TMDL models at compatibility level 1600.
 */
public final class TargetSchemaVersion {
    private static final String SCHEMA_BASE = "https://developer.microsoft.com/json-schemas/fabric/item/report/definition/";

    private final String reportVersion;
    private final String pageVersion;
    private final String visualContainerVersion;
    private final int compatibilityLevel;
    private final String culture;
    private final String baseTheme;

    public TargetSchemaVersion(
            String reportVersion,
            String pageVersion,
            String visualContainerVersion,
            int compatibilityLevel,
            String culture,
            String baseTheme) {
        this.reportVersion = Objects.requireNonNull(reportVersion, "reportVersion");
        this.pageVersion = Objects.requireNonNull(pageVersion, "pageVersion");
        this.visualContainerVersion = Objects.requireNonNull(visualContainerVersion, "visualContainerVersion");
        this.compatibilityLevel = compatibilityLevel;
        this.culture = Objects.requireNonNull(culture, "culture");
        this.baseTheme = baseTheme;
    }

    public static TargetSchemaVersion defaults() {
        return new TargetSchemaVersion("3.1.0", "2.0.0", "2.5.0", 1600, "en-US", null);
    }

    public TargetSchemaVersion withCulture(String newCulture) {
        return new TargetSchemaVersion(
                reportVersion, pageVersion, visualContainerVersion, compatibilityLevel, newCulture, baseTheme);
    }

    public String getReportVersion() {
        return reportVersion;
    }

    public String getPageVersion() {
        return pageVersion;
    }

    public String getVisualContainerVersion() {
        return visualContainerVersion;
    }

    public int getCompatibilityLevel() {
        return compatibilityLevel;
    }

    public String getCulture() {
        return culture;
    }

    /** Name of the base theme the report refers to, or {@code null} to emit no theme collection. */
    public String getBaseTheme() {
        return baseTheme;
    }

    public String reportSchema() {
        return SCHEMA_BASE + "report/" + reportVersion + "/schema.json";
    }

    public String pageSchema() {
        return SCHEMA_BASE + "page/" + pageVersion + "/schema.json";
    }

    public String visualContainerSchema() {
        return SCHEMA_BASE + "visualContainer/" + visualContainerVersion + "/schema.json";
    }

    public String pagesMetadataSchema() {
        return SCHEMA_BASE + "pagesMetadata/1.0.0/schema.json";
    }

    public String versionMetadataSchema() {
        return SCHEMA_BASE + "versionMetadata/1.0.0/schema.json";
    }
}
