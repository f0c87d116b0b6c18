package com.twbconvert.pbip;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Properties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ConversionOptionsTest {

    @AfterEach
    void clearOverrides() {
        System.clearProperty(ConversionOptions.PAGE_WIDTH);
    }

    @Test
    void defaultsDescribeASixteenByNinePage() {
        ConversionOptions options = ConversionOptions.defaults();

        assertEquals("Workbook", options.getProjectName());
        assertEquals("Workbook.SemanticModel", options.getModelFolder());
        assertEquals("Workbook.Report", options.getReportFolder());
        assertEquals(1280, options.getPageWidth());
        assertEquals(720, options.getPageHeight());
        assertEquals(1, options.getParallelism());
        assertEquals("en-US", options.getSchemaVersion().getCulture());
        assertTrue(options.getLayoutHints().isEmpty());
        assertNull(options.getExecutor());
    }

    @Test
    void readsPropertiesWithSystemPropertyTakingPrecedence() {
        Properties properties = new Properties();
        properties.setProperty(ConversionOptions.PROJECT_NAME, "Finance");
        properties.setProperty(ConversionOptions.PAGE_WIDTH, "1600");
        properties.setProperty(ConversionOptions.CULTURE, "de-DE");
        properties.setProperty(ConversionOptions.BASE_THEME, "CY24SU06");
        System.setProperty(ConversionOptions.PAGE_WIDTH, "1920");

        ConversionOptions options = ConversionOptions.fromProperties(properties);

        assertEquals("Finance.Report", options.getReportFolder());
        assertEquals(1920, options.getPageWidth());
        assertEquals(720, options.getPageHeight());
        assertEquals("de-DE", options.getSchemaVersion().getCulture());
        assertEquals("CY24SU06", options.getSchemaVersion().getBaseTheme());
    }

    @Test
    void rejectsNonPositiveAndNonNumericSettings() {
        Properties zero = new Properties();
        zero.setProperty(ConversionOptions.PARALLELISM, "0");
        assertThrows(IllegalArgumentException.class, () -> ConversionOptions.fromProperties(zero));

        Properties text = new Properties();
        text.setProperty(ConversionOptions.PAGE_HEIGHT, "tall");
        assertThrows(IllegalArgumentException.class, () -> ConversionOptions.fromProperties(text));

        assertThrows(IllegalArgumentException.class, () -> ConversionOptions.builder().projectName(" ").build());
    }

    @Test
    void layoutHintsAreLookedUpByWorksheet() {
        LayoutHints hints = LayoutHints.builder().put("Sales", 10, 20, 300, 200).build();

        assertEquals(300, hints.forWorksheet("Sales").orElseThrow().getWidth());
        assertTrue(hints.forWorksheet("Profit").isEmpty());
    }
}
