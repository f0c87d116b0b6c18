package com.twbconvert.pbip;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.UUID;
import org.junit.jupiter.api.Test;

class StableIdentifiersTest {

    @Test
    void lineageTagsAreStableUuids() {
        String tag = StableIdentifiers.columnTag("Orders", "Sales");

        assertEquals(tag, StableIdentifiers.columnTag("Orders", "Sales"));
        assertEquals(3, UUID.fromString(tag).version());
    }

    @Test
    void kindAndScopeSeparateOtherwiseEqualNames() {
        assertNotEquals(StableIdentifiers.columnTag("Orders", "Sales"), StableIdentifiers.measureTag("Orders", "Sales"));
        assertNotEquals(StableIdentifiers.columnTag("Orders", "Sales"), StableIdentifiers.columnTag("Returns", "Sales"));
        assertNotEquals(StableIdentifiers.uuid("column", "a", "bc"), StableIdentifiers.uuid("column", "ab", "c"));
    }

    @Test
    void reportNamesAreTwentyLowercaseHexDigits() {
        String page = StableIdentifiers.pageName("dashboard:Overview");

        assertEquals(20, page.length());
        assertTrue(page.matches("[0-9a-f]{20}"), page);
        assertEquals(page, StableIdentifiers.pageName("dashboard:Overview"));
        assertNotEquals(
                StableIdentifiers.visualName(page, "zone:3"),
                StableIdentifiers.visualName(StableIdentifiers.pageName("dashboard:Other"), "zone:3"));
    }

    @Test
    void relationshipNameDependsOnOrientation() {
        assertNotEquals(
                StableIdentifiers.relationshipName("Orders", "ID", "Lines", "Order ID"),
                StableIdentifiers.relationshipName("Lines", "Order ID", "Orders", "ID"));
    }
}
