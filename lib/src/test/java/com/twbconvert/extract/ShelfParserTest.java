package com.twbconvert.extract;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.twbconvert.workbook.AggregationType;
import com.twbconvert.workbook.FieldUsage;
import java.util.List;
import org.junit.jupiter.api.Test;

class ShelfParserTest {

    @Test
    void splitsCombinedShelfIntoInstancesInOrder() {
        List<FieldUsage> usages =
                ShelfParser.parseShelf("([federated.1].[sum:Sales:qk] / [federated.1].[avg:Profit:qk])");

        assertEquals(2, usages.size());
        assertEquals("Sales", usages.get(0).getFieldName());
        assertEquals(AggregationType.SUM, usages.get(0).impliedAggregation());
        assertEquals("Profit", usages.get(1).getFieldName());
        assertEquals(AggregationType.AVG, usages.get(1).impliedAggregation());
        assertTrue(usages.get(1).isQuantitative());
    }

    @Test
    void fieldNamesMayContainColons() {
        FieldUsage usage = ShelfParser.parseReference("[ds].[yr:Order Date: Shipped:ok]");

        assertEquals("yr", usage.getDerivation());
        assertEquals("Order Date: Shipped", usage.getFieldName());
        assertEquals("ok", usage.getTypeSuffix());
        assertEquals(AggregationType.NONE, usage.impliedAggregation());
    }

    @Test
    void measureNamesInstanceIsRecognized() {
        FieldUsage usage = ShelfParser.parseReference("[federated.1].[:Measure Names]");

        assertTrue(usage.isMeasureNames());
        assertEquals("none", usage.getDerivation());
    }

    @Test
    void blankShelfAndForeignTextYieldNothing() {
        assertTrue(ShelfParser.parseShelf("   ").isEmpty());
        assertTrue(ShelfParser.parseShelf(null).isEmpty());
        assertNull(ShelfParser.parseReference("Sales"));
        assertNull(ShelfParser.parseReference(null));
    }
}
