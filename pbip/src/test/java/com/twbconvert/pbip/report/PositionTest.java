package com.twbconvert.pbip.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import org.junit.jupiter.api.Test;

class PositionTest {

    @Test
    void factoryRoundsClampsAndStacksByOrder() {
        Position position = Position.of(-4, 10.126, Double.NaN, 200, 3);

        assertEquals(0, position.getX());
        assertEquals(10.13, position.getY());
        assertEquals(0, position.getWidth());
        assertEquals(200, position.getHeight());
        assertEquals(3, position.getZ());
        assertEquals(3, position.getTabOrder());
    }

    @Test
    void equalRectanglesAreEqualValues() {
        assertEquals(Position.of(0, 80, 500, 360, 1), new Position(0, 80, 1, 500, 360, 1));
        assertEquals(Position.of(0, 80, 500, 360, 1).hashCode(), new Position(0, 80, 1, 500, 360, 1).hashCode());
        assertNotEquals(Position.of(0, 80, 500, 360, 1), Position.of(0, 80, 500, 360, 2));
    }
}
