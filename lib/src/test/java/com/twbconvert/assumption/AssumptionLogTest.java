package com.twbconvert.assumption;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class AssumptionLogTest {

    @Test
    void entriesAreOrderedByCategoryThenDeclarationThenAppendOrder() {
        AssumptionLog log = new AssumptionLog();
        log.append(0, assumption(AssumptionCategory.REPORT, "sheet"));
        log.append(5, assumption(AssumptionCategory.TRANSLATION, "late field"));
        log.append(1, assumption(AssumptionCategory.TRANSLATION, "early field, first"));
        log.append(1, assumption(AssumptionCategory.TRANSLATION, "early field, second"));
        log.append(9, assumption(AssumptionCategory.EXTRACTION, "column"));

        List<String> locations = new ArrayList<>();
        for (Assumption entry : log.entries()) {
            locations.add(entry.getLocation());
        }

        assertEquals(
                List.of("column", "early field, first", "early field, second", "late field", "sheet"), locations);
    }

    @Test
    void orderDoesNotDependOnWhichThreadAppendsFirst() throws Exception {
        AssumptionLog log = new AssumptionLog();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (int i = 7; i >= 0; i--) {
                int index = i;
                pool.execute(
                        () -> {
                            try {
                                start.await();
                            } catch (InterruptedException e) {
                                Thread.currentThread().interrupt();
                            }
                            log.append(index, assumption(AssumptionCategory.TRANSLATION, "field " + index));
                        });
            }
            start.countDown();
        } finally {
            pool.shutdown();
        }
        pool.awaitTermination(10, TimeUnit.SECONDS);

        List<Assumption> entries = log.entries();
        assertEquals(8, entries.size());
        for (int i = 0; i < entries.size(); i++) {
            assertEquals("field " + i, entries.get(i).getLocation());
        }
    }

    @Test
    void snapshotIsImmutable() {
        AssumptionLog log = new AssumptionLog();
        log.append(0, assumption(AssumptionCategory.MODEL, "table"));

        assertThrows(UnsupportedOperationException.class, () -> log.entries().clear());
    }

    @Test
    void assumptionsCompareByValue() {
        assertEquals(assumption(AssumptionCategory.MODEL, "a"), assumption(AssumptionCategory.MODEL, "a"));
        assertNotEquals(assumption(AssumptionCategory.MODEL, "a"), assumption(AssumptionCategory.REPORT, "a"));
    }

    private static Assumption assumption(AssumptionCategory category, String location) {
        return new Assumption(category, location, "source", "target", "reason");
    }
}
