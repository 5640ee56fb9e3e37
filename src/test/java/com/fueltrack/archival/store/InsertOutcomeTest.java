package com.fueltrack.archival.store;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class InsertOutcomeTest {

    @Test
    public void testWithFailures() {
        InsertOutcome outcome = InsertOutcome.withFailures(4, Map.of(2, "11000: duplicate key"));

        assertEquals(3, outcome.getWrittenCount());
        assertTrue(outcome.hasFailures());
        assertEquals(List.of(2), outcome.failedIndexes());
        assertTrue(outcome.isWritten(0));
        assertFalse(outcome.isWritten(2));
        assertFalse(outcome.isWritten(4));
    }

    @Test
    public void testFailureIndexOutsideBatchRejected() {
        assertThrows(IllegalArgumentException.class, () -> InsertOutcome.withFailures(2, Map.of(2, "boom")));
    }
}
