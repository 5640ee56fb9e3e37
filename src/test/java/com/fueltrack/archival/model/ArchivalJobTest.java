package com.fueltrack.archival.model;

import com.fueltrack.archival.model.enums.JobStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class ArchivalJobTest {

    private static final Instant START = Instant.parse("2025-03-01T02:00:00Z");
    private static final Instant CUTOFF = Instant.parse("2024-09-01T02:00:00Z");

    @Test
    public void testStart_InProgress() {
        ArchivalJob job = ArchivalJob.start("LPOEntry", CUTOFF, "scheduled-job", START);

        assertEquals(JobStatus.IN_PROGRESS, job.getStatus());
        assertFalse(job.isTerminal());
        assertNull(job.getCompletedAt());
    }

    @Test
    public void testMarkCompleted() {
        ArchivalJob job = ArchivalJob.start("LPOEntry", CUTOFF, "scheduled-job", START);
        Instant end = START.plusSeconds(30);

        job.markCompleted(2500, 30_000, end);

        assertEquals(JobStatus.COMPLETED, job.getStatus());
        assertEquals(2500, job.getRecordsArchived());
        assertEquals(30_000L, job.getDuration());
        assertEquals(end, job.getCompletedAt());
        assertTrue(job.isTerminal());
    }

    @Test
    public void testMarkFailed() {
        ArchivalJob job = ArchivalJob.start("LPOEntry", CUTOFF, "admin", START);

        job.markFailed("connection reset", 1000, 4000);

        assertEquals(JobStatus.FAILED, job.getStatus());
        assertEquals("connection reset", job.getError());
        assertEquals(1000, job.getRecordsArchived());
        assertNull(job.getCompletedAt());
    }

    @Test
    public void testTerminalJobCannotMove() {
        ArchivalJob completed = ArchivalJob.start("LPOEntry", CUTOFF, "admin", START);
        completed.markCompleted(1, 1, START);
        ArchivalJob failed = ArchivalJob.start("LPOEntry", CUTOFF, "admin", START);
        failed.markFailed("boom", 0, 1);

        assertThrows(IllegalStateException.class, () -> completed.markFailed("late", 1, 1));
        assertThrows(IllegalStateException.class, () -> completed.markCompleted(2, 2, START));
        assertThrows(IllegalStateException.class, () -> failed.markCompleted(1, 1, START));
    }
}
