package com.fueltrack.archival.service;

import com.fueltrack.archival.model.ArchivalJob;
import com.fueltrack.archival.model.enums.JobStatus;
import com.fueltrack.archival.repository.ArchivalJobRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.Pageable;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class ArchivalJobServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T02:00:00Z");
    private static final Instant CUTOFF = Instant.parse("2024-09-01T02:00:00Z");

    @Mock
    private ArchivalJobRepository archivalJobRepository;

    private ArchivalJobService archivalJobService;

    @BeforeEach
    public void setUp() {
        archivalJobService = new ArchivalJobService(archivalJobRepository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    public void testStart_PersistsInProgressJob() {
        when(archivalJobRepository.save(any(ArchivalJob.class))).thenAnswer(invocation -> invocation.getArgument(0));

        ArchivalJob job = archivalJobService.start("FuelRecord", CUTOFF, "admin");

        assertEquals(JobStatus.IN_PROGRESS, job.getStatus());
        assertEquals("FuelRecord", job.getCollectionName());
        assertEquals(NOW, job.getArchivalDate());
        assertEquals(CUTOFF, job.getCutoffDate());
        assertEquals("admin", job.getInitiatedBy());
    }

    @Test
    public void testStart_StoreFailurePropagates() {
        when(archivalJobRepository.save(any(ArchivalJob.class)))
                .thenThrow(new DataAccessResourceFailureException("down"));

        assertThrows(DataAccessResourceFailureException.class,
                () -> archivalJobService.start("FuelRecord", CUTOFF, "admin"));
    }

    @Test
    public void testComplete_SaveFailureIsLoggedNotThrown() {
        ArchivalJob job = ArchivalJob.start("FuelRecord", CUTOFF, "admin", NOW);
        when(archivalJobRepository.save(job)).thenThrow(new DataAccessResourceFailureException("down"));

        archivalJobService.complete(job, 42, 900);

        assertEquals(JobStatus.COMPLETED, job.getStatus());
        assertEquals(42, job.getRecordsArchived());
        assertEquals(NOW, job.getCompletedAt());
    }

    @Test
    public void testFail_IgnoresTerminalJob() {
        ArchivalJob job = ArchivalJob.start("FuelRecord", CUTOFF, "admin", NOW);
        job.markCompleted(1, 1, NOW);

        archivalJobService.fail(job, "late failure", 1, 1);

        assertEquals(JobStatus.COMPLETED, job.getStatus());
        verifyNoInteractions(archivalJobRepository);
    }

    @Test
    public void testFail_RecordsError() {
        ArchivalJob job = ArchivalJob.start("FuelRecord", CUTOFF, "admin", NOW);

        archivalJobService.fail(job, "connection reset", 1000, 5000);

        assertEquals(JobStatus.FAILED, job.getStatus());
        assertEquals("connection reset", job.getError());
        assertEquals(1000, job.getRecordsArchived());
        verify(archivalJobRepository).save(job);
    }

    @Test
    public void testHistory_CapsLimit() {
        when(archivalJobRepository.findAllByOrderByArchivalDateDesc(any(Pageable.class))).thenReturn(List.of());

        archivalJobService.history(5000);

        ArgumentCaptor<Pageable> captor = ArgumentCaptor.forClass(Pageable.class);
        verify(archivalJobRepository).findAllByOrderByArchivalDateDesc(captor.capture());
        assertEquals(ArchivalJobService.MAX_HISTORY, captor.getValue().getPageSize());
    }

    @Test
    public void testHistory_RejectsNonPositiveLimit() {
        assertThrows(IllegalArgumentException.class, () -> archivalJobService.history(0));
    }
}
