package com.fueltrack.archival.service;

import com.fueltrack.archival.model.ArchivalJob;
import com.fueltrack.archival.model.enums.JobStatus;
import com.fueltrack.archival.repository.ArchivalJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Lifecycle of archival Job Records.
 *
 * <p>
 * Creating a job must succeed before any data moves, so {@link #start} propagates store errors.
 * Terminal updates are written best effort: the data movement they describe has already happened
 * and must not be reported as failed because the audit write did not go through.
 */
@Service
public class ArchivalJobService {

    private static final Logger log = LoggerFactory.getLogger(ArchivalJobService.class);

    public static final int MAX_HISTORY = 500;

    private final ArchivalJobRepository archivalJobRepository;
    private final Clock clock;

    public ArchivalJobService(ArchivalJobRepository archivalJobRepository, Clock clock) {
        this.archivalJobRepository = archivalJobRepository;
        this.clock = clock;
    }

    public ArchivalJob start(String entityType, Instant cutoffDate, String initiatedBy) {
        ArchivalJob job = ArchivalJob.start(entityType, cutoffDate, initiatedBy, clock.instant());
        return archivalJobRepository.save(job);
    }

    public void complete(ArchivalJob job, long recordsArchived, long durationMs) {
        job.markCompleted(recordsArchived, durationMs, clock.instant());
        save(job);
    }

    public void fail(ArchivalJob job, String error, long recordsArchived, long durationMs) {
        if (job.isTerminal()) {
            log.warn("Archival job {} for {} already {}, not marking failed", job.getId(),
                    job.getCollectionName(), job.getStatus());
            return;
        }
        job.markFailed(error, recordsArchived, durationMs);
        save(job);
    }

    public Optional<ArchivalJob> lastSuccessful() {
        return archivalJobRepository.findFirstByStatusOrderByCompletedAtDesc(JobStatus.COMPLETED);
    }

    /**
     * Most recent jobs first.
     */
    public List<ArchivalJob> history(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("History limit must be at least 1, got " + limit);
        }
        return archivalJobRepository.findAllByOrderByArchivalDateDesc(PageRequest.of(0, Math.min(limit, MAX_HISTORY)));
    }

    private void save(ArchivalJob job) {
        try {
            archivalJobRepository.save(job);
        } catch (Exception e) {
            log.error("Failed to save archival job {} for {} as {}: {}", job.getId(), job.getCollectionName(),
                    job.getStatus(), e.getMessage(), e);
        }
    }
}
