package com.fueltrack.archival.model;

import com.fueltrack.archival.model.enums.JobStatus;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Durable audit entry for one archival attempt on one entity type.
 *
 * <p>
 * Status only moves forward: IN_PROGRESS to COMPLETED or IN_PROGRESS to FAILED.
 */
@Getter
@NoArgsConstructor
@Document(collection = "archival_jobs")
@CompoundIndexes({
        @CompoundIndex(def = "{'collectionName': 1, 'completedAt': -1}", name = "collection_completed_idx"),
        @CompoundIndex(def = "{'collectionName': 1, 'archivalDate': -1}", name = "collection_archival_date_idx")
})
public class ArchivalJob {

    @Id
    private String id;

    private String collectionName;

    @Indexed
    private Instant archivalDate;

    private Instant cutoffDate;
    private String initiatedBy;

    @Indexed
    private JobStatus status;

    private long recordsArchived;
    private Long duration;
    private Instant completedAt;
    private String error;

    public static ArchivalJob start(String collectionName, Instant cutoffDate, String initiatedBy, Instant startedAt) {
        ArchivalJob job = new ArchivalJob();
        job.collectionName = collectionName;
        job.cutoffDate = cutoffDate;
        job.initiatedBy = initiatedBy;
        job.archivalDate = startedAt;
        job.status = JobStatus.IN_PROGRESS;
        return job;
    }

    public void markCompleted(long recordsArchived, long durationMs, Instant completedAt) {
        requireInProgress(JobStatus.COMPLETED);
        this.status = JobStatus.COMPLETED;
        this.recordsArchived = recordsArchived;
        this.duration = durationMs;
        this.completedAt = completedAt;
    }

    public void markFailed(String error, long recordsArchived, long durationMs) {
        requireInProgress(JobStatus.FAILED);
        this.status = JobStatus.FAILED;
        this.error = error;
        this.recordsArchived = recordsArchived;
        this.duration = durationMs;
    }

    public boolean isTerminal() {
        return status != JobStatus.IN_PROGRESS;
    }

    private void requireInProgress(JobStatus target) {
        if (status != JobStatus.IN_PROGRESS) {
            throw new IllegalStateException(
                    "Archival job " + id + " cannot move from " + status + " to " + target);
        }
    }
}
