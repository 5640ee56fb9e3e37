package com.fueltrack.archival.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Outcome of archiving one entity type within a run.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CollectionArchiveResult {
    private long recordsArchived;
    private long duration; // ms
    private Instant cutoffDate;
}
