package com.fueltrack.archival.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Snapshot of hot and cold volumes per entity type.
 *
 * <p>
 * The space figures are an estimate derived from a fixed per-record size, not a measurement of
 * the storage engine.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArchivalStats {
    private Map<String, Long> activeRecords;
    private Map<String, Long> archivedRecords;
    private long totalActiveRecords;
    private long totalArchivedRecords;
    private Instant lastArchivalRun;
    private long estimatedSpaceSavedBytes;
    private String estimatedSpaceSaved;
}
