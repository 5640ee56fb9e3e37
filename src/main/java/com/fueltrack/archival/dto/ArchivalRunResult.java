package com.fueltrack.archival.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregated outcome of one archival run. Built in memory and never persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArchivalRunResult {

    private String runId;
    private boolean success;
    private boolean dryRun;

    /**
     * Per entity type results in processing order. Disabled types have no entry.
     */
    @Builder.Default
    private Map<String, CollectionArchiveResult> collectionsArchived = new LinkedHashMap<>();

    private long totalRecordsArchived;
    private long totalDuration;

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    public void addCollection(String entityType, CollectionArchiveResult result) {
        collectionsArchived.put(entityType, result);
        totalRecordsArchived += result.getRecordsArchived();
    }

    public void addError(String entityType, String message) {
        success = false;
        errors.add(entityType + ": " + message);
    }
}
