package com.fueltrack.archival.exception;

import lombok.Getter;

/**
 * Thrown when restored records would collide with identities already present in the hot store.
 * Batches restored before the conflict stay restored.
 */
@Getter
public class RestoreConflictException extends RuntimeException {

    private final String collectionName;
    private final int conflictingRecords;
    private final long recordsRestored;

    public RestoreConflictException(String collectionName, int conflictingRecords, long recordsRestored) {
        super(String.format(
                "Restore of %s stopped: %d archived records already exist in the active collection (%d restored before the conflict)",
                collectionName, conflictingRecords, recordsRestored));
        this.collectionName = collectionName;
        this.conflictingRecords = conflictingRecords;
        this.recordsRestored = recordsRestored;
    }
}
