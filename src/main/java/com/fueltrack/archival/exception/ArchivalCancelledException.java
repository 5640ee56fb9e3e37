package com.fueltrack.archival.exception;

import lombok.Getter;

/**
 * Thrown at a batch boundary when the running archival was asked to stop.
 */
@Getter
public class ArchivalCancelledException extends RuntimeException {

    private final String collectionName;
    private final long recordsArchived;

    public ArchivalCancelledException(String collectionName, long recordsArchived) {
        super(String.format("Archival of %s cancelled after %d records", collectionName, recordsArchived));
        this.collectionName = collectionName;
        this.recordsArchived = recordsArchived;
    }
}
