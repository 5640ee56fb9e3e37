package com.fueltrack.archival.exception;

/**
 * Thrown when an archival run or restore is requested while another one holds the run lease.
 */
public class ArchivalInProgressException extends RuntimeException {

    public ArchivalInProgressException(String operation) {
        super("Cannot start " + operation + ": another archival operation is already running");
    }
}
