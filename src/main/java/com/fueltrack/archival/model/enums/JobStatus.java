package com.fueltrack.archival.model.enums;

public enum JobStatus {
    IN_PROGRESS,
    COMPLETED,
    FAILED
}
