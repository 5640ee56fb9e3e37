package com.fueltrack.archival.model.enums;

/**
 * What an archival run does when one entity type fails.
 */
public enum FailurePolicy {
    /**
     * Record the failure and carry on with the remaining entity types.
     */
    CONTINUE,

    /**
     * Record the failure and skip every entity type after it.
     */
    HALT
}
