package com.fueltrack.archival.model.enums;

/**
 * Selects which run option supplies the default retention months for an entity type.
 */
public enum RetentionClass {
    /**
     * Operational records, defaulting to {@code monthsToKeep}.
     */
    STANDARD,

    /**
     * Audit trail records, defaulting to {@code auditLogMonthsToKeep}.
     */
    AUDIT
}
