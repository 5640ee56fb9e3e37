package com.fueltrack.archival.model;

import lombok.Value;

/**
 * Effective retention for one entity type on one run.
 */
@Value
public class RetentionDecision {

    private static final RetentionDecision DISABLED = new RetentionDecision(0, false);

    int months;
    boolean enabled;

    public static RetentionDecision keepMonths(int months) {
        return new RetentionDecision(months, true);
    }

    public static RetentionDecision disabled() {
        return DISABLED;
    }
}
