package com.fueltrack.archival.service;

import com.fueltrack.archival.model.RetentionPolicy;

/**
 * Source of the retention policy. Implementations may throw when the backing store is unreachable.
 */
public interface RetentionPolicyProvider {

    /**
     * Returns the current policy, or {@link RetentionPolicy#empty()} when nothing is configured.
     */
    RetentionPolicy currentPolicy();
}
