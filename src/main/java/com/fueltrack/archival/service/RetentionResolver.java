package com.fueltrack.archival.service;

import com.fueltrack.archival.model.RetentionDecision;
import com.fueltrack.archival.model.RetentionPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Decides how many months of an entity type stay in the hot store, and whether it is archived at all.
 *
 * <p>
 * Precedence: the per-type entry, then the global settings, then the caller's default. A month value
 * below 1 counts as unset. A configuration outage resolves to the default and enabled, so archival
 * neither stops silently nor fails the run.
 */
@Service
@Slf4j
public class RetentionResolver {

    private final RetentionPolicyProvider policyProvider;

    public RetentionResolver(RetentionPolicyProvider policyProvider) {
        this.policyProvider = policyProvider;
    }

    public RetentionDecision resolve(String entityType, int defaultMonths) {
        RetentionPolicy policy;
        try {
            policy = policyProvider.currentPolicy();
        } catch (Exception e) {
            log.warn("Could not read retention settings for {}, using default of {} months: {}",
                    entityType, defaultMonths, e.getMessage());
            return RetentionDecision.keepMonths(defaultMonths);
        }
        if (policy == null) {
            return RetentionDecision.keepMonths(defaultMonths);
        }

        Optional<RetentionPolicy.TypeRetention> typeRetention = policy.forType(entityType);
        if (typeRetention.isPresent()) {
            if (!typeRetention.get().isEnabled()) {
                return RetentionDecision.disabled();
            }
            return RetentionDecision.keepMonths(orDefault(typeRetention.get().getRetentionMonths(), defaultMonths));
        }

        if (Boolean.FALSE.equals(policy.getArchivalEnabled())) {
            return RetentionDecision.disabled();
        }
        return RetentionDecision.keepMonths(orDefault(policy.getArchivalMonths(), defaultMonths));
    }

    private static int orDefault(Integer months, int defaultMonths) {
        return months != null && months >= 1 ? months : defaultMonths;
    }
}
