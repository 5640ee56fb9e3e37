package com.fueltrack.archival.scheduler;

import com.fueltrack.archival.dto.ArchivalOptions;
import com.fueltrack.archival.dto.ArchivalRunResult;
import com.fueltrack.archival.exception.ArchivalInProgressException;
import com.fueltrack.archival.model.RetentionPolicy;
import com.fueltrack.archival.service.ArchivalOrchestrator;
import com.fueltrack.archival.service.RetentionPolicyProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Monthly trigger for archival, by default at 02:00 on the first day of each month.
 *
 * <p>
 * Default retention months are seeded from the global settings of the configuration store, so
 * administrators can change the schedule's behavior without a redeploy.
 */
@Component
@Slf4j
@ConditionalOnProperty(prefix = "app.archival.scheduler", name = "enabled", havingValue = "true",
        matchIfMissing = true)
public class ArchivalScheduler {

    public static final String SCHEDULED_INITIATOR = "scheduled-job";
    public static final String MANUAL_INITIATOR = "manual-execution";

    private final ArchivalOrchestrator orchestrator;
    private final RetentionPolicyProvider policyProvider;

    public ArchivalScheduler(ArchivalOrchestrator orchestrator, RetentionPolicyProvider policyProvider) {
        this.orchestrator = orchestrator;
        this.policyProvider = policyProvider;
    }

    @Scheduled(cron = "${app.archival.scheduler.cron:0 0 2 1 * *}")
    public void runScheduled() {
        log.info("=== Scheduled archival started ===");
        try {
            report(orchestrator.run(seededOptions(false), SCHEDULED_INITIATOR));
        } catch (ArchivalInProgressException e) {
            log.warn("Scheduled archival skipped: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Scheduled archival process error: {}", e.getMessage(), e);
        }
        log.info("=== Scheduled archival finished ===");
    }

    /**
     * Runs archival immediately with the same seeded options as the schedule.
     */
    public ArchivalRunResult runNow(boolean dryRun) {
        log.info("=== Manual archival started (dry run: {}) ===", dryRun);
        ArchivalRunResult result = orchestrator.run(seededOptions(dryRun), MANUAL_INITIATOR);
        report(result);
        return result;
    }

    ArchivalOptions seededOptions(boolean dryRun) {
        ArchivalOptions.ArchivalOptionsBuilder options = orchestrator.defaultOptions().toBuilder().dryRun(dryRun);
        try {
            RetentionPolicy policy = policyProvider.currentPolicy();
            if (policy.getArchivalMonths() != null && policy.getArchivalMonths() >= 1) {
                options.monthsToKeep(policy.getArchivalMonths());
            }
            if (policy.getAuditLogMonths() != null && policy.getAuditLogMonths() >= 1) {
                options.auditLogMonthsToKeep(policy.getAuditLogMonths());
            }
        } catch (Exception e) {
            log.warn("Could not read retention settings, using configured defaults: {}", e.getMessage());
        }
        return options.build();
    }

    private void report(ArchivalRunResult result) {
        if (!result.isSuccess()) {
            log.error("Archival run {} finished with errors: {}", result.getRunId(), result.getErrors());
            return;
        }
        log.info("Archival run {} archived {} records in {} ms", result.getRunId(),
                result.getTotalRecordsArchived(), result.getTotalDuration());
        result.getCollectionsArchived().forEach((type, stats) -> log.info("  - {}: {} records ({} ms)", type,
                stats.getRecordsArchived(), stats.getDuration()));
    }
}
