package com.fueltrack.archival.service;

import com.fueltrack.archival.config.ArchivalProperties;
import com.fueltrack.archival.config.CacheConfig;
import com.fueltrack.archival.dto.ArchivalOptions;
import com.fueltrack.archival.dto.ArchivalRunResult;
import com.fueltrack.archival.dto.CollectionArchiveResult;
import com.fueltrack.archival.exception.ArchivalCancelledException;
import com.fueltrack.archival.model.RetentionDecision;
import com.fueltrack.archival.model.enums.FailurePolicy;
import com.fueltrack.archival.model.enums.RetentionClass;
import com.fueltrack.archival.store.EntityType;
import com.fueltrack.archival.store.EntityTypeRegistry;
import com.fueltrack.archival.util.DateTimeUtil;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs archival across entity types.
 *
 * <p>
 * Types are processed one after another in registry order. Each type gets its own retention
 * decision, cutoff and Job Record. Run-level failures are reported in the result rather than thrown;
 * only invalid options and a held lease are raised to the caller.
 */
@Service
@Slf4j
public class ArchivalOrchestrator {

    public static final String MDC_RUN_KEY = "archivalRun";

    private final EntityTypeRegistry registry;
    private final RetentionResolver retentionResolver;
    private final CollectionArchiver collectionArchiver;
    private final ArchivalLease lease;
    private final ArchivalEventPublisher eventPublisher;
    private final ArchivalProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final AtomicReference<CancellationToken> activeRun = new AtomicReference<>();

    public ArchivalOrchestrator(EntityTypeRegistry registry, RetentionResolver retentionResolver,
            CollectionArchiver collectionArchiver, ArchivalLease lease, ArchivalEventPublisher eventPublisher,
            ArchivalProperties properties, MeterRegistry meterRegistry, Clock clock) {
        this.registry = registry;
        this.retentionResolver = retentionResolver;
        this.collectionArchiver = collectionArchiver;
        this.lease = lease;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /**
     * Options seeded from configuration, used when a caller does not supply its own.
     */
    public ArchivalOptions defaultOptions() {
        return ArchivalOptions.builder()
                .monthsToKeep(properties.getDefaultMonthsToKeep())
                .auditLogMonthsToKeep(properties.getDefaultAuditLogMonthsToKeep())
                .batchSize(properties.getBatchSize())
                .failurePolicy(properties.getFailurePolicy())
                .build();
    }

    /**
     * @throws IllegalArgumentException for unknown entity types or non-positive numeric options
     * @throws com.fueltrack.archival.exception.ArchivalInProgressException if another run or restore
     *                                                                       is active
     */
    @CacheEvict(value = CacheConfig.STATS_CACHE, allEntries = true)
    public ArchivalRunResult run(ArchivalOptions options, String initiatedBy) {
        validate(options);
        List<EntityType> selected = registry.select(options.getCollections());
        return lease.withLease("archival run", () -> execute(options, selected, initiatedBy));
    }

    public boolean isRunning() {
        return activeRun.get() != null;
    }

    /**
     * Asks the active run to stop at its next batch boundary.
     *
     * @return false when no run is active on this instance
     */
    public boolean cancelActiveRun() {
        CancellationToken token = activeRun.get();
        if (token == null) {
            return false;
        }
        token.cancel();
        log.info("Cancellation requested for the active archival run");
        return true;
    }

    private ArchivalRunResult execute(ArchivalOptions options, List<EntityType> selected, String initiatedBy) {
        String runId = UUID.randomUUID().toString();
        CancellationToken cancellation = CancellationToken.create();
        activeRun.set(cancellation);
        MDC.put(MDC_RUN_KEY, runId);
        Timer.Sample sample = Timer.start(meterRegistry);
        long startMillis = clock.millis();

        ArchivalRunResult result = ArchivalRunResult.builder()
                .runId(runId)
                .success(true)
                .dryRun(options.isDryRun())
                .build();
        try {
            log.info("{}Archival run started by {} for {}", options.isDryRun() ? "[DRY RUN] " : "", initiatedBy,
                    selected);
            for (EntityType entityType : selected) {
                if (cancellation.isCancelled()) {
                    result.addError(entityType.getName(), "Archival run cancelled");
                    break;
                }
                if (!archiveType(entityType, options, initiatedBy, cancellation, result)) {
                    break;
                }
            }
            result.setTotalDuration(clock.millis() - startMillis);

            if (result.isSuccess() && !options.isDryRun()) {
                compact(selected, result);
            }
            if (!options.isDryRun()) {
                eventPublisher.publishRunCompleted(result, initiatedBy);
            }
            log.info("Archival run finished: success={}, records={}, duration={} ms, errors={}",
                    result.isSuccess(), result.getTotalRecordsArchived(), result.getTotalDuration(),
                    result.getErrors());
            return result;
        } finally {
            sample.stop(meterRegistry.timer("archival.run.duration",
                    "dryRun", String.valueOf(options.isDryRun()),
                    "status", result.isSuccess() ? "success" : "error"));
            activeRun.compareAndSet(cancellation, null);
            MDC.remove(MDC_RUN_KEY);
        }
    }

    /**
     * Archives one type into the result. Returns false when the run must not continue.
     */
    private boolean archiveType(EntityType entityType, ArchivalOptions options, String initiatedBy,
            CancellationToken cancellation, ArchivalRunResult result) {
        String name = entityType.getName();
        int defaultMonths = entityType.getRetentionClass() == RetentionClass.AUDIT
                ? options.getAuditLogMonthsToKeep()
                : options.getMonthsToKeep();

        RetentionDecision decision = retentionResolver.resolve(name, defaultMonths);
        if (!decision.isEnabled()) {
            log.info("Archival disabled for {}, skipping", name);
            return true;
        }

        Instant cutoff = DateTimeUtil.monthsBefore(clock, decision.getMonths());
        try {
            CollectionArchiveResult archived = collectionArchiver.archive(entityType, cutoff, initiatedBy,
                    options.isDryRun(), options.getBatchSize(), cancellation);
            result.addCollection(name, archived);
            if (!options.isDryRun()) {
                meterRegistry.counter("archival.records.archived", "collection", name)
                        .increment(archived.getRecordsArchived());
            }
            return true;
        } catch (ArchivalCancelledException e) {
            result.addError(name, e.getMessage());
            return false;
        } catch (RuntimeException e) {
            result.addError(name, messageOf(e));
            if (options.getFailurePolicy() == FailurePolicy.HALT) {
                log.warn("Halting archival run after failure on {}", name);
                return false;
            }
            return true;
        }
    }

    private void compact(List<EntityType> selected, ArchivalRunResult result) {
        if (!properties.isCompactionEnabled()) {
            return;
        }
        Map<String, CollectionArchiveResult> archived = result.getCollectionsArchived();
        for (EntityType entityType : selected) {
            CollectionArchiveResult typeResult = archived.get(entityType.getName());
            if (typeResult == null || typeResult.getRecordsArchived() == 0) {
                continue;
            }
            try {
                entityType.getHotStore().compact();
                log.info("Compacted {}", entityType.getHotStore().getCollectionName());
            } catch (Exception e) {
                log.warn("Could not compact {}: {}", entityType.getHotStore().getCollectionName(), e.getMessage());
            }
        }
    }

    private void validate(ArchivalOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("Archival options are required");
        }
        if (options.getMonthsToKeep() < 1) {
            throw new IllegalArgumentException("monthsToKeep must be at least 1");
        }
        if (options.getAuditLogMonthsToKeep() < 1) {
            throw new IllegalArgumentException("auditLogMonthsToKeep must be at least 1");
        }
        if (options.getBatchSize() < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1");
        }
    }

    private static String messageOf(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
