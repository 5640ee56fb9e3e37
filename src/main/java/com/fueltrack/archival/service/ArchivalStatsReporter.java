package com.fueltrack.archival.service;

import com.fueltrack.archival.config.ArchivalProperties;
import com.fueltrack.archival.config.CacheConfig;
import com.fueltrack.archival.dto.ArchivalStats;
import com.fueltrack.archival.model.ArchivalJob;
import com.fueltrack.archival.store.EntityType;
import com.fueltrack.archival.store.EntityTypeRegistry;
import com.fueltrack.archival.store.RecordQuery;
import com.fueltrack.archival.store.RecordStore;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Reports hot and cold volumes per entity type.
 *
 * <p>
 * All counts run in parallel on a small fixed pool. The space-saved figure is an estimate based on
 * {@code app.archival.estimated-bytes-per-record}; callers must treat it as approximate.
 */
@Service
@Slf4j
public class ArchivalStatsReporter {

    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    private final EntityTypeRegistry registry;
    private final ArchivalJobService archivalJobService;
    private final ArchivalProperties properties;
    private final ExecutorService executorService;

    public ArchivalStatsReporter(EntityTypeRegistry registry, ArchivalJobService archivalJobService,
            ArchivalProperties properties) {
        this.registry = registry;
        this.archivalJobService = archivalJobService;
        this.properties = properties;
        this.executorService = Executors.newFixedThreadPool(Math.max(1, properties.getStatsThreads()));
    }

    @Cacheable(value = CacheConfig.STATS_CACHE, key = "'snapshot'")
    public ArchivalStats stats() {
        List<EntityType> types = registry.all();
        Map<String, CompletableFuture<Long>> active = new LinkedHashMap<>();
        Map<String, CompletableFuture<Long>> archived = new LinkedHashMap<>();
        for (EntityType type : types) {
            active.put(type.getName(), countAsync(type.getHotStore(), RecordQuery.notDeleted()));
            archived.put(type.getName(), countAsync(type.getColdStore(), RecordQuery.all()));
        }

        Map<String, Long> activeCounts = await(active);
        Map<String, Long> archivedCounts = await(archived);
        long totalActive = activeCounts.values().stream().mapToLong(Long::longValue).sum();
        long totalArchived = archivedCounts.values().stream().mapToLong(Long::longValue).sum();
        long savedBytes = totalArchived * properties.getEstimatedBytesPerRecord();

        return ArchivalStats.builder()
                .activeRecords(activeCounts)
                .archivedRecords(archivedCounts)
                .totalActiveRecords(totalActive)
                .totalArchivedRecords(totalArchived)
                .lastArchivalRun(archivalJobService.lastSuccessful().map(ArchivalJob::getCompletedAt).orElse(null))
                .estimatedSpaceSavedBytes(savedBytes)
                .estimatedSpaceSaved(formatMegabytes(savedBytes))
                .build();
    }

    static String formatMegabytes(long bytes) {
        return String.format(Locale.ROOT, "%.2f MB", bytes / BYTES_PER_MB);
    }

    private CompletableFuture<Long> countAsync(RecordStore store, RecordQuery query) {
        return CompletableFuture.supplyAsync(() -> store.count(query), executorService);
    }

    private Map<String, Long> await(Map<String, CompletableFuture<Long>> futures) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (Map.Entry<String, CompletableFuture<Long>> entry : futures.entrySet()) {
            try {
                counts.put(entry.getKey(), entry.getValue().join());
            } catch (CompletionException e) {
                log.error("Failed to count records for {}: {}", entry.getKey(), e.getCause().getMessage());
                if (e.getCause() instanceof RuntimeException) {
                    throw (RuntimeException) e.getCause();
                }
                throw e;
            }
        }
        return counts;
    }

    @PreDestroy
    public void shutdown() {
        executorService.shutdown();
    }
}
