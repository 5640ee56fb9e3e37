package com.fueltrack.archival.service;

import com.fueltrack.archival.config.ArchivalProperties;
import com.fueltrack.archival.config.CacheConfig;
import com.fueltrack.archival.dto.RestoreResult;
import com.fueltrack.archival.exception.RestoreConflictException;
import com.fueltrack.archival.model.enums.CollisionPolicy;
import com.fueltrack.archival.store.EntityType;
import com.fueltrack.archival.store.EntityTypeRegistry;
import com.fueltrack.archival.store.InsertOutcome;
import com.fueltrack.archival.store.RecordQuery;
import com.fueltrack.archival.store.RecordStore;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Moves archived records back into the hot store under their original identity.
 *
 * <p>
 * Archive entries are deleted only once their reinsertion is confirmed. What happens when the
 * original identity already exists in the hot store is chosen by the caller's {@link CollisionPolicy}.
 */
@Service
@Slf4j
public class ArchiveRestorer {

    private final EntityTypeRegistry registry;
    private final ArchivalLease lease;
    private final ArchivalProperties properties;
    private final CacheManager cacheManager;

    public ArchiveRestorer(EntityTypeRegistry registry, ArchivalLease lease, ArchivalProperties properties,
            CacheManager cacheManager) {
        this.registry = registry;
        this.lease = lease;
        this.properties = properties;
        this.cacheManager = cacheManager;
    }

    /**
     * Restores the archived records of one entity type, optionally limited to those archived within
     * {@code [startDate, endDate]}.
     *
     * @throws RestoreConflictException if {@code onCollision} is FAIL and a restored identity is
     *                                  already present in the hot store
     */
    public RestoreResult restore(String entityType, Instant startDate, Instant endDate,
            CollisionPolicy onCollision) {
        if (startDate != null && endDate != null && startDate.isAfter(endDate)) {
            throw new IllegalArgumentException("startDate must not be after endDate");
        }
        EntityType type = registry.require(entityType);
        CollisionPolicy policy = onCollision != null ? onCollision : CollisionPolicy.FAIL;
        return lease.withLease("restore of " + entityType, () -> {
            try {
                return restoreAll(type, RecordQuery.archivedBetween(startDate, endDate), policy);
            } finally {
                // Earlier batches stay restored when a later one fails
                evictStats();
            }
        });
    }

    private void evictStats() {
        Cache stats = cacheManager.getCache(CacheConfig.STATS_CACHE);
        if (stats != null) {
            stats.clear();
        }
    }

    private RestoreResult restoreAll(EntityType type, RecordQuery window, CollisionPolicy policy) {
        RecordStore hot = type.getHotStore();
        RecordStore cold = type.getColdStore();
        int batchSize = properties.getRestoreBatchSize();
        log.info("Restoring {} from {} into {} (on collision: {})", type.getName(), cold.getCollectionName(),
                hot.getCollectionName(), policy);

        long restored = 0;
        long skipped = 0;
        Object cursor = null;
        while (true) {
            List<Document> batch = cold.findPage(window, cursor, batchSize);
            if (batch.isEmpty()) {
                break;
            }
            cursor = batch.get(batch.size() - 1).get(RecordStore.ID_FIELD);

            List<Object> archiveIds = new ArrayList<>();
            List<Document> candidates = new ArrayList<>();
            for (Document archived : batch) {
                Object originalId = archived.get(CollectionArchiver.ORIGINAL_ID);
                if (originalId == null) {
                    log.warn("Archived {} entry {} has no originalId, leaving it archived", type.getName(),
                            archived.get(RecordStore.ID_FIELD));
                    skipped++;
                    continue;
                }
                archiveIds.add(archived.get(RecordStore.ID_FIELD));
                candidates.add(toRestored(archived));
            }

            if (policy != CollisionPolicy.OVERWRITE) {
                Set<Object> existing = hot.findExistingIds(idsOf(candidates));
                if (!existing.isEmpty()) {
                    if (policy == CollisionPolicy.FAIL) {
                        throw new RestoreConflictException(type.getName(), existing.size(), restored);
                    }
                    for (int i = candidates.size() - 1; i >= 0; i--) {
                        if (existing.contains(candidates.get(i).get(RecordStore.ID_FIELD))) {
                            candidates.remove(i);
                            archiveIds.remove(i);
                        }
                    }
                    skipped += existing.size();
                    log.info("Skipped {} {} records already present in {}", existing.size(), type.getName(),
                            hot.getCollectionName());
                }
            }

            InsertOutcome outcome = policy == CollisionPolicy.OVERWRITE
                    ? hot.replaceAll(candidates)
                    : hot.insertAll(candidates);

            List<Object> confirmed = new ArrayList<>(outcome.getWrittenCount());
            for (int i = 0; i < candidates.size(); i++) {
                if (outcome.isWritten(i)) {
                    confirmed.add(archiveIds.get(i));
                }
            }
            for (Map.Entry<Integer, String> failure : outcome.getFailures().entrySet()) {
                log.warn("{} record {} could not be restored and stays archived: {}", type.getName(),
                        candidates.get(failure.getKey()).get(RecordStore.ID_FIELD), failure.getValue());
            }
            skipped += outcome.getFailures().size();

            cold.deleteByIds(confirmed);
            restored += confirmed.size();
            log.info("{}: restored {} records so far", type.getName(), restored);

            if (batch.size() < batchSize) {
                break;
            }
        }

        log.info("Restored {} {} records, {} left archived", restored, type.getName(), skipped);
        return RestoreResult.builder()
                .entityType(type.getName())
                .recordsRestored(restored)
                .recordsSkipped(skipped)
                .build();
    }

    static Document toRestored(Document archived) {
        Document restored = new Document(RecordStore.ID_FIELD, archived.get(CollectionArchiver.ORIGINAL_ID));
        for (Map.Entry<String, Object> field : archived.entrySet()) {
            switch (field.getKey()) {
                case RecordStore.ID_FIELD:
                case CollectionArchiver.ORIGINAL_ID:
                case CollectionArchiver.ARCHIVED_AT:
                case CollectionArchiver.ARCHIVED_REASON:
                    break;
                default:
                    restored.put(field.getKey(), field.getValue());
            }
        }
        return restored;
    }

    private static List<Object> idsOf(List<Document> documents) {
        List<Object> ids = new ArrayList<>(documents.size());
        for (Document document : documents) {
            ids.add(document.get(RecordStore.ID_FIELD));
        }
        return ids;
    }
}
