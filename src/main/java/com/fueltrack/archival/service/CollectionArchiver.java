package com.fueltrack.archival.service;

import com.fueltrack.archival.dto.CollectionArchiveResult;
import com.fueltrack.archival.exception.ArchivalCancelledException;
import com.fueltrack.archival.model.ArchivalJob;
import com.fueltrack.archival.store.EntityType;
import com.fueltrack.archival.store.InsertOutcome;
import com.fueltrack.archival.store.RecordQuery;
import com.fueltrack.archival.store.RecordStore;
import com.fueltrack.archival.util.DateTimeUtil;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Moves the records of one entity type that are older than a cutoff from the hot store to the cold
 * store, one batch at a time.
 *
 * <p>
 * Each batch is copied first and deleted second. Only records whose copy the cold store confirmed
 * are deleted, so a failure at any point leaves at worst a record present in both stores, never
 * in neither.
 */
@Service
@Slf4j
public class CollectionArchiver {

    public static final String ORIGINAL_ID = "originalId";
    public static final String ARCHIVED_AT = RecordQuery.ARCHIVED_AT;
    public static final String ARCHIVED_REASON = "archivedReason";

    private final ArchivalJobService archivalJobService;
    private final Clock clock;

    public CollectionArchiver(ArchivalJobService archivalJobService, Clock clock) {
        this.archivalJobService = archivalJobService;
        this.clock = clock;
    }

    public CollectionArchiveResult archive(String entityType, RecordStore sourceStore, RecordStore archiveStore,
            Instant cutoffDate, String initiatedBy, boolean dryRun, int batchSize, String dateField) {
        return archive(entityType, sourceStore, archiveStore, cutoffDate, initiatedBy, dryRun, batchSize,
                dateField, CancellationToken.none());
    }

    public CollectionArchiveResult archive(EntityType entityType, Instant cutoffDate, String initiatedBy,
            boolean dryRun, int batchSize, CancellationToken cancellation) {
        return archive(entityType.getName(), entityType.getHotStore(), entityType.getColdStore(), cutoffDate,
                initiatedBy, dryRun, batchSize, entityType.getDateField(), cancellation);
    }

    private CollectionArchiveResult archive(String entityType, RecordStore sourceStore, RecordStore archiveStore,
            Instant cutoffDate, String initiatedBy, boolean dryRun, int batchSize, String dateField,
            CancellationToken cancellation) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be at least 1, got " + batchSize);
        }
        if (cutoffDate == null) {
            throw new IllegalArgumentException("Cutoff date is required");
        }
        String field = dateField != null ? dateField : EntityType.DEFAULT_DATE_FIELD;
        long startMillis = clock.millis();

        ArchivalJob job = dryRun ? null : archivalJobService.start(entityType, cutoffDate, initiatedBy);
        long archived = 0;
        try {
            RecordQuery eligible = RecordQuery.eligibleForArchival(field, cutoffDate);
            long total = sourceStore.count(eligible);

            if (total == 0) {
                log.info("No {} records older than {} to archive", entityType, cutoffDate);
                if (job != null) {
                    archivalJobService.complete(job, 0, clock.millis() - startMillis);
                }
                return new CollectionArchiveResult(0, clock.millis() - startMillis, cutoffDate);
            }

            if (dryRun) {
                log.info("[DRY RUN] Would archive {} {} records older than {}", total, entityType, cutoffDate);
                return new CollectionArchiveResult(total, clock.millis() - startMillis, cutoffDate);
            }

            log.info("Archiving {} {} records older than {} in batches of {}", total, entityType, cutoffDate,
                    batchSize);
            Instant archivedAt = clock.instant();
            String reason = DateTimeUtil.archivedReason(cutoffDate, clock.getZone());
            Object cursor = null;

            while (true) {
                if (cancellation.isCancelled()) {
                    throw new ArchivalCancelledException(entityType, archived);
                }
                List<Document> batch = sourceStore.findPage(eligible, cursor, batchSize);
                if (batch.isEmpty()) {
                    break;
                }
                cursor = batch.get(batch.size() - 1).get(RecordStore.ID_FIELD);

                archived += moveBatch(entityType, batch, sourceStore, archiveStore, archivedAt, reason);
                log.info("{}: archived {}/{} ({}%)", entityType, archived, total, percent(archived, total));

                if (batch.size() < batchSize) {
                    break;
                }
            }

            long duration = clock.millis() - startMillis;
            archivalJobService.complete(job, archived, duration);
            log.info("Archived {} {} records in {} ms", archived, entityType, duration);
            return new CollectionArchiveResult(archived, duration, cutoffDate);
        } catch (RuntimeException e) {
            log.error("Archival of {} failed after {} records: {}", entityType, archived, e.getMessage(), e);
            if (job != null) {
                archivalJobService.fail(job, e.getMessage(), archived, clock.millis() - startMillis);
            }
            throw e;
        }
    }

    /**
     * Copies one batch and deletes the confirmed part of it. Returns the number of records moved.
     */
    private long moveBatch(String entityType, List<Document> batch, RecordStore sourceStore,
            RecordStore archiveStore, Instant archivedAt, String reason) {
        List<Document> copies = new ArrayList<>(batch.size());
        for (Document record : batch) {
            copies.add(toArchived(record, archivedAt, reason));
        }

        InsertOutcome outcome = archiveStore.insertAll(copies);

        List<Object> confirmed = new ArrayList<>(outcome.getWrittenCount());
        for (int i = 0; i < batch.size(); i++) {
            if (outcome.isWritten(i)) {
                confirmed.add(batch.get(i).get(RecordStore.ID_FIELD));
            }
        }
        for (Map.Entry<Integer, String> failure : outcome.getFailures().entrySet()) {
            log.warn("{} record {} was not archived and stays in {}: {}", entityType,
                    batch.get(failure.getKey()).get(RecordStore.ID_FIELD), sourceStore.getCollectionName(),
                    failure.getValue());
        }

        long deleted = sourceStore.deleteByIds(confirmed);
        if (deleted != confirmed.size()) {
            // Removed concurrently by application traffic; the archive copy is still valid
            log.debug("{}: {} of {} archived records were already gone from {}", entityType,
                    confirmed.size() - deleted, confirmed.size(), sourceStore.getCollectionName());
        }
        return confirmed.size();
    }

    static Document toArchived(Document record, Instant archivedAt, String reason) {
        Document copy = new Document(record);
        Object originalId = copy.remove(RecordStore.ID_FIELD);
        copy.put(RecordStore.ID_FIELD, new ObjectId());
        copy.put(ORIGINAL_ID, originalId);
        copy.put(ARCHIVED_AT, Date.from(archivedAt));
        copy.put(ARCHIVED_REASON, reason);
        return copy;
    }

    private static String percent(long done, long total) {
        return String.format(Locale.ROOT, "%.1f", Math.min(100.0, done * 100.0 / total));
    }
}
