package com.fueltrack.archival.store;

import org.bson.Document;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * One hot or cold collection of an entity type.
 *
 * <p>
 * Records are opaque documents identified by {@code _id}. Writes are never transactional across
 * stores; callers reconcile using the per-document {@link InsertOutcome}.
 */
public interface RecordStore {

    String ID_FIELD = "_id";

    /**
     * Name of the underlying collection.
     */
    String getCollectionName();

    /**
     * Counts the records matching the query.
     */
    long count(RecordQuery query);

    /**
     * Returns up to {@code limit} matching records ordered by ascending {@code _id}, starting strictly
     * after {@code afterId} (from the beginning when null). The order spans identities of different
     * types, so paging to an empty page visits every matching record.
     */
    List<Document> findPage(RecordQuery query, Object afterId, int limit);

    /**
     * Returns matching records for browsing, sorted on an arbitrary field.
     */
    List<Document> find(RecordQuery query, int skip, int limit, String sortField, boolean descending);

    /**
     * Inserts the documents without stopping at the first failure.
     * Constraint violations are reported per document; connectivity failures are thrown.
     */
    InsertOutcome insertAll(List<Document> documents);

    /**
     * Replaces each document by {@code _id}, inserting it when absent.
     */
    InsertOutcome replaceAll(List<Document> documents);

    /**
     * Returns the subset of the given identities that exist in this store.
     */
    Set<Object> findExistingIds(Collection<Object> ids);

    /**
     * Deletes the records with the given identities and returns how many were removed.
     */
    long deleteByIds(Collection<Object> ids);

    /**
     * Asks the store to reclaim space freed by deletions.
     */
    void compact();
}
