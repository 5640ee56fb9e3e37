package com.fueltrack.archival.store;

import com.mongodb.bulk.BulkWriteError;
import lombok.extern.slf4j.Slf4j;
import org.bson.BsonTimestamp;
import org.bson.Document;
import org.bson.types.BSONTimestamp;
import org.bson.types.Binary;
import org.bson.types.ObjectId;
import org.bson.types.Symbol;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.BulkOperationException;
import org.springframework.data.mongodb.core.BulkOperations;
import org.springframework.data.mongodb.core.FindAndReplaceOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * {@link RecordStore} over a raw MongoDB collection accessed through {@link MongoTemplate}.
 *
 * <p>
 * Keyset pages follow MongoDB's {@code _id} sort order, which groups values by BSON type. A plain
 * {@code $gt} only matches values of the cursor's own type, so the page condition also admits every
 * type that sorts after it. Collections mixing, say, string and ObjectId identities are paged in full.
 */
@Slf4j
public class MongoRecordStore implements RecordStore {

    // BSON type codes grouped in _id sort order
    private static final int[][] ID_TYPE_ORDER = {
            { 1, 16, 18, 19 }, // numbers
            { 2, 14 }, // strings, symbols
            { 3 }, // embedded documents
            { 5 }, // binary
            { 7 }, // ObjectId
            { 8 }, // boolean
            { 9 }, // date
            { 17 } // timestamp
    };

    private final MongoTemplate mongoTemplate;
    private final String collectionName;

    public MongoRecordStore(MongoTemplate mongoTemplate, String collectionName) {
        this.mongoTemplate = mongoTemplate;
        this.collectionName = collectionName;
    }

    /**
     * Ensures the indexes an archive collection relies on: a unique {@code originalId} and
     * {@code archivedAt} for restore windows and browsing.
     */
    public void ensureArchiveIndexes() {
        mongoTemplate.indexOps(collectionName).ensureIndex(new Index()
                .on("originalId", Sort.Direction.ASC)
                .unique()
                .named("originalId_unique"));
        mongoTemplate.indexOps(collectionName).ensureIndex(new Index()
                .on(RecordQuery.ARCHIVED_AT, Sort.Direction.DESC)
                .named("archivedAt_desc"));
        log.debug("Archive indexes ensured on {}", collectionName);
    }

    @Override
    public String getCollectionName() {
        return collectionName;
    }

    @Override
    public long count(RecordQuery query) {
        return mongoTemplate.count(toQuery(query, null), collectionName);
    }

    @Override
    public List<Document> findPage(RecordQuery query, Object afterId, int limit) {
        Query mongoQuery = toQuery(query, afterId)
                .with(Sort.by(Sort.Direction.ASC, ID_FIELD))
                .limit(limit);
        return mongoTemplate.find(mongoQuery, Document.class, collectionName);
    }

    @Override
    public List<Document> find(RecordQuery query, int skip, int limit, String sortField, boolean descending) {
        Query mongoQuery = toQuery(query, null)
                .with(Sort.by(descending ? Sort.Direction.DESC : Sort.Direction.ASC, sortField))
                .skip(skip)
                .limit(limit);
        return mongoTemplate.find(mongoQuery, Document.class, collectionName);
    }

    @Override
    public InsertOutcome insertAll(List<Document> documents) {
        if (documents.isEmpty()) {
            return InsertOutcome.allWritten(0);
        }
        BulkOperations bulk = mongoTemplate.bulkOps(BulkOperations.BulkMode.UNORDERED, collectionName);
        bulk.insert(documents);
        return execute(bulk, documents.size());
    }

    @Override
    public InsertOutcome replaceAll(List<Document> documents) {
        if (documents.isEmpty()) {
            return InsertOutcome.allWritten(0);
        }
        BulkOperations bulk = mongoTemplate.bulkOps(BulkOperations.BulkMode.UNORDERED, collectionName);
        for (Document document : documents) {
            Query byId = Query.query(Criteria.where(ID_FIELD).is(document.get(ID_FIELD)));
            bulk.replaceOne(byId, document, FindAndReplaceOptions.options().upsert());
        }
        return execute(bulk, documents.size());
    }

    @Override
    public Set<Object> findExistingIds(Collection<Object> ids) {
        if (ids.isEmpty()) {
            return Set.of();
        }
        Query query = Query.query(Criteria.where(ID_FIELD).in(ids));
        query.fields().include(ID_FIELD);
        return mongoTemplate.find(query, Document.class, collectionName).stream()
                .map(document -> document.get(ID_FIELD))
                .collect(Collectors.toSet());
    }

    @Override
    public long deleteByIds(Collection<Object> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        return mongoTemplate.remove(Query.query(Criteria.where(ID_FIELD).in(ids)), collectionName)
                .getDeletedCount();
    }

    @Override
    public void compact() {
        mongoTemplate.executeCommand(new Document("compact", collectionName));
    }

    private InsertOutcome execute(BulkOperations bulk, int attempted) {
        try {
            bulk.execute();
            return InsertOutcome.allWritten(attempted);
        } catch (BulkOperationException e) {
            Map<Integer, String> failures = new LinkedHashMap<>();
            for (BulkWriteError error : e.getErrors()) {
                failures.put(error.getIndex(), error.getCode() + ": " + error.getMessage());
            }
            log.warn("{} of {} writes to {} were rejected", failures.size(), attempted, collectionName);
            return InsertOutcome.withFailures(attempted, failures);
        }
    }

    Query toQuery(RecordQuery query, Object afterId) {
        List<Criteria> criteria = new ArrayList<>();
        if (query.isExcludeDeleted()) {
            criteria.add(Criteria.where(RecordQuery.DELETED_FLAG).ne(true));
        }
        if (query.hasDateRange()) {
            Criteria range = Criteria.where(query.getDateField());
            if (query.getBefore() != null) {
                range = range.lt(Date.from(query.getBefore()));
            }
            if (query.getFrom() != null) {
                range = range.gte(Date.from(query.getFrom()));
            }
            if (query.getTo() != null) {
                range = range.lte(Date.from(query.getTo()));
            }
            criteria.add(range);
        }
        query.getEqualTo().forEach((field, value) -> criteria.add(Criteria.where(field).is(value)));
        if (afterId != null) {
            criteria.add(after(afterId));
        }
        if (criteria.isEmpty()) {
            return new Query();
        }
        return new Query(new Criteria().andOperator(criteria.toArray(new Criteria[0])));
    }

    private static Criteria after(Object afterId) {
        List<Criteria> after = new ArrayList<>();
        after.add(Criteria.where(ID_FIELD).gt(afterId));
        int group = idTypeGroup(afterId);
        if (group >= 0) {
            for (int later = group + 1; later < ID_TYPE_ORDER.length; later++) {
                for (int typeCode : ID_TYPE_ORDER[later]) {
                    after.add(Criteria.where(ID_FIELD).type(typeCode));
                }
            }
        }
        if (after.size() == 1) {
            return after.get(0);
        }
        return new Criteria().orOperator(after.toArray(new Criteria[0]));
    }

    static int idTypeGroup(Object id) {
        if (id instanceof Number) {
            return 0;
        }
        if (id instanceof String || id instanceof Symbol) {
            return 1;
        }
        if (id instanceof Map) {
            return 2;
        }
        if (id instanceof Binary || id instanceof UUID || id instanceof byte[]) {
            return 3;
        }
        if (id instanceof ObjectId) {
            return 4;
        }
        if (id instanceof Boolean) {
            return 5;
        }
        if (id instanceof Date) {
            return 6;
        }
        if (id instanceof BsonTimestamp || id instanceof BSONTimestamp) {
            return 7;
        }
        return -1;
    }
}
