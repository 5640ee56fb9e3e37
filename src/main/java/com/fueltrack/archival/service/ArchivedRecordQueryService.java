package com.fueltrack.archival.service;

import com.fueltrack.archival.dto.ArchivedRecordsResponse;
import com.fueltrack.archival.dto.QueryArchivedRequest;
import com.fueltrack.archival.store.EntityType;
import com.fueltrack.archival.store.EntityTypeRegistry;
import com.fueltrack.archival.store.RecordQuery;
import com.fueltrack.archival.store.RecordStore;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read access to archive collections for reference and reporting.
 */
@Service
@Slf4j
public class ArchivedRecordQueryService {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 1000;

    private final EntityTypeRegistry registry;

    public ArchivedRecordQueryService(EntityTypeRegistry registry) {
        this.registry = registry;
    }

    public ArchivedRecordsResponse query(QueryArchivedRequest request) {
        EntityType type = registry.require(request.getCollectionName());
        if (request.getArchivedFrom() != null && request.getArchivedTo() != null
                && request.getArchivedFrom().isAfter(request.getArchivedTo())) {
            throw new IllegalArgumentException("archivedFrom must not be after archivedTo");
        }
        int skip = Math.max(0, request.getSkip());
        int limit = request.getLimit() < 1 ? DEFAULT_LIMIT : Math.min(request.getLimit(), MAX_LIMIT);
        String sortField = request.getSortField() == null || request.getSortField().isBlank()
                ? RecordQuery.ARCHIVED_AT
                : request.getSortField();
        boolean descending = !"asc".equalsIgnoreCase(request.getSortDirection());

        RecordQuery.RecordQueryBuilder query = RecordQuery.archivedBetween(request.getArchivedFrom(),
                request.getArchivedTo()).toBuilder();
        RecordQuery.checkFilters(request.getFilters()).forEach(query::equalTo);
        RecordQuery recordQuery = query.build();

        RecordStore cold = type.getColdStore();
        List<Document> records = cold.find(recordQuery, skip, limit, sortField, descending);
        long total = cold.count(recordQuery);
        log.debug("Queried {} archived {} records ({} matching)", records.size(), type.getName(), total);

        return ArchivedRecordsResponse.builder()
                .collectionName(type.getName())
                .totalCount(total)
                .skip(skip)
                .limit(limit)
                .records(records)
                .build();
    }
}
