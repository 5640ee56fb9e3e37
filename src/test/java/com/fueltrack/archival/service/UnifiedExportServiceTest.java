package com.fueltrack.archival.service;

import com.fueltrack.archival.dto.ExportRequest;
import com.fueltrack.archival.dto.UnifiedExportResponse;
import com.fueltrack.archival.store.EntityType;
import com.fueltrack.archival.store.EntityTypeRegistry;
import com.fueltrack.archival.store.InMemoryRecordStore;
import com.fueltrack.archival.store.RecordQuery;
import com.fueltrack.archival.store.RecordStore;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

public class UnifiedExportServiceTest {

    private InMemoryRecordStore hot;
    private InMemoryRecordStore cold;
    private UnifiedExportService service;

    @BeforeEach
    public void setUp() {
        hot = new InMemoryRecordStore("fuelrecords");
        cold = new InMemoryRecordStore("archivedfuelrecords", CollectionArchiver.ORIGINAL_ID);

        hot.put(record(10, "2025-03-10T00:00:00Z", "T-100"));
        hot.put(record(11, "2025-01-20T00:00:00Z", "T-200"));
        hot.put(record(12, "2025-02-01T00:00:00Z", "T-100").append("isDeleted", true));
        cold.put(archived(1, "2024-06-01T00:00:00Z", "T-100"));
        cold.put(archived(2, "2024-11-15T00:00:00Z", "T-200"));
        cold.put(archived(3, "2024-02-01T00:00:00Z", "T-100"));

        service = new UnifiedExportService(registryOf(hot, cold));
    }

    private static EntityTypeRegistry registryOf(RecordStore hotStore, RecordStore coldStore) {
        return new EntityTypeRegistry(List.of(EntityType.builder()
                .name("FuelRecord")
                .hotStore(hotStore)
                .coldStore(coldStore)
                .build()));
    }

    private static Document record(int id, String createdAt, String truckNo) {
        return new Document("_id", id)
                .append("truckNo", truckNo)
                .append("createdAt", Date.from(Instant.parse(createdAt)));
    }

    private static Document archived(int originalId, String createdAt, String truckNo) {
        return CollectionArchiver.toArchived(record(originalId, createdAt, truckNo),
                Instant.parse("2025-03-01T02:00:00Z"), "Automated archival - data older than Sat Feb 01 2025");
    }

    private static ExportRequest request() {
        ExportRequest request = new ExportRequest();
        request.setCollectionName("FuelRecord");
        return request;
    }

    private static List<String> trucksAndDates(UnifiedExportResponse response) {
        return response.getRecords().stream()
                .map(document -> document.get("truckNo") + "@" + ((Date) document.get("createdAt")).toInstant())
                .collect(Collectors.toList());
    }

    @Test
    public void testExport_MergesBothStoresNewestFirst() {
        UnifiedExportResponse response = service.export(request());

        assertEquals("FuelRecord", response.getCollectionName());
        assertEquals("createdAt", response.getDateField());
        assertEquals(2, response.getActiveRecords());
        assertEquals(3, response.getArchivedRecords());
        assertTrue(response.isArchivedIncluded());
        assertEquals(List.of(
                "T-100@2025-03-10T00:00:00Z",
                "T-200@2025-01-20T00:00:00Z",
                "T-200@2024-11-15T00:00:00Z",
                "T-100@2024-06-01T00:00:00Z",
                "T-100@2024-02-01T00:00:00Z"), trucksAndDates(response));
    }

    @Test
    public void testExport_ArchivedCopiesKeepProvenance() {
        UnifiedExportResponse response = service.export(request());

        Document oldest = response.getRecords().get(4);
        assertEquals(3, oldest.get(CollectionArchiver.ORIGINAL_ID));
        assertTrue(oldest.get(RecordStore.ID_FIELD) instanceof ObjectId);
        assertNotNull(oldest.get(CollectionArchiver.ARCHIVED_AT));
    }

    @Test
    public void testExport_WindowOnCreatedAtSpansBothStores() {
        ExportRequest request = request();
        request.setStartDate(Instant.parse("2024-11-01T00:00:00Z"));
        request.setEndDate(Instant.parse("2025-01-31T23:59:59Z"));

        UnifiedExportResponse response = service.export(request);

        assertEquals(List.of("T-200@2025-01-20T00:00:00Z", "T-200@2024-11-15T00:00:00Z"), trucksAndDates(response));
    }

    @Test
    public void testExport_FiltersAndLimit() {
        ExportRequest request = request();
        request.setFilters(Map.of("truckNo", "T-100"));
        request.setLimit(2);

        UnifiedExportResponse response = service.export(request);

        assertEquals(List.of("T-100@2025-03-10T00:00:00Z", "T-100@2024-06-01T00:00:00Z"), trucksAndDates(response));
    }

    @Test
    public void testExport_ActiveOnly() {
        ExportRequest request = request();
        request.setIncludeArchived(false);

        UnifiedExportResponse response = service.export(request);

        assertFalse(response.isArchivedIncluded());
        assertEquals(0, response.getArchivedRecords());
        assertEquals(2, response.getRecords().size());
    }

    @Test
    public void testExport_ArchiveUnavailableReturnsActiveRecords() {
        RecordStore brokenCold = mock(RecordStore.class);
        when(brokenCold.find(any(RecordQuery.class), anyInt(), anyInt(), anyString(), anyBoolean()))
                .thenThrow(new DataAccessResourceFailureException("archive unreachable"));
        service = new UnifiedExportService(registryOf(hot, brokenCold));

        UnifiedExportResponse response = service.export(request());

        assertFalse(response.isArchivedIncluded());
        assertEquals(2, response.getRecords().size());
    }

    @Test
    public void testExport_HotStoreFailurePropagates() {
        RecordStore brokenHot = mock(RecordStore.class);
        when(brokenHot.find(any(RecordQuery.class), anyInt(), anyInt(), anyString(), anyBoolean()))
                .thenThrow(new DataAccessResourceFailureException("primary unreachable"));
        service = new UnifiedExportService(registryOf(brokenHot, cold));

        assertThrows(DataAccessResourceFailureException.class, () -> service.export(request()));
    }

    @Test
    public void testExport_InvalidRequests() {
        ExportRequest inverted = request();
        inverted.setStartDate(Instant.parse("2025-02-01T00:00:00Z"));
        inverted.setEndDate(Instant.parse("2025-01-01T00:00:00Z"));
        ExportRequest operator = request();
        operator.setFilters(Map.of("truckNo", Map.of("$gt", "")));
        ExportRequest unknown = request();
        unknown.setCollectionName("Invoice");

        assertThrows(IllegalArgumentException.class, () -> service.export(inverted));
        assertThrows(IllegalArgumentException.class, () -> service.export(operator));
        assertThrows(IllegalArgumentException.class, () -> service.export(unknown));
    }
}
