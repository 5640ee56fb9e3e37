package com.fueltrack.archival.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.time.Instant;
import java.util.Map;

/**
 * Complete history export of one entity type, active and archived records together.
 */
@Data
public class ExportRequest {

    @NotBlank(message = "Collection name is required")
    private String collectionName;

    // Window on the entity type's date field, both bounds inclusive
    private Instant startDate;
    private Instant endDate;

    private Map<String, Object> filters;

    private boolean includeArchived = true;

    @Min(value = 1, message = "limit must be at least 1")
    @Max(value = 10000, message = "limit must not exceed 10000")
    private int limit = 10000;
}
