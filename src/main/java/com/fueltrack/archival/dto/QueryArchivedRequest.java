package com.fueltrack.archival.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

import java.time.Instant;
import java.util.Map;

/**
 * Filtered read of one archive collection.
 */
@Data
public class QueryArchivedRequest {

    @NotBlank(message = "Collection name is required")
    private String collectionName;

    /**
     * Exact-match conditions on archived document fields.
     */
    private Map<String, Object> filters;

    private Instant archivedFrom;
    private Instant archivedTo;

    @Min(value = 0, message = "skip must not be negative")
    private int skip = 0;

    @Min(value = 1, message = "limit must be at least 1")
    @Max(value = 1000, message = "limit must not exceed 1000")
    private int limit = 100;

    private String sortField = "archivedAt";

    @Pattern(regexp = "(?i)asc|desc", message = "sortDirection must be asc or desc")
    private String sortDirection = "desc";
}
