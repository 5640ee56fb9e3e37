package com.fueltrack.archival.dto;

import com.fueltrack.archival.model.enums.FailurePolicy;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Options for one archival run.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ArchivalOptions {

    @Builder.Default
    private int monthsToKeep = 6;

    /**
     * Default retention for entity types of the audit retention class.
     */
    @Builder.Default
    private int auditLogMonthsToKeep = 12;

    @Builder.Default
    private boolean dryRun = false;

    /**
     * Entity types to process. Null or empty means every registered type.
     */
    private List<String> collections;

    @Builder.Default
    private int batchSize = 1000;

    @Builder.Default
    private FailurePolicy failurePolicy = FailurePolicy.CONTINUE;
}
