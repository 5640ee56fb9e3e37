package com.fueltrack.archival.dto;

import com.fueltrack.archival.model.enums.FailurePolicy;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;

import java.util.List;

/**
 * Body of a manual archival run. Absent fields fall back to the configured defaults.
 */
@Data
public class RunArchivalRequest {

    @Min(value = 1, message = "monthsToKeep must be at least 1")
    private Integer monthsToKeep;

    @Min(value = 1, message = "auditLogMonthsToKeep must be at least 1")
    private Integer auditLogMonthsToKeep;

    private Boolean dryRun;

    private List<String> collections;

    @Min(value = 1, message = "batchSize must be at least 1")
    @Max(value = 10000, message = "batchSize must not exceed 10000")
    private Integer batchSize;

    private FailurePolicy failurePolicy;

    public ArchivalOptions toOptions(ArchivalOptions defaults) {
        ArchivalOptions.ArchivalOptionsBuilder builder = defaults.toBuilder();
        if (monthsToKeep != null) {
            builder.monthsToKeep(monthsToKeep);
        }
        if (auditLogMonthsToKeep != null) {
            builder.auditLogMonthsToKeep(auditLogMonthsToKeep);
        }
        if (dryRun != null) {
            builder.dryRun(dryRun);
        }
        if (collections != null && !collections.isEmpty()) {
            builder.collections(collections);
        }
        if (batchSize != null) {
            builder.batchSize(batchSize);
        }
        if (failurePolicy != null) {
            builder.failurePolicy(failurePolicy);
        }
        return builder.build();
    }
}
