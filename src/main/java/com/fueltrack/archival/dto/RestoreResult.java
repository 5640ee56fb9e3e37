package com.fueltrack.archival.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RestoreResult {
    private String entityType;
    private long recordsRestored;
    private long recordsSkipped;
}
