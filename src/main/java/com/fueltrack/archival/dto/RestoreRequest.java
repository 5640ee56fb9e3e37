package com.fueltrack.archival.dto;

import com.fueltrack.archival.model.enums.CollisionPolicy;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.time.Instant;

@Data
public class RestoreRequest {
    @NotBlank(message = "Collection name is required")
    private String collectionName;

    // Optional archivedAt window, both bounds inclusive
    private Instant startDate;
    private Instant endDate;

    private CollisionPolicy onCollision = CollisionPolicy.FAIL;
}
