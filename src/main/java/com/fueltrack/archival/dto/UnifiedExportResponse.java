package com.fueltrack.archival.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.bson.Document;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UnifiedExportResponse {
    private String collectionName;
    private String dateField;
    private int activeRecords;
    private int archivedRecords;

    /**
     * False when archived records were not requested or the archive could not be read.
     */
    private boolean archivedIncluded;

    private List<Document> records;
}
