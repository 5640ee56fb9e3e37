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
public class ArchivedRecordsResponse {
    private String collectionName;
    private long totalCount;
    private int skip;
    private int limit;
    private List<Document> records;
}
