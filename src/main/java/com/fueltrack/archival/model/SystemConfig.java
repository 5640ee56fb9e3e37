package com.fueltrack.archival.model;

import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.Map;

/**
 * Read-only view of the application's system configuration document.
 * Only the data management section is mapped; the rest of the document is ignored.
 */
@Data
@Document(collection = "systemconfigs")
public class SystemConfig {

    public static final String SYSTEM_SETTINGS = "system_settings";

    @Id
    private String id;

    @Indexed
    private String configType;

    private SystemSettings systemSettings;
    private boolean isDeleted;

    @Data
    public static class SystemSettings {
        private DataSettings data;
    }

    @Data
    public static class DataSettings {
        private Boolean archivalEnabled;
        private Integer archivalMonths;
        private Integer auditLogRetention; // months
        private Map<String, CollectionArchivalSetting> collectionArchivalSettings;
    }

    @Data
    public static class CollectionArchivalSetting {
        private Boolean enabled;
        private Integer retentionMonths;
    }
}
