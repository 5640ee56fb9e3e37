package com.fueltrack.archival.config;

import com.fueltrack.archival.model.enums.FailurePolicy;
import com.fueltrack.archival.model.enums.RetentionClass;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings for the archival engine, bound from {@code app.archival.*}.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "app.archival")
public class ArchivalProperties {

    private int batchSize = 1000;
    private int restoreBatchSize = 500;
    private int defaultMonthsToKeep = 6;
    private int defaultAuditLogMonthsToKeep = 12;
    private FailurePolicy failurePolicy = FailurePolicy.CONTINUE;

    /**
     * How long a crashed run can keep others out. A live run keeps extending its lease, so this does
     * not limit run length. Must be at least 30 seconds.
     */
    private Duration lockAtMostFor = Duration.ofMinutes(10);

    private boolean compactionEnabled = true;
    private long estimatedBytesPerRecord = 2048;
    private int statsThreads = 4;

    private List<EntityTypeSettings> entityTypes = new ArrayList<>(List.of(
            new EntityTypeSettings("FuelRecord", "fuelrecords", "archivedfuelrecords", "createdAt",
                    RetentionClass.STANDARD),
            new EntityTypeSettings("LPOEntry", "lpoentries", "archivedlpoentries", "createdAt",
                    RetentionClass.STANDARD),
            new EntityTypeSettings("LPOSummary", "lposummaries", "archivedlposummaries", "createdAt",
                    RetentionClass.STANDARD),
            new EntityTypeSettings("YardFuelDispense", "yardfueldispenses", "archivedyardfueldispenses",
                    "createdAt", RetentionClass.STANDARD),
            new EntityTypeSettings("DeliveryOrder", "deliveryorders", "archiveddeliveryorders", "createdAt",
                    RetentionClass.STANDARD),
            new EntityTypeSettings("AuditLog", "auditlogs", "archivedauditlogs", "timestamp",
                    RetentionClass.AUDIT)));

    private Scheduler scheduler = new Scheduler();
    private Notifications notifications = new Notifications();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EntityTypeSettings {
        private String name;
        private String hotCollection;
        private String coldCollection;
        private String dateField = "createdAt";
        private RetentionClass retentionClass = RetentionClass.STANDARD;
    }

    @Data
    public static class Scheduler {
        private boolean enabled = true;
        private String cron = "0 0 2 1 * *";
    }

    @Data
    public static class Notifications {
        private boolean enabled = false;
        private String exchange = "archival-events";
        private String queue = "archival-run-completed";
        private String routingKey = "archival.run.completed";
    }
}
