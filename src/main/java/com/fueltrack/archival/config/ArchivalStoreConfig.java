package com.fueltrack.archival.config;

import com.fueltrack.archival.store.EntityType;
import com.fueltrack.archival.store.EntityTypeRegistry;
import com.fueltrack.archival.store.MongoRecordStore;
import lombok.extern.slf4j.Slf4j;
import jakarta.annotation.PreDestroy;
import net.javacrumbs.shedlock.core.ExtensibleLockProvider;
import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.provider.mongo.MongoLockProvider;
import net.javacrumbs.shedlock.support.KeepAliveLockProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Wires the entity type registry, the run lease and the clock used for cutoffs.
 */
@Configuration
@Slf4j
public class ArchivalStoreConfig {

    // Not a bean, so @Scheduled jobs never land on it
    private final ScheduledExecutorService leaseKeepAlive = Executors.newSingleThreadScheduledExecutor(task -> {
        Thread thread = new Thread(task, "archival-lease-keepalive");
        thread.setDaemon(true);
        return thread;
    });

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * One hot and one cold {@link MongoRecordStore} per configured entity type. Archive indexes are
     * ensured here so that every cold collection rejects duplicate {@code originalId} values.
     */
    @Bean
    public EntityTypeRegistry entityTypeRegistry(MongoTemplate mongoTemplate, ArchivalProperties properties) {
        List<EntityType> entityTypes = new ArrayList<>();
        for (ArchivalProperties.EntityTypeSettings settings : properties.getEntityTypes()) {
            MongoRecordStore coldStore = new MongoRecordStore(mongoTemplate, settings.getColdCollection());
            coldStore.ensureArchiveIndexes();
            entityTypes.add(EntityType.builder()
                    .name(settings.getName())
                    .hotStore(new MongoRecordStore(mongoTemplate, settings.getHotCollection()))
                    .coldStore(coldStore)
                    .dateField(settings.getDateField())
                    .retentionClass(settings.getRetentionClass())
                    .build());
        }
        EntityTypeRegistry registry = new EntityTypeRegistry(entityTypes);
        log.info("Registered {} archivable entity types: {}", entityTypes.size(), registry.names());
        return registry;
    }

    /**
     * Mongo-backed run lease, extended in the background while it is held. {@code lockAtMostFor} then
     * only bounds how long a crashed instance keeps others out, not how long a run may take.
     */
    @Bean
    public LockProvider lockProvider(MongoTemplate mongoTemplate) {
        return keepAlive(new MongoLockProvider(mongoTemplate.getDb()), leaseKeepAlive);
    }

    public static LockProvider keepAlive(ExtensibleLockProvider lockProvider, ScheduledExecutorService executor) {
        return new KeepAliveLockProvider(lockProvider, executor);
    }

    @PreDestroy
    public void shutdown() {
        leaseKeepAlive.shutdownNow();
    }
}
