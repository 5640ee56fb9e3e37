package com.fueltrack.archival.service;

import com.fueltrack.archival.config.ArchivalProperties;
import com.fueltrack.archival.exception.ArchivalInProgressException;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.core.LockConfiguration;
import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.core.SimpleLock;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * System-wide lease that keeps archival runs and restores from overlapping, across instances.
 */
@Component
@Slf4j
public class ArchivalLease {

    public static final String LOCK_NAME = "archival-run";

    private final LockProvider lockProvider;
    private final ArchivalProperties properties;
    private final Clock clock;

    public ArchivalLease(LockProvider lockProvider, ArchivalProperties properties, Clock clock) {
        this.lockProvider = lockProvider;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Runs {@code work} while holding the lease.
     *
     * @throws ArchivalInProgressException if another run or restore holds the lease
     */
    public <T> T withLease(String operation, Supplier<T> work) {
        Optional<SimpleLock> lock = lockProvider.lock(new LockConfiguration(
                clock.instant(), LOCK_NAME, properties.getLockAtMostFor(), Duration.ZERO));
        if (lock.isEmpty()) {
            log.warn("Rejected {}: lease {} is held", operation, LOCK_NAME);
            throw new ArchivalInProgressException(operation);
        }
        try {
            return work.get();
        } finally {
            lock.get().unlock();
        }
    }
}
