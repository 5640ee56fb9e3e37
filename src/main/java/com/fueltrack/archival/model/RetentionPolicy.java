package com.fueltrack.archival.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.Optional;

/**
 * Retention settings as supplied by the configuration store.
 * Null fields mean "not configured" and defer to the next precedence level.
 */
@Value
@Builder
public class RetentionPolicy {

    @Singular("type")
    Map<String, TypeRetention> perType;

    Boolean archivalEnabled;
    Integer archivalMonths;
    Integer auditLogMonths;

    public Optional<TypeRetention> forType(String entityType) {
        return Optional.ofNullable(perType.get(entityType));
    }

    public static RetentionPolicy empty() {
        return RetentionPolicy.builder().build();
    }

    @Value
    public static class TypeRetention {
        boolean enabled;
        Integer retentionMonths;
    }
}
