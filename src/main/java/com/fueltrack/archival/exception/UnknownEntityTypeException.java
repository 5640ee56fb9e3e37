package com.fueltrack.archival.exception;

import lombok.Getter;

import java.util.List;

/**
 * Thrown when a request names an entity type that is not registered for archival.
 */
@Getter
public class UnknownEntityTypeException extends IllegalArgumentException {

    private final String entityType;

    public UnknownEntityTypeException(String entityType, List<String> known) {
        super("Unknown collection: " + entityType + ". Known collections: " + known);
        this.entityType = entityType;
    }
}
