package com.fueltrack.archival.store;

import com.fueltrack.archival.model.enums.RetentionClass;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

/**
 * An archivable entity type with its hot and cold stores.
 */
@Getter
@Builder
public class EntityType {

    public static final String DEFAULT_DATE_FIELD = "createdAt";

    @NonNull
    private final String name;

    @NonNull
    private final RecordStore hotStore;

    @NonNull
    private final RecordStore coldStore;

    @Builder.Default
    private final String dateField = DEFAULT_DATE_FIELD;

    @Builder.Default
    private final RetentionClass retentionClass = RetentionClass.STANDARD;

    @Override
    public String toString() {
        return name + "[" + hotStore.getCollectionName() + " -> " + coldStore.getCollectionName() + "]";
    }
}
