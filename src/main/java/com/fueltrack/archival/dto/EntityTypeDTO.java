package com.fueltrack.archival.dto;

import com.fueltrack.archival.model.enums.RetentionClass;
import com.fueltrack.archival.store.EntityType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EntityTypeDTO {
    private String name;
    private String hotCollection;
    private String coldCollection;
    private String dateField;
    private RetentionClass retentionClass;

    public static EntityTypeDTO from(EntityType entityType) {
        return EntityTypeDTO.builder()
                .name(entityType.getName())
                .hotCollection(entityType.getHotStore().getCollectionName())
                .coldCollection(entityType.getColdStore().getCollectionName())
                .dateField(entityType.getDateField())
                .retentionClass(entityType.getRetentionClass())
                .build();
    }
}
