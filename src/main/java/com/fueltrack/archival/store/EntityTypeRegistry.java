package com.fueltrack.archival.store;

import com.fueltrack.archival.exception.UnknownEntityTypeException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registration-ordered lookup of the archivable entity types.
 * The registration order is the order in which an archival run processes them.
 */
public class EntityTypeRegistry {

    private final Map<String, EntityType> types = new LinkedHashMap<>();

    public EntityTypeRegistry(Collection<EntityType> entityTypes) {
        for (EntityType entityType : entityTypes) {
            if (types.putIfAbsent(entityType.getName(), entityType) != null) {
                throw new IllegalArgumentException("Entity type registered twice: " + entityType.getName());
            }
        }
    }

    public List<EntityType> all() {
        return Collections.unmodifiableList(new ArrayList<>(types.values()));
    }

    public List<String> names() {
        return List.copyOf(types.keySet());
    }

    public Optional<EntityType> find(String name) {
        return Optional.ofNullable(types.get(name));
    }

    public EntityType require(String name) {
        EntityType entityType = types.get(name);
        if (entityType == null) {
            throw new UnknownEntityTypeException(name, names());
        }
        return entityType;
    }

    /**
     * Returns the requested types in registration order. A null or empty request selects every type.
     *
     * @throws UnknownEntityTypeException if any requested name is not registered
     */
    public List<EntityType> select(Collection<String> requested) {
        if (requested == null || requested.isEmpty()) {
            return all();
        }
        for (String name : requested) {
            require(name);
        }
        List<EntityType> selected = new ArrayList<>();
        for (EntityType entityType : types.values()) {
            if (requested.contains(entityType.getName())) {
                selected.add(entityType);
            }
        }
        return selected;
    }
}
