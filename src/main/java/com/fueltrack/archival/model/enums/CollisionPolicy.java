package com.fueltrack.archival.model.enums;

/**
 * How a restore treats an archived record whose original identity already exists in the hot store.
 */
public enum CollisionPolicy {
    FAIL,
    SKIP,
    OVERWRITE
}
