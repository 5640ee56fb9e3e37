package com.fueltrack.archival.store;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Store-neutral selection of records.
 *
 * <p>
 * All present conditions are combined with AND:
 * <ul>
 * <li>{@code excludeDeleted}: {@code isDeleted != true}</li>
 * <li>{@code before}: {@code dateField < before}</li>
 * <li>{@code from} / {@code to}: {@code from <= dateField <= to}</li>
 * <li>{@code equalTo}: exact field matches</li>
 * </ul>
 */
@Getter
@Builder(toBuilder = true)
public class RecordQuery {

    public static final String DELETED_FLAG = "isDeleted";
    public static final String ARCHIVED_AT = "archivedAt";

    private final boolean excludeDeleted;
    private final String dateField;
    private final Instant before;
    private final Instant from;
    private final Instant to;

    @Singular("equalTo")
    private final Map<String, Object> equalTo;

    /**
     * Live records whose age field is strictly older than the cutoff.
     */
    public static RecordQuery eligibleForArchival(String dateField, Instant cutoff) {
        return RecordQuery.builder()
                .excludeDeleted(true)
                .dateField(dateField)
                .before(cutoff)
                .build();
    }

    /**
     * Archived records whose {@code archivedAt} falls in the window. Either bound may be null.
     */
    public static RecordQuery archivedBetween(Instant from, Instant to) {
        return RecordQuery.builder()
                .dateField(ARCHIVED_AT)
                .from(from)
                .to(to)
                .build();
    }

    public static RecordQuery notDeleted() {
        return RecordQuery.builder().excludeDeleted(true).build();
    }

    public static RecordQuery all() {
        return RecordQuery.builder().build();
    }

    /**
     * Checks caller-supplied equality filters and returns them in a new map. Field names must be plain
     * paths and values must be strings, numbers, booleans or null, so a filter can never carry a
     * query operator.
     *
     * @throws IllegalArgumentException on an operator field name or a structured value
     */
    public static Map<String, Object> checkFilters(Map<String, Object> filters) {
        Map<String, Object> checked = new LinkedHashMap<>();
        if (filters == null) {
            return checked;
        }
        filters.forEach((field, value) -> {
            if (field == null || field.isBlank() || field.startsWith("$")) {
                throw new IllegalArgumentException("Invalid filter field: " + field);
            }
            if (value != null && !(value instanceof String) && !(value instanceof Number)
                    && !(value instanceof Boolean)) {
                throw new IllegalArgumentException(
                        "Filter " + field + " must be a string, number or boolean value");
            }
            checked.put(field, value);
        });
        return checked;
    }

    public boolean hasDateRange() {
        return dateField != null && (before != null || from != null || to != null);
    }
}
