package com.fueltrack.archival.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-document result of an unordered batch write.
 * A document counts as written only when the store did not report an error for its index.
 */
public final class InsertOutcome {

    private final int attempted;
    private final Map<Integer, String> failures;

    private InsertOutcome(int attempted, Map<Integer, String> failures) {
        this.attempted = attempted;
        this.failures = Collections.unmodifiableMap(failures);
    }

    public static InsertOutcome allWritten(int attempted) {
        return new InsertOutcome(attempted, Map.of());
    }

    public static InsertOutcome withFailures(int attempted, Map<Integer, String> failures) {
        for (Integer index : failures.keySet()) {
            if (index < 0 || index >= attempted) {
                throw new IllegalArgumentException("Failure index " + index + " outside batch of " + attempted);
            }
        }
        return new InsertOutcome(attempted, new LinkedHashMap<>(failures));
    }

    public boolean isWritten(int index) {
        return index >= 0 && index < attempted && !failures.containsKey(index);
    }

    public int getAttempted() {
        return attempted;
    }

    public int getWrittenCount() {
        return attempted - failures.size();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    /**
     * Failure reasons keyed by the index of the document in the submitted batch.
     */
    public Map<Integer, String> getFailures() {
        return failures;
    }

    public List<Integer> failedIndexes() {
        return List.copyOf(failures.keySet());
    }
}
