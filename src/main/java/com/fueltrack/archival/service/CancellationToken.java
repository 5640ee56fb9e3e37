package com.fueltrack.archival.service;

/**
 * Cooperative stop signal for a running archival. Checked at batch boundaries only.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken();

    private volatile boolean cancelled;

    /**
     * A token that is never cancelled.
     */
    public static CancellationToken none() {
        return NONE;
    }

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public void cancel() {
        if (this == NONE) {
            return;
        }
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
