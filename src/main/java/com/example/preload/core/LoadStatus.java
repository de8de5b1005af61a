package com.example.preload.core;

import java.util.Objects;

/**
 * Per-key load state. {@code FAILED} carries the reason the load did not produce a value.
 * Compared by value, so {@code LoadStatus.failed("timeout")} equals any other timeout status.
 */
public final class LoadStatus {

    public enum Kind {
        NOT_STARTED,
        LOADING,
        COMPLETED,
        FAILED
    }

    public static final LoadStatus NOT_STARTED = new LoadStatus(Kind.NOT_STARTED, null);
    public static final LoadStatus LOADING = new LoadStatus(Kind.LOADING, null);
    public static final LoadStatus COMPLETED = new LoadStatus(Kind.COMPLETED, null);

    private final Kind kind;
    private final String reason;

    private LoadStatus(Kind kind, String reason) {
        this.kind = kind;
        this.reason = reason;
    }

    public static LoadStatus failed(String reason) {
        return new LoadStatus(Kind.FAILED, Objects.requireNonNull(reason, "reason"));
    }

    public Kind kind() {
        return kind;
    }

    public String reason() {
        return reason;
    }

    public boolean isLoading() {
        return kind == Kind.LOADING;
    }

    public boolean isCompleted() {
        return kind == Kind.COMPLETED;
    }

    public boolean isFailed() {
        return kind == Kind.FAILED;
    }

    // Loading and completed keys are skipped by preload and preloadBatch.
    boolean isSettledOrBusy() {
        return kind == Kind.LOADING || kind == Kind.COMPLETED;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LoadStatus)) {
            return false;
        }
        LoadStatus other = (LoadStatus) o;
        return kind == other.kind && Objects.equals(reason, other.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, reason);
    }

    @Override
    public String toString() {
        return kind == Kind.FAILED ? "FAILED(" + reason + ")" : kind.name();
    }
}
