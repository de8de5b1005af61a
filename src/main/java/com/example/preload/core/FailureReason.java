package com.example.preload.core;

/**
 * Reason strings recorded in {@link LoadStatus#failed(String)} for failures the cache detects itself.
 * Assembler failures use {@link AssemblyException#getReason()} instead.
 */
public final class FailureReason {

    /** The assembler did not finish within the configured load timeout. */
    public static final String TIMEOUT = "timeout";

    /**
     * The key was invalidated or the cache cleared while the load was in flight.
     * Never stored as a status: the key is already absent when the load settles.
     */
    public static final String CANCELLED = "cancelled";

    private FailureReason() {
    }

    static String describe(Throwable error) {
        if (error instanceof AssemblyException) {
            return ((AssemblyException) error).getReason();
        }
        String message = error.getMessage();
        return message != null ? message : error.getClass().getSimpleName();
    }
}
