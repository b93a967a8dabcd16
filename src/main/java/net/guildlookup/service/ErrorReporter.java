package net.guildlookup.service;

/**
 * Error telemetry sink. Implementations must not throw and must not block the caller.
 */
public interface ErrorReporter {

    /**
     * Records a failure worth tracking.
     *
     * @param error the failure
     * @param context short label of where it happened, e.g. {@code guild-refresh}
     */
    void report(Throwable error, String context);
}
