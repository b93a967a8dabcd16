package net.guildlookup.util;

import org.slf4j.Logger;

/**
 * Centralized logging for Battle.net calls and the refreshes they feed.
 *
 * These logs trace the stale-while-revalidate flow:
 * - Postgres cache (served first when present)
 * - Battle.net profile API (always called to refresh)
 * - background upsert of the refreshed record
 */
public final class ExternalApiLogger {

    private static final String PREFIX = "[EXTERNAL-API]";

    private ExternalApiLogger() {
    }

    /**
     * Log an external API call attempt
     */
    public static void logApiCallAttempt(Logger log, String apiName, String operation, String identifier) {
        log.info(String.format("%s [%s] ATTEMPT: %s for '%s'", PREFIX, apiName, operation, identifier));
    }

    /**
     * Log an external API call success
     */
    public static void logApiCallSuccess(Logger log, String apiName, String operation, String identifier, int bodySize) {
        log.info(String.format("%s [%s] SUCCESS: %s for '%s' (%d bytes)", PREFIX, apiName, operation, identifier, bodySize));
    }

    /**
     * Log an external API call failure
     */
    public static void logApiCallFailure(Logger log, String apiName, String operation, String identifier, String reason) {
        log.warn(String.format("%s [%s] FAILURE: %s failed for '%s' - %s", PREFIX, apiName, operation, identifier, reason));
    }

    /**
     * Log a call that was refused before reaching the network
     */
    public static void logApiCallSkipped(Logger log, String apiName, String identifier, String reason) {
        log.info(String.format("%s [%s] SKIPPED: '%s' - %s", PREFIX, apiName, identifier, reason));
    }

    /**
     * Log which tier answered a lookup
     */
    public static void logLookupServed(Logger log, String identifier, String tier) {
        log.info(String.format("%s [LOOKUP] SERVED: '%s' from %s", PREFIX, identifier, tier));
    }

    /**
     * Log the end of a background refresh
     */
    public static void logRefreshComplete(Logger log, String identifier, String outcome) {
        log.info(String.format("%s [REFRESH] COMPLETE: '%s' outcome=%s", PREFIX, identifier, outcome));
    }
}
