package net.guildlookup.exception;

/**
 * Raised by the Battle.net client, before any HTTP call, for regions the API
 * cannot serve (the China region is hosted separately and is not reachable with
 * global credentials).
 * RETRYABLE: No
 */
public class RegionNotSupportedException extends RuntimeException {

    public RegionNotSupportedException(String region) {
        super("Region '" + region + "' is not supported by the Battle.net API");
    }
}
