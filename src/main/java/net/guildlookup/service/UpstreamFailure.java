package net.guildlookup.service;

/**
 * Classified outcome of a failed guild fetch. Exactly one variant per failure kind
 * the refresh pipeline treats differently.
 */
public sealed interface UpstreamFailure
    permits UpstreamFailure.UnsupportedRegion, UpstreamFailure.NotFound, UpstreamFailure.Unexpected {

    /** Original error as raised by the client or the mapper. */
    Throwable cause();

    /** Metric tag value. */
    String kind();

    /** Whether the failure goes to error telemetry. */
    boolean reportable();

    /** Region the API cannot serve; known limitation, tracked. */
    record UnsupportedRegion(Throwable cause) implements UpstreamFailure {
        @Override
        public String kind() {
            return "unsupported_region";
        }

        @Override
        public boolean reportable() {
            return true;
        }
    }

    /** Guild does not exist upstream; expected, not tracked. */
    record NotFound(Throwable cause) implements UpstreamFailure {
        @Override
        public String kind() {
            return "not_found";
        }

        @Override
        public boolean reportable() {
            return false;
        }
    }

    /**
     * Anything else, including malformed payloads.
     *
     * @param statusCode upstream status, or 500 when none was received
     * @param detail upstream body when present, else the error message
     * @param cause original error
     */
    record Unexpected(int statusCode, String detail, Throwable cause) implements UpstreamFailure {
        @Override
        public String kind() {
            return "unexpected";
        }

        @Override
        public boolean reportable() {
            return true;
        }
    }
}
