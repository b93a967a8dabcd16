package net.guildlookup.exception;

import jakarta.annotation.Nullable;

/**
 * Non-2xx answer (or client-side rejection) from the Battle.net API, carrying the
 * status code and the raw response body when one was sent.
 */
public class UpstreamHttpException extends RuntimeException {

    private final int statusCode;

    @Nullable
    private final String responseBody;

    public UpstreamHttpException(int statusCode, @Nullable String responseBody, String message, @Nullable Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public int getStatusCode() {
        return statusCode;
    }

    @Nullable
    public String getResponseBody() {
        return responseBody;
    }
}
