package net.guildlookup.exception;

/**
 * Upstream guild payload was absent or missing fields the stored record requires.
 * RETRYABLE: No (the same payload will fail again)
 */
public class GuildNormalizationException extends RuntimeException {

    public GuildNormalizationException(String message) {
        super(message);
    }

    public GuildNormalizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
