package net.guildlookup.service;

import net.guildlookup.model.Guild;

/**
 * What a guild lookup answers the caller with. Produced once per request through
 * {@link GuildResponseSink}.
 */
public sealed interface GuildLookupResult
    permits GuildLookupResult.Found, GuildLookupResult.NotFound,
            GuildLookupResult.RegionNotSupported, GuildLookupResult.UpstreamError {

    /** Where a found record came from. */
    enum Source {
        CACHE,
        UPSTREAM
    }

    record Found(Guild guild, Source source) implements GuildLookupResult {}

    record NotFound() implements GuildLookupResult {}

    record RegionNotSupported() implements GuildLookupResult {}

    /**
     * @param statusCode status to answer with
     * @param message upstream body or error message
     */
    record UpstreamError(int statusCode, String message) implements GuildLookupResult {}
}
