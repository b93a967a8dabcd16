package net.guildlookup.service;

import reactor.core.publisher.Mono;
import tools.jackson.databind.JsonNode;

/**
 * Source of truth for guild profiles.
 */
public interface GuildProfileClient {

    /**
     * Fetches the raw guild profile.
     *
     * @return parsed payload; fails with
     *     {@link net.guildlookup.exception.RegionNotSupportedException} before any call for
     *     unsupported regions, or {@link net.guildlookup.exception.UpstreamHttpException}
     *     for non-2xx answers
     */
    Mono<JsonNode> fetchGuild(String region, String realm, String name);
}
