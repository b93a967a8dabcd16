package net.guildlookup.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonRawValue;
import java.time.Instant;

/**
 * Canonical guild record, as cached in Postgres and returned to callers.
 *
 * <p>{@code created} holds the upstream creation timestamp as the raw JSON value
 * it arrived as (an epoch number or a quoted ISO string) and is written back out
 * untouched. {@code updatedAt} is stamped by the database on upsert and is null
 * on records that have not been read back from storage.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Guild(
    long id,
    String region,
    String realm,
    String name,
    Faction faction,
    @JsonRawValue String created,
    int achievementPoints,
    int memberCount,
    GuildCrest crest,
    Instant updatedAt
) {

    public GuildKey key() {
        return new GuildKey(region, realm, name);
    }

    /** Copy carrying the storage timestamp. */
    public Guild withUpdatedAt(Instant timestamp) {
        return new Guild(id, region, realm, name, faction, created, achievementPoints, memberCount, crest, timestamp);
    }
}
