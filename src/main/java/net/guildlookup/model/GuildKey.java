package net.guildlookup.model;

import java.util.Locale;
import org.springframework.util.StringUtils;

/**
 * Composite natural key of a guild. Realm and name keep the caller's casing.
 */
public record GuildKey(String region, String realm, String name) {

    /** Region as stored: lower-case. */
    public String storedRegion() {
        return region == null ? null : region.toLowerCase(Locale.ROOT);
    }

    /** Whether every component carries text; partial keys are never queried. */
    public boolean isComplete() {
        return StringUtils.hasText(region) && StringUtils.hasText(realm) && StringUtils.hasText(name);
    }

    @Override
    public String toString() {
        return region + "/" + realm + "/" + name;
    }
}
