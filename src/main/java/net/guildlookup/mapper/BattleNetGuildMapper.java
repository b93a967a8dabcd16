package net.guildlookup.mapper;

import static net.guildlookup.mapper.BattleNetJsonSupport.requireChannel;
import static net.guildlookup.mapper.BattleNetJsonSupport.requireChild;
import static net.guildlookup.mapper.BattleNetJsonSupport.requireCode;
import static net.guildlookup.mapper.BattleNetJsonSupport.requireInt;
import static net.guildlookup.mapper.BattleNetJsonSupport.requireLong;
import static net.guildlookup.mapper.BattleNetJsonSupport.requireObject;
import static net.guildlookup.mapper.BattleNetJsonSupport.requireRawScalar;

import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import net.guildlookup.exception.GuildNormalizationException;
import net.guildlookup.model.Faction;
import net.guildlookup.model.Guild;
import net.guildlookup.model.GuildCrest;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import tools.jackson.databind.JsonNode;

/**
 * Maps a Battle.net guild profile payload onto the canonical {@link Guild} record.
 * <p>
 * Reference: <a href="https://develop.battle.net/documentation/world-of-warcraft/profile-apis">WoW Profile API</a>
 * <p>
 * Realm and name are taken from the caller, not from the payload, because they are
 * the lookup key and upstream returns its own canonical casing.
 */
@Component
@Slf4j
public class BattleNetGuildMapper {

    /**
     * Normalizes an upstream payload.
     *
     * @param payload parsed upstream body, possibly null
     * @param region region the guild was requested for
     * @param realm realm as supplied by the caller
     * @param name guild name as supplied by the caller
     * @return fully populated guild without a storage timestamp
     * @throws GuildNormalizationException when the payload is absent or incomplete
     */
    public Guild normalize(@Nullable JsonNode payload, String region, String realm, String name) {
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            throw new GuildNormalizationException("Invalid guild response received");
        }
        requireObject(payload, "$");

        long id = requireLong(payload, "id", "id");
        Faction faction = resolveFaction(payload);
        String created = requireRawScalar(payload, "created_timestamp", "created_timestamp");
        int achievementPoints = requireInt(payload, "achievement_points", "achievement_points");
        int memberCount = requireInt(payload, "member_count", "member_count");
        GuildCrest crest = mapCrest(requireObject(payload.get("crest"), "crest"));

        return new Guild(
            id,
            region.toLowerCase(Locale.ROOT),
            realm,
            name,
            faction,
            created,
            achievementPoints,
            memberCount,
            crest,
            null
        );
    }

    private Faction resolveFaction(JsonNode payload) {
        JsonNode factionNode = requireChild(payload, "faction", "faction");
        String code = factionNode.isObject()
            ? requireCode(factionNode, "type", "faction.type")
            : requireCode(payload, "faction", "faction");
        try {
            return Faction.fromType(code);
        } catch (IllegalArgumentException ex) {
            log.warn("Unrecognized faction code '{}' in guild payload {}", code, payload.get("id"));
            throw new GuildNormalizationException(ex.getMessage(), ex);
        }
    }

    private GuildCrest mapCrest(JsonNode crest) {
        JsonNode emblem = requireObject(crest.get("emblem"), "crest.emblem");
        JsonNode border = requireObject(crest.get("border"), "crest.border");
        JsonNode background = requireObject(crest.get("background"), "crest.background");

        return new GuildCrest(
            requireInt(emblem, "id", "crest.emblem.id"),
            flattenColor(emblem, "crest.emblem"),
            requireInt(border, "id", "crest.border.id"),
            flattenColor(border, "crest.border"),
            flattenColor(background, "crest.background")
        );
    }

    /**
     * Flattens {@code {r, g, b, a}} into an ordered list. The current API nests the
     * channels one level deeper under {@code color.rgba}.
     */
    private List<Integer> flattenColor(JsonNode part, String path) {
        String colorPath = path + ".color";
        JsonNode color = requireObject(part.get("color"), colorPath);
        if (color.has("rgba")) {
            colorPath = colorPath + ".rgba";
            color = requireObject(color.get("rgba"), colorPath);
        }
        return List.of(
            requireChannel(color, "r", colorPath + ".r"),
            requireChannel(color, "g", colorPath + ".g"),
            requireChannel(color, "b", colorPath + ".b"),
            requireChannel(color, "a", colorPath + ".a")
        );
    }
}
