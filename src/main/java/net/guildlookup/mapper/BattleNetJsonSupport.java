package net.guildlookup.mapper;

import net.guildlookup.exception.GuildNormalizationException;
import org.springframework.lang.Nullable;
import tools.jackson.databind.JsonNode;

/**
 * Package-private helpers that pull required values out of Battle.net JSON nodes,
 * failing with {@link GuildNormalizationException} instead of returning defaults.
 */
final class BattleNetJsonSupport {

    private BattleNetJsonSupport() {
    }

    static JsonNode requireObject(@Nullable JsonNode node, String path) {
        if (node == null || !node.isObject()) {
            throw new GuildNormalizationException("Guild payload missing object '" + path + "'");
        }
        return node;
    }

    static JsonNode requireChild(JsonNode parent, String field, String path) {
        JsonNode child = parent.get(field);
        if (child == null || child.isNull() || child.isMissingNode()) {
            throw new GuildNormalizationException("Guild payload missing field '" + path + "'");
        }
        return child;
    }

    static int requireInt(JsonNode parent, String field, String path) {
        JsonNode value = requireChild(parent, field, path);
        if (!value.isNumber() || !value.canConvertToInt()) {
            throw new GuildNormalizationException("Guild payload field '" + path + "' is not an integer: " + value);
        }
        return value.asInt();
    }

    /**
     * A colour channel: an integer in 0-255.
     */
    static int requireChannel(JsonNode parent, String field, String path) {
        int value = requireInt(parent, field, path);
        if (value < 0 || value > 255) {
            throw new GuildNormalizationException("Guild payload field '" + path + "' is outside 0-255: " + value);
        }
        return value;
    }

    static long requireLong(JsonNode parent, String field, String path) {
        JsonNode value = requireChild(parent, field, path);
        if (!value.isIntegralNumber() || !value.canConvertToLong()) {
            throw new GuildNormalizationException("Guild payload field '" + path + "' is not an integer: " + value);
        }
        return value.asLong();
    }

    /**
     * Returns the JSON text of a scalar field so it can be stored and re-emitted verbatim.
     */
    static String requireRawScalar(JsonNode parent, String field, String path) {
        JsonNode value = requireChild(parent, field, path);
        if (!value.isNumber() && !value.isString()) {
            throw new GuildNormalizationException("Guild payload field '" + path + "' is neither a number nor a string");
        }
        return value.toString();
    }

    static String requireCode(JsonNode parent, String field, String path) {
        JsonNode value = requireChild(parent, field, path);
        if (value.isIntegralNumber()) {
            return String.valueOf(value.asLong());
        }
        if (value.isString()) {
            return value.asString();
        }
        throw new GuildNormalizationException("Guild payload field '" + path + "' is not a code: " + value);
    }
}
