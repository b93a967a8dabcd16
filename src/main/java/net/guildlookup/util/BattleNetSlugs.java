package net.guildlookup.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Builds the path slugs the Battle.net profile API expects for realms and guilds.
 * Example: "Argent Dawn" becomes "argent-dawn", "Kel'Thuzad" becomes "kelthuzad".
 * Non-Latin letters are kept; the API slugs them as lower-cased text.
 */
public final class BattleNetSlugs {
    private static final Pattern DROPPED = Pattern.compile("['’()]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern MULTIPLE_DASHES = Pattern.compile("-{2,}");
    private static final Pattern EDGE_DASHES = Pattern.compile("^-+|-+$");

    private BattleNetSlugs() {}

    /**
     * Slugs a realm or guild name.
     *
     * @param value display name as typed by the caller
     * @return slug, or an empty string for null/blank input
     */
    public static String slugify(String value) {
        if (value == null || value.isBlank()) {
            return "";
        }
        String slug = value.trim().toLowerCase(Locale.ROOT);
        slug = DROPPED.matcher(slug).replaceAll("");
        slug = WHITESPACE.matcher(slug).replaceAll("-");
        slug = MULTIPLE_DASHES.matcher(slug).replaceAll("-");
        return EDGE_DASHES.matcher(slug).replaceAll("");
    }
}
