package net.guildlookup.model;

import java.util.Locale;

/**
 * Guild faction as reported by the Battle.net profile API.
 * <p>
 * Upstream sends either the faction type name ({@code "ALLIANCE"}, {@code "HORDE"})
 * or, on older payloads, the numeric faction id.
 */
public enum Faction {
    ALLIANCE(0),
    HORDE(1);

    private final int id;

    Faction(int id) {
        this.id = id;
    }

    /**
     * Resolves an upstream faction type code.
     *
     * @param type upstream type code, either the type name or the numeric id
     * @return matching faction
     * @throws IllegalArgumentException when the code is null or unknown
     */
    public static Faction fromType(String type) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Faction type is missing");
        }
        String normalized = type.trim().toUpperCase(Locale.ROOT);
        for (Faction faction : values()) {
            if (faction.name().equals(normalized) || String.valueOf(faction.id).equals(normalized)) {
                return faction;
            }
        }
        throw new IllegalArgumentException("Unknown faction type: " + type);
    }
}
