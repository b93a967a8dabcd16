package net.guildlookup.model;

import java.util.List;

/**
 * Guild tabard. Each colour is an RGBA tuple in R, G, B, A order.
 *
 * @param emblemId upstream emblem id
 * @param emblemColor emblem colour channels
 * @param borderId upstream border id
 * @param borderColor border colour channels
 * @param backgroundColor background colour channels
 */
public record GuildCrest(
    int emblemId,
    List<Integer> emblemColor,
    int borderId,
    List<Integer> borderColor,
    List<Integer> backgroundColor
) {
    public GuildCrest {
        emblemColor = List.copyOf(emblemColor);
        borderColor = List.copyOf(borderColor);
        backgroundColor = List.copyOf(backgroundColor);
    }
}
