package net.guildlookup.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Error body for failed guild lookups.
 *
 * @param error short error label
 * @param message upstream detail, omitted when there is none
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GuildErrorResponse(String error, String message) {

    public static GuildErrorResponse of(String error) {
        return new GuildErrorResponse(error, null);
    }
}
