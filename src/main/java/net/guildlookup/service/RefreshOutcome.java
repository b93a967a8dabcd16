package net.guildlookup.service;

/**
 * How a single upstream refresh ended, independent of whether anyone was answered.
 */
public enum RefreshOutcome {
    REFRESHED,
    NOT_FOUND,
    REGION_NOT_SUPPORTED,
    FAILED
}
