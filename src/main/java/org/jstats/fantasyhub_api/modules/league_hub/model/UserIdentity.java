package org.jstats.fantasyhub_api.modules.league_hub.model;

import org.jspecify.annotations.Nullable;

/**
 * Identifiers the user has stored for each platform.
 *
 * @param sleeperUser  numeric Sleeper user id or a Sleeper username
 * @param espnMemberId ESPN member GUID (the SWID, braces included)
 */
public record UserIdentity(@Nullable String sleeperUser, @Nullable String espnMemberId) {

    public boolean sleeperUserIsNumeric() {
        return sleeperUser != null && !sleeperUser.isBlank() && sleeperUser.chars().allMatch(Character::isDigit);
    }
}
