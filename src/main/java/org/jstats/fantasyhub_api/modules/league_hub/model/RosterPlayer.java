package org.jstats.fantasyhub_api.modules.league_hub.model;

import org.jspecify.annotations.Nullable;

/**
 * A player on a roster for one week.
 *
 * @param playerId   id on the roster's own platform
 * @param espnId     ESPN player id, when known
 * @param sleeperId  Sleeper player id, when known
 * @param position   fantasy position (QB, RB, ...)
 * @param nflTeam    NFL team code, {@code UNK} when unknown
 * @param starter    whether the player is in the starting lineup
 * @param lineupSlot slot label (FLEX, BN, ...)
 * @param points     fantasy points for the week under the league's rules
 */
public record RosterPlayer(
        String playerId,
        @Nullable String espnId,
        @Nullable String sleeperId,
        String position,
        String nflTeam,
        boolean starter,
        String lineupSlot,
        double points
) {
}
