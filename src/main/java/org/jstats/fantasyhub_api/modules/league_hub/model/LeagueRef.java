package org.jstats.fantasyhub_api.modules.league_hub.model;

import java.util.Objects;

/**
 * Immutable identity of a connected league, as handed out by the league directory.
 *
 * @param platform         owning platform
 * @param leagueId         external league id on that platform
 * @param name             display name
 * @param teamCount        number of teams the league is configured for
 * @param playoffWeekStart first playoff week, or {@code null} when the platform does not say
 */
public record LeagueRef(
        Platform platform,
        String leagueId,
        String name,
        int teamCount,
        Integer playoffWeekStart
) {
    public LeagueRef {
        Objects.requireNonNull(platform, "platform");
        Objects.requireNonNull(leagueId, "leagueId");
        if (name == null || name.isBlank()) {
            name = platform.name() + " League " + leagueId;
        }
    }

    public LeagueRef(Platform platform, String leagueId, String name, int teamCount) {
        this(platform, leagueId, name, teamCount, null);
    }

    /** {@code false} when the platform never published a playoff start. */
    public boolean isPlayoffWeek(int week) {
        return playoffWeekStart != null && week >= playoffWeekStart;
    }

    /** Stable key across fetch cycles, e.g. {@code sleeper_1048}. */
    public String key() {
        return platform.name().toLowerCase() + "_" + leagueId;
    }
}
