package org.jstats.fantasyhub_api.modules.league_hub.model;

import java.time.Instant;
import java.util.Objects;

/**
 * The single output of one league's fetch cycle. Replaced wholesale by the next cycle.
 *
 * @param league      owning league
 * @param myTeamId    the user's roster id within the league
 * @param outcome     matchup or ranking
 * @param lastUpdated when the provider finished assembling it
 */
public record UnifiedResult(
        LeagueRef league,
        String myTeamId,
        LeagueOutcome outcome,
        Instant lastUpdated
) {
    public UnifiedResult {
        Objects.requireNonNull(league, "league");
        Objects.requireNonNull(myTeamId, "myTeamId");
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(lastUpdated, "lastUpdated");
    }

    public boolean isEliminationPool() {
        return outcome instanceof Ranking;
    }

    /**
     * Higher sorts first: live matchup +100, elimination pool +50, then the platform preference.
     */
    public int priority() {
        int priority = 0;
        if (outcome instanceof Matchup m && m.status() == MatchupStatus.LIVE) {
            priority += 100;
        }
        if (isEliminationPool()) {
            priority += 50;
        }
        return priority + league.platform().preferenceBonus();
    }
}
