package org.jstats.fantasyhub_api.modules.league_hub.model;

import java.util.List;
import java.util.Objects;

/**
 * Two rosters paired for a week.
 *
 * @param home           home roster
 * @param away           away roster
 * @param week           target week
 * @param status         upcoming, live or complete
 * @param winProbability home win probability, a linear heuristic on the score gap
 * @param byes           rosters with no opponent this week, recorded beside the user's matchup
 */
public record Matchup(
        RosterSnapshot home,
        RosterSnapshot away,
        int week,
        MatchupStatus status,
        double winProbability,
        List<RosterSnapshot> byes
) implements LeagueOutcome {

    public Matchup {
        Objects.requireNonNull(home, "home");
        Objects.requireNonNull(away, "away");
        Objects.requireNonNull(status, "status");
        if (home.id().equals(away.id())) {
            throw new IllegalArgumentException("Matchup needs two distinct rosters, got " + home.id() + " twice");
        }
        byes = byes == null ? List.of() : List.copyOf(byes);
    }

    public Matchup(RosterSnapshot home, RosterSnapshot away, int week, MatchupStatus status, double winProbability) {
        this(home, away, week, status, winProbability, List.of());
    }

    public boolean involves(String rosterId) {
        return home.id().equals(rosterId) || away.id().equals(rosterId);
    }

    public Matchup withByes(List<RosterSnapshot> byeTeams) {
        return new Matchup(home, away, week, status, winProbability, byeTeams);
    }
}
