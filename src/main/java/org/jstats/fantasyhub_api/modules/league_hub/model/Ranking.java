package org.jstats.fantasyhub_api.modules.league_hub.model;

import java.util.List;
import java.util.Optional;

/**
 * Ranked table for an elimination pool.
 *
 * @param week              target week
 * @param rankings          ordered by rank, ranks 1..N without gaps
 * @param eliminationCutoff how many of the bottom ranks are eliminated this week
 * @param graveyard         rosters that no longer field any player, kept out of the ranks
 */
public record Ranking(
        int week,
        List<RankedTeam> rankings,
        int eliminationCutoff,
        List<RosterSnapshot> graveyard
) implements LeagueOutcome {

    public Ranking {
        rankings = rankings == null ? List.of() : List.copyOf(rankings);
        graveyard = graveyard == null ? List.of() : List.copyOf(graveyard);
    }

    public List<RankedTeam> eliminated() {
        return rankings.stream().filter(RankedTeam::eliminated).toList();
    }

    public Optional<RankedTeam> find(String rosterId) {
        return rankings.stream().filter(r -> r.team().id().equals(rosterId)).findFirst();
    }
}
