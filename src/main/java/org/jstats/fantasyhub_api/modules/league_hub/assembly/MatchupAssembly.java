package org.jstats.fantasyhub_api.modules.league_hub.assembly;

import org.jstats.fantasyhub_api.modules.league_hub.model.Matchup;
import org.jstats.fantasyhub_api.modules.league_hub.model.RosterSnapshot;

import java.util.List;
import java.util.Optional;

/**
 * Every pairing of a week plus the rosters left without an opponent.
 */
public record MatchupAssembly(List<Matchup> matchups, List<RosterSnapshot> byes) {

    public MatchupAssembly {
        matchups = List.copyOf(matchups);
        byes = List.copyOf(byes);
    }

    public Optional<Matchup> matchupOf(String rosterId) {
        return matchups.stream().filter(m -> m.involves(rosterId)).findFirst();
    }

    public boolean isBye(String rosterId) {
        return byes.stream().anyMatch(b -> b.id().equals(rosterId));
    }
}
