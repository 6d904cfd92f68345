package org.jstats.fantasyhub_api.modules.league_hub.provider;

import org.jstats.fantasyhub_api.modules.league_hub.model.LeagueRef;
import org.jstats.fantasyhub_api.modules.league_hub.model.UnifiedResult;

/**
 * Fetches one league for one week. Instances are bound to a single (league, week, year) cycle and
 * share no mutable state with each other.
 */
public interface LeagueProvider {

    LeagueRef league();

    /**
     * @throws LeagueFetchException when the league yields no result this cycle
     */
    UnifiedResult fetch();
}
