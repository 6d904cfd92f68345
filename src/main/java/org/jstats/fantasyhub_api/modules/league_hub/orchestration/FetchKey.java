package org.jstats.fantasyhub_api.modules.league_hub.orchestration;

import org.jstats.fantasyhub_api.modules.league_hub.model.LeagueRef;

/**
 * Identity of one unit of in-flight work.
 */
public record FetchKey(String leagueKey, int week, int year) {

    public static FetchKey of(LeagueRef league, int week, int year) {
        return new FetchKey(league.key(), week, year);
    }
}
