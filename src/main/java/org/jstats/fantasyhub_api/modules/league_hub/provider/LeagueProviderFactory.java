package org.jstats.fantasyhub_api.modules.league_hub.provider;

import org.jstats.fantasyhub_api.modules.espn.client.EspnClient;
import org.jstats.fantasyhub_api.modules.league_hub.assembly.MatchupAssembler;
import org.jstats.fantasyhub_api.modules.league_hub.identity.TeamIdentityResolver;
import org.jstats.fantasyhub_api.modules.league_hub.model.LeagueRef;
import org.jstats.fantasyhub_api.modules.league_hub.model.UserIdentity;
import org.jstats.fantasyhub_api.modules.league_hub.scoring.ScoringEngine;
import org.jstats.fantasyhub_api.modules.sleeper.client.SleeperClient;
import org.jstats.fantasyhub_api.modules.sleeper.feed.PlayerDirectory;
import org.jstats.fantasyhub_api.modules.sleeper.feed.WeeklyStatFeed;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Creates a fresh provider for each (league, week, year) fetch cycle.
 */
@Component
public class LeagueProviderFactory {

    private final EspnClient espn;
    private final SleeperClient sleeper;
    private final WeeklyStatFeed statFeed;
    private final PlayerDirectory players;
    private final TeamIdentityResolver resolver;
    private final ScoringEngine scoring;
    private final MatchupAssembler assembler;
    private final Clock clock;

    public LeagueProviderFactory(EspnClient espn,
                                 SleeperClient sleeper,
                                 WeeklyStatFeed statFeed,
                                 PlayerDirectory players,
                                 TeamIdentityResolver resolver,
                                 ScoringEngine scoring,
                                 MatchupAssembler assembler,
                                 Clock clock) {
        this.espn = espn;
        this.sleeper = sleeper;
        this.statFeed = statFeed;
        this.players = players;
        this.resolver = resolver;
        this.scoring = scoring;
        this.assembler = assembler;
        this.clock = clock;
    }

    public LeagueProvider create(LeagueRef league, UserIdentity identity, int week, int year) {
        return switch (league.platform()) {
            case ESPN -> new EspnLeagueProvider(league, identity, week, year, espn, resolver, assembler, clock);
            case SLEEPER -> new SleeperLeagueProvider(league, identity, week, year,
                    sleeper, statFeed, players, resolver, scoring, assembler, clock);
        };
    }
}
