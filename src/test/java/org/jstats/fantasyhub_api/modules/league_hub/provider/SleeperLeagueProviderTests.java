package org.jstats.fantasyhub_api.modules.league_hub.provider;

import org.jstats.fantasyhub_api.core.upstream.UpstreamErrors;
import org.jstats.fantasyhub_api.modules.league_hub.assembly.MatchupAssembler;
import org.jstats.fantasyhub_api.modules.league_hub.identity.TeamIdentityResolver;
import org.jstats.fantasyhub_api.modules.league_hub.model.EliminationStatus;
import org.jstats.fantasyhub_api.modules.league_hub.model.LeagueRef;
import org.jstats.fantasyhub_api.modules.league_hub.model.Matchup;
import org.jstats.fantasyhub_api.modules.league_hub.model.MatchupStatus;
import org.jstats.fantasyhub_api.modules.league_hub.model.Platform;
import org.jstats.fantasyhub_api.modules.league_hub.model.Ranking;
import org.jstats.fantasyhub_api.modules.league_hub.model.UserIdentity;
import org.jstats.fantasyhub_api.modules.league_hub.scoring.ScoringEngine;
import org.jstats.fantasyhub_api.modules.sleeper.client.SleeperClient;
import org.jstats.fantasyhub_api.modules.sleeper.client.SleeperPayload;
import org.jstats.fantasyhub_api.modules.sleeper.feed.PlayerDirectory;
import org.jstats.fantasyhub_api.modules.sleeper.feed.WeeklyStatFeed;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SleeperLeagueProviderTests {

    private static final LeagueRef LEAGUE = new LeagueRef(Platform.SLEEPER, "1048", "Chopped", 12);
    private static final Instant NOW = Instant.parse("2024-10-20T18:00:00Z");
    private static final int WEEK = 7;
    private static final int YEAR = 2024;

    private SleeperClient client;
    private WeeklyStatFeed statFeed;
    private PlayerDirectory players;

    @BeforeEach
    void setUp() {
        client = mock(SleeperClient.class);
        statFeed = mock(WeeklyStatFeed.class);
        players = mock(PlayerDirectory.class);
        when(client.fetchNflState()).thenReturn(Optional.of(new SleeperPayload.NflState(WEEK, "2024", "regular", WEEK)));
        when(client.fetchLeague("1048")).thenReturn(Optional.of(league(null)));
        when(client.fetchLeagueUsers("1048")).thenReturn(List.of(
                new SleeperPayload.LeagueUser("1005", "five", "av5", new SleeperPayload.UserMetadata("Team Five"))));
    }

    private SleeperLeagueProvider provider(UserIdentity identity) {
        return provider(LEAGUE, identity, WEEK);
    }

    private SleeperLeagueProvider provider(LeagueRef league, UserIdentity identity, int week) {
        return new SleeperLeagueProvider(league, identity, week, YEAR, client, statFeed, players,
                new TeamIdentityResolver(client), new ScoringEngine(), new MatchupAssembler(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static SleeperPayload.League league(SleeperPayload.LeagueSettings settings) {
        return new SleeperPayload.League("1048", "Chopped", "2024", "in_season", 12,
                Map.of("rec", 1.0, "rec_td", 6.0), List.of("WR", "FLEX"), settings);
    }

    /** Roster i owned by user 100i, starting s{i} with b{i} on the bench. */
    private static SleeperPayload.Roster roster(int i) {
        return new SleeperPayload.Roster(i, String.valueOf(1000 + i), null,
                List.of("s" + i, "b" + i), List.of("s" + i), new SleeperPayload.RosterSettings(3, 3, 0, null));
    }

    private static List<SleeperPayload.Roster> rosters(int n) {
        var list = new ArrayList<SleeperPayload.Roster>();
        for (int i = 1; i <= n; i++) {
            list.add(roster(i));
        }
        return list;
    }

    /** Starter s{i} caught i passes; every bench player caught 10. */
    private static Map<String, Map<String, Double>> stats(int n) {
        var stats = new HashMap<String, Map<String, Double>>();
        for (int i = 1; i <= n; i++) {
            stats.put("s" + i, Map.of("rec", (double) i));
            stats.put("b" + i, Map.of("rec", 10.0));
        }
        return stats;
    }

    private static SleeperPayload.MatchupEntry entry(int rosterId, Integer matchupId, double points) {
        return new SleeperPayload.MatchupEntry(rosterId, matchupId, points, null,
                List.of("s" + rosterId), List.of("s" + rosterId, "b" + rosterId), null);
    }

    @Test
    void twelveRostersWithoutMatchups_becomeRanking_withLowestEliminated() {
        when(client.fetchLeague("1048")).thenReturn(Optional.of(league(new SleeperPayload.LeagueSettings(null, 12, 3, null))));
        when(client.fetchRosters("1048")).thenReturn(rosters(12));
        when(client.fetchMatchups("1048", WEEK)).thenReturn(List.of());
        when(statFeed.statsFor("2024", WEEK)).thenReturn(stats(12));

        var result = provider(new UserIdentity("1005", null)).fetch();

        assertEquals("5", result.myTeamId());
        assertEquals(NOW, result.lastUpdated());
        var ranking = assertInstanceOf(Ranking.class, result.outcome());
        assertEquals(12, ranking.rankings().size());
        assertEquals(1, ranking.eliminationCutoff());
        assertEquals("12", ranking.rankings().get(0).team().id());
        assertEquals(EliminationStatus.CHAMPION, ranking.rankings().get(0).eliminationStatus());

        var last = ranking.rankings().get(11);
        assertEquals("1", last.team().id());
        assertEquals(12, last.rank());
        assertTrue(last.eliminated());
        assertEquals(1, ranking.eliminated().size());

        // bench points never count toward the team score
        assertEquals(5.0, ranking.find("5").orElseThrow().team().score(), 1e-9);
        assertTrue(result.isEliminationPool());
        assertEquals(50 + 30, result.priority());
    }

    @Test
    void legacyChoppedFlag_alsoRanksUnpairedWeek() {
        when(client.fetchLeague("1048")).thenReturn(Optional.of(league(new SleeperPayload.LeagueSettings(null, 4, 0, true))));
        when(client.fetchRosters("1048")).thenReturn(rosters(4));
        when(client.fetchMatchups("1048", WEEK)).thenReturn(List.of());
        when(statFeed.statsFor("2024", WEEK)).thenReturn(stats(4));

        var result = provider(new UserIdentity("1002", null)).fetch();

        assertInstanceOf(Ranking.class, result.outcome());
    }

    @Test
    void headToHeadLeagueWithoutPairings_isEmptyResult_notRanking() {
        var dynasty = new LeagueRef(Platform.SLEEPER, "1048", "Dynasty", 12, 15);
        when(client.fetchLeague("1048")).thenReturn(Optional.of(league(new SleeperPayload.LeagueSettings(15, 12, 0, false))));
        when(client.fetchRosters("1048")).thenReturn(rosters(12));
        when(client.fetchMatchups("1048", 19)).thenReturn(List.of());
        when(statFeed.statsFor("2024", 19)).thenReturn(stats(12));

        var ex = assertThrows(LeagueFetchException.class, () -> provider(dynasty, new UserIdentity("1005", null), 19).fetch());

        assertEquals(FailureKind.EMPTY_RESULT, ex.kind());
        assertEquals("sleeper_1048: no playoff matchups in week 19", ex.getMessage());
    }

    @Test
    void leagueWithoutSettingsAndUnpairedEntries_isEmptyResult() {
        when(client.fetchRosters("1048")).thenReturn(rosters(2));
        when(client.fetchMatchups("1048", WEEK)).thenReturn(List.of(entry(1, null, 10.0), entry(2, null, 12.0)));
        when(statFeed.statsFor("2024", WEEK)).thenReturn(stats(2));

        var ex = assertThrows(LeagueFetchException.class, () -> provider(new UserIdentity("1001", null)).fetch());

        assertEquals(FailureKind.EMPTY_RESULT, ex.kind());
        assertEquals("sleeper_1048: no paired matchups in week 7", ex.getMessage());
    }

    @Test
    void pairedMatchups_becomeMatchup_scoredByEngine() {
        when(client.fetchRosters("1048")).thenReturn(rosters(4));
        when(client.fetchMatchups("1048", WEEK)).thenReturn(List.of(
                entry(1, 1, 99.0), entry(5, null, 0.0), entry(2, 2, 99.0), entry(3, 1, 99.0), entry(4, 2, 99.0)));
        when(statFeed.statsFor("2024", WEEK)).thenReturn(stats(4));

        var result = provider(new UserIdentity("1003", null)).fetch();

        var matchup = assertInstanceOf(Matchup.class, result.outcome());
        assertEquals("1", matchup.away().id());
        assertEquals("3", matchup.home().id());
        assertEquals(3.0, matchup.home().score(), 1e-9);
        assertEquals(1.0, matchup.away().score(), 1e-9);
        assertEquals(MatchupStatus.LIVE, matchup.status());
        assertEquals(0.5 + 0.02 * 0.3, matchup.winProbability(), 1e-9);
        assertEquals(List.of("5"), matchup.byes().stream().map(r -> r.id()).toList());
        assertEquals(100 + 30, result.priority());

        var starter = matchup.home().starters().get(0);
        assertEquals("s3", starter.playerId());
        assertEquals("WR", starter.lineupSlot());
        assertEquals("UNK", starter.position());
        assertEquals(3.0, starter.points(), 1e-9);
    }

    @Test
    void emptyStatFeed_fallsBackToPlatformPoints() {
        when(client.fetchRosters("1048")).thenReturn(rosters(2));
        when(client.fetchMatchups("1048", WEEK)).thenReturn(List.of(entry(1, 1, 88.5), entry(2, 1, 91.0)));
        when(statFeed.statsFor("2024", WEEK)).thenReturn(Map.of());

        var matchup = (Matchup) provider(new UserIdentity("1001", null)).fetch().outcome();

        assertEquals(88.5, matchup.away().score(), 1e-9);
        assertEquals(91.0, matchup.home().score(), 1e-9);
    }

    @Test
    void emptyStatFeed_prefersCommissionerOverrideAndPlatformPlayerPoints() {
        when(client.fetchRosters("1048")).thenReturn(rosters(2));
        when(client.fetchMatchups("1048", WEEK)).thenReturn(List.of(
                new SleeperPayload.MatchupEntry(1, 1, 40.0, 45.0, List.of("s1"), List.of("s1", "b1"),
                        Map.of("s1", 21.5, "b1", 3.0)),
                entry(2, 1, 50.0)));
        when(statFeed.statsFor("2024", WEEK)).thenReturn(Map.of());

        var matchup = (Matchup) provider(new UserIdentity("1001", null)).fetch().outcome();

        assertEquals(45.0, matchup.away().score(), 1e-9);
        assertEquals(21.5, matchup.away().starters().get(0).points(), 1e-9);
        assertEquals(50.0, matchup.home().score(), 1e-9);
    }

    @Test
    void unavailableStatFeed_alsoFallsBack() {
        when(client.fetchRosters("1048")).thenReturn(rosters(2));
        when(client.fetchMatchups("1048", WEEK)).thenReturn(List.of(entry(1, 1, 12.0), entry(2, 1, 14.0)));
        when(statFeed.statsFor("2024", WEEK)).thenThrow(new UpstreamErrors.UpstreamUnavailableException("down", null));

        var matchup = (Matchup) provider(new UserIdentity("1002", null)).fetch().outcome();

        assertEquals(14.0, matchup.home().score(), 1e-9);
    }

    @Test
    void userOnBye_isEmptyResult() {
        when(client.fetchRosters("1048")).thenReturn(rosters(3));
        when(client.fetchMatchups("1048", WEEK)).thenReturn(List.of(entry(1, 1, 1.0), entry(2, 1, 2.0), entry(3, null, 0.0)));
        when(statFeed.statsFor("2024", WEEK)).thenReturn(stats(3));

        var ex = assertThrows(LeagueFetchException.class, () -> provider(new UserIdentity("1003", null)).fetch());
        assertEquals(FailureKind.EMPTY_RESULT, ex.kind());
    }

    @Test
    void unknownUser_isIdentityFailure() {
        when(client.fetchRosters("1048")).thenReturn(rosters(4));

        var ex = assertThrows(LeagueFetchException.class, () -> provider(new UserIdentity("424242", null)).fetch());
        assertEquals(FailureKind.IDENTITY, ex.kind());
        assertEquals("sleeper_1048", ex.leagueKey());
    }

    @Test
    void unavailableClient_isNetworkFailure() {
        when(client.fetchRosters("1048")).thenThrow(new UpstreamErrors.UpstreamUnavailableException("Sleeper unavailable", null));

        var ex = assertThrows(LeagueFetchException.class, () -> provider(new UserIdentity("1001", null)).fetch());
        assertEquals(FailureKind.NETWORK, ex.kind());
    }

    @Test
    void unparseableUserLookup_isDecodeFailure() {
        when(client.fetchRosters("1048")).thenReturn(rosters(2));
        when(client.fetchUser(anyString())).thenThrow(new UpstreamErrors.UpstreamJsonParseException("bad json"));

        var ex = assertThrows(LeagueFetchException.class, () -> provider(new UserIdentity("someone", null)).fetch());
        assertEquals(FailureKind.DECODE, ex.kind());
    }

    @Test
    void missingLeague_isEmptyResult() {
        when(client.fetchLeague("1048")).thenReturn(Optional.empty());

        var ex = assertThrows(LeagueFetchException.class, () -> provider(new UserIdentity("1001", null)).fetch());
        assertEquals(FailureKind.EMPTY_RESULT, ex.kind());
    }
}
