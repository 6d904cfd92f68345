package org.jstats.fantasyhub_api.modules.league_hub.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UnifiedResultTests {

    private static final Instant NOW = Instant.parse("2024-10-20T18:00:00Z");

    private static RosterSnapshot team(String id, double score) {
        return new RosterSnapshot(id, "Owner " + id, null, score, null, null, List.of());
    }

    @Test
    void priorityAddsLiveAndPoolBonusesToPlatformPreference() {
        var espn = new LeagueRef(Platform.ESPN, "1", "E", 10);
        var sleeper = new LeagueRef(Platform.SLEEPER, "2", "S", 12);

        var live = new UnifiedResult(espn, "1", new Matchup(team("1", 3), team("2", 0), 7, MatchupStatus.LIVE, 0.5), NOW);
        var done = new UnifiedResult(espn, "1", new Matchup(team("1", 3), team("2", 0), 7, MatchupStatus.COMPLETE, 0.5), NOW);
        var pool = new UnifiedResult(sleeper, "1", new Ranking(7, List.of(), 1, List.of()), NOW);

        assertEquals(120, live.priority());
        assertEquals(20, done.priority());
        assertEquals(80, pool.priority());
        assertTrue(pool.isEliminationPool());
        assertFalse(live.isEliminationPool());
    }

    @Test
    void matchupRejectsSameRosterOnBothSides() {
        assertThrows(IllegalArgumentException.class,
                () -> new Matchup(team("4", 1), team("4", 2), 7, MatchupStatus.UPCOMING, 0.5));
    }

    @Test
    void blankLeagueNameGetsPlatformDefault() {
        var league = new LeagueRef(Platform.SLEEPER, "1048", " ", 12);

        assertEquals("SLEEPER League 1048", league.name());
        assertEquals("sleeper_1048", league.key());
    }

    @Test
    void outcomeJsonCarriesItsKind() throws Exception {
        var mapper = new ObjectMapper().registerModule(new JavaTimeModule());
        var league = new LeagueRef(Platform.SLEEPER, "1048", "Chopped", 12);
        var result = new UnifiedResult(league, "3", new Ranking(7, List.of(), 1, List.of()), NOW);

        var tree = mapper.readTree(mapper.writeValueAsString(result));

        assertEquals("ranking", tree.path("outcome").path("type").asText());
        assertEquals(7, tree.path("outcome").path("week").asInt());
    }
}
