package org.jstats.fantasyhub_api.modules.league_hub.assembly;

import org.jstats.fantasyhub_api.modules.league_hub.model.EliminationStatus;
import org.jstats.fantasyhub_api.modules.league_hub.model.MatchupStatus;
import org.jstats.fantasyhub_api.modules.league_hub.model.RankedTeam;
import org.jstats.fantasyhub_api.modules.league_hub.model.RosterPlayer;
import org.jstats.fantasyhub_api.modules.league_hub.model.RosterSnapshot;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MatchupAssemblerTests {

    private final MatchupAssembler assembler = new MatchupAssembler();

    static RosterSnapshot roster(String id, double score) {
        var player = new RosterPlayer("p" + id, null, "p" + id, "WR", "KC", true, "WR", score);
        return new RosterSnapshot(id, "Owner " + id, null, score, null, null, List.of(player));
    }

    static RosterSnapshot emptyRoster(String id) {
        return new RosterSnapshot(id, "Owner " + id, null, 0.0, null, null, List.of());
    }

    // ---------- pairing ----------

    @Test
    void pairsByKey_firstSeenIsAway() {
        var entries = List.of(
                new PairingEntry(roster("1", 100), 1),
                new PairingEntry(roster("2", 90), 2),
                new PairingEntry(roster("3", 80), 1),
                new PairingEntry(roster("4", 70), 2));

        var assembly = assembler.pair(entries, 5, WeekPhase.PAST);

        assertEquals(2, assembly.matchups().size());
        var first = assembly.matchups().get(0);
        assertEquals("1", first.away().id());
        assertEquals("3", first.home().id());
        assertEquals(MatchupStatus.COMPLETE, first.status());
        assertTrue(assembly.byes().isEmpty());
    }

    @Test
    void loneEntryAndNullKey_areByes() {
        var entries = List.of(
                new PairingEntry(roster("1", 10), 1),
                new PairingEntry(roster("2", 20), 1),
                new PairingEntry(roster("3", 30), 2),
                new PairingEntry(roster("4", 40), null));

        var assembly = assembler.pair(entries, 3, WeekPhase.CURRENT);

        assertEquals(1, assembly.matchups().size());
        assertTrue(assembly.isBye("3"));
        assertTrue(assembly.isBye("4"));
        assertFalse(assembly.isBye("1"));
        assertTrue(assembly.matchupOf("4").isEmpty());
    }

    @Test
    void oversizeGroup_isSkipped() {
        var entries = List.of(
                new PairingEntry(roster("1", 10), 9),
                new PairingEntry(roster("2", 20), 9),
                new PairingEntry(roster("3", 30), 9));

        var assembly = assembler.pair(entries, 3, WeekPhase.CURRENT);

        assertTrue(assembly.matchups().isEmpty());
        assertTrue(assembly.byes().isEmpty());
    }

    @Test
    void currentWeek_isLiveOnlyOnceScored() {
        var unscored = assembler.pair(List.of(
                new PairingEntry(roster("1", 0), 1),
                new PairingEntry(roster("2", 0), 1)), 4, WeekPhase.CURRENT);
        var scored = assembler.pair(List.of(
                new PairingEntry(roster("1", 0), 1),
                new PairingEntry(roster("2", 3.5), 1)), 4, WeekPhase.CURRENT);
        var future = assembler.pair(List.of(
                new PairingEntry(roster("1", 12), 1),
                new PairingEntry(roster("2", 3.5), 1)), 4, WeekPhase.FUTURE);

        assertEquals(MatchupStatus.UPCOMING, unscored.matchups().get(0).status());
        assertEquals(MatchupStatus.LIVE, scored.matchups().get(0).status());
        assertEquals(MatchupStatus.UPCOMING, future.matchups().get(0).status());
    }

    @Test
    void winProbability_isLinearAndClamped() {
        assertEquals(0.5, MatchupAssembler.winProbability(100, 100), 1e-9);
        assertEquals(0.5 + 0.2 * 0.3, MatchupAssembler.winProbability(120, 100), 1e-9);
        assertEquals(0.5 - 0.1 * 0.3, MatchupAssembler.winProbability(90, 100), 1e-9);
        assertEquals(0.65, MatchupAssembler.winProbability(400, 100), 1e-9);
        assertEquals(0.35, MatchupAssembler.winProbability(0, 150), 1e-9);
    }

    @Test
    void weekPhase_followsCurrentWeek() {
        assertEquals(WeekPhase.PAST, WeekPhase.of(3, 5));
        assertEquals(WeekPhase.CURRENT, WeekPhase.of(5, 5));
        assertEquals(WeekPhase.FUTURE, WeekPhase.of(6, 5));
    }

    // ---------- ranking ----------

    private static List<RosterSnapshot> descendingRosters(int n) {
        var rosters = new ArrayList<RosterSnapshot>();
        IntStream.rangeClosed(1, n).forEach(i -> rosters.add(roster(String.valueOf(i), 200.0 - i)));
        return rosters;
    }

    @ParameterizedTest
    @CsvSource({"10,1", "12,1", "19,1", "20,2", "24,2"})
    void cutoff_andDenseRanks(int n, int expectedCutoff) {
        var ranking = assembler.rank(descendingRosters(n), 8);

        assertEquals(expectedCutoff, ranking.eliminationCutoff());
        assertEquals(n, ranking.rankings().size());
        for (int i = 0; i < n; i++) {
            assertEquals(i + 1, ranking.rankings().get(i).rank());
        }
        assertEquals(expectedCutoff, ranking.eliminated().size());
        assertEquals(n, ranking.eliminated().get(ranking.eliminated().size() - 1).rank());
    }

    @Test
    void statusBuckets_forTwelveTeams() {
        var ranking = assembler.rank(descendingRosters(12), 8);
        var statuses = ranking.rankings().stream().map(RankedTeam::eliminationStatus).toList();

        assertEquals(EliminationStatus.CHAMPION, statuses.get(0));
        // ranks 2..6 safe, 7..9 warning, 10..11 danger, 12 critical
        IntStream.rangeClosed(2, 6).forEach(r -> assertEquals(EliminationStatus.SAFE, statuses.get(r - 1)));
        IntStream.rangeClosed(7, 9).forEach(r -> assertEquals(EliminationStatus.WARNING, statuses.get(r - 1)));
        IntStream.rangeClosed(10, 11).forEach(r -> assertEquals(EliminationStatus.DANGER, statuses.get(r - 1)));
        assertEquals(EliminationStatus.CRITICAL, statuses.get(11));
    }

    @Test
    void survivalAndPointsFromSafety() {
        var ranking = assembler.rank(List.of(
                roster("a", 120), roster("b", 100), roster("c", 90), roster("d", 75)), 2);

        var top = ranking.find("a").orElseThrow();
        assertEquals(0.75, top.survivalProbability(), 1e-9);
        assertEquals(45.0, top.pointsFromSafety(), 1e-9);

        var last = ranking.find("d").orElseThrow();
        assertEquals(0.0, last.survivalProbability());
        assertEquals(-15.0, last.pointsFromSafety(), 1e-9);
    }

    @Test
    void ties_keepReportOrder() {
        var ranking = assembler.rank(List.of(
                roster("x", 50), roster("y", 80), roster("z", 50), roster("w", 80)), 1);

        var order = ranking.rankings().stream().map(r -> r.team().id()).toList();
        assertEquals(List.of("y", "w", "x", "z"), order);
    }

    @Test
    void emptyRosters_goToGraveyard() {
        var ranking = assembler.rank(List.of(
                roster("1", 90), emptyRoster("dead"), roster("2", 60), roster("3", 70)), 6);

        assertEquals(3, ranking.rankings().size());
        assertEquals(List.of("dead"), ranking.graveyard().stream().map(RosterSnapshot::id).toList());
        assertEquals("2", ranking.eliminated().get(0).team().id());
    }

    @Test
    void singleRoster_isChampion() {
        var ranking = assembler.rank(List.of(roster("solo", 88)), 17);

        var only = ranking.rankings().get(0);
        assertEquals(1, only.rank());
        assertEquals(EliminationStatus.CHAMPION, only.eliminationStatus());
        assertEquals(0.0, only.survivalProbability());
        assertEquals(0.0, only.pointsFromSafety());
    }

    @Test
    void noRosters_emptyRanking() {
        var ranking = assembler.rank(List.of(), 1);

        assertTrue(ranking.rankings().isEmpty());
        assertEquals(1, ranking.eliminationCutoff());
    }
}
