package org.jstats.fantasyhub_api.modules.league_hub.assembly;

import org.jstats.fantasyhub_api.modules.league_hub.model.EliminationStatus;
import org.jstats.fantasyhub_api.modules.league_hub.model.Matchup;
import org.jstats.fantasyhub_api.modules.league_hub.model.RankedTeam;
import org.jstats.fantasyhub_api.modules.league_hub.model.Ranking;
import org.jstats.fantasyhub_api.modules.league_hub.model.RosterSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Builds head-to-head matchups from grouped entries, or an elimination ranking when a league pairs nobody.
 */
@Component
public class MatchupAssembler {

    private static final Logger log = LoggerFactory.getLogger(MatchupAssembler.class);

    /** Pools of this size or larger eliminate two teams a week. */
    static final int LARGE_POOL_SIZE = 20;

    /**
     * Groups entries by pairing key in first-seen order. A group of two becomes a matchup with the
     * first entry away and the second home; a lone entry or a {@code null} key is a bye.
     */
    public MatchupAssembly pair(List<PairingEntry> entries, int week, WeekPhase phase) {
        var groups = new LinkedHashMap<Integer, List<RosterSnapshot>>();
        var byes = new ArrayList<RosterSnapshot>();
        for (PairingEntry entry : entries) {
            if (entry.pairingKey() == null) {
                byes.add(entry.roster());
            } else {
                groups.computeIfAbsent(entry.pairingKey(), k -> new ArrayList<>()).add(entry.roster());
            }
        }

        var matchups = new ArrayList<Matchup>();
        groups.forEach((key, rosters) -> {
            switch (rosters.size()) {
                case 1 -> byes.add(rosters.get(0));
                case 2 -> {
                    var away = rosters.get(0);
                    var home = rosters.get(1);
                    if (away.id().equals(home.id())) {
                        log.warn("Pairing {} in week {} lists roster {} twice, skipped", key, week, home.id());
                        return;
                    }
                    matchups.add(new Matchup(home, away, week,
                            phase.statusFor(home.score(), away.score()),
                            winProbability(home.score(), away.score())));
                }
                default -> log.warn("Pairing {} in week {} has {} rosters, skipped", key, week, rosters.size());
            }
        });
        return new MatchupAssembly(matchups, byes);
    }

    /**
     * Home win probability: {@code 0.5 + clamp((home - away) / 100, -0.5, 0.5) * 0.3}.
     */
    public static double winProbability(double homeScore, double awayScore) {
        double edge = Math.max(-0.5, Math.min(0.5, (homeScore - awayScore) / 100.0));
        return 0.5 + edge * 0.3;
    }

    /**
     * Ranks every roster that still fields players by the week's score, highest first. Ties keep the
     * platform's report order. Rosters with no players at all go to the graveyard.
     */
    public Ranking rank(List<RosterSnapshot> rosters, int week) {
        var graveyard = rosters.stream().filter(r -> r.players().isEmpty()).toList();
        // List.sort is stable
        var alive = new ArrayList<>(rosters.stream().filter(r -> !r.players().isEmpty()).toList());
        alive.sort(Comparator.comparingDouble(RosterSnapshot::score).reversed());

        int n = alive.size();
        int cutoff = eliminationCutoff(n);
        double cutoffScore = n == 0 ? 0.0 : alive.get(Math.max(0, n - cutoff)).score();

        var ranked = new ArrayList<RankedTeam>(n);
        for (int i = 0; i < n; i++) {
            var team = alive.get(i);
            int rank = i + 1;
            boolean inZone = rank > n - cutoff;

            EliminationStatus status;
            if (rank == 1) {
                status = EliminationStatus.CHAMPION;
            } else if (inZone) {
                status = EliminationStatus.CRITICAL;
            } else if (rank > n * 3 / 4) {
                status = EliminationStatus.DANGER;
            } else if (rank > n / 2) {
                status = EliminationStatus.WARNING;
            } else {
                status = EliminationStatus.SAFE;
            }

            double pointsFromSafety;
            if (inZone) {
                pointsFromSafety = i > 0 ? team.score() - alive.get(i - 1).score() : 0.0;
            } else {
                pointsFromSafety = team.score() - cutoffScore;
            }
            double survival = inZone ? 0.0 : Math.max(0.0, Math.min(1.0, (double) (n - rank) / n));

            ranked.add(new RankedTeam(team, rank, status, survival, pointsFromSafety));
        }

        if (log.isDebugEnabled()) {
            log.debug("Ranked {} teams for week {} (cutoff {}, graveyard {})", n, week, cutoff, graveyard.size());
        }
        return new Ranking(week, ranked, cutoff, graveyard);
    }

    static int eliminationCutoff(int teamCount) {
        return teamCount >= LARGE_POOL_SIZE ? 2 : 1;
    }
}
