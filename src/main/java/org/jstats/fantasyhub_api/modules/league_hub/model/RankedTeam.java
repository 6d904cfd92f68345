package org.jstats.fantasyhub_api.modules.league_hub.model;

/**
 * @param team                the roster
 * @param rank                dense rank, 1 is the week's top scorer
 * @param eliminationStatus   bucket derived from the rank
 * @param survivalProbability positional heuristic, 0 inside the elimination zone
 * @param pointsFromSafety    score minus the best score inside the elimination zone
 */
public record RankedTeam(
        RosterSnapshot team,
        int rank,
        EliminationStatus eliminationStatus,
        double survivalProbability,
        double pointsFromSafety
) {
    public boolean eliminated() {
        return eliminationStatus == EliminationStatus.CRITICAL;
    }
}
