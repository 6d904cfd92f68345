package org.jstats.fantasyhub_api.modules.league_hub.model;

import java.util.Map;

/**
 * Observed counts per stat key for one player in one week.
 */
public record StatLine(Map<String, Double> counts) {

    private static final StatLine EMPTY = new StatLine(Map.of());

    public StatLine {
        counts = counts == null ? Map.of() : Map.copyOf(counts);
    }

    public static StatLine empty() {
        return EMPTY;
    }
}
