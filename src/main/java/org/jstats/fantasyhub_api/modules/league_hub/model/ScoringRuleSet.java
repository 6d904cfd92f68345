package org.jstats.fantasyhub_api.modules.league_hub.model;

import java.util.Map;

/**
 * Per-unit point weight for each stat key, scoped to one league and one fetch cycle.
 */
public record ScoringRuleSet(Map<String, Double> weights) {

    private static final ScoringRuleSet EMPTY = new ScoringRuleSet(Map.of());

    public ScoringRuleSet {
        weights = weights == null ? Map.of() : Map.copyOf(weights);
    }

    public static ScoringRuleSet empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return weights.isEmpty();
    }
}
