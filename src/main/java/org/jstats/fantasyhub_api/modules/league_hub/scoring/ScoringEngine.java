package org.jstats.fantasyhub_api.modules.league_hub.scoring;

import org.jstats.fantasyhub_api.modules.league_hub.model.ScoringRuleSet;
import org.jstats.fantasyhub_api.modules.league_hub.model.StatLine;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Applies a league's scoring rules to raw stat counts.
 * <p>
 * Keys are summed in sorted order, so the result does not depend on map iteration order.
 * No clamping, no rounding.
 */
@Component
public class ScoringEngine {

    private static final Map<String, Double> DEFAULT_PPR_RULES = Map.ofEntries(
            Map.entry("pass_yd", 0.04),
            Map.entry("pass_td", 4.0),
            Map.entry("pass_int", -1.0),
            Map.entry("pass_2pt", 2.0),
            Map.entry("rush_yd", 0.1),
            Map.entry("rush_td", 6.0),
            Map.entry("rush_2pt", 2.0),
            Map.entry("rec", 1.0),
            Map.entry("rec_yd", 0.1),
            Map.entry("rec_td", 6.0),
            Map.entry("rec_2pt", 2.0),
            Map.entry("fum_lost", -2.0),
            Map.entry("fum_rec_td", 6.0),
            Map.entry("fgm_0_19", 3.0),
            Map.entry("fgm_20_29", 3.0),
            Map.entry("fgm_30_39", 3.0),
            Map.entry("fgm_40_49", 4.0),
            Map.entry("fgm_50p", 5.0),
            Map.entry("fgmiss", -1.0),
            Map.entry("xpm", 1.0),
            Map.entry("xpmiss", -1.0),
            Map.entry("def_td", 6.0),
            Map.entry("int", 2.0),
            Map.entry("fum_rec", 2.0),
            Map.entry("sack", 1.0),
            Map.entry("safe", 2.0),
            Map.entry("blk_kick", 2.0),
            Map.entry("pts_allow_0", 10.0),
            Map.entry("pts_allow_1_6", 7.0),
            Map.entry("pts_allow_7_13", 4.0),
            Map.entry("pts_allow_14_20", 1.0),
            Map.entry("pts_allow_28_34", -1.0),
            Map.entry("pts_allow_35p", -4.0)
    );

    private static final ScoringRuleSet DEFAULT_RULES = new ScoringRuleSet(DEFAULT_PPR_RULES);

    /**
     * {@code Σ statLine[key] * ruleSet[key]} over keys present in both maps.
     */
    public double score(StatLine statLine, ScoringRuleSet ruleSet) {
        var counts = statLine.counts();
        var weights = ruleSet.weights();
        if (counts.isEmpty() || weights.isEmpty()) {
            return 0.0;
        }
        double total = 0.0;
        for (var entry : new TreeMap<>(counts).entrySet()) {
            Double weight = weights.get(entry.getKey());
            if (weight != null && entry.getValue() != null) {
                total += entry.getValue() * weight;
            }
        }
        return total;
    }

    /**
     * Sums the scores of the given player ids; a player without a stat line contributes zero.
     */
    public double scoreAll(Collection<String> playerIds,
                           Function<String, StatLine> statsLookup,
                           ScoringRuleSet ruleSet) {
        double total = 0.0;
        for (String playerId : playerIds) {
            StatLine line = statsLookup.apply(playerId);
            if (line != null) {
                total += score(line, ruleSet);
            }
        }
        return total;
    }

    /**
     * Standard PPR weights, used only when a league publishes no scoring settings at all.
     */
    public ScoringRuleSet defaultRules() {
        return DEFAULT_RULES;
    }
}
