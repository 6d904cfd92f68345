package org.jstats.fantasyhub_api.modules.league_hub.provider;

import java.util.Map;
import java.util.Set;

/**
 * ESPN's numeric codes for lineup slots, positions and pro teams.
 */
final class EspnCodes {

    static final int BENCH_SLOT = 20;
    static final int IR_SLOT = 21;

    private static final Map<Integer, String> SLOTS = Map.ofEntries(
            Map.entry(0, "QB"),
            Map.entry(2, "RB"),
            Map.entry(3, "RB/WR"),
            Map.entry(4, "WR"),
            Map.entry(5, "WR/TE"),
            Map.entry(6, "TE"),
            Map.entry(16, "D/ST"),
            Map.entry(17, "K"),
            Map.entry(20, "BN"),
            Map.entry(21, "IR"),
            Map.entry(23, "FLEX"),
            Map.entry(24, "EDR"),
            Map.entry(25, "RDP")
    );

    private static final Map<Integer, String> POSITIONS = Map.of(
            1, "QB",
            2, "RB",
            3, "WR",
            4, "TE",
            5, "K",
            16, "DEF"
    );

    private static final Map<Integer, String> PRO_TEAMS = Map.ofEntries(
            Map.entry(1, "ATL"), Map.entry(2, "BUF"), Map.entry(3, "CHI"), Map.entry(4, "CIN"),
            Map.entry(5, "CLE"), Map.entry(6, "DAL"), Map.entry(7, "DEN"), Map.entry(8, "DET"),
            Map.entry(9, "GB"), Map.entry(10, "TEN"), Map.entry(11, "IND"), Map.entry(12, "KC"),
            Map.entry(13, "LV"), Map.entry(14, "LAR"), Map.entry(15, "MIA"), Map.entry(16, "MIN"),
            Map.entry(17, "NE"), Map.entry(18, "NO"), Map.entry(19, "NYG"), Map.entry(20, "NYJ"),
            Map.entry(21, "PHI"), Map.entry(22, "ARI"), Map.entry(23, "PIT"), Map.entry(24, "LAC"),
            Map.entry(25, "SF"), Map.entry(26, "SEA"), Map.entry(27, "TB"), Map.entry(28, "WSH"),
            Map.entry(29, "CAR"), Map.entry(30, "JAX"), Map.entry(33, "BAL"), Map.entry(34, "HOU")
    );

    private static final Set<Integer> NON_STARTING = Set.of(BENCH_SLOT, IR_SLOT);

    private EspnCodes() {
    }

    static String slot(int slotId) {
        return SLOTS.getOrDefault(slotId, "BN");
    }

    static boolean isStarter(int slotId) {
        return SLOTS.containsKey(slotId) && !NON_STARTING.contains(slotId);
    }

    static String position(Integer positionId) {
        return positionId == null ? "UNK" : POSITIONS.getOrDefault(positionId, "UNK");
    }

    static String proTeam(Integer proTeamId) {
        return proTeamId == null ? "UNK" : PRO_TEAMS.getOrDefault(proTeamId, "FA");
    }
}
