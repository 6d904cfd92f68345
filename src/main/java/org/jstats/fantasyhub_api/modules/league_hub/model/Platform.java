package org.jstats.fantasyhub_api.modules.league_hub.model;

/**
 * Source platform of a connected league.
 * <p>
 * The preference bonus is a fixed tie-break added to a result's priority.
 */
public enum Platform {
    /** Cookie-authenticated private API. */
    ESPN(20),
    /** Public REST API with a shared weekly stat feed. */
    SLEEPER(30);

    private final int preferenceBonus;

    Platform(int preferenceBonus) {
        this.preferenceBonus = preferenceBonus;
    }

    public int preferenceBonus() {
        return preferenceBonus;
    }

    /** ESPN applies the league's custom rules itself; Sleeper leaves that to us. */
    public boolean preAppliesScoring() {
        return this == ESPN;
    }
}
