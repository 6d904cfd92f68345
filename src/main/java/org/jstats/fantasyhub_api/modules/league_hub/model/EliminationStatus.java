package org.jstats.fantasyhub_api.modules.league_hub.model;

public enum EliminationStatus {
    CHAMPION,
    SAFE,
    WARNING,
    DANGER,
    /** Inside this week's elimination zone. */
    CRITICAL
}
