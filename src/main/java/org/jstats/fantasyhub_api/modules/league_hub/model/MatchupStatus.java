package org.jstats.fantasyhub_api.modules.league_hub.model;

public enum MatchupStatus {
    UPCOMING,
    LIVE,
    COMPLETE
}
