package org.jstats.fantasyhub_api.modules.league_hub.orchestration;

public enum LoadStatus {
    PENDING,
    LOADING,
    COMPLETED,
    FAILED
}
