package org.jstats.fantasyhub_api.modules.league_hub.api;

import org.jspecify.annotations.Nullable;
import org.jstats.fantasyhub_api.modules.league_hub.model.UnifiedResult;
import org.jstats.fantasyhub_api.modules.league_hub.orchestration.LeagueLoadingState;
import org.jstats.fantasyhub_api.modules.league_hub.orchestration.LoadProgress;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public class LeagueHubViews {

    public record Results(
            List<UnifiedResult> results,
            @Nullable Instant lastUpdated,
            boolean loading,
            boolean noLeaguesFound
    ) {}

    public record Loading(
            boolean loading,
            LoadProgress progress,
            Map<String, LeagueLoadingState> leagues
    ) {}

    public record Accepted(String action, int week, int year) {}

    public record Activity(boolean active, boolean refreshRunning) {}
}
