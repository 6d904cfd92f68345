package org.jstats.fantasyhub_api.modules.league_hub.orchestration;

import org.jspecify.annotations.Nullable;
import org.jstats.fantasyhub_api.modules.league_hub.model.LeagueRef;
import org.jstats.fantasyhub_api.modules.league_hub.provider.FailureKind;

/**
 * Where one league stands in the current full load.
 */
public record LeagueLoadingState(LeagueRef league, LoadStatus status, @Nullable FailureKind failure, @Nullable String message) {

    static LeagueLoadingState pending(LeagueRef league) {
        return new LeagueLoadingState(league, LoadStatus.PENDING, null, null);
    }

    LeagueLoadingState loading() {
        return new LeagueLoadingState(league, LoadStatus.LOADING, null, null);
    }

    LeagueLoadingState completed() {
        return new LeagueLoadingState(league, LoadStatus.COMPLETED, null, null);
    }

    LeagueLoadingState failed(FailureKind kind, String reason) {
        return new LeagueLoadingState(league, LoadStatus.FAILED, kind, reason);
    }

    LeagueLoadingState skipped() {
        return new LeagueLoadingState(league, LoadStatus.FAILED, null, "already in flight");
    }

    boolean finished() {
        return status == LoadStatus.COMPLETED || status == LoadStatus.FAILED;
    }
}
