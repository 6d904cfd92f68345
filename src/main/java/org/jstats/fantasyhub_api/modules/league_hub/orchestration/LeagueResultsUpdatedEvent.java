package org.jstats.fantasyhub_api.modules.league_hub.orchestration;

import org.jstats.fantasyhub_api.modules.league_hub.model.UnifiedResult;
import org.springframework.context.ApplicationEvent;

import java.util.List;

/**
 * Published whenever the visible result list is replaced.
 */
public class LeagueResultsUpdatedEvent extends ApplicationEvent {

    private final List<UnifiedResult> results;
    private final boolean refresh;

    public LeagueResultsUpdatedEvent(Object source, List<UnifiedResult> results, boolean refresh) {
        super(source);
        this.results = List.copyOf(results);
        this.refresh = refresh;
    }

    public List<UnifiedResult> results() {
        return results;
    }

    /** True when the replacement came from a background refresh rather than a full load. */
    public boolean refresh() {
        return refresh;
    }
}
