package org.jstats.fantasyhub_api.modules.league_hub.identity;

import org.jstats.fantasyhub_api.modules.league_hub.model.LeagueRef;
import org.jstats.fantasyhub_api.modules.league_hub.model.UserIdentity;

import java.util.List;

/**
 * Everything identity resolution may look at. The ownership rows are the ones the provider already fetched.
 */
public record ResolutionContext(LeagueRef league, UserIdentity identity, List<RosterOwnership> ownerships) {
    public ResolutionContext {
        ownerships = ownerships == null ? List.of() : List.copyOf(ownerships);
    }
}
