package org.jstats.fantasyhub_api.modules.league_hub.directory;

import org.jstats.fantasyhub_api.modules.league_hub.model.LeagueRef;
import org.jstats.fantasyhub_api.modules.league_hub.model.UserIdentity;

import java.util.List;

/**
 * The leagues a user belongs to across both platforms.
 */
public interface LeagueDirectory {

    List<LeagueRef> leaguesFor(UserIdentity identity, int year);
}
