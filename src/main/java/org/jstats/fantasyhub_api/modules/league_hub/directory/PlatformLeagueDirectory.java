package org.jstats.fantasyhub_api.modules.league_hub.directory;

import org.jstats.fantasyhub_api.modules.espn.client.EspnClient;
import org.jstats.fantasyhub_api.modules.espn.client.EspnPayload;
import org.jstats.fantasyhub_api.modules.league_hub.config.UserProperties;
import org.jstats.fantasyhub_api.modules.league_hub.model.LeagueRef;
import org.jstats.fantasyhub_api.modules.league_hub.model.Platform;
import org.jstats.fantasyhub_api.modules.league_hub.model.UserIdentity;
import org.jstats.fantasyhub_api.modules.sleeper.client.SleeperClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lists Sleeper leagues from the user's account and ESPN leagues from configuration.
 * A platform that cannot be listed contributes nothing; the other one still does.
 */
@Component
public class PlatformLeagueDirectory implements LeagueDirectory {

    private static final Logger log = LoggerFactory.getLogger(PlatformLeagueDirectory.class);

    private final SleeperClient sleeper;
    private final EspnClient espn;
    private final UserProperties user;

    public PlatformLeagueDirectory(SleeperClient sleeper, EspnClient espn, UserProperties user) {
        this.sleeper = sleeper;
        this.espn = espn;
        this.user = user;
    }

    @Override
    public List<LeagueRef> leaguesFor(UserIdentity identity, int year) {
        var leagues = new ArrayList<LeagueRef>();
        leagues.addAll(espnLeagues(year));
        leagues.addAll(sleeperLeagues(identity, year));
        log.info("Directory found {} leagues for {}", leagues.size(), year);
        return List.copyOf(leagues);
    }

    private List<LeagueRef> sleeperLeagues(UserIdentity identity, int year) {
        if (identity.sleeperUser() == null || identity.sleeperUser().isBlank()) {
            return List.of();
        }
        try {
            Optional<String> userId = identity.sleeperUserIsNumeric()
                    ? Optional.of(identity.sleeperUser())
                    : sleeper.fetchUser(identity.sleeperUser()).map(u -> u.userId());
            if (userId.isEmpty()) {
                log.warn("Sleeper user {} not found", identity.sleeperUser());
                return List.of();
            }
            return sleeper.fetchUserLeagues(userId.get(), String.valueOf(year)).stream()
                    .filter(l -> l.leagueId() != null)
                    .map(l -> new LeagueRef(Platform.SLEEPER, l.leagueId(), l.name(),
                            l.totalRosters() == null ? 0 : l.totalRosters(),
                            l.settings() == null ? null : l.settings().playoffWeekStart()))
                    .toList();
        } catch (RuntimeException ex) {
            log.warn("Could not list Sleeper leagues for {}: {}", identity.sleeperUser(), ex.getMessage());
            return List.of();
        }
    }

    private List<LeagueRef> espnLeagues(int year) {
        var leagues = new ArrayList<LeagueRef>();
        for (String leagueId : user.espnLeagueIds()) {
            try {
                espn.fetchLeague(leagueId, String.valueOf(year)).ifPresentOrElse(
                        l -> leagues.add(toRef(leagueId, l)),
                        () -> log.warn("ESPN league {} not found for {}", leagueId, year));
            } catch (RuntimeException ex) {
                log.warn("Could not read ESPN league {}: {}", leagueId, ex.getMessage());
            }
        }
        return leagues;
    }

    private static LeagueRef toRef(String leagueId, EspnPayload.League l) {
        var settings = l.settings();
        Integer playoffStart = settings != null && settings.scheduleSettings() != null
                && settings.scheduleSettings().matchupPeriodCount() != null
                ? settings.scheduleSettings().matchupPeriodCount() + 1
                : null;
        int size = settings != null && settings.size() != null ? settings.size()
                : l.teams() == null ? 0 : l.teams().size();
        return new LeagueRef(Platform.ESPN, leagueId, settings != null ? settings.name() : null, size, playoffStart);
    }
}
