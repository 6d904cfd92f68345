package org.jstats.fantasyhub_api.modules.espn.client;

import org.jstats.fantasyhub_api.core.upstream.UpstreamErrors.NotFoundException;
import org.jstats.fantasyhub_api.core.upstream.UpstreamErrors.RateLimitedException;
import org.jstats.fantasyhub_api.core.upstream.UpstreamErrors.Upstream5xxException;
import org.jstats.fantasyhub_api.core.upstream.UpstreamErrors.UpstreamAuthException;
import org.jstats.fantasyhub_api.core.upstream.UpstreamErrors.UpstreamClientException;
import org.jstats.fantasyhub_api.core.upstream.UpstreamErrors.UpstreamJsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.util.Optional;

import static org.jstats.fantasyhub_api.core.upstream.UpstreamErrors.exhausted;
import static org.jstats.fantasyhub_api.core.upstream.UpstreamErrors.guard;
import static org.jstats.fantasyhub_api.core.upstream.UpstreamErrors.translate;

/**
 * Read-only client for the ESPN fantasy football league document.
 * Authentication rides on the cookie header installed by {@code EspnApiConfig}.
 */
@Component
public class EspnClient {

    private static final Logger log = LoggerFactory.getLogger(EspnClient.class);
    private static final String SOURCE = "ESPN";
    private static final String LEAGUE_PATH = "/seasons/{year}/segments/0/leagues/{id}";

    private final RestClient http;

    public EspnClient(@Qualifier("espn") RestClient http) {
        this.http = http;
    }

    /**
     * Teams, owners, members, settings and status: {@code view=mTeam&view=mSettings}.
     * 404 -> Optional.empty()
     */
    @Retryable(
            retryFor = {RateLimitedException.class, Upstream5xxException.class, ResourceAccessException.class},
            noRetryFor = {UpstreamJsonParseException.class, UpstreamAuthException.class, UpstreamClientException.class},
            maxAttempts = 3,
            backoff = @Backoff(delay = 1000, multiplier = 2.0, maxDelay = 8000),
            recover = "recoverLeague"
    )
    public Optional<EspnPayload.League> fetchLeague(String leagueId, String year) {
        var what = "league " + leagueId + " settings";
        if (log.isDebugEnabled()) {
            log.debug("Calling ESPN GET {} for {}", LEAGUE_PATH, what);
        }
        try {
            return Optional.ofNullable(translate(SOURCE, what, () -> guard(http.get()
                    .uri(u -> u.path(LEAGUE_PATH)
                            .queryParam("view", "mTeam", "mSettings")
                            .build(year, leagueId))
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve(), what)
                    .body(EspnPayload.League.class)));
        } catch (NotFoundException nf) {
            if (log.isDebugEnabled()) {
                log.debug("ESPN league not found: {}", leagueId);
            }
            return Optional.empty();
        }
    }

    /**
     * Schedule and rosters with player stats for one scoring period:
     * {@code view=mMatchupScore&view=mLiveScoring&view=mRoster&scoringPeriodId=week}.
     */
    @Retryable(
            retryFor = {RateLimitedException.class, Upstream5xxException.class, ResourceAccessException.class},
            noRetryFor = {UpstreamJsonParseException.class, UpstreamAuthException.class, UpstreamClientException.class},
            maxAttempts = 3,
            backoff = @Backoff(delay = 1000, multiplier = 2.0, maxDelay = 8000),
            recover = "recoverWeek"
    )
    public Optional<EspnPayload.League> fetchWeek(String leagueId, String year, int week) {
        var what = "league " + leagueId + " week " + week;
        if (log.isDebugEnabled()) {
            log.debug("Calling ESPN GET {} for {}", LEAGUE_PATH, what);
        }
        try {
            return Optional.ofNullable(translate(SOURCE, what, () -> guard(http.get()
                    .uri(u -> u.path(LEAGUE_PATH)
                            .queryParam("view", "mMatchupScore", "mLiveScoring", "mRoster")
                            .queryParam("scoringPeriodId", week)
                            .build(year, leagueId))
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve(), what)
                    .body(EspnPayload.League.class)));
        } catch (NotFoundException nf) {
            if (log.isDebugEnabled()) {
                log.debug("ESPN week not found: {}", what);
            }
            return Optional.empty();
        }
    }

    // ---------- @Recover handlers (run after the final attempt fails) ----------
    @Recover
    public Optional<EspnPayload.League> recoverLeague(RuntimeException ex, String leagueId, String year) {
        throw exhausted(SOURCE, "league " + leagueId + " settings", ex);
    }

    @Recover
    public Optional<EspnPayload.League> recoverWeek(RuntimeException ex, String leagueId, String year, Integer week) {
        throw exhausted(SOURCE, "league " + leagueId + " week " + week, ex);
    }
}
