package org.jstats.fantasyhub_api.modules.sleeper.client;

import org.jstats.fantasyhub_api.core.upstream.UpstreamErrors.NotFoundException;
import org.jstats.fantasyhub_api.core.upstream.UpstreamErrors.RateLimitedException;
import org.jstats.fantasyhub_api.core.upstream.UpstreamErrors.Upstream5xxException;
import org.jstats.fantasyhub_api.core.upstream.UpstreamErrors.UpstreamAuthException;
import org.jstats.fantasyhub_api.core.upstream.UpstreamErrors.UpstreamClientException;
import org.jstats.fantasyhub_api.core.upstream.UpstreamErrors.UpstreamJsonParseException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriBuilder;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import static org.jstats.fantasyhub_api.core.upstream.UpstreamErrors.exhausted;
import static org.jstats.fantasyhub_api.core.upstream.UpstreamErrors.guard;
import static org.jstats.fantasyhub_api.core.upstream.UpstreamErrors.translate;

/**
 * Read-only client for the public Sleeper API.
 * <ul>
 *     <li>200 JSON -> body</li>
 *     <li>404 -> empty</li>
 *     <li>429/5xx/IO -> retry with exponential backoff, then {@code UpstreamUnavailableException}</li>
 *     <li>other 4xx, unreadable JSON -> thrown without retry</li>
 * </ul>
 */
@Component
public class SleeperClient {

    private static final Logger log = LoggerFactory.getLogger(SleeperClient.class);
    private static final String SOURCE = "Sleeper";

    private static final ParameterizedTypeReference<List<SleeperPayload.League>> LEAGUES = new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<List<SleeperPayload.Roster>> ROSTERS = new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<List<SleeperPayload.LeagueUser>> USERS = new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<List<SleeperPayload.MatchupEntry>> MATCHUPS = new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<Map<String, Map<String, Double>>> STATS = new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<Map<String, SleeperPayload.Player>> PLAYERS = new ParameterizedTypeReference<>() {};

    private final RestClient http;

    public SleeperClient(@Qualifier("sleeper") RestClient http) {
        this.http = http;
    }

    /** GET /user/{username}. Also accepts a user id. */
    @Retryable(
            retryFor = {RateLimitedException.class, Upstream5xxException.class, ResourceAccessException.class},
            noRetryFor = {UpstreamJsonParseException.class, UpstreamAuthException.class, UpstreamClientException.class},
            maxAttempts = 3,
            backoff = @Backoff(delay = 1000, multiplier = 2.0, maxDelay = 8000),
            recover = "recoverUser"
    )
    public Optional<SleeperPayload.User> fetchUser(String username) {
        return Optional.ofNullable(get(u -> u.path("/user/{username}").build(username),
                "user " + username, SleeperPayload.User.class));
    }

    /** GET /user/{id}/leagues/nfl/{season} */
    @Retryable(
            retryFor = {RateLimitedException.class, Upstream5xxException.class, ResourceAccessException.class},
            noRetryFor = {UpstreamJsonParseException.class, UpstreamAuthException.class, UpstreamClientException.class},
            maxAttempts = 3,
            backoff = @Backoff(delay = 1000, multiplier = 2.0, maxDelay = 8000),
            recover = "recoverLeagues"
    )
    public List<SleeperPayload.League> fetchUserLeagues(String userId, String season) {
        return listOrEmpty(getList(u -> u.path("/user/{id}/leagues/nfl/{season}").build(userId, season),
                "leagues of " + userId, LEAGUES));
    }

    /** GET /league/{id} */
    @Retryable(
            retryFor = {RateLimitedException.class, Upstream5xxException.class, ResourceAccessException.class},
            noRetryFor = {UpstreamJsonParseException.class, UpstreamAuthException.class, UpstreamClientException.class},
            maxAttempts = 3,
            backoff = @Backoff(delay = 1000, multiplier = 2.0, maxDelay = 8000),
            recover = "recoverLeague"
    )
    public Optional<SleeperPayload.League> fetchLeague(String leagueId) {
        return Optional.ofNullable(get(u -> u.path("/league/{id}").build(leagueId),
                "league " + leagueId, SleeperPayload.League.class));
    }

    /** GET /league/{id}/rosters */
    @Retryable(
            retryFor = {RateLimitedException.class, Upstream5xxException.class, ResourceAccessException.class},
            noRetryFor = {UpstreamJsonParseException.class, UpstreamAuthException.class, UpstreamClientException.class},
            maxAttempts = 3,
            backoff = @Backoff(delay = 1000, multiplier = 2.0, maxDelay = 8000),
            recover = "recoverRosters"
    )
    public List<SleeperPayload.Roster> fetchRosters(String leagueId) {
        return listOrEmpty(getList(u -> u.path("/league/{id}/rosters").build(leagueId),
                "rosters of " + leagueId, ROSTERS));
    }

    /** GET /league/{id}/users */
    @Retryable(
            retryFor = {RateLimitedException.class, Upstream5xxException.class, ResourceAccessException.class},
            noRetryFor = {UpstreamJsonParseException.class, UpstreamAuthException.class, UpstreamClientException.class},
            maxAttempts = 3,
            backoff = @Backoff(delay = 1000, multiplier = 2.0, maxDelay = 8000),
            recover = "recoverLeagueUsers"
    )
    public List<SleeperPayload.LeagueUser> fetchLeagueUsers(String leagueId) {
        return listOrEmpty(getList(u -> u.path("/league/{id}/users").build(leagueId),
                "users of " + leagueId, USERS));
    }

    /** GET /league/{id}/matchups/{week} */
    @Retryable(
            retryFor = {RateLimitedException.class, Upstream5xxException.class, ResourceAccessException.class},
            noRetryFor = {UpstreamJsonParseException.class, UpstreamAuthException.class, UpstreamClientException.class},
            maxAttempts = 3,
            backoff = @Backoff(delay = 1000, multiplier = 2.0, maxDelay = 8000),
            recover = "recoverMatchups"
    )
    public List<SleeperPayload.MatchupEntry> fetchMatchups(String leagueId, int week) {
        return listOrEmpty(getList(u -> u.path("/league/{id}/matchups/{week}").build(leagueId, week),
                "matchups of " + leagueId + " week " + week, MATCHUPS));
    }

    /** GET /state/nfl */
    @Retryable(
            retryFor = {RateLimitedException.class, Upstream5xxException.class, ResourceAccessException.class},
            noRetryFor = {UpstreamJsonParseException.class, UpstreamAuthException.class, UpstreamClientException.class},
            maxAttempts = 3,
            backoff = @Backoff(delay = 1000, multiplier = 2.0, maxDelay = 8000),
            recover = "recoverNflState"
    )
    public Optional<SleeperPayload.NflState> fetchNflState() {
        return Optional.ofNullable(get(u -> u.path("/state/nfl").build(), "nfl state", SleeperPayload.NflState.class));
    }

    /** GET /stats/nfl/{seasonType}/{year}/{week}, keyed by player id then stat key. */
    @Retryable(
            retryFor = {RateLimitedException.class, Upstream5xxException.class, ResourceAccessException.class},
            noRetryFor = {UpstreamJsonParseException.class, UpstreamAuthException.class, UpstreamClientException.class},
            maxAttempts = 3,
            backoff = @Backoff(delay = 1000, multiplier = 2.0, maxDelay = 8000),
            recover = "recoverWeekStats"
    )
    public Map<String, Map<String, Double>> fetchWeekStats(String seasonType, String year, int week) {
        var stats = getList(u -> u.path("/stats/nfl/{type}/{year}/{week}").build(seasonType, year, week),
                "stats " + seasonType + "/" + year + "/" + week, STATS);
        return stats == null ? Map.of() : stats;
    }

    /** GET /players/nfl. Large payload, callers cache it. */
    @Retryable(
            retryFor = {RateLimitedException.class, Upstream5xxException.class, ResourceAccessException.class},
            noRetryFor = {UpstreamJsonParseException.class, UpstreamAuthException.class, UpstreamClientException.class},
            maxAttempts = 3,
            backoff = @Backoff(delay = 1000, multiplier = 2.0, maxDelay = 8000),
            recover = "recoverPlayers"
    )
    public Map<String, SleeperPayload.Player> fetchPlayers() {
        var players = getList(u -> u.path("/players/nfl").build(), "player directory", PLAYERS);
        return players == null ? Map.of() : players;
    }

    private <T> @Nullable T get(Function<UriBuilder, URI> uri, String what, Class<T> type) {
        return fetch(uri, what, spec -> spec.body(type));
    }

    private <T> @Nullable T getList(Function<UriBuilder, URI> uri, String what, ParameterizedTypeReference<T> type) {
        return fetch(uri, what, spec -> spec.body(type));
    }

    private <T> @Nullable T fetch(Function<UriBuilder, URI> uri, String what,
                                  Function<RestClient.ResponseSpec, T> body) {
        if (log.isDebugEnabled()) {
            log.debug("Calling Sleeper for {}", what);
        }
        try {
            return translate(SOURCE, what, () -> body.apply(guard(http.get()
                    .uri(uri)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve(), what)));
        } catch (NotFoundException nf) {
            if (log.isDebugEnabled()) {
                log.debug("Sleeper has no {}", what);
            }
            return null;
        }
    }

    private static <T> List<T> listOrEmpty(@Nullable List<T> list) {
        return list == null ? List.of() : list;
    }

    // ---------- @Recover handlers (run after the final attempt fails) ----------
    @Recover
    public Optional<SleeperPayload.User> recoverUser(RuntimeException ex, String username) {
        throw exhausted(SOURCE, "user " + username, ex);
    }

    @Recover
    public List<SleeperPayload.League> recoverLeagues(RuntimeException ex, String userId, String season) {
        throw exhausted(SOURCE, "leagues of " + userId, ex);
    }

    @Recover
    public Optional<SleeperPayload.League> recoverLeague(RuntimeException ex, String leagueId) {
        throw exhausted(SOURCE, "league " + leagueId, ex);
    }

    @Recover
    public List<SleeperPayload.Roster> recoverRosters(RuntimeException ex, String leagueId) {
        throw exhausted(SOURCE, "rosters of " + leagueId, ex);
    }

    @Recover
    public List<SleeperPayload.LeagueUser> recoverLeagueUsers(RuntimeException ex, String leagueId) {
        throw exhausted(SOURCE, "users of " + leagueId, ex);
    }

    @Recover
    public List<SleeperPayload.MatchupEntry> recoverMatchups(RuntimeException ex, String leagueId, Integer week) {
        throw exhausted(SOURCE, "matchups of " + leagueId + " week " + week, ex);
    }

    @Recover
    public Optional<SleeperPayload.NflState> recoverNflState(RuntimeException ex) {
        throw exhausted(SOURCE, "nfl state", ex);
    }

    @Recover
    public Map<String, Map<String, Double>> recoverWeekStats(RuntimeException ex, String seasonType, String year, Integer week) {
        throw exhausted(SOURCE, "stats " + seasonType + "/" + year + "/" + week, ex);
    }

    @Recover
    public Map<String, SleeperPayload.Player> recoverPlayers(RuntimeException ex) {
        throw exhausted(SOURCE, "player directory", ex);
    }
}
