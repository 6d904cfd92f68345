package org.jstats.fantasyhub_api.modules.sleeper.feed;

import org.jspecify.annotations.Nullable;
import org.jstats.fantasyhub_api.modules.sleeper.client.SleeperClient;
import org.jstats.fantasyhub_api.modules.sleeper.client.SleeperPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Sleeper player metadata (position, NFL team, ESPN cross id). The upstream document is large,
 * so it is fetched at most once a day.
 */
@Component
public class PlayerDirectory {

    private static final Logger log = LoggerFactory.getLogger(PlayerDirectory.class);

    private static final Duration TTL = Duration.ofHours(24);
    private static final Duration FAILURE_BACKOFF = Duration.ofMinutes(1);

    private final SleeperClient client;
    private final Clock clock;
    private volatile Instant unavailableUntil = Instant.MIN;
    private final SharedFetchCache<String, Map<String, SleeperPayload.Player>> cache;

    public PlayerDirectory(SleeperClient client, Clock clock) {
        this.client = client;
        this.clock = clock;
        this.cache = new SharedFetchCache<>(clock, TTL);
    }

    /**
     * Looks up one player. A directory that cannot be loaded yields {@code null} for every id, and is
     * not asked for again until {@link #FAILURE_BACKOFF} has passed.
     */
    public SleeperPayload.@Nullable Player find(String playerId) {
        if (clock.instant().isBefore(unavailableUntil)) {
            return null;
        }
        try {
            return cache.get("nfl", client::fetchPlayers).get(playerId);
        } catch (RuntimeException ex) {
            unavailableUntil = clock.instant().plus(FAILURE_BACKOFF);
            log.warn("Sleeper player directory unavailable: {}", ex.getMessage());
            return null;
        }
    }
}
