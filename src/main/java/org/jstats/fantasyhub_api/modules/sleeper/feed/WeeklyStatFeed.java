package org.jstats.fantasyhub_api.modules.sleeper.feed;

import org.jstats.fantasyhub_api.modules.sleeper.client.SleeperClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * Week-scoped stat counts shared by every Sleeper league in a cycle.
 * Week numbers from 19 on are playoff rounds and are read from the {@code post} feed.
 */
@Component
public class WeeklyStatFeed {

    private static final Logger log = LoggerFactory.getLogger(WeeklyStatFeed.class);

    static final int LAST_REGULAR_WEEK = 18;

    private record WeekKey(String seasonType, String year, int week) {}

    private final SleeperClient client;
    private final SharedFetchCache<WeekKey, Map<String, Map<String, Double>>> cache;

    public WeeklyStatFeed(SleeperClient client, Clock clock, @Qualifier("sleeperStatsTtl") Duration ttl) {
        this.client = client;
        this.cache = new SharedFetchCache<>(clock, ttl);
    }

    /**
     * Stat counts for every player who recorded something in the given week, keyed by Sleeper player id.
     */
    public Map<String, Map<String, Double>> statsFor(String year, int week) {
        var key = week > LAST_REGULAR_WEEK
                ? new WeekKey("post", year, week - LAST_REGULAR_WEEK)
                : new WeekKey("regular", year, week);
        return cache.get(key, () -> {
            var stats = client.fetchWeekStats(key.seasonType(), key.year(), key.week());
            if (log.isDebugEnabled()) {
                log.debug("Loaded {} stat lines for {}/{}/{}", stats.size(), key.seasonType(), key.year(), key.week());
            }
            return stats;
        });
    }
}
