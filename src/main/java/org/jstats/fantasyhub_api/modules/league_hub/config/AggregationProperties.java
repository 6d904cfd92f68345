package org.jstats.fantasyhub_api.modules.league_hub.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Bounds for the league fetch pool and the refresh cadence.
 */
@ConfigurationProperties(prefix = "fantasyhub.aggregation")
public record AggregationProperties(
        Integer corePoolSize,
        Integer maxPoolSize,
        Integer queueCapacity,
        @DurationUnit(ChronoUnit.SECONDS) Duration joinTimeout,
        @DurationUnit(ChronoUnit.SECONDS) Duration refreshInterval,
        boolean autoRefresh) {

    public AggregationProperties {
        if (corePoolSize == null) corePoolSize = 4;
        if (maxPoolSize == null) maxPoolSize = Math.max(8, corePoolSize);
        if (queueCapacity == null) queueCapacity = 100;
        if (joinTimeout == null) joinTimeout = Duration.ofSeconds(60);
        if (refreshInterval == null) refreshInterval = Duration.ofSeconds(15);
    }
}
