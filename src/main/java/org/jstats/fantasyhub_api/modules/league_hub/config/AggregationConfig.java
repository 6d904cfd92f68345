package org.jstats.fantasyhub_api.modules.league_hub.config;

import org.jstats.fantasyhub_api.modules.league_hub.model.UserIdentity;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties({AggregationProperties.class, UserProperties.class})
public class AggregationConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    UserIdentity userIdentity(UserProperties user) {
        return new UserIdentity(user.sleeperUser(), user.espnMemberId());
    }

    /** Runs one provider per league; the only pool that blocks on upstream I/O. */
    @Bean(name = "leagueFetchExecutor")
    public ThreadPoolTaskExecutor leagueFetchExecutor(AggregationProperties p) {
        ThreadPoolTaskExecutor exec = new ThreadPoolTaskExecutor();
        exec.setCorePoolSize(p.corePoolSize());
        exec.setMaxPoolSize(p.maxPoolSize());
        exec.setQueueCapacity(p.queueCapacity());
        exec.setThreadNamePrefix("league-fetch-");
        exec.initialize();
        return exec;
    }

    /** Drives loads started over HTTP, so the request thread returns at once. */
    @Bean(name = "aggregationCoordinator")
    public ThreadPoolTaskExecutor aggregationCoordinator() {
        ThreadPoolTaskExecutor exec = new ThreadPoolTaskExecutor();
        exec.setCorePoolSize(1);
        exec.setMaxPoolSize(2);
        exec.setQueueCapacity(4);
        exec.setThreadNamePrefix("league-coordinator-");
        exec.initialize();
        return exec;
    }
}
