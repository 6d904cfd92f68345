package org.jstats.fantasyhub_api.modules.sleeper.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;
import java.time.temporal.ChronoUnit;

@ConfigurationProperties(prefix = "sleeper.api")
record SleeperApiProperties(
        String baseUrl,
        @DurationUnit(ChronoUnit.MILLIS) Duration connectTimeout,
        @DurationUnit(ChronoUnit.MILLIS) Duration readTimeout,
        String userAgent,
        @DurationUnit(ChronoUnit.SECONDS) Duration statsTtl) {}

@Configuration
@EnableConfigurationProperties(SleeperApiProperties.class)
public class SleeperApiConfig {

    private static final Logger log = LoggerFactory.getLogger(SleeperApiConfig.class);

    static final Duration DEFAULT_STATS_TTL = Duration.ofSeconds(60);

    @Bean(name = "sleeper")
    RestClient sleeperRestClient(RestClient.Builder builder, SleeperApiProperties p) {
        if (!StringUtils.hasText(p.baseUrl())) {
            throw new IllegalStateException("Sleeper base url missing. Set sleeper.api.base-url.");
        }
        log.info("Sleeper API client targeting {}", p.baseUrl());

        var httpClientBuilder = HttpClient.newBuilder();
        if (p.connectTimeout() != null) {
            httpClientBuilder.connectTimeout(p.connectTimeout());
        }
        final var factory = new JdkClientHttpRequestFactory(httpClientBuilder.build());
        if (p.readTimeout() != null) {
            factory.setReadTimeout(p.readTimeout());
        }

        var b = builder.clone()
                .baseUrl(p.baseUrl())
                .requestFactory(factory)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        if (StringUtils.hasText(p.userAgent())) {
            b.defaultHeader(HttpHeaders.USER_AGENT, p.userAgent());
        }
        return b.build();
    }

    /** How long a fetched week of stats is reused before the feed asks again. */
    @Bean(name = "sleeperStatsTtl")
    Duration sleeperStatsTtl(SleeperApiProperties p) {
        return p.statsTtl() != null ? p.statsTtl() : DEFAULT_STATS_TTL;
    }
}
