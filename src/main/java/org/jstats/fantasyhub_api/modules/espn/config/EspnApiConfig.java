package org.jstats.fantasyhub_api.modules.espn.config;

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

@ConfigurationProperties(prefix = "espn.api")
record EspnApiProperties(
        String baseUrl,
        String swid,
        String espnS2,
        @DurationUnit(ChronoUnit.MILLIS) Duration connectTimeout,
        @DurationUnit(ChronoUnit.MILLIS) Duration readTimeout,
        String userAgent) {}

@Configuration
@EnableConfigurationProperties(EspnApiProperties.class)
public class EspnApiConfig {

    private static final Logger log = LoggerFactory.getLogger(EspnApiConfig.class);

    static String cookieHeader(String swid, String espnS2) {
        return "SWID=" + swid.trim() + "; espn_s2=" + espnS2.trim();
    }

    @Bean(name = "espn")
    RestClient espnRestClient(RestClient.Builder builder, EspnApiProperties p) {
        if (!StringUtils.hasText(p.baseUrl())) {
            throw new IllegalStateException("ESPN base url missing. Set espn.api.base-url.");
        }

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

        // Private leagues need both cookies; public ones work without.
        if (StringUtils.hasText(p.swid()) && StringUtils.hasText(p.espnS2())) {
            int len = p.espnS2().length();
            String tail = len >= 2 ? p.espnS2().substring(len - 2) : "??";
            log.info("ESPN cookies configured (espn_s2 len={}, endsWith=**{})", len, tail);
            b.defaultHeader(HttpHeaders.COOKIE, cookieHeader(p.swid(), p.espnS2()));
        } else {
            log.warn("ESPN cookies missing (espn.api.swid / espn.api.espn-s2); only public leagues will load");
        }
        return b.build();
    }
}
