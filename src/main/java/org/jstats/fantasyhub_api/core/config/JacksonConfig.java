package org.jstats.fantasyhub_api.core.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class JacksonConfig {

    @Bean
    Jackson2ObjectMapperBuilderCustomizer jacksonCustomizer() {
        return builder -> builder
                // ESPN and Sleeper both add fields without notice
                .failOnUnknownProperties(false)
                // lastUpdated goes out as ISO-8601
                .featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                // avatars, projections and records are often missing; leave them out
                .serializationInclusion(JsonInclude.Include.NON_NULL);
    }
}
