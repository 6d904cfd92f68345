package org.jstats.fantasyhub_api.modules.league_hub.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * The user's platform identities and the ESPN leagues to follow (ESPN has no "my leagues" listing).
 */
@ConfigurationProperties(prefix = "fantasyhub.user")
public record UserProperties(String sleeperUser, String espnMemberId, List<String> espnLeagueIds) {

    public UserProperties {
        espnLeagueIds = espnLeagueIds == null ? List.of()
                : espnLeagueIds.stream().filter(id -> id != null && !id.isBlank()).map(String::trim).toList();
    }
}
