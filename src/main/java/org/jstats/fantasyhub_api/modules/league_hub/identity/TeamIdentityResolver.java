package org.jstats.fantasyhub_api.modules.league_hub.identity;

import org.jstats.fantasyhub_api.modules.sleeper.client.SleeperClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Finds the user's roster within a league. The platform user id is resolved first; the ordered
 * strategies then run against the league's ownership rows and the first match wins.
 * Names are never used for matching.
 */
@Component
public class TeamIdentityResolver {

    private static final Logger log = LoggerFactory.getLogger(TeamIdentityResolver.class);

    // The chain's first step is platformUserId(), which may call Sleeper and so is not a pure strategy.
    // The strategies below are the remaining steps, in order, and only ever see the resolved id.
    private static final List<IdentityStrategy> STRATEGIES = List.of(
            IdentityStrategy.PRIMARY_OWNER,
            IdentityStrategy.CO_OWNER
    );

    private final SleeperClient sleeper;

    public TeamIdentityResolver(SleeperClient sleeper) {
        this.sleeper = sleeper;
    }

    public Optional<String> resolve(ResolutionContext context) {
        var userId = platformUserId(context);
        if (userId.isEmpty()) {
            log.warn("No {} user id available for league {}", context.league().platform(), context.league().key());
            return Optional.empty();
        }
        for (IdentityStrategy strategy : STRATEGIES) {
            var match = strategy.match(userId.get(), context.ownerships());
            if (match.isPresent()) {
                return match;
            }
        }
        if (log.isDebugEnabled()) {
            log.debug("User {} owns no roster in league {}", userId.get(), context.league().key());
        }
        return Optional.empty();
    }

    /**
     * The user's id on the league's platform. A numeric Sleeper identity is the id itself, a username
     * is looked up. ESPN uses the member GUID as configured.
     */
    Optional<String> platformUserId(ResolutionContext context) {
        var identity = context.identity();
        return switch (context.league().platform()) {
            case ESPN -> Optional.ofNullable(identity.espnMemberId())
                    .filter(s -> !s.isBlank())
                    .map(TeamIdentityResolver::normalizeEspnGuid);
            case SLEEPER -> {
                if (identity.sleeperUser() == null || identity.sleeperUser().isBlank()) {
                    yield Optional.empty();
                }
                if (identity.sleeperUserIsNumeric()) {
                    yield Optional.of(identity.sleeperUser());
                }
                yield sleeper.fetchUser(identity.sleeperUser()).map(u -> u.userId());
            }
        };
    }

    /**
     * ESPN reports member GUIDs as {@code {XXXXXXXX-...}}; stored SWIDs sometimes lack the braces or differ in case.
     */
    public static String normalizeEspnGuid(String guid) {
        var trimmed = guid.trim().toUpperCase(Locale.ROOT);
        if (!trimmed.startsWith("{")) {
            trimmed = "{" + trimmed;
        }
        if (!trimmed.endsWith("}")) {
            trimmed = trimmed + "}";
        }
        return trimmed;
    }
}
