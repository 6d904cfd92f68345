package org.jstats.fantasyhub_api.modules.league_hub.identity;

import java.util.List;
import java.util.Optional;

/**
 * One id-based way of finding the user's roster.
 */
@FunctionalInterface
public interface IdentityStrategy {

    Optional<String> match(String platformUserId, List<RosterOwnership> ownerships);

    /** Exact equality against each roster's primary owner. */
    IdentityStrategy PRIMARY_OWNER = (userId, ownerships) -> ownerships.stream()
            .filter(o -> userId.equals(o.primaryOwner()))
            .map(RosterOwnership::rosterId)
            .findFirst();

    /** The id appears anywhere in the roster's owner array. */
    IdentityStrategy CO_OWNER = (userId, ownerships) -> ownerships.stream()
            .filter(o -> o.owners().contains(userId))
            .map(RosterOwnership::rosterId)
            .findFirst();
}
