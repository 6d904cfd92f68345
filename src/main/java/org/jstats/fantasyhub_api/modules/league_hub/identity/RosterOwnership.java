package org.jstats.fantasyhub_api.modules.league_hub.identity;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Who owns a roster, as reported by the platform.
 *
 * @param rosterId     roster id within the league
 * @param primaryOwner primary owner id (Sleeper {@code owner_id}, ESPN {@code primaryOwner})
 * @param owners       every owner id on the roster (Sleeper {@code co_owners}, ESPN {@code owners})
 */
public record RosterOwnership(String rosterId, @Nullable String primaryOwner, List<String> owners) {
    public RosterOwnership {
        owners = owners == null ? List.of() : owners.stream().filter(o -> o != null).toList();
    }
}
