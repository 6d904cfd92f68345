package org.jstats.fantasyhub_api.modules.league_hub.assembly;

import org.jspecify.annotations.Nullable;
import org.jstats.fantasyhub_api.modules.league_hub.model.RosterSnapshot;

/**
 * A roster's week entry with the platform's grouping key; {@code null} means no opponent.
 */
public record PairingEntry(RosterSnapshot roster, @Nullable Integer pairingKey) {
}
