package org.jstats.fantasyhub_api.modules.league_hub.model;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * One team's state for one week. Built fresh per fetch cycle and never mutated.
 *
 * @param id             roster id within the league
 * @param ownerName      owner display name
 * @param avatarUrl      avatar reference, may be {@code null}
 * @param score          computed score for the week
 * @param projectedScore projected score, may be {@code null}
 * @param record         season record, when the platform reports one
 * @param players        ordered roster entries
 */
public record RosterSnapshot(
        String id,
        String ownerName,
        @Nullable String avatarUrl,
        double score,
        @Nullable Double projectedScore,
        @Nullable TeamRecord record,
        List<RosterPlayer> players
) {
    public RosterSnapshot {
        Objects.requireNonNull(id, "id");
        players = players == null ? List.of() : List.copyOf(players);
    }

    public List<RosterPlayer> starters() {
        return players.stream().filter(RosterPlayer::starter).toList();
    }
}
