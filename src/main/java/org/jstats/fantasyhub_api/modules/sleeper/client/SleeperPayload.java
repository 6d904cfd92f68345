package org.jstats.fantasyhub_api.modules.sleeper.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

public class SleeperPayload {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record User(
            @JsonProperty("user_id") String userId,
            String username,
            @JsonProperty("display_name") String displayName,
            String avatar
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record League(
            @JsonProperty("league_id") String leagueId,
            String name,
            String season,
            String status,
            @JsonProperty("total_rosters") Integer totalRosters,
            @JsonProperty("scoring_settings") Map<String, Double> scoringSettings,
            @JsonProperty("roster_positions") List<String> rosterPositions,
            LeagueSettings settings
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LeagueSettings(
            @JsonProperty("playoff_week_start") Integer playoffWeekStart,
            @JsonProperty("num_teams") Integer numTeams,
            Integer type,
            @JsonProperty("is_chopped") Boolean chopped
    ) {
        /** Sleeper league type 3 is a guillotine league, the older leagues only carry the flag. */
        static final int GUILLOTINE_TYPE = 3;

        public boolean eliminationFormat() {
            return (type != null && type == GUILLOTINE_TYPE) || Boolean.TRUE.equals(chopped);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Roster(
            @JsonProperty("roster_id") int rosterId,
            @JsonProperty("owner_id") String ownerId,
            @JsonProperty("co_owners") List<String> coOwners,
            List<String> players,
            List<String> starters,
            RosterSettings settings
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RosterSettings(
            Integer wins,
            Integer losses,
            Integer ties,
            Integer fpts
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LeagueUser(
            @JsonProperty("user_id") String userId,
            @JsonProperty("display_name") String displayName,
            String avatar,
            UserMetadata metadata
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record UserMetadata(
            @JsonProperty("team_name") String teamName
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MatchupEntry(
            @JsonProperty("roster_id") int rosterId,
            @JsonProperty("matchup_id") Integer matchupId,
            Double points,
            @JsonProperty("custom_points") Double customPoints,
            List<String> starters,
            List<String> players,
            @JsonProperty("players_points") Map<String, Double> playersPoints
    ) {
        /** The commissioner's override wins over the computed total. */
        public Double platformPoints() {
            return customPoints != null ? customPoints : points;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Player(
            @JsonProperty("player_id") String playerId,
            @JsonProperty("full_name") String fullName,
            String position,
            String team,
            @JsonProperty("espn_id") String espnId
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record NflState(
            Integer week,
            String season,
            @JsonProperty("season_type") String seasonType,
            @JsonProperty("display_week") Integer displayWeek
    ) {}
}
