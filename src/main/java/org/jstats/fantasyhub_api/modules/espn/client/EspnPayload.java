package org.jstats.fantasyhub_api.modules.espn.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * The subset of the ESPN league document read by this service. The same shape comes back for every
 * {@code view}; fields outside the requested views are absent.
 */
public class EspnPayload {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record League(
            long id,
            Integer seasonId,
            Integer scoringPeriodId,
            Settings settings,
            Status status,
            List<Team> teams,
            List<Member> members,
            List<ScheduleEntry> schedule
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Settings(
            String name,
            Integer size,
            ScheduleSettings scheduleSettings
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ScheduleSettings(
            Integer matchupPeriodCount,
            Integer playoffTeamCount
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Status(
            Integer currentMatchupPeriod,
            Integer latestScoringPeriod,
            Boolean isActive
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Team(
            int id,
            String name,
            String location,
            String nickname,
            String abbrev,
            String logo,
            String primaryOwner,
            List<String> owners,
            TeamRecord record,
            Roster roster
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TeamRecord(Overall overall) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Overall(Integer wins, Integer losses, Integer ties) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Member(
            String id,
            String displayName,
            String firstName,
            String lastName
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Roster(List<RosterEntry> entries) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RosterEntry(
            int lineupSlotId,
            PlayerPoolEntry playerPoolEntry
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PlayerPoolEntry(
            Player player,
            Double appliedStatTotal
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Player(
            long id,
            String fullName,
            Integer proTeamId,
            Integer defaultPositionId,
            List<PlayerStat> stats
    ) {}

    /** {@code statSourceId} 0 is actual, 1 is projected. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PlayerStat(
            Integer scoringPeriodId,
            Integer statSourceId,
            Integer statSplitTypeId,
            Double appliedTotal
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ScheduleEntry(
            Integer id,
            Integer matchupPeriodId,
            Side home,
            Side away,
            String winner
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Side(
            int teamId,
            Double totalPoints,
            Double totalPointsLive,
            Double totalProjectedPointsLive
    ) {}
}
