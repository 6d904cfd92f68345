package org.jstats.fantasyhub_api.modules.league_hub.provider;

import org.jspecify.annotations.Nullable;
import org.jstats.fantasyhub_api.modules.espn.client.EspnClient;
import org.jstats.fantasyhub_api.modules.espn.client.EspnPayload;
import org.jstats.fantasyhub_api.modules.league_hub.assembly.MatchupAssembler;
import org.jstats.fantasyhub_api.modules.league_hub.assembly.PairingEntry;
import org.jstats.fantasyhub_api.modules.league_hub.assembly.WeekPhase;
import org.jstats.fantasyhub_api.modules.league_hub.identity.ResolutionContext;
import org.jstats.fantasyhub_api.modules.league_hub.identity.RosterOwnership;
import org.jstats.fantasyhub_api.modules.league_hub.identity.TeamIdentityResolver;
import org.jstats.fantasyhub_api.modules.league_hub.model.LeagueRef;
import org.jstats.fantasyhub_api.modules.league_hub.model.RosterPlayer;
import org.jstats.fantasyhub_api.modules.league_hub.model.RosterSnapshot;
import org.jstats.fantasyhub_api.modules.league_hub.model.TeamRecord;
import org.jstats.fantasyhub_api.modules.league_hub.model.UnifiedResult;
import org.jstats.fantasyhub_api.modules.league_hub.model.UserIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * ESPN leagues. ESPN applies each league's custom scoring itself, so player points are read as
 * reported. The schedule always pairs teams; an entry without an away side is a bye.
 */
final class EspnLeagueProvider implements LeagueProvider {

    private static final Logger log = LoggerFactory.getLogger(EspnLeagueProvider.class);

    static final int ACTUAL_STATS = 0;
    static final int PROJECTED_STATS = 1;

    private final LeagueRef league;
    private final UserIdentity identity;
    private final int week;
    private final int year;
    private final EspnClient client;
    private final TeamIdentityResolver resolver;
    private final MatchupAssembler assembler;
    private final Clock clock;

    EspnLeagueProvider(LeagueRef league, UserIdentity identity, int week, int year,
                       EspnClient client, TeamIdentityResolver resolver, MatchupAssembler assembler, Clock clock) {
        this.league = league;
        this.identity = identity;
        this.week = week;
        this.year = year;
        this.client = client;
        this.resolver = resolver;
        this.assembler = assembler;
        this.clock = clock;
    }

    @Override
    public LeagueRef league() {
        return league;
    }

    @Override
    public UnifiedResult fetch() {
        try {
            return doFetch();
        } catch (RuntimeException ex) {
            throw LeagueFetchException.from(league, ex);
        }
    }

    private UnifiedResult doFetch() {
        var season = String.valueOf(year);
        var settings = client.fetchLeague(league.leagueId(), season)
                .orElseThrow(() -> new LeagueFetchException(league, FailureKind.EMPTY_RESULT, "league not found"));
        var teams = settings.teams() == null ? List.<EspnPayload.Team>of() : settings.teams();

        var ownerships = teams.stream()
                .map(t -> new RosterOwnership(
                        String.valueOf(t.id()),
                        t.primaryOwner() == null ? null : TeamIdentityResolver.normalizeEspnGuid(t.primaryOwner()),
                        t.owners() == null ? List.of() : t.owners().stream().map(TeamIdentityResolver::normalizeEspnGuid).toList()))
                .toList();
        var myTeamId = resolver.resolve(new ResolutionContext(league, identity, ownerships))
                .orElseThrow(() -> new LeagueFetchException(league, FailureKind.IDENTITY, "no team owned by the user"));

        var weekDoc = client.fetchWeek(league.leagueId(), season, week)
                .orElseThrow(() -> new LeagueFetchException(league, FailureKind.EMPTY_RESULT, "week " + week + " not found"));

        var members = settings.members() == null ? Map.<String, EspnPayload.Member>of() : settings.members().stream()
                .filter(m -> m.id() != null)
                .collect(Collectors.toMap(m -> TeamIdentityResolver.normalizeEspnGuid(m.id()), Function.identity(), (a, b) -> a));
        var teamsById = teams.stream()
                .collect(Collectors.toMap(EspnPayload.Team::id, Function.identity(), (a, b) -> a));
        var weekTeamsById = weekDoc.teams() == null ? Map.<Integer, EspnPayload.Team>of() : weekDoc.teams().stream()
                .collect(Collectors.toMap(EspnPayload.Team::id, Function.identity(), (a, b) -> a));

        var entries = new ArrayList<PairingEntry>();
        var schedule = weekDoc.schedule() == null ? List.<EspnPayload.ScheduleEntry>of() : weekDoc.schedule();
        int pairing = 0;
        for (EspnPayload.ScheduleEntry game : schedule) {
            if (game.matchupPeriodId() == null || game.matchupPeriodId() != week || game.home() == null) {
                continue;
            }
            if (game.away() != null) {
                entries.add(new PairingEntry(snapshot(game.away(), teamsById, weekTeamsById, members), pairing));
            }
            entries.add(new PairingEntry(snapshot(game.home(), teamsById, weekTeamsById, members), pairing));
            pairing++;
        }
        if (entries.isEmpty()) {
            throw new LeagueFetchException(league, FailureKind.EMPTY_RESULT, league.isPlayoffWeek(week)
                    ? "no playoff games for week " + week
                    : "no schedule for week " + week);
        }

        var assembly = assembler.pair(entries, week, WeekPhase.of(week, currentWeek(weekDoc, settings)));
        if (assembly.isBye(myTeamId)) {
            throw new LeagueFetchException(league, FailureKind.EMPTY_RESULT, "user's team is on a bye in week " + week);
        }
        var matchup = assembly.matchupOf(myTeamId)
                .map(m -> m.withByes(assembly.byes()))
                .orElseThrow(() -> new LeagueFetchException(league, FailureKind.EMPTY_RESULT,
                        "no matchup for team " + myTeamId + " in week " + week));
        return new UnifiedResult(league, myTeamId, matchup, clock.instant());
    }

    private int currentWeek(EspnPayload.League weekDoc, EspnPayload.League settings) {
        var status = weekDoc.status() != null ? weekDoc.status() : settings.status();
        if (status == null || status.currentMatchupPeriod() == null) {
            return week;
        }
        return status.currentMatchupPeriod();
    }

    private RosterSnapshot snapshot(EspnPayload.Side side,
                                    Map<Integer, EspnPayload.Team> teamsById,
                                    Map<Integer, EspnPayload.Team> weekTeamsById,
                                    Map<String, EspnPayload.Member> members) {
        var team = teamsById.get(side.teamId());
        var weekTeam = weekTeamsById.get(side.teamId());
        var players = weekTeam != null && weekTeam.roster() != null && weekTeam.roster().entries() != null
                ? weekTeam.roster().entries().stream().map(this::player).toList()
                : List.<RosterPlayer>of();

        double score;
        if (!players.isEmpty()) {
            score = players.stream().filter(RosterPlayer::starter).mapToDouble(RosterPlayer::points).sum();
        } else {
            score = firstNonNull(side.totalPointsLive(), side.totalPoints(), 0.0);
        }
        Double projected = side.totalProjectedPointsLive();
        if (projected == null && weekTeam != null && weekTeam.roster() != null && weekTeam.roster().entries() != null) {
            projected = weekTeam.roster().entries().stream()
                    .filter(e -> EspnCodes.isStarter(e.lineupSlotId()))
                    .mapToDouble(e -> appliedTotal(e.playerPoolEntry(), PROJECTED_STATS))
                    .sum();
        }

        return new RosterSnapshot(
                String.valueOf(side.teamId()),
                ownerName(team, side.teamId(), members),
                team != null ? team.logo() : null,
                score,
                projected,
                recordOf(team),
                players);
    }

    private RosterPlayer player(EspnPayload.RosterEntry entry) {
        var pool = entry.playerPoolEntry();
        var p = pool != null ? pool.player() : null;
        var id = p != null ? String.valueOf(p.id()) : "unknown";
        return new RosterPlayer(
                id,
                p != null ? id : null,
                null,
                EspnCodes.position(p != null ? p.defaultPositionId() : null),
                EspnCodes.proTeam(p != null ? p.proTeamId() : null),
                EspnCodes.isStarter(entry.lineupSlotId()),
                EspnCodes.slot(entry.lineupSlotId()),
                appliedTotal(pool, ACTUAL_STATS));
    }

    /**
     * ESPN's own total for this week, or 0 when it reports none. A roster entry with no actual stat line
     * falls back to {@code appliedStatTotal}.
     */
    private double appliedTotal(EspnPayload.@Nullable PlayerPoolEntry pool, int statSource) {
        if (pool == null || pool.player() == null) {
            return 0.0;
        }
        var stats = pool.player().stats();
        if (stats != null) {
            for (EspnPayload.PlayerStat stat : stats) {
                if (stat.scoringPeriodId() != null && stat.scoringPeriodId() == week
                        && stat.statSourceId() != null && stat.statSourceId() == statSource
                        && stat.appliedTotal() != null) {
                    return stat.appliedTotal();
                }
            }
        }
        if (statSource == ACTUAL_STATS && pool.appliedStatTotal() != null) {
            return pool.appliedStatTotal();
        }
        return 0.0;
    }

    private String ownerName(EspnPayload.@Nullable Team team, int teamId, Map<String, EspnPayload.Member> members) {
        if (team != null && team.primaryOwner() != null) {
            var member = members.get(TeamIdentityResolver.normalizeEspnGuid(team.primaryOwner()));
            if (member != null) {
                if (member.firstName() != null && member.lastName() != null) {
                    return (member.firstName() + " " + member.lastName()).trim();
                }
                if (member.displayName() != null && !member.displayName().isBlank()) {
                    return member.displayName();
                }
            }
        }
        if (team != null) {
            if (team.name() != null && !team.name().isBlank()) {
                return team.name();
            }
            if (team.location() != null || team.nickname() != null) {
                return ((team.location() == null ? "" : team.location()) + " "
                        + (team.nickname() == null ? "" : team.nickname())).trim();
            }
        }
        if (log.isDebugEnabled()) {
            log.debug("No owner name for ESPN team {} in league {}", teamId, league.key());
        }
        return "Team " + teamId;
    }

    private static @Nullable TeamRecord recordOf(EspnPayload.@Nullable Team team) {
        if (team == null || team.record() == null || team.record().overall() == null) {
            return null;
        }
        var o = team.record().overall();
        return new TeamRecord(o.wins() == null ? 0 : o.wins(), o.losses() == null ? 0 : o.losses(), o.ties() == null ? 0 : o.ties());
    }

    private static double firstNonNull(@Nullable Double first, @Nullable Double second, double fallback) {
        if (first != null) return first;
        return second != null ? second : fallback;
    }
}
