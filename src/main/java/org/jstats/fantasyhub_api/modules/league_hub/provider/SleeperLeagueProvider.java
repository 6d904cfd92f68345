package org.jstats.fantasyhub_api.modules.league_hub.provider;

import org.jstats.fantasyhub_api.modules.league_hub.assembly.MatchupAssembler;
import org.jstats.fantasyhub_api.modules.league_hub.assembly.PairingEntry;
import org.jstats.fantasyhub_api.modules.league_hub.assembly.WeekPhase;
import org.jstats.fantasyhub_api.modules.league_hub.identity.ResolutionContext;
import org.jstats.fantasyhub_api.modules.league_hub.identity.RosterOwnership;
import org.jstats.fantasyhub_api.modules.league_hub.identity.TeamIdentityResolver;
import org.jstats.fantasyhub_api.modules.league_hub.model.LeagueOutcome;
import org.jstats.fantasyhub_api.modules.league_hub.model.LeagueRef;
import org.jstats.fantasyhub_api.modules.league_hub.model.RosterPlayer;
import org.jstats.fantasyhub_api.modules.league_hub.model.RosterSnapshot;
import org.jstats.fantasyhub_api.modules.league_hub.model.ScoringRuleSet;
import org.jstats.fantasyhub_api.modules.league_hub.model.StatLine;
import org.jstats.fantasyhub_api.modules.league_hub.model.TeamRecord;
import org.jstats.fantasyhub_api.modules.league_hub.model.UnifiedResult;
import org.jstats.fantasyhub_api.modules.league_hub.model.UserIdentity;
import org.jstats.fantasyhub_api.modules.league_hub.scoring.ScoringEngine;
import org.jstats.fantasyhub_api.modules.sleeper.client.SleeperClient;
import org.jstats.fantasyhub_api.modules.sleeper.client.SleeperPayload;
import org.jstats.fantasyhub_api.modules.sleeper.feed.PlayerDirectory;
import org.jstats.fantasyhub_api.modules.sleeper.feed.WeeklyStatFeed;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Sleeper leagues. Sleeper reports raw stats only, so every player is scored here with the league's
 * {@code scoring_settings}. A league configured as a guillotine league is ranked as an elimination pool
 * in any week without paired matchups.
 */
final class SleeperLeagueProvider implements LeagueProvider {

    private static final Logger log = LoggerFactory.getLogger(SleeperLeagueProvider.class);

    static final String AVATAR_URL = "https://sleepercdn.com/avatars/thumbs/";
    static final String EMPTY_SLOT = "0";

    private final LeagueRef league;
    private final UserIdentity identity;
    private final int week;
    private final int year;
    private final SleeperClient client;
    private final WeeklyStatFeed statFeed;
    private final PlayerDirectory players;
    private final TeamIdentityResolver resolver;
    private final ScoringEngine scoring;
    private final MatchupAssembler assembler;
    private final Clock clock;

    SleeperLeagueProvider(LeagueRef league, UserIdentity identity, int week, int year,
                          SleeperClient client, WeeklyStatFeed statFeed, PlayerDirectory players,
                          TeamIdentityResolver resolver, ScoringEngine scoring, MatchupAssembler assembler,
                          Clock clock) {
        this.league = league;
        this.identity = identity;
        this.week = week;
        this.year = year;
        this.client = client;
        this.statFeed = statFeed;
        this.players = players;
        this.resolver = resolver;
        this.scoring = scoring;
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
        var settings = client.fetchLeague(league.leagueId())
                .orElseThrow(() -> new LeagueFetchException(league, FailureKind.EMPTY_RESULT, "league not found"));
        var rosters = client.fetchRosters(league.leagueId());
        var users = client.fetchLeagueUsers(league.leagueId()).stream()
                .filter(u -> u.userId() != null)
                .collect(Collectors.toMap(SleeperPayload.LeagueUser::userId, Function.identity(), (a, b) -> a));

        var ruleSet = ruleSetOf(settings);

        var ownerships = rosters.stream()
                .map(r -> new RosterOwnership(String.valueOf(r.rosterId()), r.ownerId(), r.coOwners()))
                .toList();
        var myTeamId = resolver.resolve(new ResolutionContext(league, identity, ownerships))
                .orElseThrow(() -> new LeagueFetchException(league, FailureKind.IDENTITY, "no roster owned by the user"));

        var matchups = client.fetchMatchups(league.leagueId(), week);
        var stats = weekStats();
        var phase = WeekPhase.of(week, currentWeek());

        var byRosterId = matchups.stream()
                .collect(Collectors.toMap(SleeperPayload.MatchupEntry::rosterId, Function.identity(), (a, b) -> a));
        var scored = new SnapshotBuilder(settings, users, ruleSet, stats);

        boolean paired = matchups.stream().anyMatch(m -> m.matchupId() != null);
        LeagueOutcome outcome;
        if (!paired) {
            if (!isEliminationFormat(settings) || rosters.isEmpty()) {
                throw new LeagueFetchException(league, FailureKind.EMPTY_RESULT, league.isPlayoffWeek(week)
                        ? "no playoff matchups in week " + week
                        : "no paired matchups in week " + week);
            }
            if (log.isDebugEnabled()) {
                log.debug("League {} is an elimination league, ranking {} rosters for week {}", league.key(), rosters.size(), week);
            }
            var snapshots = rosters.stream()
                    .map(r -> scored.build(r, byRosterId.get(r.rosterId())))
                    .toList();
            outcome = assembler.rank(snapshots, week);
        } else {
            var rostersById = rosters.stream()
                    .collect(Collectors.toMap(SleeperPayload.Roster::rosterId, Function.identity(), (a, b) -> a));
            var entries = matchups.stream()
                    .map(m -> new PairingEntry(scored.build(rostersById.get(m.rosterId()), m), m.matchupId()))
                    .toList();
            var assembly = assembler.pair(entries, week, phase);
            if (assembly.isBye(myTeamId)) {
                throw new LeagueFetchException(league, FailureKind.EMPTY_RESULT, "user's roster is on a bye in week " + week);
            }
            outcome = assembly.matchupOf(myTeamId)
                    .map(m -> m.withByes(assembly.byes()))
                    .orElseThrow(() -> new LeagueFetchException(league, FailureKind.EMPTY_RESULT,
                            "no matchup for roster " + myTeamId + " in week " + week));
        }
        return new UnifiedResult(league, myTeamId, outcome, clock.instant());
    }

    private static boolean isEliminationFormat(SleeperPayload.League settings) {
        return settings.settings() != null && settings.settings().eliminationFormat();
    }

    private ScoringRuleSet ruleSetOf(SleeperPayload.League settings) {
        var weights = settings.scoringSettings();
        if (weights == null || weights.isEmpty()) {
            log.warn("League {} publishes no scoring settings, using default PPR weights", league.key());
            return scoring.defaultRules();
        }
        return new ScoringRuleSet(weights);
    }

    /** An unavailable stat feed degrades to the platform's own totals. */
    private Map<String, Map<String, Double>> weekStats() {
        try {
            return statFeed.statsFor(String.valueOf(year), week);
        } catch (RuntimeException ex) {
            log.warn("Stat feed unavailable for {} week {}, falling back to platform points: {}", year, week, ex.getMessage());
            return Map.of();
        }
    }

    /** Sleeper's {@code /state/nfl} week, shifted past the regular season during the playoffs. */
    private int currentWeek() {
        return client.fetchNflState()
                .filter(s -> s.week() != null)
                .map(s -> "post".equals(s.seasonType()) ? s.week() + 18 : s.week())
                .orElse(week);
    }

    private final class SnapshotBuilder {
        private final SleeperPayload.League settings;
        private final Map<String, SleeperPayload.LeagueUser> users;
        private final ScoringRuleSet ruleSet;
        private final Map<String, Map<String, Double>> stats;

        SnapshotBuilder(SleeperPayload.League settings, Map<String, SleeperPayload.LeagueUser> users,
                        ScoringRuleSet ruleSet, Map<String, Map<String, Double>> stats) {
            this.settings = settings;
            this.users = users;
            this.ruleSet = ruleSet;
            this.stats = stats;
        }

        /**
         * The week's entry wins over the season roster for lineup and platform points.
         */
        RosterSnapshot build(SleeperPayload.@Nullable Roster roster, SleeperPayload.@Nullable MatchupEntry entry) {
            int rosterId = roster != null ? roster.rosterId() : entry.rosterId();
            var starters = firstNonNull(entry != null ? entry.starters() : null, roster != null ? roster.starters() : null);
            var playerIds = firstNonNull(entry != null ? entry.players() : null, roster != null ? roster.players() : null);

            var platformPlayerPoints = entry != null && entry.playersPoints() != null
                    ? entry.playersPoints() : Map.<String, Double>of();
            var starterSet = new HashSet<>(starters);
            var lineup = new ArrayList<RosterPlayer>();
            for (int i = 0; i < starters.size(); i++) {
                var id = starters.get(i);
                if (!EMPTY_SLOT.equals(id)) {
                    lineup.add(player(id, true, slotLabel(i), platformPlayerPoints));
                }
            }
            for (String id : playerIds) {
                if (!starterSet.contains(id)) {
                    lineup.add(player(id, false, "BN", platformPlayerPoints));
                }
            }

            double score;
            if (!stats.isEmpty()) {
                score = scoring.scoreAll(lineup.stream().filter(RosterPlayer::starter).map(RosterPlayer::playerId).toList(),
                        this::statLine, ruleSet);
            } else {
                var platformPoints = entry != null ? entry.platformPoints() : null;
                score = platformPoints != null ? platformPoints : 0.0;
            }

            var owner = roster != null && roster.ownerId() != null ? users.get(roster.ownerId()) : null;
            return new RosterSnapshot(
                    String.valueOf(rosterId),
                    ownerName(owner, rosterId),
                    owner != null && owner.avatar() != null ? AVATAR_URL + owner.avatar() : null,
                    score,
                    null,
                    recordOf(roster),
                    lineup);
        }

        private RosterPlayer player(String id, boolean starter, String slot, Map<String, Double> platformPlayerPoints) {
            var meta = players.find(id);
            var position = meta != null && meta.position() != null ? meta.position() : "UNK";
            var team = meta != null && meta.team() != null ? meta.team() : "UNK";
            return new RosterPlayer(
                    id,
                    meta != null ? meta.espnId() : null,
                    id,
                    position,
                    team,
                    starter,
                    starter && "UNK".equals(slot) ? position : slot,
                    playerPoints(id, platformPlayerPoints));
        }

        /** Without a stat feed, Sleeper's own per-player totals stand in for the computed ones. */
        private double playerPoints(String id, Map<String, Double> platformPlayerPoints) {
            if (stats.isEmpty() && platformPlayerPoints.get(id) != null) {
                return platformPlayerPoints.get(id);
            }
            return scoring.score(statLine(id), ruleSet);
        }

        private StatLine statLine(String playerId) {
            var counts = stats.get(playerId);
            return counts == null ? StatLine.empty() : new StatLine(counts);
        }

        private String slotLabel(int index) {
            var positions = settings.rosterPositions();
            return positions != null && index < positions.size() ? positions.get(index) : "UNK";
        }
    }

    private static String ownerName(SleeperPayload.@Nullable LeagueUser owner, int rosterId) {
        if (owner != null) {
            if (owner.metadata() != null && owner.metadata().teamName() != null && !owner.metadata().teamName().isBlank()) {
                return owner.metadata().teamName();
            }
            if (owner.displayName() != null && !owner.displayName().isBlank()) {
                return owner.displayName();
            }
        }
        return "Team " + rosterId;
    }

    private static @Nullable TeamRecord recordOf(SleeperPayload.@Nullable Roster roster) {
        if (roster == null || roster.settings() == null || roster.settings().wins() == null) {
            return null;
        }
        var s = roster.settings();
        return new TeamRecord(s.wins(), s.losses() == null ? 0 : s.losses(), s.ties() == null ? 0 : s.ties());
    }

    private static List<String> firstNonNull(@Nullable List<String> preferred, @Nullable List<String> fallback) {
        if (preferred != null) return preferred;
        return fallback != null ? fallback : List.of();
    }
}
