package org.jstats.fantasyhub_api.modules.league_hub.orchestration;

import org.jspecify.annotations.Nullable;
import org.jstats.fantasyhub_api.modules.league_hub.config.AggregationProperties;
import org.jstats.fantasyhub_api.modules.league_hub.directory.LeagueDirectory;
import org.jstats.fantasyhub_api.modules.league_hub.model.LeagueRef;
import org.jstats.fantasyhub_api.modules.league_hub.model.UnifiedResult;
import org.jstats.fantasyhub_api.modules.league_hub.model.UserIdentity;
import org.jstats.fantasyhub_api.modules.league_hub.provider.FailureKind;
import org.jstats.fantasyhub_api.modules.league_hub.provider.LeagueFetchException;
import org.jstats.fantasyhub_api.modules.league_hub.provider.LeagueProviderFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;

/**
 * Runs one provider per league on a bounded pool and merges the results into one priority-ordered list.
 * <p>
 * A full load clears the visible list, tracks per-league state and progress, and appends results as they
 * complete. A background refresh does the same fetches silently and merges them in at the end; leagues
 * that fail during a refresh keep their previous result. Whichever commit lands, each league shows the
 * result whose fetch finished last. The same (league, week, year) is never fetched twice at once.
 */
@Service
public class AggregationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(AggregationOrchestrator.class);

    // List.sort is stable, so equal priorities keep insertion order
    private static final Comparator<UnifiedResult> BY_PRIORITY =
            Comparator.comparingInt(UnifiedResult::priority).reversed();

    private record WeekTarget(int week, int year) {}

    private final LeagueDirectory directory;
    private final LeagueProviderFactory providers;
    private final UserIdentity identity;
    private final Executor executor;
    private final Executor coordinator;
    private final ApplicationEventPublisher events;
    private final Clock clock;
    private final Duration joinTimeout;

    private final InFlightRegistry inFlight = new InFlightRegistry();
    private final AtomicBoolean loading = new AtomicBoolean(false);
    private final AtomicInteger loaded = new AtomicInteger();
    private final AtomicInteger total = new AtomicInteger();
    private final ConcurrentMap<String, LeagueLoadingState> loadingStates = new ConcurrentHashMap<>();

    /** A fetched result and the order in which its fetch finished. */
    private record Arrival(UnifiedResult result, long seq) {}

    private final AtomicLong arrivals = new AtomicLong();

    private final Object resultsLock = new Object();
    private final Map<String, Arrival> visible = new LinkedHashMap<>(); // guarded by resultsLock
    private List<UnifiedResult> results = List.of(); // guarded by resultsLock, snapshot of visible
    private long generation; // guarded by resultsLock, bumped by every full load

    private volatile List<LeagueRef> knownLeagues = List.of();
    private volatile @Nullable WeekTarget lastTarget;
    private volatile @Nullable Instant lastUpdated;
    private volatile boolean noLeaguesFound;

    public AggregationOrchestrator(LeagueDirectory directory,
                                   LeagueProviderFactory providers,
                                   UserIdentity identity,
                                   @Qualifier("leagueFetchExecutor") Executor executor,
                                   @Qualifier("aggregationCoordinator") Executor coordinator,
                                   ApplicationEventPublisher events,
                                   Clock clock,
                                   AggregationProperties properties) {
        this.directory = directory;
        this.providers = providers;
        this.identity = identity;
        this.executor = executor;
        this.coordinator = coordinator;
        this.events = events;
        this.clock = clock;
        this.joinTimeout = properties.joinTimeout();
    }

    // ---------- full load ----------

    /**
     * Blocking full load of every league the directory lists. Rejected while another full load runs.
     */
    public LoadReport loadAll(int week, int year) {
        if (!loading.compareAndSet(false, true)) {
            log.info("Full load already running, request for week {} of {} rejected", week, year);
            return LoadReport.rejected();
        }
        try {
            return runFullLoad(directory.leaguesFor(identity, year), week, year);
        } finally {
            loading.set(false);
        }
    }

    /**
     * Blocking full load of the given leagues. Rejected while another full load runs.
     */
    public LoadReport loadAll(List<LeagueRef> leagues, int week, int year) {
        if (!loading.compareAndSet(false, true)) {
            log.info("Full load already running, request for {} leagues rejected", leagues.size());
            return LoadReport.rejected();
        }
        try {
            return runFullLoad(leagues, week, year);
        } finally {
            loading.set(false);
        }
    }

    /**
     * Starts a full load on the coordinator thread.
     *
     * @return false when a full load is already running
     */
    public boolean startLoad(int week, int year) {
        if (!loading.compareAndSet(false, true)) {
            return false;
        }
        try {
            coordinator.execute(() -> {
                try {
                    runFullLoad(directory.leaguesFor(identity, year), week, year);
                } catch (RuntimeException ex) {
                    log.error("Full load for week {} of {} aborted", week, year, ex);
                } finally {
                    loading.set(false);
                }
            });
        } catch (RejectedExecutionException ex) {
            loading.set(false);
            throw ex;
        }
        return true;
    }

    private LoadReport runFullLoad(List<LeagueRef> leagues, int week, int year) {
        lastTarget = new WeekTarget(week, year);
        knownLeagues = List.copyOf(leagues);

        long gen;
        synchronized (resultsLock) {
            gen = ++generation;
            visible.clear();
            results = List.of();
        }
        loadingStates.clear();
        leagues.forEach(l -> loadingStates.put(l.key(), LeagueLoadingState.pending(l)));
        total.set(leagues.size());
        loaded.set(0);
        log.info("Loading {} leagues for week {} of {}", leagues.size(), week, year);

        var cycle = new Cycle(gen);
        var report = runCycle(leagues, week, year, cycle);

        var arrived = cycle.close();
        List<UnifiedResult> committed;
        synchronized (resultsLock) {
            committed = mergeNewest(arrived, true);
        }
        lastUpdated = clock.instant();
        noLeaguesFound = committed.isEmpty();
        loaded.set(total.get());
        events.publishEvent(new LeagueResultsUpdatedEvent(this, committed, false));

        log.info("Loaded week {} of {}: total={}, succeeded={}, failed={}, skipped={}",
                week, year, report.total(), report.succeeded(), report.failed(), report.skipped());
        if (noLeaguesFound) {
            log.info("No leagues found for week {} of {}", week, year);
        }
        return report;
    }

    // ---------- background refresh ----------

    /**
     * Re-fetches the given leagues without touching the loading flag, states or progress.
     * The visible list is updated once, after every fetch has finished. A full load that started in
     * the meantime wins and the refresh is discarded; one that was already running keeps the refreshed
     * results unless it fetched the same league again afterwards.
     */
    public LoadReport refreshInBackground(List<LeagueRef> leagues, int week, int year) {
        long gen;
        synchronized (resultsLock) {
            gen = generation;
        }

        var cycle = new Cycle(null);
        var report = runCycle(leagues, week, year, cycle);

        var fresh = cycle.close();
        List<UnifiedResult> merged;
        synchronized (resultsLock) {
            if (generation != gen) {
                log.debug("Refresh of week {} discarded, a full load replaced the list", week);
                return report;
            }
            merged = mergeNewest(fresh, true);
        }
        lastUpdated = clock.instant();
        events.publishEvent(new LeagueResultsUpdatedEvent(this, merged, true));

        if (log.isDebugEnabled()) {
            log.debug("Refreshed week {} of {}: succeeded={}, failed={}, skipped={}",
                    week, year, report.succeeded(), report.failed(), report.skipped());
        }
        return report;
    }

    /** Refreshes the leagues of the last full load. */
    public LoadReport refreshInBackground(int week, int year) {
        return refreshInBackground(knownLeagues, week, year);
    }

    /** Refreshes the week of the last full load, if there was one. */
    public Optional<LoadReport> refreshLastTarget() {
        var target = lastTarget;
        if (target == null) {
            return Optional.empty();
        }
        return Optional.of(refreshInBackground(knownLeagues, target.week(), target.year()));
    }

    /** Queues a background refresh on the coordinator thread. */
    public void startRefresh(int week, int year) {
        coordinator.execute(() -> {
            try {
                refreshInBackground(week, year);
            } catch (RuntimeException ex) {
                log.error("Background refresh for week {} of {} aborted", week, year, ex);
            }
        });
    }

    /**
     * Folds arrivals into the visible list, keeping for each league the one that finished last.
     * Caller holds {@code resultsLock}.
     */
    private List<UnifiedResult> mergeNewest(Collection<Arrival> incoming, boolean reorder) {
        for (Arrival arrival : incoming) {
            visible.merge(arrival.result().league().key(), arrival,
                    (held, offered) -> offered.seq() > held.seq() ? offered : held);
        }
        var next = new ArrayList<UnifiedResult>(visible.size());
        visible.values().forEach(a -> next.add(a.result()));
        if (reorder) {
            next.sort(BY_PRIORITY);
        }
        results = List.copyOf(next);
        return results;
    }

    // ---------- shared fetch cycle ----------

    private LoadReport runCycle(List<LeagueRef> leagues, int week, int year, Cycle cycle) {
        var futures = new LinkedHashMap<LeagueRef, CompletableFuture<Void>>();
        int skipped = 0;
        for (LeagueRef league : leagues) {
            var lease = inFlight.tryAcquire(FetchKey.of(league, week, year));
            if (lease.isEmpty()) {
                skipped++;
                if (log.isDebugEnabled()) {
                    log.debug("League {} week {} already in flight, skipped", league.key(), week);
                }
                if (cycle.tracksState()) {
                    updateState(league, LeagueLoadingState::skipped);
                    loaded.incrementAndGet();
                }
                continue;
            }
            futures.put(league, submit(league, week, year, lease.get(), cycle));
        }

        int timedOut = 0;
        if (!awaitAll(futures.values())) {
            for (var entry : futures.entrySet()) {
                if (!entry.getValue().isDone()) {
                    timedOut++;
                    log.warn("League {} did not finish within {}s, marked failed", entry.getKey().key(), joinTimeout.toSeconds());
                    if (cycle.tracksState()) {
                        updateState(entry.getKey(), s -> s.failed(FailureKind.NETWORK, "timed out"));
                    }
                }
            }
        }
        cycle.closeTracking();
        return new LoadReport(true, leagues.size(), cycle.succeeded.get(), cycle.failed.get() + timedOut, skipped);
    }

    private CompletableFuture<Void> submit(LeagueRef league, int week, int year, InFlightRegistry.Lease lease, Cycle cycle) {
        try {
            return CompletableFuture.runAsync(() -> fetchOne(league, week, year, lease, cycle), executor);
        } catch (RejectedExecutionException ex) {
            lease.close();
            log.warn("League {} rejected by the fetch pool: {}", league.key(), ex.getMessage());
            cycle.failed.incrementAndGet();
            if (cycle.tracksState()) {
                updateState(league, s -> s.failed(FailureKind.NETWORK, "fetch pool saturated"));
                loaded.incrementAndGet();
            }
            return CompletableFuture.completedFuture(null);
        }
    }

    private void fetchOne(LeagueRef league, int week, int year, InFlightRegistry.Lease lease, Cycle cycle) {
        try (lease) {
            if (cycle.tracksState()) {
                updateState(league, LeagueLoadingState::loading);
            }
            var result = providers.create(league, identity, week, year).fetch();
            if (cycle.offer(result) && cycle.tracksState()) {
                updateState(league, LeagueLoadingState::completed);
            }
        } catch (LeagueFetchException ex) {
            log.warn("League {} failed ({}): {}", league.key(), ex.kind(), ex.getMessage());
            cycle.failed.incrementAndGet();
            if (cycle.tracksState()) {
                updateState(league, s -> s.failed(ex.kind(), ex.getMessage()));
            }
        } catch (RuntimeException ex) {
            log.error("League {} failed unexpectedly", league.key(), ex);
            cycle.failed.incrementAndGet();
            if (cycle.tracksState()) {
                updateState(league, s -> s.failed(FailureKind.NETWORK, String.valueOf(ex.getMessage())));
            }
        } finally {
            if (cycle.tracksState()) {
                loaded.incrementAndGet();
            }
        }
    }

    private boolean awaitAll(Collection<CompletableFuture<Void>> futures) {
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                    .get(joinTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException ex) {
            return false;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for league fetches");
            return false;
        } catch (ExecutionException ex) {
            log.error("League fetch task failed", ex.getCause());
            return true;
        }
    }

    private void updateState(LeagueRef league, UnaryOperator<LeagueLoadingState> change) {
        loadingStates.compute(league.key(), (k, current) ->
                change.apply(current != null ? current : LeagueLoadingState.pending(league)));
    }

    /**
     * Results gathered by one load or refresh. A full load carries its generation and appends each
     * arrival to the visible list; a refresh carries none and only collects.
     */
    private final class Cycle {
        private final @Nullable Long generation;
        private final List<Arrival> arrived = new ArrayList<>();
        private final AtomicInteger succeeded = new AtomicInteger();
        private final AtomicInteger failed = new AtomicInteger();
        private boolean closed; // guarded by this
        private volatile boolean tracking;

        Cycle(@Nullable Long generation) {
            this.generation = generation;
            this.tracking = generation != null;
        }

        /** Full loads report per-league state and progress until the join barrier passes. */
        boolean tracksState() {
            return tracking;
        }

        void closeTracking() {
            tracking = false;
        }

        synchronized boolean offer(UnifiedResult result) {
            if (closed) {
                return false;
            }
            var arrival = new Arrival(result, arrivals.incrementAndGet());
            arrived.add(arrival);
            succeeded.incrementAndGet();
            if (generation != null) {
                synchronized (resultsLock) {
                    if (AggregationOrchestrator.this.generation == generation) {
                        mergeNewest(List.of(arrival), false);
                    }
                }
            }
            return true;
        }

        synchronized List<Arrival> close() {
            closed = true;
            return new ArrayList<>(arrived);
        }
    }

    // ---------- queries ----------

    public List<UnifiedResult> currentResults() {
        synchronized (resultsLock) {
            return results;
        }
    }

    public Map<String, LeagueLoadingState> loadingStates() {
        return Collections.unmodifiableMap(new TreeMap<>(loadingStates));
    }

    public LoadProgress progress() {
        return new LoadProgress(Math.min(loaded.get(), total.get()), total.get());
    }

    public boolean isLoading() {
        return loading.get();
    }

    public Optional<Instant> lastUpdated() {
        return Optional.ofNullable(lastUpdated);
    }

    public boolean noLeaguesFound() {
        return noLeaguesFound;
    }
}
