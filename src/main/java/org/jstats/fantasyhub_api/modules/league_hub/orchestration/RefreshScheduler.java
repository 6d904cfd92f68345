package org.jstats.fantasyhub_api.modules.league_hub.orchestration;

import org.jspecify.annotations.Nullable;
import org.jstats.fantasyhub_api.modules.league_hub.config.AggregationProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodic background refresh while the activity signal is on. The running {@link ScheduledFuture}
 * is the cancellation token: starting twice is a no-op, stopping cancels it.
 */
@Component
public class RefreshScheduler implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(RefreshScheduler.class);

    private final ScheduledExecutorService ticker = Executors.newSingleThreadScheduledExecutor(r -> {
        var t = new Thread(r, "league-refresh-ticker");
        t.setDaemon(true);
        return t;
    });
    private final AggregationOrchestrator orchestrator;
    private final ActivitySignal signal;
    private final Duration interval;
    private final boolean autoRefresh;

    private @Nullable ScheduledFuture<?> token; // guarded by this

    public RefreshScheduler(AggregationOrchestrator orchestrator, ActivitySignal signal, AggregationProperties properties) {
        this.orchestrator = orchestrator;
        this.signal = signal;
        this.interval = properties.refreshInterval();
        this.autoRefresh = properties.autoRefresh();
        signal.onChange(active -> {
            if (active) {
                start();
            } else {
                stop();
            }
        });
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (autoRefresh) {
            log.info("Auto refresh on, every {}s", interval.toSeconds());
            signal.activate();
        }
    }

    public synchronized void start() {
        if (token != null && !token.isDone()) {
            return;
        }
        long millis = interval.toMillis();
        token = ticker.scheduleAtFixedRate(this::tick, millis, millis, TimeUnit.MILLISECONDS);
        log.debug("Refresh ticker started");
    }

    public synchronized void stop() {
        if (token != null) {
            token.cancel(false);
            token = null;
            log.debug("Refresh ticker stopped");
        }
    }

    public synchronized boolean isRunning() {
        return token != null && !token.isDone();
    }

    /**
     * One tick: refresh only when someone is watching and no full load is running.
     */
    void tick() {
        if (!signal.isActive() || orchestrator.isLoading()) {
            return;
        }
        try {
            orchestrator.refreshLastTarget();
        } catch (RuntimeException ex) {
            // a failing tick must not cancel the schedule
            log.error("Background refresh tick failed", ex);
        }
    }

    @Override
    public void destroy() {
        stop();
        ticker.shutdownNow();
    }
}
