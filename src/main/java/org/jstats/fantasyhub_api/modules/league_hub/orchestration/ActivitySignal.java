package org.jstats.fantasyhub_api.modules.league_hub.orchestration;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Whether anyone is currently looking at the results. Flipped from outside (the HTTP layer, startup
 * configuration); listeners hear about every change.
 */
@Component
public class ActivitySignal {

    private final AtomicBoolean active = new AtomicBoolean(false);
    private final List<Consumer<Boolean>> listeners = new CopyOnWriteArrayList<>();

    public boolean isActive() {
        return active.get();
    }

    public void activate() {
        if (active.compareAndSet(false, true)) {
            listeners.forEach(l -> l.accept(true));
        }
    }

    public void deactivate() {
        if (active.compareAndSet(true, false)) {
            listeners.forEach(l -> l.accept(false));
        }
    }

    public void onChange(Consumer<Boolean> listener) {
        listeners.add(listener);
    }
}
