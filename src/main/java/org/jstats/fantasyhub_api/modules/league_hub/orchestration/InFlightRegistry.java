package org.jstats.fantasyhub_api.modules.league_hub.orchestration;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Mutex-guarded set of keys currently being fetched. A key already present is refused, never queued.
 */
final class InFlightRegistry {

    private final Object lock = new Object();
    private final Set<FetchKey> inFlight = new HashSet<>();

    /** Held for the lifetime of one fetch; closing it releases the key. */
    final class Lease implements AutoCloseable {
        private final FetchKey key;
        private boolean released;

        private Lease(FetchKey key) {
            this.key = key;
        }

        @Override
        public void close() {
            synchronized (lock) {
                if (!released) {
                    released = true;
                    inFlight.remove(key);
                }
            }
        }
    }

    Optional<Lease> tryAcquire(FetchKey key) {
        synchronized (lock) {
            if (!inFlight.add(key)) {
                return Optional.empty();
            }
            return Optional.of(new Lease(key));
        }
    }
}
