package org.jstats.fantasyhub_api.modules.sleeper.feed;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Keyed cache where concurrent callers for the same key share a single upstream call.
 * Entries expire after {@code ttl}; an entry still in flight never expires. Failures are not cached.
 */
final class SharedFetchCache<K, V> {

    private record Entry<V>(CompletableFuture<V> future, Instant createdAt) {
        boolean usableAt(Instant now, Duration ttl) {
            return !future.isDone() || createdAt.plus(ttl).isAfter(now);
        }
    }

    private final ConcurrentMap<K, Entry<V>> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;

    SharedFetchCache(Clock clock, Duration ttl) {
        this.clock = clock;
        this.ttl = ttl;
    }

    V get(K key, Supplier<V> loader) {
        var now = clock.instant();
        var mine = new CompletableFuture<V>();
        var entry = entries.compute(key, (k, existing) ->
                existing != null && existing.usableAt(now, ttl) ? existing : new Entry<>(mine, now));

        if (entry.future() == mine) {
            try {
                mine.complete(loader.get());
            } catch (RuntimeException ex) {
                entries.remove(key, entry);
                mine.completeExceptionally(ex);
            }
        }

        try {
            return entry.future().join();
        } catch (CompletionException ce) {
            if (ce.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw ce;
        }
    }
}
