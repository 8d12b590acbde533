package com.piratebomb.cache.core;

import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded string-keyed map whose entries carry an absolute expiry time.
 *
 * <p>
 * Expired entries are removed lazily on lookup and actively by a periodic sweep.
 * Inserting a new key into a full map is rejected rather than evicting anything;
 * replacing an existing key always succeeds.
 *
 * <p>
 * All mutations go through {@link ConcurrentHashMap} per-key operations, so
 * operations on different keys never share a lock and operations on the same key
 * are linearizable. Null values are not storable.
 *
 * @param <V> the value type
 */
public class ExpiringMap<V> {

    private static final Logger log = LoggerFactory.getLogger(ExpiringMap.class);

    private final ConcurrentHashMap<String, CacheEntry<V>> store = new ConcurrentHashMap<>();
    private final AtomicInteger size = new AtomicInteger();
    private final String name;
    private final long defaultTtlMillis;
    private final int maxEntries;
    private final Clock clock;
    private final int sweepBatchSize;

    private volatile ScheduledFuture<?> sweepTask;
    private volatile boolean closed;

    public ExpiringMap(String name, Duration defaultTtl, int maxEntries, Clock clock, int sweepBatchSize) {
        if (sweepBatchSize <= 0) {
            throw new IllegalArgumentException("sweepBatchSize must be positive, got: " + sweepBatchSize);
        }
        this.name = Objects.requireNonNull(name, "name");
        this.defaultTtlMillis = toMillisSaturated(defaultTtl);
        this.maxEntries = maxEntries;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sweepBatchSize = sweepBatchSize;
    }

    /**
     * Inserts or replaces an entry.
     *
     * @param ttl time-to-live, or {@code null} for the map's default
     * @return {@code false} if the key is new and the map is already full, or the map is closed
     */
    public boolean set(String key, V value, Duration ttl) {
        Objects.requireNonNull(value, "value");
        if (closed) {
            return false;
        }
        return compute(key, previous -> value, expiryTime(ttl)).isPresent();
    }

    /**
     * Atomically replaces the value for {@code key} with {@code remapping.apply(current)},
     * where an expired entry is presented as absent. The new entry expires after {@code ttl}.
     *
     * @return the stored value, or empty if the key was new and the map is full
     */
    public Optional<V> update(String key, Function<Optional<V>, V> remapping, Duration ttl) {
        if (closed) {
            return Optional.empty();
        }
        return compute(key, remapping, expiryTime(ttl));
    }

    private Optional<V> compute(String key, Function<Optional<V>, V> remapping, long expiryTime) {
        Objects.requireNonNull(key, "key");
        long now = clock.millis();
        CacheEntry<V> entry = store.compute(key, (k, existing) -> {
            if (existing == null && size.incrementAndGet() > maxEntries) {
                size.decrementAndGet();
                return null;
            }
            Optional<V> current = existing == null || existing.isExpired(now)
                ? Optional.empty()
                : Optional.of(existing.value);
            V next;
            try {
                next = Objects.requireNonNull(remapping.apply(current), "remapped value");
            } catch (RuntimeException e) {
                if (existing == null) {
                    size.decrementAndGet();
                }
                throw e;
            }
            return new CacheEntry<>(next, expiryTime);
        });
        return Optional.ofNullable(entry).map(e -> e.value);
    }

    /**
     * Looks up a live entry. An entry found expired is removed on the way out.
     */
    public Optional<V> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        CacheEntry<V> entry = store.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.millis())) {
            if (store.remove(key, entry)) {
                size.decrementAndGet();
                log.debug("Cache EXPIRED: {}:{}", name, key);
            }
            return Optional.empty();
        }
        return Optional.of(entry.value);
    }

    /**
     * @return 1 if an entry was removed, otherwise 0
     */
    public int delete(String key) {
        if (key != null && store.remove(key) != null) {
            size.decrementAndGet();
            return 1;
        }
        return 0;
    }

    /**
     * Snapshot of the keys of live entries.
     */
    public Set<String> keys() {
        long now = clock.millis();
        Set<String> keys = new HashSet<>();
        for (Map.Entry<String, CacheEntry<V>> e : store.entrySet()) {
            if (!e.getValue().isExpired(now)) {
                keys.add(e.getKey());
            }
        }
        return keys;
    }

    /**
     * Removes every entry.
     *
     * @return number of entries removed
     */
    public int flushAll() {
        int removed = 0;
        for (String key : store.keySet()) {
            if (store.remove(key) != null) {
                size.decrementAndGet();
                removed++;
            }
        }
        return removed;
    }

    /**
     * Removes all entries whose expiry time has passed. Walks the map without a
     * global lock and yields between batches of {@code sweepBatchSize} entries.
     *
     * @return number of entries removed
     */
    public int sweepExpired() {
        long now = clock.millis();
        int removed = 0;
        int scanned = 0;
        for (Map.Entry<String, CacheEntry<V>> e : store.entrySet()) {
            CacheEntry<V> entry = e.getValue();
            if (entry.isExpired(now) && store.remove(e.getKey(), entry)) {
                size.decrementAndGet();
                removed++;
            }
            if (++scanned % sweepBatchSize == 0) {
                Thread.yield();
            }
        }
        if (removed > 0) {
            log.debug("Swept {} expired entries from {}", removed, name);
        }
        return removed;
    }

    /**
     * Schedules the periodic sweep on {@code scheduler}. Calling it again is a no-op.
     */
    public synchronized void startSweeping(ScheduledExecutorService scheduler, Duration interval) {
        if (sweepTask != null || closed) {
            return;
        }
        long periodMillis = interval.toMillis();
        sweepTask = scheduler.scheduleWithFixedDelay(this::sweepSafely, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
    }

    public synchronized void stopSweeping() {
        if (sweepTask != null) {
            sweepTask.cancel(false);
            sweepTask = null;
        }
    }

    /**
     * Stops sweeping and releases every entry. Safe to call more than once.
     */
    public synchronized void close() {
        stopSweeping();
        closed = true;
        flushAll();
    }

    private void sweepSafely() {
        try {
            sweepExpired();
        } catch (RuntimeException e) {
            // an exception would cancel the scheduled task for good
            log.error("Expiry sweep failed for {}", name, e);
        }
    }

    /**
     * Absolute expiry for an entry written now. Saturates at {@link Long#MAX_VALUE},
     * so a TTL too large to represent means the entry never expires.
     */
    private long expiryTime(Duration ttl) {
        long ttlMillis;
        if (ttl == null) {
            ttlMillis = defaultTtlMillis;
        } else if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive, got: " + ttl);
        } else {
            ttlMillis = toMillisSaturated(ttl);
        }
        long now = clock.millis();
        return ttlMillis > Long.MAX_VALUE - now ? Long.MAX_VALUE : now + ttlMillis;
    }

    private static long toMillisSaturated(Duration duration) {
        try {
            return duration.toMillis();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    public String getName() {
        return name;
    }

    public int size() {
        return size.get();
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public boolean isClosed() {
        return closed;
    }

    boolean isSweeping() {
        return sweepTask != null;
    }
}
