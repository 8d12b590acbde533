package com.piratebomb.cache.core;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide cache split into named partitions, each backed by its own
 * {@link ExpiringMap} with a fixed TTL and capacity.
 *
 * <p>
 * Every operation is non-throwing: an unknown namespace, a full namespace or a
 * failing loader is logged and degrades to an absent, {@code false} or zero
 * result, so a cache problem costs the caller at most a trip to the system of
 * record. Counters are updated synchronously by the operation they describe.
 *
 * <p>
 * Lifecycle: construct, {@link #start()} to schedule expiry sweeps, and
 * {@link #shutdown()} once in-flight requests have drained.
 */
public class NamespacedCache {

    private static final Logger log = LoggerFactory.getLogger(NamespacedCache.class);

    public static final int DEFAULT_SWEEP_BATCH_SIZE = 1_000;
    private static final long SWEEPER_TERMINATION_TIMEOUT_MILLIS = 5_000;

    private final Map<String, NamespaceConfig> configs;
    private final Map<String, ExpiringMap<Object>> maps;
    private final Map<String, NamespaceStats> stats;
    private final Clock clock;

    private ScheduledExecutorService sweeper;
    private boolean started;
    private boolean shutdown;

    public NamespacedCache(Collection<NamespaceConfig> namespaces, Clock clock) {
        this(namespaces, clock, DEFAULT_SWEEP_BATCH_SIZE);
    }

    public NamespacedCache(Collection<NamespaceConfig> namespaces, Clock clock, int sweepBatchSize) {
        if (namespaces.isEmpty()) {
            throw new IllegalArgumentException("At least one namespace must be configured");
        }
        Map<String, NamespaceConfig> configs = new LinkedHashMap<>();
        Map<String, ExpiringMap<Object>> maps = new LinkedHashMap<>();
        Map<String, NamespaceStats> stats = new LinkedHashMap<>();
        for (NamespaceConfig config : namespaces) {
            if (configs.putIfAbsent(config.getName(), config) != null) {
                throw new IllegalArgumentException("Duplicate namespace: " + config.getName());
            }
            maps.put(config.getName(),
                new ExpiringMap<>(config.getName(), config.getDefaultTtl(), config.getMaxEntries(), clock, sweepBatchSize));
            stats.put(config.getName(), new NamespaceStats());
        }
        this.configs = Collections.unmodifiableMap(configs);
        this.maps = Collections.unmodifiableMap(maps);
        this.stats = Collections.unmodifiableMap(stats);
        this.clock = clock;
    }

    /**
     * Schedules one recurring expiry sweep per namespace on a single daemon thread.
     */
    public synchronized void start() {
        if (started || shutdown) {
            return;
        }
        sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cache-sweeper");
            t.setDaemon(true);
            return t;
        });
        configs.values().forEach(config ->
            maps.get(config.getName()).startSweeping(sweeper, config.getSweepInterval()));
        started = true;
        log.info("Cache started with namespaces {}", configs.keySet());
    }

    // --- Generic operations ---

    public Optional<Object> get(String namespace, String key) {
        try {
            ExpiringMap<Object> map = resolve(namespace);
            Optional<Object> value = map.get(key);
            if (value.isPresent()) {
                stats.get(namespace).recordHit();
            } else {
                stats.get(namespace).recordMiss();
            }
            return value;
        } catch (CacheException e) {
            logFailure(e);
            return Optional.empty();
        }
    }

    /**
     * Typed lookup. A value of another type is reported absent and counted as a miss.
     */
    public <T> Optional<T> get(String namespace, String key, Class<T> type) {
        try {
            ExpiringMap<Object> map = resolve(namespace);
            Optional<Object> value = map.get(key);
            if (value.isPresent() && type.isInstance(value.get())) {
                stats.get(namespace).recordHit();
                return Optional.of(type.cast(value.get()));
            }
            if (value.isPresent()) {
                log.warn("Cached value at {}:{} is {}, not {}", namespace, key,
                    value.get().getClass().getName(), type.getName());
            }
            stats.get(namespace).recordMiss();
            return Optional.empty();
        } catch (CacheException e) {
            logFailure(e);
            return Optional.empty();
        }
    }

    public boolean set(String namespace, String key, Object value) {
        return set(namespace, key, value, null);
    }

    /**
     * Stores {@code value} under {@code key}.
     *
     * @param ttl time-to-live, or {@code null} for the namespace default
     * @return {@code false} for an unknown namespace, a null value or TTL that cannot be
     *         stored, or a new key in a full namespace
     */
    public boolean set(String namespace, String key, Object value, Duration ttl) {
        try {
            ExpiringMap<Object> map = resolve(namespace);
            if (key == null || value == null) {
                log.warn("Refusing to cache null key or value in {}", namespace);
                return false;
            }
            if (!map.set(key, value, ttl)) {
                if (!map.isClosed()) {
                    throw new CacheException(CacheErrorKind.CAPACITY_EXCEEDED,
                        "Namespace " + namespace + " is full (" + map.getMaxEntries() + " entries), not caching " + key);
                }
                return false;
            }
            stats.get(namespace).recordSet();
            log.debug("Cache SET: {}:{}", namespace, key);
            return true;
        } catch (CacheException e) {
            logFailure(e);
            return false;
        } catch (IllegalArgumentException | ArithmeticException e) {
            log.warn("Cannot cache {}:{}: {}", namespace, key, e.getMessage());
            return false;
        }
    }

    /**
     * @return number of entries removed (0 or 1)
     */
    public int delete(String namespace, String key) {
        try {
            int removed = resolve(namespace).delete(key);
            if (removed > 0) {
                stats.get(namespace).recordDeletes(removed);
                log.debug("Cache DELETE: {}:{}", namespace, key);
            }
            return removed;
        } catch (CacheException e) {
            logFailure(e);
            return 0;
        }
    }

    // --- Invalidation ---

    /**
     * Deletes every key of the namespace that contains {@code substring}. This is
     * plain containment: unrelated keys sharing the substring are removed too, and an
     * empty substring matches every key.
     *
     * @return number of entries removed
     */
    public int invalidatePattern(String namespace, String substring) {
        try {
            ExpiringMap<Object> map = resolve(namespace);
            if (substring == null) {
                log.warn("Ignoring null invalidation pattern for {}", namespace);
                return 0;
            }
            int removed = 0;
            for (String key : map.keys()) {
                if (key.contains(substring)) {
                    removed += map.delete(key);
                }
            }
            if (removed > 0) {
                stats.get(namespace).recordDeletes(removed);
                log.info("Invalidated {} cache entries in {} matching pattern: {}", removed, namespace, substring);
            }
            return removed;
        } catch (CacheException e) {
            logFailure(e);
            return 0;
        }
    }

    /**
     * Empties one namespace.
     *
     * @return {@code false} if the namespace is unknown
     */
    public boolean invalidateNamespace(String namespace) {
        try {
            int removed = resolve(namespace).flushAll();
            stats.get(namespace).recordFlush();
            log.info("Cache FLUSH: {} ({} entries)", namespace, removed);
            return true;
        } catch (CacheException e) {
            logFailure(e);
            return false;
        }
    }

    // --- Compound operations ---

    /**
     * Atomically increments the counter stored under {@code key} in {@code namespace}
     * and restarts its TTL. Concurrent increments of the same key are never lost.
     *
     * @return the new count, or 0 if the counter could not be stored
     */
    public long increment(String namespace, String key, Duration ttl) {
        try {
            ExpiringMap<Object> map = resolve(namespace);
            if (key == null) {
                log.warn("Refusing to count a null key in {}", namespace);
                return 0;
            }
            NamespaceStats counters = stats.get(namespace);
            Optional<Object> stored = map.update(key, current -> {
                if (current.isPresent()) {
                    counters.recordHit();
                } else {
                    counters.recordMiss();
                }
                return current.filter(Number.class::isInstance)
                    .map(v -> ((Number) v).longValue() + 1)
                    .orElse(1L);
            }, ttl);
            if (stored.isEmpty()) {
                if (!map.isClosed()) {
                    throw new CacheException(CacheErrorKind.CAPACITY_EXCEEDED,
                        "Namespace " + namespace + " is full, not counting " + key);
                }
                return 0;
            }
            counters.recordSet();
            return (Long) stored.get();
        } catch (CacheException e) {
            logFailure(e);
            return 0;
        } catch (IllegalArgumentException | ArithmeticException e) {
            log.warn("Cannot increment {}:{}: {}", namespace, key, e.getMessage());
            return 0;
        }
    }

    /**
     * Rate-limit counter for {@code identifier} in the {@code rateLimits} namespace.
     *
     * @see #increment(String, String, Duration)
     */
    public long incrementRateLimit(String identifier, Duration ttl) {
        return increment(NamespaceConfig.RATE_LIMITS, CacheKeys.rateLimit(identifier), ttl);
    }

    /**
     * Populates {@code namespace} from {@code loader}. Entries with a null key or value
     * are skipped. If the loader fails, whatever was stored before the failure stays;
     * nothing is rolled back.
     *
     * @return number of entries stored
     */
    public int warmCache(String namespace, Callable<? extends Iterable<WarmEntry>> loader) {
        int loaded = 0;
        try {
            resolve(namespace);
            log.info("Warming cache: {}", namespace);
            Iterable<WarmEntry> entries = loader.call();
            if (entries != null) {
                for (WarmEntry entry : entries) {
                    if (entry != null && entry.getKey() != null && entry.getValue() != null
                        && set(namespace, entry.getKey(), entry.getValue())) {
                        loaded++;
                    }
                }
            }
            log.info("Cache warming completed for {}: {} entries", namespace, loaded);
        } catch (CacheException e) {
            logFailure(e);
        } catch (Exception e) {
            logFailure(new CacheException(CacheErrorKind.LOADER_FAILURE,
                "Cache warming failed for " + namespace + " after " + loaded + " entries", e));
        }
        return loaded;
    }

    // --- Statistics and maintenance ---

    public Map<String, NamespaceStats.Snapshot> getStats() {
        Map<String, NamespaceStats.Snapshot> result = new LinkedHashMap<>();
        maps.forEach((name, map) -> result.put(name, stats.get(name).snapshot(map.size())));
        return result;
    }

    public Map<String, MemoryUsage> getMemoryUsage() {
        Map<String, MemoryUsage> usage = new LinkedHashMap<>();
        maps.forEach((name, map) -> {
            Set<String> keys = map.keys();
            // length of the keys rendered as a JSON array of strings
            long size = 2 + Math.max(0, keys.size() - 1);
            for (String key : keys) {
                size += key.length() + 2;
            }
            usage.put(name, new MemoryUsage(keys.size(), size));
        });
        return usage;
    }

    public CacheHealth healthCheck() {
        return new CacheHealth("healthy", clock.instant().toString(), maps.size(), getStats(), getMemoryUsage());
    }

    /**
     * Runs an expiry sweep over every namespace immediately.
     *
     * @return total number of entries removed
     */
    public int sweepExpired() {
        int removed = 0;
        for (ExpiringMap<Object> map : maps.values()) {
            removed += map.sweepExpired();
        }
        return removed;
    }

    /**
     * Flushes every namespace, then zeroes all counters.
     */
    public void cleanup() {
        maps.forEach((name, map) -> {
            map.flushAll();
            stats.get(name).recordFlush();
        });
        resetStats();
        log.info("Cache cleanup completed");
    }

    public void resetStats() {
        stats.values().forEach(NamespaceStats::reset);
    }

    /**
     * Stops the expiry sweeps, waits for a running sweep to finish and releases every
     * namespace. Idempotent.
     */
    public synchronized void shutdown() {
        if (shutdown) {
            return;
        }
        maps.values().forEach(ExpiringMap::stopSweeping);
        if (sweeper != null) {
            awaitTermination(sweeper);
            sweeper = null;
        }
        maps.values().forEach(ExpiringMap::close);
        shutdown = true;
        log.info("Cache manager shutdown completed");
    }

    private static void awaitTermination(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SWEEPER_TERMINATION_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)) {
                log.warn("Expiry sweeper did not stop within {} ms", SWEEPER_TERMINATION_TIMEOUT_MILLIS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public synchronized boolean isShutdown() {
        return shutdown;
    }

    public Set<String> namespaces() {
        return configs.keySet();
    }

    public Optional<NamespaceConfig> config(String namespace) {
        return Optional.ofNullable(configs.get(namespace));
    }

    private ExpiringMap<Object> resolve(String namespace) {
        ExpiringMap<Object> map = namespace == null ? null : maps.get(namespace);
        if (map == null) {
            throw new CacheException(CacheErrorKind.INVALID_NAMESPACE, "Invalid cache namespace: " + namespace);
        }
        return map;
    }

    private static void logFailure(CacheException e) {
        if (e.getKind() == CacheErrorKind.LOADER_FAILURE) {
            log.error("{} [{}]", e.getMessage(), e.getKind(), e.getCause());
        } else {
            log.warn("{} [{}]", e.getMessage(), e.getKind());
        }
    }
}
