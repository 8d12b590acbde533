package com.piratebomb.cache.core;

import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Hit/miss/set/delete/flush counters of one namespace. Counters only grow until
 * {@link #reset()}.
 */
public class NamespaceStats {

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong sets = new AtomicLong();
    private final AtomicLong deletes = new AtomicLong();
    private final AtomicLong flushes = new AtomicLong();

    void recordHit() {
        hits.incrementAndGet();
    }

    void recordMiss() {
        misses.incrementAndGet();
    }

    void recordSet() {
        sets.incrementAndGet();
    }

    void recordDeletes(long count) {
        deletes.addAndGet(count);
    }

    void recordFlush() {
        flushes.incrementAndGet();
    }

    void reset() {
        hits.set(0);
        misses.set(0);
        sets.set(0);
        deletes.set(0);
        flushes.set(0);
    }

    public Snapshot snapshot(int keyCount) {
        return new Snapshot(keyCount, hits.get(), misses.get(), sets.get(), deletes.get(), flushes.get());
    }

    /**
     * Formats {@code hits / (hits + misses)} as a percentage with two decimals,
     * or {@code "0%"} before any lookup.
     */
    static String formatHitRate(long hits, long misses) {
        long lookups = hits + misses;
        if (lookups == 0) {
            return "0%";
        }
        return String.format(Locale.ROOT, "%.2f%%", hits * 100.0 / lookups);
    }

    public static class Snapshot {
        private final int keyCount;
        private final long hits;
        private final long misses;
        private final long sets;
        private final long deletes;
        private final long flushes;
        private final String hitRate;

        Snapshot(int keyCount, long hits, long misses, long sets, long deletes, long flushes) {
            this.keyCount = keyCount;
            this.hits = hits;
            this.misses = misses;
            this.sets = sets;
            this.deletes = deletes;
            this.flushes = flushes;
            this.hitRate = formatHitRate(hits, misses);
        }

        public int getKeyCount() {
            return keyCount;
        }

        public long getHits() {
            return hits;
        }

        public long getMisses() {
            return misses;
        }

        public long getSets() {
            return sets;
        }

        public long getDeletes() {
            return deletes;
        }

        public long getFlushes() {
            return flushes;
        }

        public String getHitRate() {
            return hitRate;
        }
    }
}
