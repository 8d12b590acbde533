package com.piratebomb.cache.core;

import java.util.Map;

/**
 * Liveness report of the cache object. {@code status} is "healthy" whenever the
 * namespaces could be enumerated; no get/set round-trip is probed.
 */
public class CacheHealth {
    private final String status;
    private final String timestamp;
    private final int namespaceCount;
    private final Map<String, NamespaceStats.Snapshot> stats;
    private final Map<String, MemoryUsage> memoryEstimate;

    public CacheHealth(String status, String timestamp, int namespaceCount,
                       Map<String, NamespaceStats.Snapshot> stats, Map<String, MemoryUsage> memoryEstimate) {
        this.status = status;
        this.timestamp = timestamp;
        this.namespaceCount = namespaceCount;
        this.stats = stats;
        this.memoryEstimate = memoryEstimate;
    }

    public String getStatus() {
        return status;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public int getNamespaceCount() {
        return namespaceCount;
    }

    public Map<String, NamespaceStats.Snapshot> getStats() {
        return stats;
    }

    public Map<String, MemoryUsage> getMemoryEstimate() {
        return memoryEstimate;
    }
}
