package com.piratebomb.cache.core;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * TTL and capacity policy of one cache namespace. Fixed once the cache is built.
 */
public class NamespaceConfig {

    public static final String PLAYERS = "players";
    public static final String LEADERBOARDS = "leaderboards";
    public static final String STATISTICS = "statistics";
    public static final String ACHIEVEMENTS = "achievements";
    public static final String SESSIONS = "sessions";
    public static final String API_RESPONSES = "apiResponses";
    public static final String BLOCKCHAIN_DATA = "blockchainData";
    public static final String RATE_LIMITS = "rateLimits";

    private final String name;
    private final Duration defaultTtl;
    private final int maxEntries;
    private final Duration sweepInterval;

    public NamespaceConfig(String name, Duration defaultTtl, int maxEntries, Duration sweepInterval) {
        this.name = Objects.requireNonNull(name, "name");
        this.defaultTtl = Objects.requireNonNull(defaultTtl, "defaultTtl");
        this.sweepInterval = Objects.requireNonNull(sweepInterval, "sweepInterval");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Namespace name must not be blank");
        }
        if (defaultTtl.isNegative() || defaultTtl.isZero()) {
            throw new IllegalArgumentException("Default TTL must be positive for namespace " + name + ", got: " + defaultTtl);
        }
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive for namespace " + name + ", got: " + maxEntries);
        }
        if (sweepInterval.isNegative() || sweepInterval.isZero()) {
            throw new IllegalArgumentException("Sweep interval must be positive for namespace " + name + ", got: " + sweepInterval);
        }
        this.maxEntries = maxEntries;
    }

    public static NamespaceConfig of(String name, long ttlSeconds, int maxEntries, long sweepSeconds) {
        return new NamespaceConfig(name, Duration.ofSeconds(ttlSeconds), maxEntries, Duration.ofSeconds(sweepSeconds));
    }

    /**
     * The eight namespaces the game backend relies on, with their production TTLs,
     * capacity bounds and sweep periods.
     */
    public static List<NamespaceConfig> defaults() {
        return List.of(
            of(PLAYERS, 300, 10_000, 60),
            of(LEADERBOARDS, 600, 100, 120),
            of(STATISTICS, 900, 200, 180),
            of(ACHIEVEMENTS, 1800, 1_000, 300),
            of(SESSIONS, 180, 5_000, 30),
            of(API_RESPONSES, 120, 2_000, 30),
            of(BLOCKCHAIN_DATA, 1200, 500, 240),
            of(RATE_LIMITS, 3600, 50_000, 600)
        );
    }

    public String getName() {
        return name;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public Duration getSweepInterval() {
        return sweepInterval;
    }

    @Override
    public String toString() {
        return "NamespaceConfig{name=" + name + ", defaultTtl=" + defaultTtl
            + ", maxEntries=" + maxEntries + ", sweepInterval=" + sweepInterval + "}";
    }
}
