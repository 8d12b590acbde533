package com.piratebomb.cache.core;

import static com.piratebomb.cache.core.NamespaceConfig.ACHIEVEMENTS;
import static com.piratebomb.cache.core.NamespaceConfig.API_RESPONSES;
import static com.piratebomb.cache.core.NamespaceConfig.BLOCKCHAIN_DATA;
import static com.piratebomb.cache.core.NamespaceConfig.LEADERBOARDS;
import static com.piratebomb.cache.core.NamespaceConfig.PLAYERS;
import static com.piratebomb.cache.core.NamespaceConfig.RATE_LIMITS;
import static com.piratebomb.cache.core.NamespaceConfig.SESSIONS;
import static com.piratebomb.cache.core.NamespaceConfig.STATISTICS;

import java.time.Duration;
import java.util.Optional;

/**
 * Game-shaped view over {@link NamespacedCache}: each method pins a namespace and a
 * key template from {@link CacheKeys}. A {@code null} TTL means the namespace default.
 */
public class GameDataCache {

    private final NamespacedCache cache;

    public GameDataCache(NamespacedCache cache) {
        this.cache = cache;
    }

    // Players

    public Optional<Object> getPlayer(String walletAddress) {
        return cache.get(PLAYERS, CacheKeys.player(walletAddress));
    }

    public boolean setPlayer(String walletAddress, Object player, Duration ttl) {
        return cache.set(PLAYERS, CacheKeys.player(walletAddress), player, ttl);
    }

    public int invalidatePlayer(String walletAddress) {
        return cache.delete(PLAYERS, CacheKeys.player(walletAddress));
    }

    /**
     * Drops everything derived from one player's record: the record itself, the
     * player's achievements and stats, and every cached leaderboard.
     */
    public void invalidatePlayerCascade(String walletAddress) {
        invalidatePlayer(walletAddress);
        cache.delete(ACHIEVEMENTS, CacheKeys.achievements(walletAddress));
        cache.delete(STATISTICS, CacheKeys.playerStats(walletAddress));
        invalidateLeaderboards();
    }

    // Leaderboards

    public Optional<Object> getLeaderboard(String type, int limit) {
        return cache.get(LEADERBOARDS, CacheKeys.leaderboard(type, limit));
    }

    public boolean setLeaderboard(String type, int limit, Object leaderboard, Duration ttl) {
        return cache.set(LEADERBOARDS, CacheKeys.leaderboard(type, limit), leaderboard, ttl);
    }

    public boolean invalidateLeaderboards() {
        return cache.invalidateNamespace(LEADERBOARDS);
    }

    // Statistics

    public Optional<Object> getGameStats() {
        return cache.get(STATISTICS, CacheKeys.GAME_STATS);
    }

    public boolean setGameStats(Object stats, Duration ttl) {
        return cache.set(STATISTICS, CacheKeys.GAME_STATS, stats, ttl);
    }

    public Optional<Object> getPlayerStats(String walletAddress) {
        return cache.get(STATISTICS, CacheKeys.playerStats(walletAddress));
    }

    public boolean setPlayerStats(String walletAddress, Object stats, Duration ttl) {
        return cache.set(STATISTICS, CacheKeys.playerStats(walletAddress), stats, ttl);
    }

    // Achievements

    public Optional<Object> getPlayerAchievements(String walletAddress) {
        return cache.get(ACHIEVEMENTS, CacheKeys.achievements(walletAddress));
    }

    public boolean setPlayerAchievements(String walletAddress, Object achievements, Duration ttl) {
        return cache.set(ACHIEVEMENTS, CacheKeys.achievements(walletAddress), achievements, ttl);
    }

    public Optional<Object> getAllAchievements() {
        return cache.get(ACHIEVEMENTS, CacheKeys.ALL_ACHIEVEMENTS);
    }

    public boolean setAllAchievements(Object achievements, Duration ttl) {
        return cache.set(ACHIEVEMENTS, CacheKeys.ALL_ACHIEVEMENTS, achievements, ttl);
    }

    // Sessions

    public Optional<Object> getSession(String sessionId) {
        return cache.get(SESSIONS, CacheKeys.session(sessionId));
    }

    public boolean setSession(String sessionId, Object session, Duration ttl) {
        return cache.set(SESSIONS, CacheKeys.session(sessionId), session, ttl);
    }

    public int deleteSession(String sessionId) {
        return cache.delete(SESSIONS, CacheKeys.session(sessionId));
    }

    // API responses

    public Optional<Object> getApiResponse(String endpoint, String params) {
        return cache.get(API_RESPONSES, CacheKeys.apiResponse(endpoint, params));
    }

    public boolean setApiResponse(String endpoint, String params, Object response, Duration ttl) {
        return cache.set(API_RESPONSES, CacheKeys.apiResponse(endpoint, params), response, ttl);
    }

    // Blockchain data

    public Optional<Object> getBlockchainData(String key) {
        return cache.get(BLOCKCHAIN_DATA, CacheKeys.blockchain(key));
    }

    public boolean setBlockchainData(String key, Object data, Duration ttl) {
        return cache.set(BLOCKCHAIN_DATA, CacheKeys.blockchain(key), data, ttl);
    }

    // Rate limiting

    public Optional<Long> getRateLimit(String identifier) {
        return cache.get(RATE_LIMITS, CacheKeys.rateLimit(identifier), Long.class);
    }

    public boolean setRateLimit(String identifier, long count, Duration ttl) {
        return cache.set(RATE_LIMITS, CacheKeys.rateLimit(identifier), count, ttl);
    }

    /**
     * Counts one more request for {@code identifier} and restarts its window.
     *
     * @return the new count, or 0 if the identifier could not be tracked
     */
    public long incrementRateLimit(String identifier, Duration ttl) {
        return cache.incrementRateLimit(identifier, ttl);
    }
}
