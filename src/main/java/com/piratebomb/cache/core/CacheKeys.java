package com.piratebomb.cache.core;

import java.nio.charset.StandardCharsets;

import org.springframework.util.DigestUtils;

/**
 * Canonical key templates. Each template has its own prefix, and the variable
 * part that may contain ':' is always the last segment or followed only by a
 * colon-free token, so two different entities never compose the same key.
 */
public final class CacheKeys {

    public static final String GAME_STATS = "game_stats";
    public static final String ALL_ACHIEVEMENTS = "all_achievements";

    private CacheKeys() {
    }

    public static String player(String walletAddress) {
        return "player:" + walletAddress;
    }

    public static String leaderboard(String type, int limit) {
        return "leaderboard:" + type + ":" + limit;
    }

    public static String session(String sessionId) {
        return "session:" + sessionId;
    }

    public static String achievements(String walletAddress) {
        return "achievements:" + walletAddress;
    }

    public static String playerStats(String walletAddress) {
        return "stats:" + walletAddress;
    }

    public static String apiResponse(String endpoint, String params) {
        return "api:" + endpoint + ":" + paramsHash(params);
    }

    public static String blockchain(String key) {
        return "blockchain:" + key;
    }

    public static String rateLimit(String identifier) {
        return "rate:" + identifier;
    }

    static String paramsHash(String params) {
        String canonical = params == null ? "" : params;
        return DigestUtils.md5DigestAsHex(canonical.getBytes(StandardCharsets.UTF_8));
    }
}
