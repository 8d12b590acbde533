package com.piratebomb.cache.backend;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import org.springframework.stereotype.Component;

import com.piratebomb.cache.config.GameCacheProperties;
import com.piratebomb.cache.core.CacheKeys;
import com.piratebomb.cache.core.WarmEntry;

/**
 * Stand-in for the player database: every lookup costs the configured latency
 * and is counted, so cache effectiveness shows up as fewer backend requests.
 */
@Component
public class MockRecordStore {

    private final AtomicLong requestCount = new AtomicLong();
    private final long latencyMillis;

    public MockRecordStore(GameCacheProperties properties) {
        this.latencyMillis = properties.getBackend().getLatency().toMillis();
    }

    public Map<String, Object> fetchPlayer(String walletAddress) {
        requestCount.incrementAndGet();
        simulateLatency();
        return playerRecord(walletAddress, Math.abs(walletAddress.hashCode() % 100_000));
    }

    /**
     * Highest scoring players, keyed the way the players namespace stores them.
     */
    public List<WarmEntry> loadTopPlayers(int limit) {
        requestCount.incrementAndGet();
        simulateLatency();
        List<WarmEntry> entries = new ArrayList<>(limit);
        for (int rank = 1; rank <= limit; rank++) {
            String address = String.format("0xtop%036d", rank);
            entries.add(WarmEntry.of(CacheKeys.player(address), playerRecord(address, 1_000_000 - rank)));
        }
        return entries;
    }

    private static Map<String, Object> playerRecord(String walletAddress, int score) {
        Map<String, Object> player = new LinkedHashMap<>();
        player.put("walletAddress", walletAddress);
        player.put("highScore", score);
        player.put("gamesPlayed", score % 500);
        return player;
    }

    private void simulateLatency() {
        try {
            if (latencyMillis > 0) {
                Thread.sleep(latencyMillis);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public long getRequestCount() {
        return requestCount.get();
    }

    public void resetCount() {
        requestCount.set(0);
    }
}
