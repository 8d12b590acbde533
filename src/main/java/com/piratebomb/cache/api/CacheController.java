package com.piratebomb.cache.api;

import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.piratebomb.cache.backend.MockRecordStore;
import com.piratebomb.cache.core.CacheHealth;
import com.piratebomb.cache.core.GameDataCache;
import com.piratebomb.cache.core.NamespaceConfig;
import com.piratebomb.cache.core.NamespaceStats;
import com.piratebomb.cache.core.NamespacedCache;

@RestController
public class CacheController {

    private final NamespacedCache cache;
    private final GameDataCache gameDataCache;
    private final MockRecordStore recordStore;

    public CacheController(NamespacedCache cache, GameDataCache gameDataCache, MockRecordStore recordStore) {
        this.cache = cache;
        this.gameDataCache = gameDataCache;
        this.recordStore = recordStore;
    }

    @GetMapping("/players/{address}")
    public Object getPlayer(@PathVariable String address) {
        return gameDataCache.getPlayer(address).orElseGet(() -> {
            Object player = recordStore.fetchPlayer(address);
            gameDataCache.setPlayer(address, player, null);
            return player;
        });
    }

    @GetMapping("/cache/stats")
    public Map<String, NamespaceStats.Snapshot> getStats() {
        return cache.getStats();
    }

    @GetMapping("/cache/health")
    public CacheHealth health() {
        return cache.healthCheck();
    }

    @DeleteMapping("/cache/{namespace}")
    public ResponseEntity<Map<String, Object>> invalidate(
        @PathVariable String namespace,
        @RequestParam(required = false) String pattern
    ) {
        if (!cache.namespaces().contains(namespace)) {
            return ResponseEntity.notFound().build();
        }
        if (pattern == null) {
            cache.invalidateNamespace(namespace);
            return ResponseEntity.ok(Map.of("namespace", namespace, "flushed", true));
        }
        int removed = cache.invalidatePattern(namespace, pattern);
        return ResponseEntity.ok(Map.of("namespace", namespace, "pattern", pattern, "removed", removed));
    }

    @PostMapping("/cache/rate/{identifier}")
    public Map<String, Object> incrementRateLimit(@PathVariable String identifier) {
        long count = cache.incrementRateLimit(identifier,
            cache.config(NamespaceConfig.RATE_LIMITS).map(NamespaceConfig::getDefaultTtl).orElse(null));
        return Map.of("identifier", identifier, "count", count);
    }

    @GetMapping("/backend/stats")
    public Map<String, Object> backendStats() {
        return Map.of("backendRequests", recordStore.getRequestCount());
    }

    @PostMapping("/cache/cleanup")
    public void cleanup() {
        recordStore.resetCount();
        cache.cleanup();
    }
}
