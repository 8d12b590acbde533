package com.piratebomb.cache.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.piratebomb.cache.core.NamespaceConfig;
import com.piratebomb.cache.core.NamespacedCache;

/**
 * Startup options under {@code game-cache}. Namespace entries override the
 * built-in defaults field by field; unknown names add extra namespaces.
 */
@ConfigurationProperties(prefix = "game-cache")
public class GameCacheProperties {

    private Map<String, Namespace> namespaces = new LinkedHashMap<>();
    private int sweepBatchSize = NamespacedCache.DEFAULT_SWEEP_BATCH_SIZE;
    private boolean warmOnStartup = false;
    private int warmPlayerCount = 100;
    private Backend backend = new Backend();

    public List<NamespaceConfig> toNamespaceConfigs() {
        Map<String, Namespace> remaining = new LinkedHashMap<>(namespaces);
        List<NamespaceConfig> result = new ArrayList<>();
        for (NamespaceConfig defaults : NamespaceConfig.defaults()) {
            result.add(merge(defaults, remaining.remove(defaults.getName())));
        }
        remaining.forEach((name, ns) -> {
            if (ns.getTtl() == null || ns.getMaxEntries() == null) {
                throw new IllegalArgumentException("Namespace " + name + " needs both ttl and max-entries");
            }
            Duration sweep = ns.getSweepInterval() != null ? ns.getSweepInterval() : ns.getTtl();
            result.add(new NamespaceConfig(name, ns.getTtl(), ns.getMaxEntries(), sweep));
        });
        return result;
    }

    private static NamespaceConfig merge(NamespaceConfig defaults, Namespace override) {
        if (override == null) {
            return defaults;
        }
        return new NamespaceConfig(
            defaults.getName(),
            override.getTtl() != null ? override.getTtl() : defaults.getDefaultTtl(),
            override.getMaxEntries() != null ? override.getMaxEntries() : defaults.getMaxEntries(),
            override.getSweepInterval() != null ? override.getSweepInterval() : defaults.getSweepInterval());
    }

    public Map<String, Namespace> getNamespaces() {
        return namespaces;
    }

    public void setNamespaces(Map<String, Namespace> namespaces) {
        this.namespaces = namespaces;
    }

    public int getSweepBatchSize() {
        return sweepBatchSize;
    }

    public void setSweepBatchSize(int sweepBatchSize) {
        this.sweepBatchSize = sweepBatchSize;
    }

    public boolean isWarmOnStartup() {
        return warmOnStartup;
    }

    public void setWarmOnStartup(boolean warmOnStartup) {
        this.warmOnStartup = warmOnStartup;
    }

    public int getWarmPlayerCount() {
        return warmPlayerCount;
    }

    public void setWarmPlayerCount(int warmPlayerCount) {
        this.warmPlayerCount = warmPlayerCount;
    }

    public Backend getBackend() {
        return backend;
    }

    public void setBackend(Backend backend) {
        this.backend = backend;
    }

    public static class Namespace {
        private Duration ttl;
        private Integer maxEntries;
        private Duration sweepInterval;

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public Integer getMaxEntries() {
            return maxEntries;
        }

        public void setMaxEntries(Integer maxEntries) {
            this.maxEntries = maxEntries;
        }

        public Duration getSweepInterval() {
            return sweepInterval;
        }

        public void setSweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
        }
    }

    public static class Backend {
        // simulated system-of-record latency per lookup
        private Duration latency = Duration.ofMillis(50);

        public Duration getLatency() {
            return latency;
        }

        public void setLatency(Duration latency) {
            this.latency = latency;
        }
    }
}
