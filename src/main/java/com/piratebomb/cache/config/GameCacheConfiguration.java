package com.piratebomb.cache.config;

import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.piratebomb.cache.backend.MockRecordStore;
import com.piratebomb.cache.core.GameDataCache;
import com.piratebomb.cache.core.NamespaceConfig;
import com.piratebomb.cache.core.NamespacedCache;

@Configuration
@EnableConfigurationProperties(GameCacheProperties.class)
public class GameCacheConfiguration {

    private static final Logger log = LoggerFactory.getLogger(GameCacheConfiguration.class);

    @Bean
    public Clock cacheClock() {
        return Clock.systemUTC();
    }

    // the context closes the cache only after the web server has drained requests
    @Bean(initMethod = "start", destroyMethod = "shutdown")
    public NamespacedCache namespacedCache(GameCacheProperties properties, Clock cacheClock) {
        return new NamespacedCache(properties.toNamespaceConfigs(), cacheClock, properties.getSweepBatchSize());
    }

    @Bean
    public GameDataCache gameDataCache(NamespacedCache namespacedCache) {
        return new GameDataCache(namespacedCache);
    }

    @Bean
    public ApplicationRunner cacheWarmer(GameCacheProperties properties, NamespacedCache cache, MockRecordStore recordStore) {
        return args -> {
            if (!properties.isWarmOnStartup()) {
                return;
            }
            int warmed = cache.warmCache(NamespaceConfig.PLAYERS,
                () -> recordStore.loadTopPlayers(properties.getWarmPlayerCount()));
            log.info("Warmed {} player records on startup", warmed);
        };
    }
}
