package com.piratebomb.cache.api;

import static org.hamcrest.Matchers.hasKey;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import com.piratebomb.cache.backend.MockRecordStore;
import com.piratebomb.cache.core.NamespaceConfig;
import com.piratebomb.cache.core.NamespacedCache;

@SpringBootTest(properties = "game-cache.backend.latency=0ms")
@AutoConfigureMockMvc
@DisplayName("CacheController")
class CacheControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private NamespacedCache cache;

    @Autowired
    private MockRecordStore recordStore;

    @BeforeEach
    void setUp() {
        cache.cleanup();
        recordStore.resetCount();
    }

    @Test
    @DisplayName("should read a player through the cache")
    void shouldReadThrough() throws Exception {
        mockMvc.perform(get("/players/0xabc"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.walletAddress").value("0xabc"));
        mockMvc.perform(get("/players/0xabc"))
            .andExpect(status().isOk());

        assertEquals(1, recordStore.getRequestCount());
        mockMvc.perform(get("/cache/stats"))
            .andExpect(jsonPath("$.players.hits").value(1))
            .andExpect(jsonPath("$.players.misses").value(1))
            .andExpect(jsonPath("$.players.hitRate").value("50.00%"));
    }

    @Test
    @DisplayName("should report health for every namespace")
    void shouldReportHealth() throws Exception {
        mockMvc.perform(get("/cache/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("healthy"))
            .andExpect(jsonPath("$.namespaceCount").value(8))
            .andExpect(jsonPath("$.stats", hasKey(NamespaceConfig.RATE_LIMITS)))
            .andExpect(jsonPath("$.memoryEstimate", hasKey(NamespaceConfig.PLAYERS)));
    }

    @Test
    @DisplayName("should invalidate by pattern and by namespace")
    void shouldInvalidate() throws Exception {
        cache.set(NamespaceConfig.PLAYERS, "player:wallet123", "a");
        cache.set(NamespaceConfig.PLAYERS, "player:wallet999", "b");

        mockMvc.perform(delete("/cache/players").param("pattern", "wallet123"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.removed").value(1));
        mockMvc.perform(delete("/cache/players"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.flushed").value(true));

        assertEquals(0, cache.getStats().get(NamespaceConfig.PLAYERS).getKeyCount());
    }

    @Test
    @DisplayName("should answer 404 for an unknown namespace")
    void shouldRejectUnknownNamespace() throws Exception {
        mockMvc.perform(delete("/cache/treasure"))
            .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("should count rate-limited requests")
    void shouldIncrementRateLimit() throws Exception {
        mockMvc.perform(post("/cache/rate/1.2.3.4"))
            .andExpect(jsonPath("$.count").value(1));
        mockMvc.perform(post("/cache/rate/1.2.3.4"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.count").value(2));
    }
}
