package com.piratebomb.cache.core;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("NamespaceStats")
class NamespaceStatsTest {

    @Test
    @DisplayName("should format hit rates with two decimals")
    void shouldFormatHitRate() {
        assertEquals("0%", NamespaceStats.formatHitRate(0, 0));
        assertEquals("0.00%", NamespaceStats.formatHitRate(0, 5));
        assertEquals("100.00%", NamespaceStats.formatHitRate(4, 0));
        assertEquals("33.33%", NamespaceStats.formatHitRate(1, 2));
    }

    @Test
    @DisplayName("should zero every counter on reset")
    void shouldReset() {
        var stats = new NamespaceStats();
        stats.recordHit();
        stats.recordMiss();
        stats.recordSet();
        stats.recordDeletes(3);
        stats.recordFlush();

        NamespaceStats.Snapshot before = stats.snapshot(7);
        stats.reset();
        NamespaceStats.Snapshot after = stats.snapshot(0);

        assertEquals(7, before.getKeyCount());
        assertEquals(3, before.getDeletes());
        assertEquals("50.00%", before.getHitRate());
        assertEquals(0, after.getHits());
        assertEquals(0, after.getMisses());
        assertEquals(0, after.getSets());
        assertEquals(0, after.getDeletes());
        assertEquals(0, after.getFlushes());
    }
}
