package com.piratebomb.cache.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ExpiringMap")
class ExpiringMapTest {

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAtEpoch();
    }

    private ExpiringMap<String> newMap(int maxEntries) {
        return new ExpiringMap<>("test", Duration.ofSeconds(10), maxEntries, clock, 2);
    }

    @Nested
    @DisplayName("Basic Operations")
    class BasicOperations {

        @Test
        @DisplayName("should set and get a value")
        void shouldSetAndGet() {
            var map = newMap(10);

            assertTrue(map.set("k", "v", null));

            assertEquals(Optional.of("v"), map.get("k"));
            assertEquals(1, map.size());
        }

        @Test
        @DisplayName("should replace a value without growing")
        void shouldReplaceValue() {
            var map = newMap(10);
            map.set("k", "old", null);

            map.set("k", "new", null);

            assertEquals(Optional.of("new"), map.get("k"));
            assertEquals(1, map.size());
        }

        @Test
        @DisplayName("should report removed count on delete")
        void shouldDelete() {
            var map = newMap(10);
            map.set("k", "v", null);

            assertEquals(1, map.delete("k"));
            assertEquals(0, map.delete("k"));
            assertFalse(map.get("k").isPresent());
            assertEquals(0, map.size());
        }

        @Test
        @DisplayName("should return a key snapshot")
        void shouldReturnKeys() {
            var map = newMap(10);
            map.set("a", "1", null);
            map.set("b", "2", null);

            Set<String> keys = map.keys();
            map.set("c", "3", null);

            assertEquals(Set.of("a", "b"), keys);
        }

        @Test
        @DisplayName("should flush every entry")
        void shouldFlushAll() {
            var map = newMap(10);
            map.set("a", "1", null);
            map.set("b", "2", null);

            assertEquals(2, map.flushAll());
            assertEquals(0, map.size());
            assertTrue(map.keys().isEmpty());
        }

        @Test
        @DisplayName("should reject a non-positive TTL")
        void shouldRejectNonPositiveTtl() {
            var map = newMap(10);

            assertThrows(IllegalArgumentException.class, () -> map.set("k", "v", Duration.ZERO));
            assertEquals(0, map.size());
        }
    }

    @Nested
    @DisplayName("Expiry")
    class Expiry {

        @Test
        @DisplayName("should treat an entry as absent once its TTL has elapsed")
        void shouldExpireLazily() {
            var map = newMap(10);
            map.set("k", "v", Duration.ofSeconds(1));

            clock.advance(Duration.ofMillis(999));
            assertTrue(map.get("k").isPresent());

            clock.advance(Duration.ofMillis(1));
            assertFalse(map.get("k").isPresent());
            assertEquals(0, map.size());
        }

        @Test
        @DisplayName("should use the default TTL when none is given")
        void shouldUseDefaultTtl() {
            var map = newMap(10);
            map.set("k", "v", null);

            clock.advance(Duration.ofSeconds(9));
            assertTrue(map.get("k").isPresent());

            clock.advance(Duration.ofSeconds(1));
            assertFalse(map.get("k").isPresent());
        }

        @Test
        @DisplayName("should sweep expired entries nobody reads")
        void shouldSweepExpired() {
            var map = newMap(10);
            map.set("short1", "v", Duration.ofSeconds(1));
            map.set("short2", "v", Duration.ofSeconds(1));
            map.set("short3", "v", Duration.ofSeconds(1));
            map.set("long", "v", Duration.ofSeconds(60));

            clock.advance(Duration.ofSeconds(2));

            assertEquals(3, map.sweepExpired());
            assertEquals(1, map.size());
            assertEquals(Set.of("long"), map.keys());
        }

        @Test
        @DisplayName("should keep an entry whose TTL is too large to represent")
        void shouldSaturateHugeTtl() {
            var map = newMap(10);

            assertTrue(map.set("millis", "v", Duration.ofMillis(Long.MAX_VALUE)));
            assertTrue(map.set("seconds", "v", Duration.ofSeconds(Long.MAX_VALUE)));
            assertEquals(Optional.of("first"),
                map.update("updated", current -> current.orElse("first"), Duration.ofSeconds(Long.MAX_VALUE)));

            clock.advance(Duration.ofDays(365 * 100));

            assertEquals(Optional.of("v"), map.get("millis"));
            assertEquals(Optional.of("v"), map.get("seconds"));
            assertEquals(0, map.sweepExpired());
            assertEquals(3, map.size());
        }

        @Test
        @DisplayName("should hide expired entries from the key snapshot")
        void shouldHideExpiredKeys() {
            var map = newMap(10);
            map.set("gone", "v", Duration.ofSeconds(1));
            map.set("kept", "v", Duration.ofSeconds(5));

            clock.advance(Duration.ofSeconds(2));

            assertEquals(Set.of("kept"), map.keys());
        }
    }

    @Nested
    @DisplayName("Capacity")
    class Capacity {

        @Test
        @DisplayName("should reject a new key when full and keep existing entries")
        void shouldRejectWhenFull() {
            var map = newMap(2);

            assertTrue(map.set("a", "1", null));
            assertTrue(map.set("b", "2", null));
            assertFalse(map.set("c", "3", null));

            assertEquals(Optional.of("1"), map.get("a"));
            assertEquals(Optional.of("2"), map.get("b"));
            assertFalse(map.get("c").isPresent());
            assertEquals(2, map.size());
        }

        @Test
        @DisplayName("should still replace an existing key when full")
        void shouldReplaceWhenFull() {
            var map = newMap(1);
            map.set("a", "1", null);

            assertTrue(map.set("a", "2", null));
            assertEquals(Optional.of("2"), map.get("a"));
        }

        @Test
        @DisplayName("should accept new keys again after a delete")
        void shouldFreeCapacityOnDelete() {
            var map = newMap(1);
            map.set("a", "1", null);
            map.delete("a");

            assertTrue(map.set("b", "2", null));
        }
    }

    @Nested
    @DisplayName("Update")
    class Update {

        @Test
        @DisplayName("should see absent for a missing or expired key")
        void shouldSeeAbsentForExpired() {
            var map = newMap(10);
            map.set("k", "old", Duration.ofSeconds(1));
            clock.advance(Duration.ofSeconds(2));

            Optional<String> result = map.update("k", current -> current.orElse("none") + "!", null);

            assertEquals(Optional.of("none!"), result);
        }

        @Test
        @DisplayName("should not leak capacity when the remapping fails")
        void shouldNotLeakCapacityOnFailure() {
            var map = newMap(1);

            assertThrows(IllegalStateException.class, () -> map.update("k", current -> {
                throw new IllegalStateException("boom");
            }, null));

            assertEquals(0, map.size());
            assertTrue(map.set("other", "v", null));
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("should release entries and refuse writes after close")
        void shouldCloseIdempotently() {
            ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
            try {
                var map = newMap(10);
                map.set("k", "v", null);
                map.startSweeping(scheduler, Duration.ofMinutes(1));
                assertTrue(map.isSweeping());

                map.close();
                map.close();

                assertFalse(map.isSweeping());
                assertTrue(map.isClosed());
                assertEquals(0, map.size());
                assertFalse(map.set("k", "v", null));
            } finally {
                scheduler.shutdownNow();
            }
        }
    }
}
