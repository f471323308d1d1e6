package com.example.mediacache.core;

import com.example.mediacache.MutableClock;
import com.example.mediacache.eviction.LruEvictionStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class CacheServiceTest {

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
    }

    private CacheService<String> cache(int maxSize) {
        return new CacheService<>(new LruEvictionStrategy(), maxSize, Duration.ofSeconds(300), clock);
    }

    @Nested
    @DisplayName("get / set")
    class GetSet {

        @Test
        void setThenGet_beforeTtl_returnsValue() {
            CacheService<String> cache = cache(10);
            cache.set("https://example.org/a", "meta-a", Duration.ofSeconds(100));
            clock.advance(Duration.ofSeconds(99));

            assertEquals(Optional.of("meta-a"), cache.get("https://example.org/a"));
        }

        @Test
        void getOfUnknownLocator_isMissNotError() {
            CacheService<String> cache = cache(10);
            assertEquals(Optional.empty(), cache.get("https://example.org/none"));
            assertEquals(1, cache.stats().missCount());
        }

        @Test
        void expiredEntry_isMissAndRemoved() {
            CacheService<String> cache = cache(10);
            cache.set("u", "v", Duration.ofSeconds(10));
            assertEquals(1, cache.stats().size());

            clock.advance(Duration.ofSeconds(10));

            assertTrue(cache.get("u").isEmpty());
            assertEquals(0, cache.stats().size());
            assertEquals(0, cache.cleanupExpired());
            assertEquals(1, cache.stats().missCount());
            assertEquals(0, cache.stats().hitCount());
        }

        @Test
        void overwrite_restartsTtl() {
            CacheService<String> cache = cache(10);
            cache.set("u", "old", Duration.ofSeconds(10));
            clock.advance(Duration.ofSeconds(8));
            cache.set("u", "new", Duration.ofSeconds(10));
            clock.advance(Duration.ofSeconds(8));

            assertEquals(Optional.of("new"), cache.get("u"));
            assertEquals(1, cache.size());
        }

        @Test
        void nullTtl_usesDefault() {
            CacheService<String> cache = cache(10);
            cache.set("u", "v", null);
            clock.advance(Duration.ofSeconds(299));
            assertTrue(cache.get("u").isPresent());
            clock.advance(Duration.ofSeconds(1));
            assertTrue(cache.get("u").isEmpty());
        }

        @Test
        void zeroOrNegativeTtl_usesDefault() {
            CacheService<String> cache = cache(10);
            cache.set("zero", "z", Duration.ZERO);
            cache.set("negative", "n", Duration.ofSeconds(-5));
            clock.advance(Duration.ofSeconds(299));

            assertEquals(Optional.of("z"), cache.get("zero"));
            assertEquals(Optional.of("n"), cache.get("negative"));

            clock.advance(Duration.ofSeconds(1));
            assertTrue(cache.get("zero").isEmpty());
            assertTrue(cache.get("negative").isEmpty());
        }

        @Test
        void equivalentLocators_shareEntry() {
            CacheService<String> cache = cache(10);
            cache.set("https://www.youtube.com/watch?v=abcdefghijk", "video");

            assertEquals(Optional.of("video"), cache.get("https://youtu.be/abcdefghijk"));
            assertEquals(1, cache.stats().hitCount());
        }
    }

    @Nested
    @DisplayName("capacity and LRU eviction")
    class Eviction {

        @Test
        void recentlyReadEntry_survives_leastRecentIsEvicted() {
            CacheService<Integer> cache =
                new CacheService<>(new LruEvictionStrategy(), 2, Duration.ofSeconds(300), clock);
            cache.set("A", 1);
            cache.set("B", 2);
            assertEquals(Optional.of(1), cache.get("A"));
            cache.set("C", 3);

            assertEquals(Optional.of(1), cache.get("A"));
            assertEquals(Optional.of(3), cache.get("C"));
            assertEquals(Optional.empty(), cache.get("B"));
        }

        @Test
        void evictionIgnoresRemainingTtl() {
            CacheService<String> cache = cache(2);
            cache.set("long", "l", Duration.ofHours(10));
            cache.set("short", "s", Duration.ofSeconds(5));
            cache.set("new", "n");

            assertTrue(cache.get("long").isEmpty());
            assertTrue(cache.get("short").isPresent());
        }

        @Test
        void sizeNeverExceedsCapacity() {
            CacheService<String> cache = cache(5);
            for (int i = 0; i < 50; i++) {
                cache.set("key-" + i, "v" + i);
                assertTrue(cache.stats().size() <= 5);
            }
            assertEquals(5, cache.size());
            assertTrue(cache.get("key-49").isPresent());
            assertTrue(cache.get("key-44").isEmpty());
        }

        @Test
        void rejectsNonPositiveCapacity() {
            assertThrows(IllegalArgumentException.class,
                () -> new CacheService<String>(new LruEvictionStrategy(), 0, Duration.ofSeconds(1), clock));
        }
    }

    @Nested
    @DisplayName("invalidate / clear / cleanupExpired / stats")
    class Maintenance {

        @Test
        void invalidate_reportsPresence() {
            CacheService<String> cache = cache(10);
            cache.set("u", "v");

            assertTrue(cache.invalidate("u"));
            assertFalse(cache.invalidate("u"));
            assertTrue(cache.get("u").isEmpty());
        }

        @Test
        void clear_emptiesStoreAndCounters() {
            CacheService<String> cache = cache(10);
            cache.set("u", "v");
            cache.get("u");
            cache.get("x");

            cache.clear();

            CacheStats stats = cache.stats();
            assertEquals(0, stats.size());
            assertEquals(0, stats.hitCount());
            assertEquals(0, stats.missCount());
            assertEquals(0.0, stats.hitRate());
            assertEquals(0, stats.totalRequests());
        }

        @Test
        void cleanupExpired_removesOnlyExpired_andKeepsRecencyOrder() {
            CacheService<String> cache = cache(3);
            cache.set("A", "a", Duration.ofSeconds(10));
            cache.set("B", "b", Duration.ofSeconds(100));
            cache.set("C", "c", Duration.ofSeconds(100));
            clock.advance(Duration.ofSeconds(20));

            assertEquals(1, cache.cleanupExpired());
            assertEquals(2, cache.size());

            cache.set("D", "d");
            cache.set("E", "e");

            // B was the oldest survivor, so it is the one pushed out
            assertTrue(cache.get("B").isEmpty());
            assertTrue(cache.get("C").isPresent());
            assertTrue(cache.get("D").isPresent());
            assertTrue(cache.get("E").isPresent());
        }

        @Test
        void stats_reportHitRateAsPercentage() {
            CacheService<String> cache = cache(10);
            cache.set("u", "v");
            cache.get("u");
            cache.get("x");
            cache.get("y");

            CacheStats stats = cache.stats();
            assertEquals(1, stats.size());
            assertEquals(10, stats.maxSize());
            assertEquals(1, stats.hitCount());
            assertEquals(2, stats.missCount());
            assertEquals(3, stats.totalRequests());
            assertEquals(33.33, stats.hitRate(), 0.0001);
        }

        @Test
        void stats_withNoRequests_haveZeroHitRate() {
            assertEquals(0.0, cache(10).stats().hitRate());
        }
    }

    @Nested
    @DisplayName("concurrent access")
    class Concurrency {

        @Test
        void parallelWriters_neverPushSizePastCapacity() throws Exception {
            CacheService<String> cache = cache(50);
            int writers = 8;
            ExecutorService pool = Executors.newFixedThreadPool(writers + 1);
            CountDownLatch start = new CountDownLatch(1);
            AtomicBoolean overflow = new AtomicBoolean(false);
            AtomicBoolean done = new AtomicBoolean(false);

            List<Future<?>> futures = new ArrayList<>();
            for (int w = 0; w < writers; w++) {
                int id = w;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 500; i++) {
                        cache.set("w" + id + "-" + i, "v");
                        cache.get("w" + id + "-" + (i / 2));
                    }
                    return null;
                }));
            }
            Future<?> watcher = pool.submit(() -> {
                start.await();
                while (!done.get()) {
                    if (cache.stats().size() > 50) {
                        overflow.set(true);
                    }
                }
                return null;
            });

            start.countDown();
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
            done.set(true);
            watcher.get(5, TimeUnit.SECONDS);
            pool.shutdown();

            assertFalse(overflow.get());
            assertEquals(50, cache.size());
            assertEquals(writers * 500L, cache.stats().totalRequests());
        }

        @Test
        void parallelReaders_countEveryHit() throws Exception {
            CacheService<String> cache = cache(10);
            cache.set("hot", "v");
            ExecutorService pool = Executors.newFixedThreadPool(4);
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 1000; i++) {
                        cache.get("hot");
                    }
                }));
            }
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
            pool.shutdown();

            assertEquals(4000, cache.stats().hitCount());
            assertEquals(0, cache.stats().missCount());
        }
    }
}
