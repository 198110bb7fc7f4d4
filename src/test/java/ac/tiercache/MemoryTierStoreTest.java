// MemoryTierStoreTest.java
package ac.tiercache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("L1 Memory Tier Tests")
class MemoryTierStoreTest {

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
    }

    private MemoryTierStore store(int capacity, EvictionPolicy policy) {
        return new MemoryTierStore(capacity, Duration.ofMinutes(10), policy, clock);
    }

    @Test
    @DisplayName("Test Basic Set And Get")
    void testBasicSetAndGet() {
        // Arrange
        MemoryTierStore store = store(10, EvictionPolicy.LRU);

        // Act
        store.set("user:1", "Alice");

        // Assert
        assertEquals(Optional.of("Alice"), store.get("user:1"));
        assertTrue(store.get("user:2").isEmpty());
    }

    @Test
    @DisplayName("Test Entry Expires After TTL")
    void testTtlExpiry() {
        MemoryTierStore store = store(10, EvictionPolicy.LRU);
        store.set("k", "v", Duration.ofSeconds(30));

        clock.advance(Duration.ofSeconds(29));
        assertTrue(store.get("k").isPresent());

        clock.advance(Duration.ofSeconds(2));
        assertTrue(store.get("k").isEmpty());
        assertFalse(store.containsKey("k"), "expired entry is removed on read");
    }

    @Test
    @DisplayName("Test Default And Infinite TTL")
    void testDefaultAndInfiniteTtl() {
        MemoryTierStore store = store(10, EvictionPolicy.LRU);
        store.set("default", "v");
        store.set("forever", "v", Duration.ZERO);

        clock.advance(Duration.ofMinutes(11));

        assertTrue(store.get("default").isEmpty());
        assertTrue(store.get("forever").isPresent());
    }

    @Test
    @DisplayName("Test Capacity Must Be Positive")
    void testInvalidCapacity() {
        assertThatThrownBy(() -> store(0, EvictionPolicy.LRU))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("capacity");
    }

    @Test
    @DisplayName("Test Size Never Exceeds Capacity")
    void testCapacityBound() {
        MemoryTierStore store = store(5, EvictionPolicy.FIFO);

        for (int i = 0; i < 50; i++) {
            store.set("k" + i, i);
            assertThat(store.size()).isLessThanOrEqualTo(5);
        }
        assertThat(store.getEvictionCount()).isEqualTo(45);
    }

    @Test
    @DisplayName("Test LRU Evicts Least Recently Used")
    void testLruEviction() {
        MemoryTierStore store = store(3, EvictionPolicy.LRU);
        store.set("a", 1);
        store.set("b", 2);
        store.set("c", 3);

        store.set("d", 4);

        assertThat(store.keys()).containsExactlyInAnyOrder("b", "c", "d");
    }

    @Test
    @DisplayName("Test LRU Read Protects Key From Eviction")
    void testLruReadProtectsKey() {
        MemoryTierStore store = store(3, EvictionPolicy.LRU);
        store.set("a", 1);
        store.set("b", 2);
        store.set("c", 3);

        store.get("a");
        store.set("d", 4);

        assertThat(store.keys()).containsExactlyInAnyOrder("a", "c", "d");
    }

    @Test
    @DisplayName("Test FIFO Ignores Reads")
    void testFifoEviction() {
        MemoryTierStore store = store(3, EvictionPolicy.FIFO);
        store.set("a", 1);
        store.set("b", 2);
        store.set("c", 3);

        store.get("a");
        store.set("d", 4);

        assertThat(store.keys()).containsExactlyInAnyOrder("b", "c", "d");
    }

    @Test
    @DisplayName("Test FIFO Overwrite Requeues Key")
    void testFifoOverwriteRequeues() {
        MemoryTierStore store = store(3, EvictionPolicy.FIFO);
        store.set("a", 1);
        store.set("b", 2);
        store.set("c", 3);

        store.set("a", 10);
        store.set("d", 4);

        assertThat(store.keys()).containsExactlyInAnyOrder("a", "c", "d");
        assertEquals(Optional.of(10), store.get("a"));
    }

    @Test
    @DisplayName("Test TTL Policy Evicts Expired First")
    void testTtlPolicyPrefersExpired() {
        MemoryTierStore store = store(3, EvictionPolicy.TTL);
        store.set("a", 1, Duration.ofHours(1));
        store.set("short", 2, Duration.ofSeconds(5));
        store.set("c", 3, Duration.ofHours(1));

        clock.advance(Duration.ofSeconds(10));
        store.set("d", 4);

        assertThat(store.keys()).containsExactlyInAnyOrder("a", "c", "d");
    }

    @Test
    @DisplayName("Test TTL Policy Falls Back To FIFO")
    void testTtlPolicyFallsBackToFifo() {
        MemoryTierStore store = store(2, EvictionPolicy.TTL);
        store.set("a", 1);
        store.set("b", 2);

        store.set("c", 3);

        assertThat(store.keys()).containsExactlyInAnyOrder("b", "c");
    }

    @Test
    @DisplayName("Test Eviction Clears Tag Index")
    void testEvictionUpdatesTagIndex() {
        MemoryTierStore store = store(1, EvictionPolicy.LRU);
        store.set("a", 1, null, List.of("t"));

        store.set("b", 2);

        assertThat(store.keysForTag("t")).isEmpty();
        assertEquals(0, store.invalidateByTag("t"));
    }

    @Test
    @DisplayName("Test Invalidate By Tag")
    void testInvalidateByTag() {
        MemoryTierStore store = store(10, EvictionPolicy.LRU);
        store.set("user:1", "a", null, List.of("users"));
        store.set("user:2", "b", null, List.of("users", "admins"));
        store.set("order:1", "c", null, List.of("orders"));

        int removed = store.invalidateByTag("users");

        assertEquals(2, removed);
        assertTrue(store.get("user:1").isEmpty());
        assertTrue(store.get("user:2").isEmpty());
        assertTrue(store.get("order:1").isPresent());
        assertThat(store.keysForTag("admins")).isEmpty();
    }

    @Test
    @DisplayName("Test Overwrite Replaces Tags")
    void testOverwriteReplacesTags() {
        MemoryTierStore store = store(10, EvictionPolicy.LRU);
        store.set("k", "v1", null, List.of("old"));

        store.set("k", "v2", null, List.of("new"));

        assertThat(store.keysForTag("old")).isEmpty();
        assertThat(store.keysForTag("new")).containsExactly("k");
        assertEquals(0, store.invalidateByTag("old"));
        assertEquals(Optional.of("v2"), store.get("k"));
    }

    @Test
    @DisplayName("Test Invalidate By Prefix")
    void testInvalidateByPrefix() {
        MemoryTierStore store = store(10, EvictionPolicy.LRU);
        store.set("user:1", "a");
        store.set("user:2", "b");
        store.set("users", "c");
        store.set("order:1", "d");

        assertEquals(2, store.invalidateByPrefix("user:"));
        assertThat(store.keys()).containsExactlyInAnyOrder("users", "order:1");
    }

    @Test
    @DisplayName("Test Delete And Clear Are Idempotent")
    void testDeleteAndClearIdempotent() {
        MemoryTierStore store = store(10, EvictionPolicy.LRU);
        store.set("k", "v", null, List.of("t"));

        assertTrue(store.delete("k"));
        assertFalse(store.delete("k"));
        assertThat(store.keysForTag("t")).isEmpty();

        store.set("x", "y");
        store.clear();
        store.clear();
        assertEquals(0, store.size());
    }

    @Test
    @DisplayName("Test Null Value Rejected")
    void testNullValueRejected() {
        MemoryTierStore store = store(10, EvictionPolicy.LRU);
        assertThrows(IllegalArgumentException.class, () -> store.set("k", null));
    }

    @Test
    @DisplayName("Test Access Metadata Recorded")
    void testAccessMetadata() {
        MemoryTierStore store = store(10, EvictionPolicy.LRU);
        store.set("k", "v");

        clock.advance(Duration.ofSeconds(3));
        store.get("k");
        CacheEntry entry = store.getEntry("k").orElseThrow();

        assertThat(entry.getAccessCount()).isEqualTo(2);
        assertThat(entry.getLastAccessedAt()).isEqualTo(clock.instant());
    }

    @Test
    @DisplayName("Test Returned Entry Is Not Updated By Later Reads")
    void testReturnedEntryIsSnapshot() {
        MemoryTierStore store = store(10, EvictionPolicy.LRU);
        store.set("k", "v");
        CacheEntry first = store.getEntry("k").orElseThrow();
        Instant firstAccess = first.getLastAccessedAt();

        clock.advance(Duration.ofSeconds(5));
        store.get("k");
        CacheEntry second = store.getEntry("k").orElseThrow();

        assertThat(first.getAccessCount()).isEqualTo(1);
        assertThat(first.getLastAccessedAt()).isEqualTo(firstAccess);
        assertThat(second.getAccessCount()).isEqualTo(3);
        assertThat(second).isNotSameAs(first);

        first.recordAccess(clock.instant().plusSeconds(60));
        assertThat(store.getEntry("k").orElseThrow().getAccessCount()).isEqualTo(4);
    }

    @Test
    @DisplayName("Test Concurrent Writers Leave Consistent State")
    void testConcurrentSetSameKey() throws Exception {
        MemoryTierStore store = store(100, EvictionPolicy.LRU);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        for (int i = 0; i < 200; i++) {
            final String value = i % 2 == 0 ? "A" : "B";
            futures.add(executor.submit(() -> {
                start.await();
                return store.set("x", value, null, List.of("tag-" + value));
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        executor.shutdown();

        Object winner = store.get("x").orElseThrow();
        assertThat(winner).isIn("A", "B");
        String loser = "A".equals(winner) ? "B" : "A";
        assertThat(store.keysForTag("tag-" + winner)).isEqualTo(Set.of("x"));
        assertThat(store.keysForTag("tag-" + loser)).isEmpty();
    }
}
