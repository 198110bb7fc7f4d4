// RedissonKeyValueClientTest.java
package ac.tiercache.backend;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import ac.tiercache.CacheLevel;
import ac.tiercache.CodecValueSerializer;
import ac.tiercache.RedisTierStore;
import ac.tiercache.TierAccessException;
import org.redisson.api.*;
import org.redisson.client.RedisTimeoutException;
import org.redisson.client.codec.Codec;

import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RedissonKeyValueClientTest {

    @Mock
    private RedissonClient redissonClient;

    @Mock
    private RBucket<byte[]> bucket;

    @Mock
    private RKeys keys;

    @Mock
    private RBatch batch;

    @Mock
    private RBucketAsync<byte[]> asyncBucket;

    @Mock
    private RKeysAsync asyncKeys;

    @Mock
    private RFuture<byte[]> bytesFuture;

    @Mock
    private RFuture<Void> voidFuture;

    @Mock
    private RFuture<Long> longFuture;

    @Mock
    private RFuture<BatchResult<?>> batchFuture;

    private RedissonKeyValueClient client;

    @BeforeEach
    void setUp() {
        client = new RedissonKeyValueClient(redissonClient, Duration.ofMillis(250));

        when(redissonClient.<byte[]>getBucket(anyString(), any(Codec.class))).thenReturn(bucket);
        when(redissonClient.getKeys()).thenReturn(keys);
        when(redissonClient.createBatch(any(BatchOptions.class))).thenReturn(batch);
        when(batch.<byte[]>getBucket(anyString(), any(Codec.class))).thenReturn(asyncBucket);
        when(batch.getKeys()).thenReturn(asyncKeys);
        when(batch.executeAsync()).thenReturn(batchFuture);
    }

    @Test
    void testGetReturnsBytesWithinTimeout() throws Exception {
        // Arrange
        byte[] payload = {1, 2, 3};
        when(bucket.getAsync()).thenReturn(bytesFuture);
        when(bytesFuture.get(anyLong(), any(TimeUnit.class))).thenReturn(payload);

        // Act
        byte[] result = client.get("tiercache:value:k");

        // Assert
        assertThat(result).isEqualTo(payload);
        verify(bytesFuture).get(250L, TimeUnit.MILLISECONDS);
    }

    @Test
    void testTimeoutCancelsAndRaisesClientException() throws Exception {
        when(bucket.getAsync()).thenReturn(bytesFuture);
        when(bytesFuture.get(anyLong(), any(TimeUnit.class))).thenThrow(new TimeoutException());

        assertThatThrownBy(() -> client.get("slow"))
                .isInstanceOf(KeyValueClientException.class)
                .hasMessageContaining("timed out after 250 ms");
        verify(bytesFuture).cancel(false);
    }

    @Test
    void testExecutionFailureIsUnwrapped() throws Exception {
        IllegalStateException cause = new IllegalStateException("connection reset");
        when(bucket.getAsync()).thenReturn(bytesFuture);
        when(bytesFuture.get(anyLong(), any(TimeUnit.class))).thenThrow(new ExecutionException(cause));

        assertThatThrownBy(() -> client.get("k"))
                .isInstanceOf(KeyValueClientException.class)
                .hasCause(cause);
    }

    @Test
    void testSetWithTtlUsesExpiringWrite() throws Exception {
        byte[] payload = {9};
        when(bucket.setAsync(any(), anyLong(), any(TimeUnit.class))).thenReturn(voidFuture);

        client.set("k", payload, Duration.ofSeconds(60));

        verify(bucket).setAsync(payload, 60_000L, TimeUnit.MILLISECONDS);
        verify(bucket, never()).setAsync(any());
    }

    @Test
    void testSetWithoutTtlNeverExpires() throws Exception {
        byte[] payload = {9};
        when(bucket.setAsync(any())).thenReturn(voidFuture);

        client.set("k", payload, Duration.ZERO);

        verify(bucket).setAsync(payload);
    }

    @Test
    void testDeleteReportsRemoval() throws Exception {
        when(keys.deleteAsync(any(String[].class))).thenReturn(longFuture);
        when(longFuture.get(anyLong(), any(TimeUnit.class))).thenReturn(1L, 0L);

        assertThat(client.delete("k")).isTrue();
        assertThat(client.delete("k")).isFalse();
    }

    @Test
    void testEmptyBatchIsNotSent() {
        KeyValueBatch keyValueBatch = client.newBatch().orElseThrow();

        keyValueBatch.execute();

        verify(batch, never()).executeAsync();
    }

    @Test
    void testBatchQueuesAndExecutesOnce() throws Exception {
        KeyValueBatch keyValueBatch = client.newBatch().orElseThrow();

        keyValueBatch.set("k", new byte[]{1}, Duration.ofSeconds(5))
                .delete(List.of("a", "b"));
        keyValueBatch.execute();

        verify(asyncBucket).setAsync(any(byte[].class), eq(5000L), eq(TimeUnit.MILLISECONDS));
        verify(asyncKeys).deleteAsync("a", "b");
        verify(batch).executeAsync();
        verify(batchFuture).get(250L, TimeUnit.MILLISECONDS);
    }

    @Test
    void testSupportsBatchingAndPatternScan() {
        assertThat(client.newBatch()).isPresent();
        assertThat(client.supportsPatternScan()).isTrue();
    }

    @Test
    void testExistsCountsMatchingKeys() throws Exception {
        when(keys.countExistsAsync(any(String[].class))).thenReturn(longFuture);
        when(longFuture.get(anyLong(), any(TimeUnit.class))).thenReturn(1L, 0L);

        assertThat(client.exists("tiercache:value:k")).isTrue();
        assertThat(client.exists("tiercache:value:k")).isFalse();
    }

    @Test
    void testScanCollectsEveryPage() {
        when(keys.getKeysByPattern(anyString())).thenReturn(List.of("tiercache:value:a", "tiercache:value:b"));

        Iterable<String> scanned = client.scanKeys("tiercache:value:*");

        assertThat(scanned).containsExactly("tiercache:value:a", "tiercache:value:b");
        verify(keys).getKeysByPattern("tiercache:value:*");
    }

    @Test
    void testScanFailureWhileFetchingNextPageIsWrapped() {
        // Arrange: the first page is served, fetching the next one times out
        RedisTimeoutException cause = new RedisTimeoutException("Command execution timeout");
        when(keys.getKeysByPattern(anyString())).thenReturn(() -> new Iterator<String>() {
            private boolean served;

            @Override
            public boolean hasNext() {
                if (served) throw cause;
                return true;
            }

            @Override
            public String next() {
                if (served) throw new NoSuchElementException();
                served = true;
                return "tiercache:value:user:1";
            }
        });

        // Act & Assert
        assertThatThrownBy(() -> client.scanKeys("tiercache:value:user:*"))
                .isInstanceOf(KeyValueClientException.class)
                .hasMessageContaining("SCAN tiercache:value:user:*")
                .hasCause(cause);

        RedisTierStore store = new RedisTierStore(client, new CodecValueSerializer(), "tiercache:", Duration.ofHours(1));
        assertThatThrownBy(() -> store.invalidateByPrefix("user:"))
                .isInstanceOfSatisfying(TierAccessException.class, e -> assertThat(e.getLevel()).isEqualTo(CacheLevel.L2))
                .hasRootCause(cause);
        assertThatThrownBy(store::clear).isInstanceOf(TierAccessException.class);
    }

    @Test
    void testScanStopsOnceOperationTimeoutIsSpent() {
        // an endless cursor whose pages arrive slowly
        when(keys.getKeys()).thenReturn(() -> new Iterator<String>() {
            private int served;

            @Override
            public boolean hasNext() {
                return true;
            }

            @Override
            public String next() {
                try {
                    Thread.sleep(50);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return "key-" + served++;
            }
        });

        assertThatThrownBy(() -> client.scanKeys(null))
                .isInstanceOf(KeyValueClientException.class)
                .hasMessageContaining("timed out after 250 ms");
    }
}
