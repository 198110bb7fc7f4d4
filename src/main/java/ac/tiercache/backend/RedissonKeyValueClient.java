package ac.tiercache.backend;

import org.redisson.api.*;
import org.redisson.client.codec.ByteArrayCodec;
import org.redisson.client.codec.StringCodec;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link KeyValueClient} over a {@link RedissonClient}. Values travel as raw bytes,
 * hashes and sets as strings. Every blocking call waits at most {@code operationTimeout}.
 * The client is not owned: closing the tier never shuts Redisson down.
 */
public class RedissonKeyValueClient implements KeyValueClient {

    private final RedissonClient redissonClient;
    private final Duration operationTimeout;

    public RedissonKeyValueClient(RedissonClient redissonClient, Duration operationTimeout) {
        this.redissonClient = Objects.requireNonNull(redissonClient, "Redisson client cannot be null");
        this.operationTimeout = Objects.requireNonNull(operationTimeout, "Operation timeout cannot be null");
    }

    @Override
    public byte[] get(String key) {
        RBucket<byte[]> bucket = redissonClient.getBucket(key, ByteArrayCodec.INSTANCE);
        return await(bucket.getAsync(), "GET " + key);
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) {
        RBucket<byte[]> bucket = redissonClient.getBucket(key, ByteArrayCodec.INSTANCE);
        if (expires(ttl)) {
            await(bucket.setAsync(value, ttl.toMillis(), TimeUnit.MILLISECONDS), "SET " + key);
        } else {
            await(bucket.setAsync(value), "SET " + key);
        }
    }

    @Override
    public boolean exists(String key) {
        Long count = await(redissonClient.getKeys().countExistsAsync(key), "EXISTS " + key);
        return count != null && count > 0;
    }

    @Override
    public boolean delete(String key) {
        Long removed = await(redissonClient.getKeys().deleteAsync(key), "DEL " + key);
        return removed != null && removed > 0;
    }

    @Override
    public long delete(Collection<String> keys) {
        if (keys.isEmpty()) return 0;
        Long removed = await(redissonClient.getKeys().deleteAsync(keys.toArray(new String[0])),
                "DEL " + keys.size() + " keys");
        return removed != null ? removed : 0;
    }

    @Override
    public Map<String, String> getFields(String hashKey) {
        RMap<String, String> map = redissonClient.getMap(hashKey, StringCodec.INSTANCE);
        Map<String, String> fields = await(map.readAllMapAsync(), "HGETALL " + hashKey);
        return fields != null ? fields : Collections.emptyMap();
    }

    @Override
    public void putFields(String hashKey, Map<String, String> fields, Duration ttl) {
        RMap<String, String> map = redissonClient.getMap(hashKey, StringCodec.INSTANCE);
        await(map.putAllAsync(fields), "HSET " + hashKey);
        if (expires(ttl)) {
            await(map.expireAsync(ttl.toMillis(), TimeUnit.MILLISECONDS), "PEXPIRE " + hashKey);
        }
    }

    @Override
    public CompletionStage<Void> incrementFieldAsync(String hashKey, String field, long delta) {
        // the reply is a number, not a String, despite the string codec
        RMap<String, Object> map = redissonClient.getMap(hashKey, StringCodec.INSTANCE);
        return map.addAndGetAsync(field, delta).thenApply(result -> null);
    }

    @Override
    public CompletionStage<Void> putFieldAsync(String hashKey, String field, String value) {
        RMap<String, String> map = redissonClient.getMap(hashKey, StringCodec.INSTANCE);
        return map.fastPutAsync(field, value).thenApply(result -> null);
    }

    @Override
    public Set<String> members(String setKey) {
        RSet<String> set = redissonClient.getSet(setKey, StringCodec.INSTANCE);
        Set<String> members = await(set.readAllAsync(), "SMEMBERS " + setKey);
        return members != null ? members : Collections.emptySet();
    }

    @Override
    public void addMembers(String setKey, Collection<String> members, Duration ttl) {
        if (members.isEmpty()) return;
        RSet<String> set = redissonClient.getSet(setKey, StringCodec.INSTANCE);
        await(set.addAllAsync(members), "SADD " + setKey);
        if (expires(ttl)) {
            await(set.expireAsync(ttl.toMillis(), TimeUnit.MILLISECONDS), "PEXPIRE " + setKey);
        }
    }

    @Override
    public void removeMembers(String setKey, Collection<String> members) {
        if (members.isEmpty()) return;
        RSet<String> set = redissonClient.getSet(setKey, StringCodec.INSTANCE);
        await(set.removeAllAsync(members), "SREM " + setKey);
    }

    @Override
    public Iterable<String> scanKeys(String pattern) {
        String operation = "SCAN " + (pattern != null ? pattern : "*");
        long deadline = System.nanoTime() + operationTimeout.toNanos();
        List<String> collected = new ArrayList<>();
        try {
            RKeys keys = redissonClient.getKeys();
            // Redisson pages the cursor lazily, so every page is fetched here under the deadline
            Iterable<String> cursor = pattern != null ? keys.getKeysByPattern(pattern) : keys.getKeys();
            for (String key : cursor) {
                collected.add(key);
                if (System.nanoTime() - deadline > 0) {
                    throw new KeyValueClientException(operation + " timed out after "
                            + operationTimeout.toMillis() + " ms with " + collected.size() + " keys read");
                }
            }
        } catch (KeyValueClientException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new KeyValueClientException(operation + " failed", e);
        }
        return collected;
    }

    @Override
    public boolean supportsPatternScan() {
        return true;
    }

    @Override
    public Optional<KeyValueBatch> newBatch() {
        BatchOptions options = BatchOptions.defaults()
                .executionMode(BatchOptions.ExecutionMode.IN_MEMORY_ATOMIC)
                .responseTimeout(operationTimeout.toMillis(), TimeUnit.MILLISECONDS);
        return Optional.of(new RedissonBatch(redissonClient.createBatch(options)));
    }

    private <T> T await(RFuture<T> future, String operation) {
        try {
            return future.get(operationTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(false);
            throw new KeyValueClientException(operation + " timed out after " + operationTimeout.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            throw new KeyValueClientException(operation + " failed", e.getCause() != null ? e.getCause() : e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new KeyValueClientException(operation + " interrupted", e);
        } catch (RuntimeException e) {
            throw new KeyValueClientException(operation + " failed", e);
        }
    }

    private static boolean expires(Duration ttl) {
        return ttl != null && !ttl.isZero() && !ttl.isNegative();
    }

    private class RedissonBatch implements KeyValueBatch {
        private final RBatch batch;
        private int operations;

        RedissonBatch(RBatch batch) {
            this.batch = batch;
        }

        @Override
        public KeyValueBatch set(String key, byte[] value, Duration ttl) {
            RBucketAsync<byte[]> bucket = batch.getBucket(key, ByteArrayCodec.INSTANCE);
            if (expires(ttl)) {
                bucket.setAsync(value, ttl.toMillis(), TimeUnit.MILLISECONDS);
            } else {
                bucket.setAsync(value);
            }
            operations++;
            return this;
        }

        @Override
        public KeyValueBatch putFields(String hashKey, Map<String, String> fields, Duration ttl) {
            RMapAsync<String, String> map = batch.getMap(hashKey, StringCodec.INSTANCE);
            map.putAllAsync(fields);
            if (expires(ttl)) {
                map.expireAsync(ttl.toMillis(), TimeUnit.MILLISECONDS);
            }
            operations++;
            return this;
        }

        @Override
        public KeyValueBatch addMembers(String setKey, Collection<String> members, Duration ttl) {
            if (members.isEmpty()) return this;
            RSetAsync<String> set = batch.getSet(setKey, StringCodec.INSTANCE);
            set.addAllAsync(members);
            if (expires(ttl)) {
                set.expireAsync(ttl.toMillis(), TimeUnit.MILLISECONDS);
            }
            operations++;
            return this;
        }

        @Override
        public KeyValueBatch removeMembers(String setKey, Collection<String> members) {
            if (members.isEmpty()) return this;
            RSetAsync<String> set = batch.getSet(setKey, StringCodec.INSTANCE);
            set.removeAllAsync(members);
            operations++;
            return this;
        }

        @Override
        public KeyValueBatch delete(Collection<String> keys) {
            if (keys.isEmpty()) return this;
            batch.getKeys().deleteAsync(keys.toArray(new String[0]));
            operations++;
            return this;
        }

        @Override
        public void execute() {
            if (operations == 0) return;
            await(batch.executeAsync(), "batch of " + operations + " operations");
        }
    }
}
