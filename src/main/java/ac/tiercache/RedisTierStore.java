package ac.tiercache;

import ac.tiercache.backend.KeyValueBatch;
import ac.tiercache.backend.KeyValueClient;
import ac.tiercache.backend.KeyValueClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

/**
 * L2: entries kept in a networked key-value service, TTL enforced by the backend.
 * <p>
 * Record layout under the namespace:
 * <ul>
 *   <li>{@code value:<key>} serialized value</li>
 *   <li>{@code meta:<key>} hash of created_at, accessed_at, access_count</li>
 *   <li>{@code tags:<key>} set of the entry's tags</li>
 *   <li>{@code tag:<tag>} set of keys carrying the tag</li>
 * </ul>
 * Without a batching backend, writes go value first, then metadata, then tag records,
 * so an interrupted write never loses the value.
 * <p>
 * Writes and deletes of one key are serialized in this process by striped locks, so
 * the read of a key's old tags and the rewrite of its tag records never interleave
 * with another writer of that key. {@code tag:<tag>} sets carry no TTL; members whose
 * value has expired are dropped by {@link #pruneTagIndexes()}, optionally on a timer.
 */
public class RedisTierStore implements TierStore {
    private static final Logger logger = LoggerFactory.getLogger(RedisTierStore.class);

    public static final String DEFAULT_NAMESPACE = "tiercache:";

    static final String VALUE_PREFIX = "value:";
    static final String META_PREFIX = "meta:";
    static final String TAGS_PREFIX = "tags:";
    static final String TAG_INDEX_PREFIX = "tag:";

    static final String CREATED_AT = "created_at";
    static final String ACCESSED_AT = "accessed_at";
    static final String ACCESS_COUNT = "access_count";

    private static final int LOCK_STRIPES = 64;

    private final KeyValueClient client;
    private final ValueSerializer serializer;
    private final String namespace;
    private final Duration defaultTtl;
    private final Clock clock;
    private final ReentrantLock[] keyLocks = newStripes();
    private final BackgroundSweeper pruner;

    public RedisTierStore(KeyValueClient client, ValueSerializer serializer, String namespace, Duration defaultTtl) {
        this(client, serializer, namespace, defaultTtl, null, Clock.systemUTC());
    }

    public RedisTierStore(KeyValueClient client, ValueSerializer serializer, String namespace,
                          Duration defaultTtl, Clock clock) {
        this(client, serializer, namespace, defaultTtl, null, clock);
    }

    /**
     * @param pruneInterval period of the background tag-index pruning; {@code null} disables it
     */
    public RedisTierStore(KeyValueClient client, ValueSerializer serializer, String namespace,
                          Duration defaultTtl, Duration pruneInterval, Clock clock) {
        this.client = Objects.requireNonNull(client, "Key-value client cannot be null");
        this.serializer = Objects.requireNonNull(serializer, "Serializer cannot be null");
        this.namespace = namespace != null ? namespace : DEFAULT_NAMESPACE;
        this.defaultTtl = defaultTtl;
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        if (BackgroundSweeper.isEnabled(pruneInterval)) {
            this.pruner = new BackgroundSweeper("tiercache-redis-tag-pruner", pruneInterval, this::pruneTagIndexes);
            this.pruner.start();
        } else {
            this.pruner = null;
        }
        logger.info("L2 redis tier initialized with namespace={}, defaultTtl={}, batching={}, pruneInterval={}",
                this.namespace, defaultTtl, client.newBatch().isPresent(), pruneInterval);
    }

    @Override
    public CacheLevel getLevel() {
        return CacheLevel.L2;
    }

    @Override
    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    // ==================== GET ====================

    @Override
    public Optional<CacheEntry> getEntry(String key) {
        if (key == null) return Optional.empty();

        byte[] data;
        Set<String> tags;
        try {
            data = client.get(valueKey(key));
            if (data == null) {
                return Optional.empty();
            }
            tags = client.members(tagsKey(key));
        } catch (KeyValueClientException e) {
            throw new TierAccessException(CacheLevel.L2, "Error reading key '" + key + "' from Redis", e);
        }

        Object value = deserialize(key, data);
        Instant now = clock.instant();
        CacheEntry entry = toEntry(key, value, tags, readMetadata(key), now);
        entry.recordAccess(now);
        touchMetadata(key, now);
        return Optional.of(entry);
    }

    private Map<String, String> readMetadata(String key) {
        try {
            return client.getFields(metaKey(key));
        } catch (KeyValueClientException e) {
            logger.debug("Could not read metadata for key={}: {}", key, e.getMessage());
            return Collections.emptyMap();
        }
    }

    private void touchMetadata(String key, Instant now) {
        String metaKey = metaKey(key);
        try {
            client.incrementFieldAsync(metaKey, ACCESS_COUNT, 1)
                    .thenCompose(ignored -> client.putFieldAsync(metaKey, ACCESSED_AT, Long.toString(now.toEpochMilli())))
                    .whenComplete((ignored, error) -> {
                        if (error != null) {
                            logger.debug("Access metadata update failed for key={}: {}", key, error.getMessage());
                        }
                    });
        } catch (RuntimeException e) {
            logger.debug("Access metadata update failed for key={}: {}", key, e.getMessage());
        }
    }

    private CacheEntry toEntry(String key, Object value, Set<String> tags, Map<String, String> meta, Instant now) {
        Instant createdAt = parseInstant(meta.get(CREATED_AT), now);
        Instant accessedAt = parseInstant(meta.get(ACCESSED_AT), createdAt);
        long accessCount = parseLong(meta.get(ACCESS_COUNT));
        // expiry is tracked by the backend, not mirrored client side
        return new CacheEntry(key, value, null, tags, createdAt, accessedAt, accessCount);
    }

    // ==================== SET ====================

    @Override
    public boolean set(String key, Object value, Duration ttl, Collection<String> tags) {
        if (key == null || value == null) {
            throw new IllegalArgumentException("Key and value cannot be null");
        }

        Duration effectiveTtl = ttl != null ? ttl : defaultTtl;
        Set<String> newTags = tags == null ? Collections.emptySet() : new LinkedHashSet<>(tags);
        byte[] data = serialize(key, value);
        String now = Long.toString(clock.instant().toEpochMilli());
        Map<String, String> meta = new HashMap<>();
        meta.put(CREATED_AT, now);
        meta.put(ACCESSED_AT, now);
        meta.put(ACCESS_COUNT, "0");

        ReentrantLock lock = keyLock(key);
        lock.lock();
        try {
            Set<String> oldTags = client.members(tagsKey(key));
            Set<String> staleTags = new HashSet<>(oldTags);
            staleTags.removeAll(newTags);

            Optional<KeyValueBatch> batch = client.newBatch();
            if (batch.isPresent()) {
                KeyValueBatch b = batch.get();
                b.set(valueKey(key), data, effectiveTtl);
                b.delete(List.of(metaKey(key), tagsKey(key)));
                b.putFields(metaKey(key), meta, effectiveTtl);
                b.addMembers(tagsKey(key), newTags, effectiveTtl);
                for (String tag : staleTags) {
                    b.removeMembers(tagIndexKey(tag), List.of(key));
                }
                for (String tag : newTags) {
                    b.addMembers(tagIndexKey(tag), List.of(key), null);
                }
                b.execute();
            } else {
                client.set(valueKey(key), data, effectiveTtl);
                client.delete(List.of(metaKey(key), tagsKey(key)));
                client.putFields(metaKey(key), meta, effectiveTtl);
                client.addMembers(tagsKey(key), newTags, effectiveTtl);
                for (String tag : staleTags) {
                    client.removeMembers(tagIndexKey(tag), List.of(key));
                }
                for (String tag : newTags) {
                    client.addMembers(tagIndexKey(tag), List.of(key), null);
                }
            }
            return true;
        } catch (KeyValueClientException e) {
            throw new TierAccessException(CacheLevel.L2, "Error writing key '" + key + "' to Redis", e);
        } finally {
            lock.unlock();
        }
    }

    // ==================== DELETE / INVALIDATE ====================

    @Override
    public boolean delete(String key) {
        if (key == null) return false;

        ReentrantLock lock = keyLock(key);
        lock.lock();
        try {
            Set<String> tags = client.members(tagsKey(key));
            boolean existed = client.delete(valueKey(key));
            client.delete(List.of(metaKey(key), tagsKey(key)));
            for (String tag : tags) {
                client.removeMembers(tagIndexKey(tag), List.of(key));
            }
            return existed;
        } catch (KeyValueClientException e) {
            throw new TierAccessException(CacheLevel.L2, "Error deleting key '" + key + "' from Redis", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int invalidateByTag(String tag) {
        Set<String> keys;
        try {
            keys = client.members(tagIndexKey(tag));
        } catch (KeyValueClientException e) {
            throw new TierAccessException(CacheLevel.L2, "Error reading tag index '" + tag + "'", e);
        }

        int count = 0;
        for (String key : keys) {
            if (delete(key)) {
                count++;
            }
        }

        try {
            client.delete(tagIndexKey(tag));
        } catch (KeyValueClientException e) {
            throw new TierAccessException(CacheLevel.L2, "Error dropping tag index '" + tag + "'", e);
        }
        return count;
    }

    @Override
    public int invalidateByPrefix(String prefix) {
        String valuePrefix = namespace + VALUE_PREFIX;
        String fullPrefix = valuePrefix + prefix;

        List<String> matchingKeys = new ArrayList<>();
        try {
            Iterable<String> candidates = client.supportsPatternScan()
                    ? client.scanKeys(escapeGlob(fullPrefix) + "*")
                    : client.scanKeys(null);
            // only value records count; meta/tags/tag-index records live outside value:
            for (String candidate : candidates) {
                if (candidate.startsWith(fullPrefix)) {
                    matchingKeys.add(candidate.substring(valuePrefix.length()));
                }
            }
        } catch (KeyValueClientException e) {
            throw new TierAccessException(CacheLevel.L2, "Error scanning keys with prefix '" + prefix + "'", e);
        }

        int count = 0;
        for (String key : matchingKeys) {
            if (delete(key)) {
                count++;
            }
        }
        return count;
    }

    @Override
    public void clear() {
        try {
            List<String> keys = new ArrayList<>();
            Iterable<String> candidates = client.supportsPatternScan()
                    ? client.scanKeys(escapeGlob(namespace) + "*")
                    : client.scanKeys(null);
            for (String candidate : candidates) {
                if (candidate.startsWith(namespace)) {
                    keys.add(candidate);
                }
            }
            long removed = client.delete(keys);
            logger.debug("Cleared {} Redis records under namespace {}", removed, namespace);
        } catch (KeyValueClientException e) {
            throw new TierAccessException(CacheLevel.L2, "Error clearing namespace " + namespace, e);
        }
    }

    // ==================== TAG INDEX PRUNING ====================

    /**
     * Removes members of every {@code tag:<tag>} set whose value record no longer exists,
     * usually because its TTL ran out. Emptied index sets disappear with their last member.
     *
     * @param cancelled checked between tag indexes; the sweep stops early once it returns true
     * @return number of index members removed
     */
    public int pruneTagIndexes(BooleanSupplier cancelled) {
        String indexPrefix = namespace + TAG_INDEX_PREFIX;
        List<String> indexKeys = new ArrayList<>();
        try {
            Iterable<String> candidates = client.supportsPatternScan()
                    ? client.scanKeys(escapeGlob(indexPrefix) + "*")
                    : client.scanKeys(null);
            for (String candidate : candidates) {
                if (candidate.startsWith(indexPrefix)) {
                    indexKeys.add(candidate);
                }
            }
        } catch (KeyValueClientException e) {
            throw new TierAccessException(CacheLevel.L2, "Error scanning tag indexes under " + namespace, e);
        }

        int pruned = 0;
        for (String indexKey : indexKeys) {
            if (cancelled.getAsBoolean()) {
                logger.debug("Tag index pruning cancelled after {} members", pruned);
                break;
            }
            pruned += pruneIndex(indexKey);
        }
        if (pruned > 0) {
            logger.debug("Pruned {} dead members from {} tag indexes", pruned, indexKeys.size());
        }
        return pruned;
    }

    public int pruneTagIndexes() {
        return pruneTagIndexes(() -> false);
    }

    private int pruneIndex(String indexKey) {
        int pruned = 0;
        try {
            for (String key : client.members(indexKey)) {
                // under the key lock a concurrent set cannot re-add the key between the check and the removal
                ReentrantLock lock = keyLock(key);
                lock.lock();
                try {
                    if (!client.exists(valueKey(key))) {
                        client.removeMembers(indexKey, List.of(key));
                        pruned++;
                    }
                } finally {
                    lock.unlock();
                }
            }
        } catch (KeyValueClientException e) {
            throw new TierAccessException(CacheLevel.L2, "Error pruning tag index " + indexKey, e);
        }
        return pruned;
    }

    public boolean isPrunerRunning() {
        return pruner != null && pruner.isRunning();
    }

    @Override
    public void close() {
        if (pruner != null) {
            pruner.close();
        }
    }

    // ==================== HELPERS ====================

    private ReentrantLock keyLock(String key) {
        return keyLocks[stripe(key)];
    }

    private static int stripe(String key) {
        return (key.hashCode() & 0x7fffffff) % LOCK_STRIPES;
    }

    private static ReentrantLock[] newStripes() {
        ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
        return locks;
    }

    private byte[] serialize(String key, Object value) {
        try {
            return serializer.serialize(value);
        } catch (IOException | RuntimeException e) {
            throw new TierAccessException(CacheLevel.L2, "Cannot serialize value for key '" + key + "'", e);
        }
    }

    private Object deserialize(String key, byte[] data) {
        try {
            return serializer.deserialize(data);
        } catch (IOException | RuntimeException e) {
            throw new TierAccessException(CacheLevel.L2, "Cannot deserialize value for key '" + key + "'", e);
        }
    }

    String valueKey(String key) {
        return namespace + VALUE_PREFIX + key;
    }

    String metaKey(String key) {
        return namespace + META_PREFIX + key;
    }

    String tagsKey(String key) {
        return namespace + TAGS_PREFIX + key;
    }

    String tagIndexKey(String tag) {
        return namespace + TAG_INDEX_PREFIX + tag;
    }

    static String escapeGlob(String literal) {
        StringBuilder sb = new StringBuilder(literal.length());
        for (char c : literal.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    private static Instant parseInstant(String epochMillis, Instant fallback) {
        if (epochMillis == null) return fallback;
        try {
            return Instant.ofEpochMilli((long) Double.parseDouble(epochMillis));
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static long parseLong(String number) {
        if (number == null) return 0L;
        try {
            return (long) Double.parseDouble(number);
        } catch (NumberFormatException e) {
            return 0L;
        }
    }
}
