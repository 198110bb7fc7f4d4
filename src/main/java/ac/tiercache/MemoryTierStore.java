package ac.tiercache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * L1: bounded in-process store with a tag index and pluggable eviction.
 * <p>
 * Entries, tag index and eviction order share one read/write lock. Reads take the
 * write lock too, since they update access metadata and LRU order.
 */
public class MemoryTierStore implements TierStore {
    private static final Logger logger = LoggerFactory.getLogger(MemoryTierStore.class);

    private final int capacity;
    private final Duration defaultTtl;
    private final EvictionPolicy evictionPolicy;
    private final Clock clock;

    private final Map<String, CacheEntry> entries = new HashMap<>();
    private final Map<String, Set<String>> tagIndex = new HashMap<>();
    // head = next eviction candidate; access order for LRU, insertion order otherwise
    private final LinkedHashSet<String> evictionOrder = new LinkedHashSet<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicLong evictions = new AtomicLong();

    public MemoryTierStore(int capacity, Duration defaultTtl, EvictionPolicy evictionPolicy) {
        this(capacity, defaultTtl, evictionPolicy, Clock.systemUTC());
    }

    public MemoryTierStore(int capacity, Duration defaultTtl, EvictionPolicy evictionPolicy, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("L1 capacity must be at least 1, got " + capacity);
        }
        this.capacity = capacity;
        this.defaultTtl = defaultTtl;
        this.evictionPolicy = Objects.requireNonNull(evictionPolicy, "Eviction policy cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        logger.info("L1 memory tier initialized with capacity={}, policy={}, defaultTtl={}",
                capacity, evictionPolicy, defaultTtl);
    }

    @Override
    public CacheLevel getLevel() {
        return CacheLevel.L1;
    }

    @Override
    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public int getCapacity() {
        return capacity;
    }

    public EvictionPolicy getEvictionPolicy() {
        return evictionPolicy;
    }

    @Override
    public Optional<CacheEntry> getEntry(String key) {
        if (key == null) return Optional.empty();

        lock.writeLock().lock();
        try {
            CacheEntry entry = entries.get(key);
            if (entry == null) {
                return Optional.empty();
            }

            Instant now = clock.instant();
            if (entry.isExpired(now)) {
                removeEntry(key);
                return Optional.empty();
            }

            entry.recordAccess(now);
            if (evictionPolicy == EvictionPolicy.LRU) {
                moveToTail(key);
            }
            // the live entry keeps mutating under the lock, callers get a copy
            return Optional.of(entry.snapshot());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean set(String key, Object value, Duration ttl, Collection<String> tags) {
        if (key == null || value == null) {
            throw new IllegalArgumentException("Key and value cannot be null");
        }

        lock.writeLock().lock();
        try {
            Instant now = clock.instant();
            CacheEntry entry = new CacheEntry(key, value, TierStore.resolveExpiry(now, ttl, defaultTtl), tags, now);

            CacheEntry previous = entries.get(key);
            if (previous != null) {
                unindexTags(key, previous.getTags());
            } else if (entries.size() >= capacity) {
                evictForInsert();
            }

            entries.put(key, entry);
            moveToTail(key);
            for (String tag : entry.getTags()) {
                tagIndex.computeIfAbsent(tag, t -> new HashSet<>()).add(key);
            }
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean delete(String key) {
        if (key == null) return false;

        lock.writeLock().lock();
        try {
            return removeEntry(key);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int invalidateByTag(String tag) {
        lock.writeLock().lock();
        try {
            Set<String> keys = tagIndex.get(tag);
            if (keys == null) {
                return 0;
            }
            int count = 0;
            for (String key : new ArrayList<>(keys)) {
                if (removeEntry(key)) {
                    count++;
                }
            }
            tagIndex.remove(tag);
            return count;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int invalidateByPrefix(String prefix) {
        lock.writeLock().lock();
        try {
            List<String> matching = entries.keySet().stream()
                    .filter(key -> key.startsWith(prefix))
                    .collect(Collectors.toList());
            int count = 0;
            for (String key : matching) {
                if (removeEntry(key)) {
                    count++;
                }
            }
            return count;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void clear() {
        lock.writeLock().lock();
        try {
            entries.clear();
            tagIndex.clear();
            evictionOrder.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ==================== READ-ONLY VIEWS ====================

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean containsKey(String key) {
        lock.readLock().lock();
        try {
            return entries.containsKey(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<String> keys() {
        lock.readLock().lock();
        try {
            return new LinkedHashSet<>(evictionOrder);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<String> keysForTag(String tag) {
        lock.readLock().lock();
        try {
            Set<String> keys = tagIndex.get(tag);
            return keys == null ? Collections.emptySet() : new HashSet<>(keys);
        } finally {
            lock.readLock().unlock();
        }
    }

    public long getEvictionCount() {
        return evictions.get();
    }

    // ==================== INTERNALS (caller holds write lock) ====================

    private void evictForInsert() {
        Instant now = clock.instant();
        List<String> expired = entries.values().stream()
                .filter(entry -> entry.isExpired(now))
                .map(CacheEntry::getKey)
                .collect(Collectors.toList());
        for (String key : expired) {
            removeEntry(key);
        }
        if (!expired.isEmpty()) {
            logger.debug("Reclaimed {} expired L1 entries under capacity pressure", expired.size());
        }

        // TTL has no order of its own; evictionOrder is insertion order for it, i.e. FIFO
        Iterator<String> candidates = evictionOrder.iterator();
        while (entries.size() >= capacity && candidates.hasNext()) {
            String victim = candidates.next();
            candidates.remove();
            CacheEntry removed = entries.remove(victim);
            if (removed != null) {
                unindexTags(victim, removed.getTags());
                evictions.incrementAndGet();
                logger.debug("L1 evicted key={} policy={}", victim, evictionPolicy);
            }
        }
    }

    private boolean removeEntry(String key) {
        CacheEntry entry = entries.remove(key);
        if (entry == null) {
            return false;
        }
        unindexTags(key, entry.getTags());
        evictionOrder.remove(key);
        return true;
    }

    private void unindexTags(String key, Set<String> tags) {
        for (String tag : tags) {
            Set<String> keys = tagIndex.get(tag);
            if (keys != null) {
                keys.remove(key);
                if (keys.isEmpty()) {
                    tagIndex.remove(tag);
                }
            }
        }
    }

    private void moveToTail(String key) {
        evictionOrder.remove(key);
        evictionOrder.add(key);
    }
}
