package ac.tiercache;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-tier counters for the multi-level cache.
 * Thread-safe; every counter is an independent atomic.
 */
public class CacheStatistics {
    private final AtomicLong requests = new AtomicLong(0);
    private final AtomicLong promotions = new AtomicLong(0);
    private final Map<CacheLevel, LevelCounters> levels = new EnumMap<>(CacheLevel.class);

    private volatile LocalDateTime createdAt = LocalDateTime.now();
    private volatile LocalDateTime lastResetAt = createdAt;

    public CacheStatistics() {
        for (CacheLevel level : CacheLevel.values()) {
            levels.put(level, new LevelCounters());
        }
    }

    // ==================== RECORDING ====================

    public void recordRequest() {
        requests.incrementAndGet();
    }

    public void recordHit(CacheLevel level) {
        levels.get(level).hits.incrementAndGet();
    }

    public void recordMiss(CacheLevel level) {
        levels.get(level).misses.incrementAndGet();
    }

    public void recordWrite(CacheLevel level) {
        levels.get(level).writes.incrementAndGet();
    }

    public void recordError(CacheLevel level) {
        levels.get(level).errors.incrementAndGet();
    }

    public void recordPromotion() {
        promotions.incrementAndGet();
    }

    // ==================== GETTERS ====================

    public long getRequests() {
        return requests.get();
    }

    public long getHits() {
        return levels.values().stream().mapToLong(c -> c.hits.get()).sum();
    }

    /** Requests that no tier could answer. */
    public long getMisses() {
        return Math.max(0, getRequests() - getHits());
    }

    public double getHitRate() {
        long total = getRequests();
        return total > 0 ? (double) getHits() / total : 0.0;
    }

    public long getHits(CacheLevel level) {
        return levels.get(level).hits.get();
    }

    public long getMisses(CacheLevel level) {
        return levels.get(level).misses.get();
    }

    public long getWrites(CacheLevel level) {
        return levels.get(level).writes.get();
    }

    public long getErrors(CacheLevel level) {
        return levels.get(level).errors.get();
    }

    public double getHitRate(CacheLevel level) {
        long total = getHits(level) + getMisses(level);
        return total > 0 ? (double) getHits(level) / total : 0.0;
    }

    public long getPromotions() {
        return promotions.get();
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public LocalDateTime getLastResetAt() {
        return lastResetAt;
    }

    /**
     * Resets all counters to zero and updates the lastResetAt timestamp.
     */
    public void reset() {
        requests.set(0);
        promotions.set(0);
        levels.values().forEach(LevelCounters::reset);
        lastResetAt = LocalDateTime.now();
    }

    public Snapshot getSnapshot() {
        Map<CacheLevel, LevelSnapshot> perLevel = new EnumMap<>(CacheLevel.class);
        levels.forEach((level, counters) -> perLevel.put(level, new LevelSnapshot(
                counters.hits.get(), counters.misses.get(), counters.writes.get(), counters.errors.get())));
        return new Snapshot(getRequests(), getPromotions(), perLevel, createdAt, lastResetAt);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(String.format(
                "CacheStatistics{requests=%d, hits=%d, hitRate=%.2f%%, promotions=%d",
                getRequests(), getHits(), getHitRate() * 100, getPromotions()));
        for (CacheLevel level : CacheLevel.values()) {
            sb.append(String.format(", %s[hits=%d, misses=%d, writes=%d, errors=%d]",
                    level, getHits(level), getMisses(level), getWrites(level), getErrors(level)));
        }
        return sb.append('}').toString();
    }

    private static final class LevelCounters {
        final AtomicLong hits = new AtomicLong(0);
        final AtomicLong misses = new AtomicLong(0);
        final AtomicLong writes = new AtomicLong(0);
        final AtomicLong errors = new AtomicLong(0);

        void reset() {
            hits.set(0);
            misses.set(0);
            writes.set(0);
            errors.set(0);
        }
    }

    /**
     * Counters of one tier at a point in time.
     */
    public static class LevelSnapshot {
        private final long hits;
        private final long misses;
        private final long writes;
        private final long errors;

        public LevelSnapshot(long hits, long misses, long writes, long errors) {
            this.hits = hits;
            this.misses = misses;
            this.writes = writes;
            this.errors = errors;
        }

        public long getHits() { return hits; }
        public long getMisses() { return misses; }
        public long getWrites() { return writes; }
        public long getErrors() { return errors; }
    }

    /**
     * Immutable snapshot of cache statistics at a point in time.
     */
    public static class Snapshot {
        private final long requests;
        private final long promotions;
        private final Map<CacheLevel, LevelSnapshot> levels;
        private final LocalDateTime createdAt;
        private final LocalDateTime lastResetAt;
        private final LocalDateTime snapshotAt;

        public Snapshot(long requests, long promotions, Map<CacheLevel, LevelSnapshot> levels,
                        LocalDateTime createdAt, LocalDateTime lastResetAt) {
            this.requests = requests;
            this.promotions = promotions;
            this.levels = Collections.unmodifiableMap(new EnumMap<>(levels));
            this.createdAt = createdAt;
            this.lastResetAt = lastResetAt;
            this.snapshotAt = LocalDateTime.now();
        }

        public long getRequests() { return requests; }
        public long getPromotions() { return promotions; }
        public LevelSnapshot getLevel(CacheLevel level) { return levels.get(level); }
        public long getHits() { return levels.values().stream().mapToLong(LevelSnapshot::getHits).sum(); }
        public double getHitRate() { return requests > 0 ? (double) getHits() / requests : 0.0; }
        public LocalDateTime getCreatedAt() { return createdAt; }
        public LocalDateTime getLastResetAt() { return lastResetAt; }
        public LocalDateTime getSnapshotAt() { return snapshotAt; }
    }
}
