package ac.tiercache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Composes up to three tiers into one cache.
 * <p>
 * Reads go L1, L2, L3 and stop at the first hit; a hit in a slower tier is copied,
 * tags included, into every faster configured tier using that tier's default TTL.
 * Writes and invalidations fan out to the requested tiers (all configured tiers when
 * none are named). A failing tier is logged and counted, never propagated: reads fall
 * through to the next tier, writes report {@code false}, invalidations count zero for it.
 * <p>
 * Any tier may be absent. Requests naming an absent tier skip it.
 */
public class MultiLevelCacheManager {
    private static final Logger logger = LoggerFactory.getLogger(MultiLevelCacheManager.class);

    private final Map<CacheLevel, TierStore> tiers = new EnumMap<>(CacheLevel.class);
    private final CacheStatistics statistics;
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public MultiLevelCacheManager(TierStore l1, TierStore l2, TierStore l3) {
        this(l1, l2, l3, new CacheStatistics());
    }

    public MultiLevelCacheManager(TierStore l1, TierStore l2, TierStore l3, CacheStatistics statistics) {
        register(CacheLevel.L1, l1);
        register(CacheLevel.L2, l2);
        register(CacheLevel.L3, l3);
        this.statistics = Objects.requireNonNull(statistics, "Statistics cannot be null");
        logger.info("Multi-level cache initialized with tiers {}", tiers.keySet());
    }

    private void register(CacheLevel level, TierStore tier) {
        if (tier == null) return;
        if (tier.getLevel() != level) {
            throw new IllegalArgumentException("Tier " + tier.getClass().getSimpleName()
                    + " serves " + tier.getLevel() + ", cannot be registered as " + level);
        }
        tiers.put(level, tier);
    }

    // ==================== GET ====================

    public Optional<Object> get(String key) {
        validateKey(key);
        statistics.recordRequest();

        for (Map.Entry<CacheLevel, TierStore> tier : tiers.entrySet()) {
            CacheLevel level = tier.getKey();
            Optional<CacheEntry> entry;
            try {
                entry = tier.getValue().getEntry(key);
            } catch (RuntimeException e) {
                logger.warn("{} read failed for key {}, falling through: {}", level, key, e.getMessage());
                statistics.recordError(level);
                continue;
            }

            if (entry.isPresent()) {
                statistics.recordHit(level);
                promote(entry.get(), level);
                return Optional.of(entry.get().getValue());
            }
            statistics.recordMiss(level);
        }
        return Optional.empty();
    }

    /**
     * Reads a single tier without promotion.
     */
    public Optional<Object> get(String key, CacheLevel level) {
        validateKey(key);
        TierStore tier = tiers.get(level);
        if (tier == null) {
            logger.debug("Level {} not configured, get({}) skipped", level, key);
            return Optional.empty();
        }

        statistics.recordRequest();
        try {
            Optional<Object> value = tier.get(key);
            if (value.isPresent()) {
                statistics.recordHit(level);
            } else {
                statistics.recordMiss(level);
            }
            return value;
        } catch (RuntimeException e) {
            logger.warn("{} read failed for key {}: {}", level, key, e.getMessage());
            statistics.recordError(level);
            return Optional.empty();
        }
    }

    public <T> Optional<T> get(String key, Class<T> type) {
        return get(key).filter(type::isInstance).map(type::cast);
    }

    private void promote(CacheEntry entry, CacheLevel foundAt) {
        for (Map.Entry<CacheLevel, TierStore> tier : tiers.entrySet()) {
            CacheLevel target = tier.getKey();
            if (target.compareTo(foundAt) >= 0) break;
            try {
                if (tier.getValue().set(entry.getKey(), entry.getValue(), null, entry.getTags())) {
                    statistics.recordPromotion();
                    logger.debug("Promoted key {} from {} to {}", entry.getKey(), foundAt, target);
                }
            } catch (RuntimeException e) {
                logger.warn("Promotion of key {} from {} to {} failed: {}",
                        entry.getKey(), foundAt, target, e.getMessage());
                statistics.recordError(target);
            }
        }
    }

    // ==================== SET ====================

    public boolean set(String key, Object value) {
        return set(key, value, Collections.emptyMap(), Collections.emptyList(), null);
    }

    public boolean set(String key, Object value, Collection<String> tags) {
        return set(key, value, Collections.emptyMap(), tags, null);
    }

    /**
     * Writes the same TTL to every targeted tier.
     */
    public boolean set(String key, Object value, Duration ttl, Collection<String> tags) {
        Map<CacheLevel, Duration> ttls = new EnumMap<>(CacheLevel.class);
        if (ttl != null) {
            for (CacheLevel level : CacheLevel.values()) {
                ttls.put(level, ttl);
            }
        }
        return set(key, value, ttls, tags, null);
    }

    /**
     * @param ttls   per-tier TTL; a tier without an entry uses its own default
     * @param tags   tags attached to the entry in every targeted tier
     * @param levels tiers to write, {@code null} or empty for all configured tiers
     * @return true only if every targeted tier accepted the write
     */
    public boolean set(String key, Object value, Map<CacheLevel, Duration> ttls,
                       Collection<String> tags, Collection<CacheLevel> levels) {
        validateKey(key);
        if (value == null) {
            throw new IllegalArgumentException("Value cannot be null");
        }
        Map<CacheLevel, Duration> tierTtls = ttls != null ? ttls : Collections.emptyMap();
        Collection<String> entryTags = tags != null ? tags : Collections.emptyList();

        List<CacheLevel> failed = new ArrayList<>();
        for (TierStore tier : targets(levels, "set", key)) {
            CacheLevel level = tier.getLevel();
            try {
                if (tier.set(key, value, tierTtls.get(level), entryTags)) {
                    statistics.recordWrite(level);
                } else {
                    failed.add(level);
                }
            } catch (RuntimeException e) {
                logger.warn("{} write failed for key {}: {}", level, key, e.getMessage());
                statistics.recordError(level);
                failed.add(level);
            }
        }

        if (!failed.isEmpty()) {
            logger.warn("Partial write for key {}: failed tiers {}", key, failed);
            return false;
        }
        return true;
    }

    // ==================== DELETE / INVALIDATE ====================

    public boolean delete(String key) {
        return delete(key, null);
    }

    /**
     * @return true only if every targeted tier reported a removal
     */
    public boolean delete(String key, Collection<CacheLevel> levels) {
        validateKey(key);
        boolean allRemoved = true;
        for (TierStore tier : targets(levels, "delete", key)) {
            try {
                allRemoved &= tier.delete(key);
            } catch (RuntimeException e) {
                logger.warn("{} delete failed for key {}: {}", tier.getLevel(), key, e.getMessage());
                statistics.recordError(tier.getLevel());
                allRemoved = false;
            }
        }
        return allRemoved;
    }

    public void clear() {
        clear(null);
    }

    public void clear(Collection<CacheLevel> levels) {
        for (TierStore tier : targets(levels, "clear", null)) {
            try {
                tier.clear();
                logger.info("Cleared {}", tier.getLevel());
            } catch (RuntimeException e) {
                logger.warn("{} clear failed: {}", tier.getLevel(), e.getMessage());
                statistics.recordError(tier.getLevel());
            }
        }
    }

    public int invalidateByTag(String tag) {
        return invalidateByTag(tag, null);
    }

    public int invalidateByTag(String tag, Collection<CacheLevel> levels) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("Tag cannot be blank");
        }
        int total = 0;
        for (TierStore tier : targets(levels, "invalidateByTag", tag)) {
            try {
                total += tier.invalidateByTag(tag);
            } catch (RuntimeException e) {
                logger.warn("{} tag invalidation failed for {}: {}", tier.getLevel(), tag, e.getMessage());
                statistics.recordError(tier.getLevel());
            }
        }
        logger.debug("Invalidated {} entries tagged {}", total, tag);
        return total;
    }

    public int invalidateByPrefix(String prefix) {
        return invalidateByPrefix(prefix, null);
    }

    public int invalidateByPrefix(String prefix, Collection<CacheLevel> levels) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("Prefix cannot be blank");
        }
        int total = 0;
        for (TierStore tier : targets(levels, "invalidateByPrefix", prefix)) {
            try {
                total += tier.invalidateByPrefix(prefix);
            } catch (RuntimeException e) {
                logger.warn("{} prefix invalidation failed for {}: {}", tier.getLevel(), prefix, e.getMessage());
                statistics.recordError(tier.getLevel());
            }
        }
        logger.debug("Invalidated {} entries with prefix {}", total, prefix);
        return total;
    }

    // ==================== LIFECYCLE / INTROSPECTION ====================

    /**
     * Stops background work and closes every tier. Safe to call more than once.
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) return;

        List<TierStore> slowestFirst = new ArrayList<>(tiers.values());
        Collections.reverse(slowestFirst);
        for (TierStore tier : slowestFirst) {
            try {
                tier.close();
            } catch (RuntimeException e) {
                logger.warn("Error closing {}: {}", tier.getLevel(), e.getMessage());
            }
        }
        logger.info("Multi-level cache shut down. Final stats: {}", statistics);
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    public CacheStatistics getStatistics() {
        return statistics;
    }

    public boolean isLevelConfigured(CacheLevel level) {
        return tiers.containsKey(level);
    }

    public Set<CacheLevel> configuredLevels() {
        Set<CacheLevel> levels = EnumSet.noneOf(CacheLevel.class);
        levels.addAll(tiers.keySet());
        return Collections.unmodifiableSet(levels);
    }

    public Optional<TierStore> getTier(CacheLevel level) {
        return Optional.ofNullable(tiers.get(level));
    }

    private List<TierStore> targets(Collection<CacheLevel> levels, String operation, String subject) {
        List<TierStore> targets = new ArrayList<>();
        for (CacheLevel level : CacheLevel.of(levels)) {
            TierStore tier = tiers.get(level);
            if (tier != null) {
                targets.add(tier);
            } else if (levels != null && !levels.isEmpty()) {
                logger.debug("Level {} not configured, {}({}) skipped there", level, operation, subject);
            }
        }
        return targets;
    }

    private static void validateKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Key cannot be empty");
        }
    }
}
