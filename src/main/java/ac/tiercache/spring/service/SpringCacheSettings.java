package ac.tiercache.spring.service;

import ac.tiercache.CacheLevel;

import java.time.Duration;
import java.util.*;

/**
 * Per-cache write settings for {@link TieredSpringCache}: a TTL per tier and the tiers
 * written to. A tier without a TTL uses its own default; no levels means every configured tier.
 */
public final class SpringCacheSettings {

    private static final SpringCacheSettings DEFAULTS =
            new SpringCacheSettings(Collections.emptyMap(), Collections.emptySet());

    private final Map<CacheLevel, Duration> ttls;
    private final Set<CacheLevel> levels;

    private SpringCacheSettings(Map<CacheLevel, Duration> ttls, Set<CacheLevel> levels) {
        this.ttls = ttls;
        this.levels = levels;
    }

    public static SpringCacheSettings defaults() {
        return DEFAULTS;
    }

    public static SpringCacheSettings of(Map<CacheLevel, Duration> ttls, Collection<CacheLevel> levels) {
        Map<CacheLevel, Duration> ttlCopy = new EnumMap<>(CacheLevel.class);
        if (ttls != null) {
            ttls.forEach((level, ttl) -> {
                if (level != null && ttl != null) ttlCopy.put(level, ttl);
            });
        }
        Set<CacheLevel> levelCopy = EnumSet.noneOf(CacheLevel.class);
        if (levels != null) {
            levelCopy.addAll(levels);
        }
        return new SpringCacheSettings(Collections.unmodifiableMap(ttlCopy), Collections.unmodifiableSet(levelCopy));
    }

    public SpringCacheSettings withTtl(CacheLevel level, Duration ttl) {
        Map<CacheLevel, Duration> updated = new EnumMap<>(CacheLevel.class);
        updated.putAll(ttls);
        updated.put(Objects.requireNonNull(level, "Level cannot be null"), Objects.requireNonNull(ttl, "TTL cannot be null"));
        return of(updated, levels);
    }

    public SpringCacheSettings withLevels(CacheLevel... levels) {
        return of(ttls, Arrays.asList(levels));
    }

    public Map<CacheLevel, Duration> getTtls() {
        return ttls;
    }

    /** Empty when every configured tier is written. */
    public Set<CacheLevel> getLevels() {
        return levels;
    }

    @Override
    public String toString() {
        return "SpringCacheSettings{ttls=" + ttls + ", levels=" + (levels.isEmpty() ? "all" : levels) + "}";
    }
}
