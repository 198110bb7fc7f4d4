package ac.tiercache;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.Optional;

/**
 * One backing store in the cache hierarchy.
 * <p>
 * TTL convention for {@link #set}: {@code null} uses {@link #getDefaultTtl()},
 * zero or negative never expires, anything else expires after that duration.
 * Implementations report backend failures with {@link TierAccessException};
 * an absent or expired key is an empty {@code Optional}.
 */
public interface TierStore extends AutoCloseable {

    CacheLevel getLevel();

    Duration getDefaultTtl();

    Optional<CacheEntry> getEntry(String key);

    default Optional<Object> get(String key) {
        return getEntry(key).map(CacheEntry::getValue);
    }

    boolean set(String key, Object value, Duration ttl, Collection<String> tags);

    default boolean set(String key, Object value) {
        return set(key, value, null, Collections.emptyList());
    }

    default boolean set(String key, Object value, Duration ttl) {
        return set(key, value, ttl, Collections.emptyList());
    }

    boolean delete(String key);

    int invalidateByTag(String tag);

    int invalidateByPrefix(String prefix);

    void clear();

    @Override
    default void close() {
    }

    /**
     * Resolves an absolute expiry from a TTL following the convention above.
     */
    static Instant resolveExpiry(Instant now, Duration ttl, Duration defaultTtl) {
        Duration effective = ttl != null ? ttl : defaultTtl;
        if (effective == null || effective.isZero() || effective.isNegative()) {
            return null;
        }
        return now.plus(effective);
    }
}
