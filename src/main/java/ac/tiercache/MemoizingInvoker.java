package ac.tiercache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.*;
import java.util.function.Function;

/**
 * Caches function results in a {@link MultiLevelCacheManager}.
 * <p>
 * The cache is consulted first; on a miss the function runs and a non-null result is
 * stored with the configured per-tier TTLs, tags and levels. Without a manager every
 * call goes straight to the function. Cache faults are logged, never thrown.
 *
 * <pre>{@code
 * MemoizingInvoker invoker = MemoizingInvoker.builder(manager)
 *         .keyPrefix("user")
 *         .ttl(CacheLevel.L1, Duration.ofMinutes(1))
 *         .tags("users")
 *         .build();
 * User user = invoker.call(() -> repository.load(42), 42);   // key "user:42"
 * }</pre>
 */
public class MemoizingInvoker {
    private static final Logger logger = LoggerFactory.getLogger(MemoizingInvoker.class);

    private final MultiLevelCacheManager manager;
    private final String keyPrefix;
    private final Map<CacheLevel, Duration> ttls;
    private final List<String> tags;
    private final Set<CacheLevel> levels;

    private MemoizingInvoker(Builder builder) {
        this.manager = builder.manager;
        this.keyPrefix = builder.keyPrefix;
        this.ttls = Collections.unmodifiableMap(new EnumMap<>(builder.ttls));
        this.tags = List.copyOf(builder.tags);
        this.levels = builder.levels.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(builder.levels));
    }

    public static Builder builder(MultiLevelCacheManager manager) {
        return new Builder(manager);
    }

    public String keyFor(Object... args) {
        return CacheKeyGenerator.generate(keyPrefix, args);
    }

    /**
     * Memoizes under the key derived from the prefix and {@code args}.
     */
    public <T, E extends Throwable> T call(CacheLoader<T, E> loader, Object... args) throws E {
        return invoke(keyFor(args), loader);
    }

    @SuppressWarnings("unchecked")
    public <T, E extends Throwable> T invoke(String key, CacheLoader<T, E> loader) throws E {
        if (manager == null) {
            return loader.load();
        }

        try {
            Optional<Object> cached = manager.get(key);
            if (cached.isPresent()) {
                return (T) cached.get();
            }
        } catch (RuntimeException e) {
            logger.warn("Cache lookup failed for key {}, invoking directly: {}", key, e.getMessage());
        }

        T result = loader.load();

        if (result != null) {
            try {
                manager.set(key, result, ttls, tags, levels);
            } catch (RuntimeException e) {
                logger.warn("Failed to cache result for key {}: {}", key, e.getMessage());
            }
        }
        return result;
    }

    public <A, R> Function<A, R> memoize(Function<A, R> function) {
        Objects.requireNonNull(function, "Function cannot be null");
        return arg -> call(() -> function.apply(arg), arg);
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }

    public Map<CacheLevel, Duration> getTtls() {
        return ttls;
    }

    public List<String> getTags() {
        return tags;
    }

    public Set<CacheLevel> getLevels() {
        return levels;
    }

    public static final class Builder {
        private final MultiLevelCacheManager manager;
        private String keyPrefix;
        private final Map<CacheLevel, Duration> ttls = new EnumMap<>(CacheLevel.class);
        private final List<String> tags = new ArrayList<>();
        private final Set<CacheLevel> levels = EnumSet.noneOf(CacheLevel.class);

        private Builder(MultiLevelCacheManager manager) {
            this.manager = manager;
        }

        public Builder keyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
            return this;
        }

        public Builder ttl(CacheLevel level, Duration ttl) {
            if (ttl != null) {
                ttls.put(level, ttl);
            }
            return this;
        }

        public Builder tags(String... tags) {
            this.tags.addAll(Arrays.asList(tags));
            return this;
        }

        public Builder levels(CacheLevel... levels) {
            this.levels.addAll(Arrays.asList(levels));
            return this;
        }

        public MemoizingInvoker build() {
            if (keyPrefix == null || keyPrefix.isBlank()) {
                throw new IllegalArgumentException("Key prefix cannot be blank");
            }
            return new MemoizingInvoker(this);
        }
    }
}
