package ac.tiercache.spring.service;

import ac.tiercache.MultiLevelCacheManager;
import org.springframework.cache.Cache;
import org.springframework.cache.support.SimpleValueWrapper;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Spring {@link Cache} view over one namespace of the multi-level cache.
 * Entries are stored under {@code <name>::<key>}, written with the cache's
 * {@link SpringCacheSettings} and tagged {@code spring-cache:<name>}; {@link #clear()}
 * invalidates that tag, so it also reaches entries promoted into other tiers.
 */
public class TieredSpringCache implements Cache {

    static final String SEPARATOR = "::";
    static final String TAG_PREFIX = "spring-cache:";

    private final String name;
    private final MultiLevelCacheManager cacheManager;
    private final SpringCacheSettings settings;
    private final List<String> tags;

    public TieredSpringCache(String name, MultiLevelCacheManager cacheManager) {
        this(name, cacheManager, SpringCacheSettings.defaults());
    }

    public TieredSpringCache(String name, MultiLevelCacheManager cacheManager, SpringCacheSettings settings) {
        this.name = Objects.requireNonNull(name, "Cache name cannot be null");
        this.cacheManager = Objects.requireNonNull(cacheManager, "Cache manager cannot be null");
        this.settings = settings != null ? settings : SpringCacheSettings.defaults();
        this.tags = List.of(cacheTag());
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Object getNativeCache() {
        return cacheManager;
    }

    @Override
    @Nullable
    public ValueWrapper get(Object key) {
        if (key == null) return null;

        return cacheManager.get(qualify(key))
                .map(SimpleValueWrapper::new)
                .orElse(null);
    }

    @Override
    @Nullable
    public <T> T get(Object key, @Nullable Class<T> type) {
        if (key == null) return null;

        Object value = cacheManager.get(qualify(key)).orElse(null);
        if (value != null && type != null && !type.isInstance(value)) {
            throw new IllegalStateException("Cached value for key '" + key + "' is not of required type ["
                    + type.getName() + "]: " + value.getClass().getName());
        }
        @SuppressWarnings("unchecked")
        T typed = (T) value;
        return typed;
    }

    @Override
    @Nullable
    @SuppressWarnings("unchecked")
    public <T> T get(Object key, Callable<T> valueLoader) {
        String qualifiedKey = qualify(key);
        Object cached = cacheManager.get(qualifiedKey).orElse(null);
        if (cached != null) {
            return (T) cached;
        }

        T value;
        try {
            value = valueLoader.call();
        } catch (Exception e) {
            throw new ValueRetrievalException(key, valueLoader, e);
        }
        if (value != null) {
            write(qualifiedKey, value);
        }
        return value;
    }

    @Override
    public void put(Object key, @Nullable Object value) {
        if (key != null && value != null) {
            write(qualify(key), value);
        }
    }

    @Override
    @Nullable
    public ValueWrapper putIfAbsent(Object key, @Nullable Object value) {
        if (key == null) return null;

        ValueWrapper existing = get(key);
        if (existing == null && value != null) {
            put(key, value);
        }
        return existing;
    }

    @Override
    public void evict(Object key) {
        if (key != null) {
            cacheManager.delete(qualify(key));
        }
    }

    @Override
    public boolean evictIfPresent(Object key) {
        if (key != null) {
            boolean existed = get(key) != null;
            evict(key);
            return existed;
        }
        return false;
    }

    @Override
    public void clear() {
        cacheManager.invalidateByTag(cacheTag());
    }

    public SpringCacheSettings getSettings() {
        return settings;
    }

    private void write(String qualifiedKey, Object value) {
        cacheManager.set(qualifiedKey, value, settings.getTtls(), tags, settings.getLevels());
    }

    String qualify(Object key) {
        return name + SEPARATOR + key;
    }

    String cacheTag() {
        return TAG_PREFIX + name;
    }
}
