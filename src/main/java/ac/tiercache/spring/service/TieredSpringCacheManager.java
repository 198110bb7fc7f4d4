// TieredSpringCacheManager.java (backs standard Spring Cache annotations)
package ac.tiercache.spring.service;

import ac.tiercache.MultiLevelCacheManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.lang.Nullable;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Hands out one {@link TieredSpringCache} per name. Caches listed in the per-name settings
 * are created up front with their own TTLs and tiers; any other name is created on first
 * use with the default settings.
 */
public class TieredSpringCacheManager implements CacheManager {
    private static final Logger logger = LoggerFactory.getLogger(TieredSpringCacheManager.class);

    private final MultiLevelCacheManager cacheManager;
    private final SpringCacheSettings defaultSettings;
    private final Map<String, SpringCacheSettings> namedSettings;
    private final ConcurrentMap<String, TieredSpringCache> caches = new ConcurrentHashMap<>();

    public TieredSpringCacheManager(MultiLevelCacheManager cacheManager) {
        this(cacheManager, SpringCacheSettings.defaults(), Collections.emptyMap());
    }

    public TieredSpringCacheManager(MultiLevelCacheManager cacheManager, SpringCacheSettings defaultSettings,
                                    Map<String, SpringCacheSettings> namedSettings) {
        this.cacheManager = Objects.requireNonNull(cacheManager, "Cache manager cannot be null");
        this.defaultSettings = defaultSettings != null ? defaultSettings : SpringCacheSettings.defaults();
        this.namedSettings = namedSettings != null ? Map.copyOf(namedSettings) : Collections.emptyMap();
        this.namedSettings.forEach((name, settings) -> caches.put(name, new TieredSpringCache(name, cacheManager, settings)));
        if (!this.namedSettings.isEmpty()) {
            logger.info("Spring caches configured: {}", this.namedSettings);
        }
    }

    @Override
    @Nullable
    public Cache getCache(String name) {
        return caches.computeIfAbsent(name, cacheName -> new TieredSpringCache(cacheName, cacheManager,
                namedSettings.getOrDefault(cacheName, defaultSettings)));
    }

    @Override
    public Collection<String> getCacheNames() {
        return Collections.unmodifiableSet(caches.keySet());
    }

    public SpringCacheSettings getSettings(String name) {
        return namedSettings.getOrDefault(name, defaultSettings);
    }

    public void clearAllCaches() {
        caches.values().forEach(Cache::clear);
    }
}
