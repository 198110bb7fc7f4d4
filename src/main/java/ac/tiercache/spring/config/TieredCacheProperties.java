// TieredCacheProperties.java
package ac.tiercache.spring.config;

import ac.tiercache.CacheLevel;
import ac.tiercache.EvictionPolicy;
import ac.tiercache.RedisTierStore;
import ac.tiercache.spring.service.SpringCacheSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.nio.file.Path;
import java.time.Duration;
import java.util.*;

@ConfigurationProperties(prefix = "tiered.cache")
public class TieredCacheProperties {

    @NestedConfigurationProperty
    private MemoryProperties l1 = new MemoryProperties();

    @NestedConfigurationProperty
    private RedisProperties l2 = new RedisProperties();

    @NestedConfigurationProperty
    private DiskProperties l3 = new DiskProperties();

    // per-name settings for caches served through the Spring CacheManager
    private Map<String, SpringCacheProperties> springCaches = new LinkedHashMap<>();

    // Getters and setters
    public MemoryProperties getL1() { return l1; }
    public void setL1(MemoryProperties l1) { this.l1 = l1; }

    public RedisProperties getL2() { return l2; }
    public void setL2(RedisProperties l2) { this.l2 = l2; }

    public DiskProperties getL3() { return l3; }
    public void setL3(DiskProperties l3) { this.l3 = l3; }

    public Map<String, SpringCacheProperties> getSpringCaches() { return springCaches; }
    public void setSpringCaches(Map<String, SpringCacheProperties> springCaches) { this.springCaches = springCaches; }

    public static class MemoryProperties {
        private boolean enabled = true;
        private int capacity = 10000;
        private Duration defaultTtl = Duration.ofMinutes(10);
        private EvictionPolicy evictionPolicy = EvictionPolicy.LRU;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getCapacity() { return capacity; }
        public void setCapacity(int capacity) { this.capacity = capacity; }

        public Duration getDefaultTtl() { return defaultTtl; }
        public void setDefaultTtl(Duration defaultTtl) { this.defaultTtl = defaultTtl; }

        public EvictionPolicy getEvictionPolicy() { return evictionPolicy; }
        public void setEvictionPolicy(EvictionPolicy evictionPolicy) { this.evictionPolicy = evictionPolicy; }
    }

    public static class RedisProperties {
        private boolean enabled = false;
        // when false, an unreachable server leaves the cache running without L2
        private boolean required = false;
        private String address = "redis://localhost:6379";
        private String password;
        private int connectionPoolSize = 64;
        private int connectionMinimumIdleSize = 10;
        private int timeout = 3000;
        private Duration operationTimeout = Duration.ofSeconds(3);
        private String namespace = RedisTierStore.DEFAULT_NAMESPACE;
        private Duration defaultTtl = Duration.ofHours(1);
        // zero disables background pruning of dead tag-index members
        private Duration pruneInterval = Duration.ofMinutes(10);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public boolean isRequired() { return required; }
        public void setRequired(boolean required) { this.required = required; }

        public String getAddress() { return address; }
        public void setAddress(String address) { this.address = address; }

        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }

        public int getConnectionPoolSize() { return connectionPoolSize; }
        public void setConnectionPoolSize(int connectionPoolSize) { this.connectionPoolSize = connectionPoolSize; }

        public int getConnectionMinimumIdleSize() { return connectionMinimumIdleSize; }
        public void setConnectionMinimumIdleSize(int connectionMinimumIdleSize) { this.connectionMinimumIdleSize = connectionMinimumIdleSize; }

        public int getTimeout() { return timeout; }
        public void setTimeout(int timeout) { this.timeout = timeout; }

        public Duration getOperationTimeout() { return operationTimeout; }
        public void setOperationTimeout(Duration operationTimeout) { this.operationTimeout = operationTimeout; }

        public String getNamespace() { return namespace; }
        public void setNamespace(String namespace) { this.namespace = namespace; }

        public Duration getDefaultTtl() { return defaultTtl; }
        public void setDefaultTtl(Duration defaultTtl) { this.defaultTtl = defaultTtl; }

        public Duration getPruneInterval() { return pruneInterval; }
        public void setPruneInterval(Duration pruneInterval) { this.pruneInterval = pruneInterval; }
    }

    public static class DiskProperties {
        private boolean enabled = true;
        private boolean required = false;
        private String directory = Path.of(System.getProperty("java.io.tmpdir"), "tiercache").toString();
        private Duration defaultTtl = Duration.ofHours(24);
        private Duration sweepInterval = Duration.ofMinutes(5);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public boolean isRequired() { return required; }
        public void setRequired(boolean required) { this.required = required; }

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }

        public Duration getDefaultTtl() { return defaultTtl; }
        public void setDefaultTtl(Duration defaultTtl) { this.defaultTtl = defaultTtl; }

        public Duration getSweepInterval() { return sweepInterval; }
        public void setSweepInterval(Duration sweepInterval) { this.sweepInterval = sweepInterval; }
    }

    public static class SpringCacheProperties {
        private Duration l1Ttl;
        private Duration l2Ttl;
        private Duration l3Ttl;
        private Set<CacheLevel> levels = EnumSet.noneOf(CacheLevel.class);

        public Duration getL1Ttl() { return l1Ttl; }
        public void setL1Ttl(Duration l1Ttl) { this.l1Ttl = l1Ttl; }

        public Duration getL2Ttl() { return l2Ttl; }
        public void setL2Ttl(Duration l2Ttl) { this.l2Ttl = l2Ttl; }

        public Duration getL3Ttl() { return l3Ttl; }
        public void setL3Ttl(Duration l3Ttl) { this.l3Ttl = l3Ttl; }

        public Set<CacheLevel> getLevels() { return levels; }
        public void setLevels(Set<CacheLevel> levels) { this.levels = levels; }

        public SpringCacheSettings toSettings() {
            Map<CacheLevel, Duration> ttls = new EnumMap<>(CacheLevel.class);
            if (l1Ttl != null) ttls.put(CacheLevel.L1, l1Ttl);
            if (l2Ttl != null) ttls.put(CacheLevel.L2, l2Ttl);
            if (l3Ttl != null) ttls.put(CacheLevel.L3, l3Ttl);
            return SpringCacheSettings.of(ttls, levels);
        }
    }
}
