package ac.tiercache;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A cached value together with its expiry, tags and usage metadata.
 * <p>
 * Access metadata is mutable and not synchronized; the tier holding the entry
 * is responsible for guarding it.
 */
public class CacheEntry {
    private final String key;
    private final Object value;
    private final Instant expiry;
    private final Set<String> tags;
    private final Instant createdAt;
    private Instant lastAccessedAt;
    private long accessCount;

    public CacheEntry(String key, Object value, Instant expiry, Collection<String> tags, Instant createdAt) {
        this(key, value, expiry, tags, createdAt, createdAt, 0L);
    }

    public CacheEntry(String key, Object value, Instant expiry, Collection<String> tags,
                      Instant createdAt, Instant lastAccessedAt, long accessCount) {
        this.key = Objects.requireNonNull(key, "Key cannot be null");
        this.value = Objects.requireNonNull(value, "Value cannot be null");
        this.expiry = expiry;
        this.tags = tags == null || tags.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
        this.createdAt = Objects.requireNonNull(createdAt, "Creation time cannot be null");
        this.lastAccessedAt = lastAccessedAt == null || lastAccessedAt.isBefore(createdAt)
                ? createdAt : lastAccessedAt;
        this.accessCount = Math.max(0L, accessCount);
    }

    public boolean isExpired(Instant now) {
        return expiry != null && now.isAfter(expiry);
    }

    public void recordAccess(Instant now) {
        accessCount++;
        if (now.isAfter(lastAccessedAt)) {
            lastAccessedAt = now;
        }
    }

    /**
     * Point-in-time copy whose access metadata no longer follows this entry.
     */
    public CacheEntry snapshot() {
        return new CacheEntry(key, value, expiry, tags, createdAt, lastAccessedAt, accessCount);
    }

    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }

    public String getKey() {
        return key;
    }

    public Object getValue() {
        return value;
    }

    public Instant getExpiry() {
        return expiry;
    }

    public Set<String> getTags() {
        return tags;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastAccessedAt() {
        return lastAccessedAt;
    }

    public long getAccessCount() {
        return accessCount;
    }

    @Override
    public String toString() {
        return "CacheEntry{key='" + key + "', expiry=" + expiry + ", tags=" + tags
                + ", accessCount=" + accessCount + "}";
    }
}
