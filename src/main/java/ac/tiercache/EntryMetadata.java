package ac.tiercache;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * JSON sidecar stored next to each L3 data file. Times are epoch milliseconds;
 * a {@code null} expiry never expires.
 */
public class EntryMetadata {
    private final String key;
    private final List<String> tags;
    private final long createdAt;
    private final long accessedAt;
    private final long accessCount;
    private final Long expiry;

    @JsonCreator
    public EntryMetadata(
            @JsonProperty("key") String key,
            @JsonProperty("tags") List<String> tags,
            @JsonProperty("createdAt") long createdAt,
            @JsonProperty("accessedAt") long accessedAt,
            @JsonProperty("accessCount") long accessCount,
            @JsonProperty("expiry") Long expiry) {
        this.key = key;
        this.tags = tags != null ? List.copyOf(tags) : List.of();
        this.createdAt = createdAt;
        this.accessedAt = accessedAt;
        this.accessCount = accessCount;
        this.expiry = expiry;
    }

    static EntryMetadata create(String key, Collection<String> tags, Instant now, Instant expiry) {
        return new EntryMetadata(key, tags != null ? new ArrayList<>(tags) : List.of(),
                now.toEpochMilli(), now.toEpochMilli(), 0L,
                expiry != null ? expiry.toEpochMilli() : null);
    }

    EntryMetadata withAccess(Instant now) {
        long accessed = Math.max(accessedAt, now.toEpochMilli());
        return new EntryMetadata(key, tags, createdAt, accessed, accessCount + 1, expiry);
    }

    @JsonIgnore
    public boolean isExpired(Instant now) {
        return expiry != null && now.toEpochMilli() > expiry;
    }

    @JsonIgnore
    public Instant getExpiryInstant() {
        return expiry != null ? Instant.ofEpochMilli(expiry) : null;
    }

    public String getKey() {
        return key;
    }

    public List<String> getTags() {
        return tags;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public long getAccessedAt() {
        return accessedAt;
    }

    public long getAccessCount() {
        return accessCount;
    }

    public Long getExpiry() {
        return expiry;
    }
}
