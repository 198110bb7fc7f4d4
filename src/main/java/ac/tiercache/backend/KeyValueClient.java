package ac.tiercache.backend;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionStage;

/**
 * Minimal contract the Redis tier needs from a networked key-value service.
 * <p>
 * A {@code null} or non-positive TTL means the record does not expire. Failures,
 * including timeouts, are reported as {@link KeyValueClientException}.
 */
public interface KeyValueClient {

    byte[] get(String key);

    void set(String key, byte[] value, Duration ttl);

    boolean exists(String key);

    boolean delete(String key);

    long delete(Collection<String> keys);

    Map<String, String> getFields(String hashKey);

    void putFields(String hashKey, Map<String, String> fields, Duration ttl);

    /** Fire-and-forget counterpart of a field increment; completion is only observed for logging. */
    CompletionStage<Void> incrementFieldAsync(String hashKey, String field, long delta);

    CompletionStage<Void> putFieldAsync(String hashKey, String field, String value);

    Set<String> members(String setKey);

    void addMembers(String setKey, Collection<String> members, Duration ttl);

    void removeMembers(String setKey, Collection<String> members);

    /**
     * Collects keys matching a glob pattern, or every key when the pattern is {@code null}.
     * Clients without {@link #supportsPatternScan()} ignore the pattern. The scan is complete
     * when this returns; failures surface here, never from the returned collection.
     */
    Iterable<String> scanKeys(String pattern);

    boolean supportsPatternScan();

    /**
     * @return a batch whose operations are applied together on {@link KeyValueBatch#execute()},
     * or empty when the backend cannot pipeline writes
     */
    Optional<KeyValueBatch> newBatch();
}
