package ac.tiercache.backend;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;

/**
 * Write operations queued and applied in one round trip.
 */
public interface KeyValueBatch {

    KeyValueBatch set(String key, byte[] value, Duration ttl);

    KeyValueBatch putFields(String hashKey, Map<String, String> fields, Duration ttl);

    KeyValueBatch addMembers(String setKey, Collection<String> members, Duration ttl);

    KeyValueBatch removeMembers(String setKey, Collection<String> members);

    KeyValueBatch delete(Collection<String> keys);

    void execute();
}
