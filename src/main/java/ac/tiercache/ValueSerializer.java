package ac.tiercache;

import java.io.IOException;

/**
 * Converts opaque cache values to and from bytes for tiers that leave the heap.
 */
public interface ValueSerializer {

    byte[] serialize(Object value) throws IOException;

    Object deserialize(byte[] bytes) throws IOException;
}
