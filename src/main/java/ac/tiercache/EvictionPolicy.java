package ac.tiercache;

/**
 * Strategy the in-memory tier uses to make room when it is full.
 * Expired entries are always reclaimed first, whatever the policy.
 */
public enum EvictionPolicy {
    /** Evict the least recently read or written key. */
    LRU,
    /** Evict the oldest inserted key. */
    FIFO,
    /** Rely on expiry; falls back to FIFO order when nothing has expired. */
    TTL
}
