package ac.tiercache;

/**
 * Raised by a tier when its backing resource fails: I/O errors, serialization
 * errors or timeouts. A miss is never reported through this exception.
 */
public class TierAccessException extends RuntimeException {
    private final CacheLevel level;

    public TierAccessException(CacheLevel level, String message) {
        super(message);
        this.level = level;
    }

    public TierAccessException(CacheLevel level, String message, Throwable cause) {
        super(message, cause);
        this.level = level;
    }

    public CacheLevel getLevel() {
        return level;
    }
}
