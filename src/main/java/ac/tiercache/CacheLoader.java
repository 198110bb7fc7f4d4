package ac.tiercache;

/**
 * Computes a value on a cache miss.
 *
 * @param <T> value type
 * @param <E> exception the computation may throw
 */
@FunctionalInterface
public interface CacheLoader<T, E extends Throwable> {

    T load() throws E;
}
