package ac.tiercache;

import java.lang.reflect.Method;

/**
 * Builds memoization keys: a prefix followed by each scalar argument, joined with {@code :}.
 * Scalars are character sequences, numbers, booleans, characters and enums; any other
 * argument, {@code null} included, does not contribute to the key.
 */
public final class CacheKeyGenerator {

    private CacheKeyGenerator() {
    }

    /**
     * @return {@code keyPrefix}, or {@code DeclaringClass.method} when it is blank
     */
    public static String prefixFor(String keyPrefix, Method method) {
        return keyPrefix == null || keyPrefix.isBlank()
                ? method.getDeclaringClass().getSimpleName() + "." + method.getName()
                : keyPrefix;
    }

    public static String generate(String prefix, Object... args) {
        StringBuilder keyBuilder = new StringBuilder(prefix);
        if (args != null) {
            for (Object arg : args) {
                if (isScalar(arg)) {
                    keyBuilder.append(':').append(arg instanceof Enum ? ((Enum<?>) arg).name() : arg.toString());
                }
            }
        }
        return keyBuilder.toString();
    }

    static boolean isScalar(Object arg) {
        return arg instanceof CharSequence
                || arg instanceof Number
                || arg instanceof Boolean
                || arg instanceof Character
                || arg instanceof Enum;
    }
}
