// TieredCacheable.java
package ac.tiercache.spring.annotation;

import ac.tiercache.CacheLevel;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Memoizes the annotated method in the multi-level cache.
 * The key is {@link #keyPrefix()} (or {@code DeclaringClass.method}) followed by the
 * scalar arguments. A negative TTL uses the tier default, zero never expires.
 */
@Target({ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
public @interface TieredCacheable {
    String keyPrefix() default "";
    long l1TtlSeconds() default -1;
    long l2TtlSeconds() default -1;
    long l3TtlSeconds() default -1;
    String[] tags() default {};
    CacheLevel[] levels() default {};
}
