// TieredCacheAspect.java (AOP support)
package ac.tiercache.spring.aspect;

import ac.tiercache.CacheKeyGenerator;
import ac.tiercache.CacheLevel;
import ac.tiercache.MemoizingInvoker;
import ac.tiercache.MultiLevelCacheManager;
import ac.tiercache.spring.annotation.TieredCacheable;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.beans.factory.ObjectProvider;

import java.lang.reflect.Method;
import java.time.Duration;

@Aspect
public class TieredCacheAspect {

    private final ObjectProvider<MultiLevelCacheManager> cacheManager;
    // per-method invoker, built once from the annotation
    private final Cache<Method, MemoizingInvoker> invokers = Caffeine.newBuilder()
            .maximumSize(1000)
            .build();

    public TieredCacheAspect(ObjectProvider<MultiLevelCacheManager> cacheManager) {
        this.cacheManager = cacheManager;
    }

    @Around("@annotation(tieredCacheable)")
    public Object aroundCacheableMethod(ProceedingJoinPoint joinPoint,
                                        TieredCacheable tieredCacheable) throws Throwable {
        MultiLevelCacheManager manager = cacheManager.getIfAvailable();
        if (manager == null) {
            return joinPoint.proceed();
        }

        Method method = ((MethodSignature) joinPoint.getSignature()).getMethod();
        MemoizingInvoker invoker = invokers.get(method, m -> createInvoker(manager, m, tieredCacheable));
        return invoker.call(joinPoint::proceed, joinPoint.getArgs());
    }

    private MemoizingInvoker createInvoker(MultiLevelCacheManager manager, Method method,
                                           TieredCacheable annotation) {
        String keyPrefix = CacheKeyGenerator.prefixFor(annotation.keyPrefix(), method);
        return MemoizingInvoker.builder(manager)
                .keyPrefix(keyPrefix)
                .ttl(CacheLevel.L1, toTtl(annotation.l1TtlSeconds()))
                .ttl(CacheLevel.L2, toTtl(annotation.l2TtlSeconds()))
                .ttl(CacheLevel.L3, toTtl(annotation.l3TtlSeconds()))
                .tags(annotation.tags())
                .levels(annotation.levels())
                .build();
    }

    private static Duration toTtl(long seconds) {
        return seconds < 0 ? null : Duration.ofSeconds(seconds);
    }

    long cachedInvokerCount() {
        invokers.cleanUp();
        return invokers.estimatedSize();
    }
}
