// TieredCacheAspectTest.java
package ac.tiercache.spring.aspect;

import ac.tiercache.CacheLevel;
import ac.tiercache.EvictionPolicy;
import ac.tiercache.MemoryTierStore;
import ac.tiercache.MultiLevelCacheManager;
import ac.tiercache.spring.annotation.TieredCacheable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.aop.aspectj.annotation.AspectJProxyFactory;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TieredCacheAspectTest {

    private MultiLevelCacheManager manager;
    private MemoryTierStore l1;
    private TieredCacheAspect aspect;
    private ProductService target;
    private ProductService service;

    @BeforeEach
    void setUp() {
        l1 = new MemoryTierStore(100, Duration.ofMinutes(5), EvictionPolicy.LRU);
        manager = new MultiLevelCacheManager(l1, null, null);

        StaticListableBeanFactory beanFactory = new StaticListableBeanFactory();
        beanFactory.addBean("multiLevelCacheManager", manager);
        aspect = new TieredCacheAspect(beanFactory.getBeanProvider(MultiLevelCacheManager.class));

        target = new ProductService();
        service = proxy(target, aspect);
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
    }

    private static ProductService proxy(ProductService target, TieredCacheAspect aspect) {
        AspectJProxyFactory factory = new AspectJProxyFactory(target);
        factory.setProxyTargetClass(true);
        factory.addAspect(aspect);
        return factory.getProxy();
    }

    @Test
    void testAnnotatedMethodIsMemoized() {
        // Arrange & Act
        String first = service.findProduct(42);
        String second = service.findProduct(42);

        // Assert
        assertThat(first).isEqualTo("product-42");
        assertThat(second).isEqualTo(first);
        assertThat(target.calls.get()).isEqualTo(1);
        assertThat(l1.containsKey("product:42")).isTrue();
    }

    @Test
    void testTagsFromAnnotationAllowInvalidation() {
        service.findProduct(1);
        service.findProduct(2);

        assertThat(manager.invalidateByTag("products")).isEqualTo(2);

        service.findProduct(1);
        assertThat(target.calls.get()).isEqualTo(3);
    }

    @Test
    void testDefaultPrefixUsesClassAndMethod() {
        service.describe("x", List.of("ignored"));

        assertThat(manager.get("ProductService.describe:x")).isEqualTo(Optional.of("described-x"));
    }

    @Test
    void testLevelRestrictionSkipsUnlistedTiers() {
        service.onlyOnDisk(3);
        service.onlyOnDisk(3);

        assertThat(l1.containsKey("disk:3")).isFalse();
        assertThat(target.calls.get()).isEqualTo(2);
    }

    @Test
    void testExceptionPassesThroughAndIsNotCached() {
        assertThatThrownBy(() -> service.failing("a"))
                .isInstanceOf(IOException.class)
                .hasMessage("unavailable a");
        assertThatThrownBy(() -> service.failing("a")).isInstanceOf(IOException.class);

        assertThat(target.calls.get()).isEqualTo(2);
        assertThat(l1.size()).isZero();
    }

    @Test
    void testUnannotatedMethodIsNotIntercepted() {
        service.plain(5);
        service.plain(5);

        assertThat(target.calls.get()).isEqualTo(2);
        assertThat(aspect.cachedInvokerCount()).isZero();
    }

    @Test
    void testInvokerBuiltOncePerMethod() {
        service.findProduct(1);
        service.findProduct(2);
        service.describe("y", null);

        assertThat(aspect.cachedInvokerCount()).isEqualTo(2);
    }

    @Test
    void testWithoutManagerMethodRunsDirectly() {
        TieredCacheAspect detached = new TieredCacheAspect(
                new StaticListableBeanFactory().getBeanProvider(MultiLevelCacheManager.class));
        ProductService uncached = proxy(target, detached);

        uncached.findProduct(9);
        uncached.findProduct(9);

        assertThat(target.calls.get()).isEqualTo(2);
        assertThat(detached.cachedInvokerCount()).isZero();
    }

    static class ProductService {
        final AtomicInteger calls = new AtomicInteger();

        @TieredCacheable(keyPrefix = "product", l1TtlSeconds = 60, tags = {"products"})
        public String findProduct(int id) {
            calls.incrementAndGet();
            return "product-" + id;
        }

        @TieredCacheable
        public String describe(String name, List<String> options) {
            calls.incrementAndGet();
            return "described-" + name;
        }

        @TieredCacheable(keyPrefix = "disk", levels = {CacheLevel.L3})
        public String onlyOnDisk(int id) {
            calls.incrementAndGet();
            return "disk-" + id;
        }

        @TieredCacheable(keyPrefix = "failing")
        public String failing(String id) throws IOException {
            calls.incrementAndGet();
            throw new IOException("unavailable " + id);
        }

        public String plain(int id) {
            calls.incrementAndGet();
            return "plain-" + id;
        }
    }
}
