package net.seoedge.service;

import net.seoedge.config.SeoCacheProperties;
import net.seoedge.support.cache.CacheWarmupStrategy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CacheWarmupServiceTest {

    @Mock
    private TaggedCache taggedCache;

    @Mock
    private CacheWarmupStrategy strategy;

    @Test
    void should_RegisterEveryStrategy_When_Constructed() {
        new CacheWarmupService(taggedCache, new SeoCacheProperties(), List.of(strategy));

        verify(taggedCache).registerWarmupStrategy(strategy);
    }

    @Test
    void should_RunWarmup_When_ApplicationIsReady() {
        when(taggedCache.warmup()).thenReturn(4);
        CacheWarmupService service = new CacheWarmupService(taggedCache, new SeoCacheProperties(), List.of());

        service.warmupCachesOnStartup();

        verify(taggedCache).warmup();
        assertFalse(service.isWarmupInProgress());
    }

    @Test
    void should_SkipStartupWarmup_When_Disabled() {
        SeoCacheProperties properties = new SeoCacheProperties();
        properties.setWarmupOnStartup(false);
        CacheWarmupService service = new CacheWarmupService(taggedCache, properties, List.of());

        service.warmupCachesOnStartup();

        verify(taggedCache, never()).warmup();
    }

    @Test
    void should_RejectConcurrentWarmup_When_OneIsRunning() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(taggedCache.warmup()).thenAnswer(invocation -> {
            started.countDown();
            release.await();
            return 7;
        });
        CacheWarmupService service = new CacheWarmupService(taggedCache, new SeoCacheProperties(), List.of());
        AtomicInteger firstResult = new AtomicInteger();

        Thread first = new Thread(() -> firstResult.set(service.warmup()));
        first.start();
        started.await();

        assertTrue(service.isWarmupInProgress());
        assertEquals(-1, service.warmup());

        release.countDown();
        first.join();
        assertEquals(7, firstResult.get());
        assertFalse(service.isWarmupInProgress());
    }
}
