package com.llmdispatch.service;

import com.llmdispatch.provider.LlmProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for ProviderRegistry.
 */
class ProviderRegistryTest {

    private ProviderRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ProviderRegistry();
    }

    private static LlmProvider provider(String name, Mono<Boolean> availability) {
        LlmProvider provider = mock(LlmProvider.class);
        when(provider.getName()).thenReturn(name);
        when(provider.isAvailable()).thenReturn(availability);
        return provider;
    }

    @Test
    void testListNamesKeepsRegistrationOrder() {
        registry.register(provider("openai", Mono.just(true)));
        registry.register(provider("claude", Mono.just(true)));
        registry.register(provider("ollama", Mono.just(true)));

        assertEquals(List.of("openai", "claude", "ollama"), registry.listNames());
    }

    @Test
    void testRegisteringSameNameReplaces() {
        LlmProvider first = provider("openai", Mono.just(true));
        LlmProvider second = provider("openai", Mono.just(false));
        registry.register(first);
        registry.register(provider("ollama", Mono.just(true)));
        registry.register(second);

        assertSame(second, registry.get("openai").orElseThrow());
        assertEquals(List.of("openai", "ollama"), registry.listNames());
    }

    @Test
    void testGetUnknownIsEmpty() {
        assertTrue(registry.get("missing").isEmpty());
        assertTrue(registry.get(null).isEmpty());
    }

    @Test
    void testRejectsBlankName() {
        assertThrows(IllegalArgumentException.class, () -> registry.register(provider(" ", Mono.just(true))));
    }

    @Test
    void testAvailabilityIsolatesFailingProbes() {
        LlmProvider throwing = mock(LlmProvider.class);
        when(throwing.getName()).thenReturn("throwing");
        when(throwing.isAvailable()).thenThrow(new IllegalStateException("probe blew up"));

        registry.register(provider("up", Mono.just(true)));
        registry.register(provider("down", Mono.just(false)));
        registry.register(provider("erroring", Mono.error(new RuntimeException("connection refused"))));
        registry.register(throwing);
        registry.register(provider("silent", Mono.empty()));

        StepVerifier.create(registry.availability())
                .assertNext(availability -> {
                    assertEquals(List.of("up", "down", "erroring", "throwing", "silent"),
                            List.copyOf(availability.keySet()));
                    assertEquals(Map.of(
                            "up", true,
                            "down", false,
                            "erroring", false,
                            "throwing", false,
                            "silent", false), availability);
                })
                .verifyComplete();
    }

    @Test
    void testAvailabilityOfEmptyRegistry() {
        StepVerifier.create(registry.availability())
                .assertNext(availability -> assertTrue(availability.isEmpty()))
                .verifyComplete();
    }

    @Test
    void testConcurrentRegistrationAndReads() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 50; i++) {
                LlmProvider provider = provider("provider-" + i, Mono.just(true).subscribeOn(Schedulers.parallel()));
                futures.add(executor.submit(() -> {
                    start.await();
                    registry.register(provider);
                    return null;
                }));
                futures.add(executor.submit(() -> {
                    start.await();
                    registry.listNames();
                    return registry.availability().block();
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(50, registry.listNames().size());
    }
}
