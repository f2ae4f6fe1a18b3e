package com.llmdispatch.config;

import com.llmdispatch.model.DispatchConfig;
import com.llmdispatch.service.CompletionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Startup wiring: property binding and conditional provider registration.
 */
@SpringBootTest(properties = {
        "dispatch.default-provider=ollama",
        "dispatch.fallback-order=openai,claude",
        "dispatch.retry-attempts=2",
        "dispatch.retry-base-delay=250ms",
        "dispatch.attempt-timeout=30s",
        "dispatch.providers.openai.api-key=sk-test",
        "dispatch.providers.claude.api-key="
})
class CompletionServiceConfigurationTest {

    @Autowired
    private CompletionService completionService;

    @Autowired
    private DispatchProperties properties;

    @Test
    void testRegistersOnlyProvidersWithCredentials() {
        List<String> providers = completionService.listProviders();

        assertTrue(providers.contains("openai"));
        assertTrue(providers.contains("ollama"));
        assertFalse(providers.contains("claude"));
    }

    @Test
    void testAppliesDispatchSettings() {
        DispatchConfig config = completionService.getConfiguration();

        assertEquals("ollama", config.getDefaultProvider());
        assertEquals(List.of("openai", "claude"), config.getFallbackOrder());
        assertEquals(2, config.getRetryAttempts());
        assertEquals(Duration.ofMillis(250), config.getRetryBaseDelay());
        assertEquals(Duration.ofSeconds(30), config.getAttemptTimeout());
    }

    @Test
    void testBindsProviderEndpoints() {
        assertEquals("https://api.openai.com/v1", properties.getProviders().get("openai").getBaseUrl());
        assertEquals(Duration.ofSeconds(5), properties.getProbeTimeout());
    }
}
