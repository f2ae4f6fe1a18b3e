package com.llmdispatch.config;

import com.llmdispatch.model.DispatchConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for LLM dispatch.
 */
@Data
@Component
@ConfigurationProperties(prefix = "dispatch")
public class DispatchProperties {

    private Map<String, ProviderConfig> providers = new HashMap<>();
    private HttpConfig http = new HttpConfig();

    private String defaultProvider = "openai";
    private List<String> fallbackOrder = new ArrayList<>(List.of("ollama", "claude", "openai"));
    private int retryAttempts = DispatchConfig.DEFAULT_RETRY_ATTEMPTS;
    private Duration retryBaseDelay = DispatchConfig.DEFAULT_RETRY_BASE_DELAY;
    private Duration attemptTimeout = Duration.ofSeconds(60);
    private Duration probeTimeout = Duration.ofSeconds(5);

    @Data
    public static class ProviderConfig {
        private boolean enabled = true;
        private String baseUrl;
        private String apiKey;
        private String defaultModel;

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    @Data
    public static class HttpConfig {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration responseTimeout = Duration.ofSeconds(60);
    }

    /**
     * Snapshot of the retry and fallback settings.
     */
    public DispatchConfig toDispatchConfig() {
        return DispatchConfig.builder()
                .defaultProvider(defaultProvider)
                .fallbackOrder(fallbackOrder)
                .retryAttempts(retryAttempts)
                .retryBaseDelay(retryBaseDelay)
                .attemptTimeout(attemptTimeout)
                .build();
    }
}
