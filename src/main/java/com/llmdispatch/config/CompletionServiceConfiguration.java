package com.llmdispatch.config;

import com.llmdispatch.provider.LlmProvider;
import com.llmdispatch.service.CompletionService;
import com.llmdispatch.service.DispatchPolicy;
import com.llmdispatch.service.ProviderRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Wires the completion service: registers every enabled provider, then applies the
 * retry and fallback settings from {@link DispatchProperties}.
 */
@Slf4j
@Configuration
public class CompletionServiceConfiguration {

    @Bean
    public ProviderRegistry providerRegistry() {
        return new ProviderRegistry();
    }

    @Bean
    public DispatchPolicy dispatchPolicy() {
        return new DispatchPolicy();
    }

    @Bean
    public CompletionService completionService(ProviderRegistry registry,
                                               DispatchPolicy policy,
                                               List<LlmProvider> providers,
                                               DispatchProperties properties) {
        CompletionService service = new CompletionService(registry, policy);
        for (LlmProvider provider : providers) {
            if (provider.isEnabled()) {
                service.registerProvider(provider);
            } else {
                log.info("Provider {} is disabled or has no credentials, not registering", provider.getName());
            }
        }
        service.configure(properties.toDispatchConfig());
        return service;
    }
}
