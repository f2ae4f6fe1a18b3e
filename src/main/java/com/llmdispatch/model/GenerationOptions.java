package com.llmdispatch.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;

/**
 * Per-call generation options. Every field is optional; unset values fall back to
 * adapter defaults (model, temperature) or to the dispatch configuration (timeout).
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GenerationOptions {

    private static final GenerationOptions NONE = GenerationOptions.builder().build();

    @JsonProperty("provider")
    String provider;

    @JsonProperty("model")
    String model;

    @JsonProperty("temperature")
    Double temperature;

    @JsonProperty("maxTokens")
    Integer maxTokens;

    @JsonProperty("topP")
    Double topP;

    // Overrides DispatchConfig.attemptTimeout for this call only
    @JsonIgnore
    Duration timeout;

    public static GenerationOptions none() {
        return NONE;
    }

    /**
     * Returns the requested provider, or null when absent or blank.
     */
    @JsonIgnore
    public String requestedProvider() {
        return provider == null || provider.isBlank() ? null : provider.trim();
    }

    public double temperatureOr(double fallback) {
        return temperature != null ? temperature : fallback;
    }

    public String modelOr(String fallback) {
        return model != null && !model.isBlank() ? model : fallback;
    }
}
