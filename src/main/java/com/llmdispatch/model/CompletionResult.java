package com.llmdispatch.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Generated text plus the name of the provider that actually produced it.
 * {@code usage} is null when the vendor did not report token counts.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CompletionResult {

    @NonNull
    @JsonProperty("content")
    String content;

    @JsonProperty("usage")
    TokenUsage usage;

    @NonNull
    @JsonProperty("provider")
    String provider;
}
