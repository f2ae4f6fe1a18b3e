package com.llmdispatch.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Token accounting reported by a vendor.
 */
@Value
@Builder
@Jacksonized
public class TokenUsage {

    @JsonProperty("promptTokens")
    int promptTokens;

    @JsonProperty("completionTokens")
    int completionTokens;

    @JsonProperty("totalTokens")
    int totalTokens;

    public static TokenUsage of(int promptTokens, int completionTokens) {
        return new TokenUsage(promptTokens, completionTokens, promptTokens + completionTokens);
    }
}
