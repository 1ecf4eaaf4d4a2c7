package com.phonepe.soulwire.core.messages;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Token accounting reported by a provider for one call
 */
@Value
@Builder
@Jacksonized
public class TokenUsage {
    long inputOther;
    long output;
    long inputCacheRead;
    long inputCacheCreation;

    public long input() {
        return inputOther + inputCacheRead + inputCacheCreation;
    }

    public long total() {
        return input() + output;
    }
}
