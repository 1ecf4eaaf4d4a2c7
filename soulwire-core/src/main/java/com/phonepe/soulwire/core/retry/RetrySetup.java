package com.phonepe.soulwire.core.retry;

import com.google.common.base.Preconditions;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Duration;
import java.util.Objects;

/**
 * Backoff used when a provider call fails with a retryable error
 */
@Value
@With
public class RetrySetup {
    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofMillis(300);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(5);
    public static final Duration DEFAULT_JITTER = Duration.ofMillis(500);
    public static final RetrySetup DEFAULT = RetrySetup.builder().build();

    /**
     * Delay before the first retry. Doubles on every further retry.
     */
    Duration initialDelay;

    /**
     * Upper bound of the exponential part of the delay
     */
    Duration maxDelay;

    /**
     * Random extra delay, between zero and this value, added to every wait
     */
    Duration jitter;

    @Builder
    public RetrySetup(Duration initialDelay, Duration maxDelay, Duration jitter) {
        this.initialDelay = Objects.requireNonNullElse(initialDelay, DEFAULT_INITIAL_DELAY);
        this.maxDelay = Objects.requireNonNullElse(maxDelay, DEFAULT_MAX_DELAY);
        this.jitter = Objects.requireNonNullElse(jitter, DEFAULT_JITTER);
        Preconditions.checkArgument(!this.initialDelay.isNegative(), "Initial delay cannot be negative");
        Preconditions.checkArgument(this.initialDelay.compareTo(this.maxDelay) <= 0,
                                    "Initial delay cannot be greater than max delay");
        Preconditions.checkArgument(!this.jitter.isNegative(), "Jitter cannot be negative");
    }
}
