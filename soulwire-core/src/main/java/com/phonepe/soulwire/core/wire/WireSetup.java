package com.phonepe.soulwire.core.wire;

import com.google.common.base.Preconditions;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning for a {@link Wire}
 */
@Value
@With
public class WireSetup {
    public static final int DEFAULT_SIDE_QUEUE_CAPACITY = 10_000;
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(100);
    public static final WireSetup DEFAULT = WireSetup.builder().build();

    /**
     * How many undelivered messages a side may hold. A side that falls further behind is detached as lagging.
     */
    int sideQueueCapacity;

    /**
     * How often blocked receivers check for shutdown
     */
    Duration pollInterval;

    @Builder
    public WireSetup(int sideQueueCapacity, Duration pollInterval) {
        Preconditions.checkArgument(sideQueueCapacity >= 0, "Side queue capacity cannot be negative");
        this.sideQueueCapacity = sideQueueCapacity == 0 ? DEFAULT_SIDE_QUEUE_CAPACITY : sideQueueCapacity;
        this.pollInterval = Objects.requireNonNullElse(pollInterval, DEFAULT_POLL_INTERVAL);
    }
}
