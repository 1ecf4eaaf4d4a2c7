package com.phonepe.soulwire.core.soul;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.phonepe.soulwire.core.compaction.CompactionSetup;
import com.phonepe.soulwire.core.retry.RetrySetup;
import com.phonepe.soulwire.core.utils.JsonUtils;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Loop control and resources of a {@link Soul}. Zero or null values fall back to the defaults.
 */
@Value
@With
public class SoulSetup {
    public static final int DEFAULT_MAX_STEPS_PER_TURN = 100;
    public static final int DEFAULT_MAX_RETRIES_PER_STEP = 3;
    public static final long DEFAULT_MAX_CONTEXT_SIZE = 200_000;
    public static final long DEFAULT_RESERVED_CONTEXT_SIZE = 50_000;

    /**
     * Steps after which a turn is aborted with {@link com.phonepe.soulwire.core.errors.MaxStepsReachedException}
     */
    int maxStepsPerTurn;

    /**
     * Total attempts for a provider call failing with a retryable error
     */
    int maxRetriesPerStep;

    /**
     * Context window of the model in tokens
     */
    long maxContextSize;

    /**
     * Tokens kept free for the next response. Compaction starts when less than this is left.
     */
    long reservedContextSize;

    CompactionSetup compaction;

    RetrySetup retrySetup;

    /**
     * Runs provider calls, tool calls and the approval pipe. A cached thread pool is created if not provided.
     */
    ExecutorService executorService;

    ObjectMapper mapper;

    @Builder
    public SoulSetup(
            int maxStepsPerTurn,
            int maxRetriesPerStep,
            long maxContextSize,
            long reservedContextSize,
            CompactionSetup compaction,
            RetrySetup retrySetup,
            ExecutorService executorService,
            ObjectMapper mapper) {
        this.maxStepsPerTurn = maxStepsPerTurn <= 0 ? DEFAULT_MAX_STEPS_PER_TURN : maxStepsPerTurn;
        this.maxRetriesPerStep = maxRetriesPerStep <= 0 ? DEFAULT_MAX_RETRIES_PER_STEP : maxRetriesPerStep;
        this.maxContextSize = maxContextSize <= 0 ? DEFAULT_MAX_CONTEXT_SIZE : maxContextSize;
        this.reservedContextSize = reservedContextSize <= 0 ? DEFAULT_RESERVED_CONTEXT_SIZE : reservedContextSize;
        Preconditions.checkArgument(this.reservedContextSize < this.maxContextSize,
                                    "Reserved context size must be smaller than the max context size");
        this.compaction = Objects.requireNonNullElse(compaction, CompactionSetup.DEFAULT);
        this.retrySetup = Objects.requireNonNullElse(retrySetup, RetrySetup.DEFAULT);
        this.executorService = Objects.requireNonNullElseGet(executorService, Executors::newCachedThreadPool);
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
    }
}
