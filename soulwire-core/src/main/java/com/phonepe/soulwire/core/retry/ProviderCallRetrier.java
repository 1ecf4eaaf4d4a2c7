package com.phonepe.soulwire.core.retry;

import com.google.common.base.Preconditions;
import com.phonepe.soulwire.core.errors.ChatProviderException;
import com.phonepe.soulwire.core.provider.ChatProvider;
import com.phonepe.soulwire.core.provider.RecoverableChatProvider;
import dev.failsafe.Failsafe;
import dev.failsafe.RetryPolicy;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Runs provider calls with two layers of protection:
 * <ol>
 *     <li>A connection failure on a {@link RecoverableChatProvider} gets one more try if the provider says it
 *     recovered. This never loops and does not count against the attempts below.</li>
 *     <li>Timeouts, empty responses and 429/500/502/503 status errors are retried with exponential backoff up to
 *     the configured number of attempts.</li>
 * </ol>
 */
@Slf4j
public class ProviderCallRetrier {
    @Getter
    private final int maxAttempts;
    private final RetrySetup retrySetup;

    public ProviderCallRetrier(int maxAttempts, RetrySetup retrySetup) {
        Preconditions.checkArgument(maxAttempts > 0, "At least one attempt is needed");
        this.maxAttempts = maxAttempts;
        this.retrySetup = retrySetup;
    }

    /**
     * @param provider Provider the call goes to, consulted for recovery
     * @param call     The call, must raise {@link ChatProviderException} for provider failures
     * @return Result of the first successful attempt
     */
    public <T> T call(ChatProvider provider, Supplier<T> call) {
        final var retryPolicy = RetryPolicy.<T>builder()
                .handleIf(error -> error instanceof ChatProviderException providerError
                        && providerError.isBackoffRetryable())
                .withMaxAttempts(maxAttempts)
                .withDelayFn(context -> delayBeforeRetry(context.getAttemptCount()))
                .onRetry(event -> log.info("Retrying {} call. Attempt: {} Error: {}",
                                           provider.modelName(),
                                           event.getAttemptCount() + 1,
                                           null != event.getLastException()
                                           ? event.getLastException().getMessage()
                                           : "none"))
                .onRetriesExceeded(event -> log.error("Giving up on {} call after {} attempts",
                                                      provider.modelName(), event.getAttemptCount()))
                .build();
        return Failsafe.with(retryPolicy)
                .get(() -> callWithRecovery(provider, call));
    }

    /**
     * Delay after the given number of failed attempts: <code>min(initial * 2^(n-1), max) + random jitter</code>
     */
    Duration delayBeforeRetry(int failedAttempts) {
        final var exponent = Math.max(0, Math.min(failedAttempts - 1, 30));
        final var backoffMillis = Math.min(retrySetup.getInitialDelay().toMillis() * (1L << exponent),
                                           retrySetup.getMaxDelay().toMillis());
        final var jitterMillis = retrySetup.getJitter().toMillis();
        final var extra = jitterMillis > 0 ? ThreadLocalRandom.current().nextLong(jitterMillis + 1) : 0;
        return Duration.ofMillis(backoffMillis + extra);
    }

    private static <T> T callWithRecovery(ChatProvider provider, Supplier<T> call) {
        try {
            return call.get();
        }
        catch (ChatProviderException e) {
            if (e.getKind() != ChatProviderException.Kind.CONNECTION
                    || !(provider instanceof RecoverableChatProvider recoverable)) {
                throw e;
            }
            log.warn("Connection error from {}: {}. Trying to recover", provider.modelName(), e.getMessage());
            if (!recoverable.recover(e)) {
                log.warn("Provider {} could not recover", provider.modelName());
                throw e;
            }
            log.info("Provider {} recovered. Retrying call once", provider.modelName());
            return call.get();
        }
    }
}
