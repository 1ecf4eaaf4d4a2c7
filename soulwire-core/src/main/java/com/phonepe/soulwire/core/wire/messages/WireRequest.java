package com.phonepe.soulwire.core.wire.messages;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.phonepe.soulwire.core.utils.SoulUtils;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A message that needs exactly one answer. The answer is delivered through a one shot resolution slot that is
 * not part of the serialized form. Only the first resolution is kept.
 *
 * @param <R> Type of the answer
 */
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public abstract class WireRequest<R> extends WireMessage {
    @JsonIgnore
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    private final CompletableFuture<R> resolution = new CompletableFuture<>();

    protected WireRequest(WireMessageType type) {
        super(type);
    }

    public abstract String getId();

    /**
     * Answer used when no client is able to answer, for example on disconnect or cancellation
     */
    public abstract R defaultResolution();

    public abstract <T> T accept(WireRequestVisitor<T> visitor);

    /**
     * @return true if this call resolved the request, false if it had already been resolved
     */
    public boolean resolve(R value) {
        return resolution.complete(value);
    }

    public boolean resolveWithDefault() {
        return resolve(defaultResolution());
    }

    public boolean setException(Throwable error) {
        return resolution.completeExceptionally(error);
    }

    @JsonIgnore
    public boolean isResolved() {
        return resolution.isDone();
    }

    /**
     * Blocks until the request is resolved. An error set on the slot is rethrown as is.
     */
    public R await() throws InterruptedException {
        try {
            return resolution.get();
        }
        catch (ExecutionException e) {
            throw SoulUtils.propagate(e);
        }
    }

    public R await(Duration timeout) throws InterruptedException, TimeoutException {
        try {
            return resolution.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        catch (ExecutionException e) {
            throw SoulUtils.propagate(e);
        }
    }

    /**
     * A view of the resolution that completes with it but cannot be used to resolve the request
     */
    public CompletableFuture<R> future() {
        return resolution.copy();
    }
}
