package com.phonepe.soulwire.core.utils;

import lombok.experimental.UtilityClass;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

@UtilityClass
public class SoulUtils {

    public static Throwable rootCause(Throwable throwable) {
        var cause = throwable;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause;
    }

    /**
     * Strips the wrappers added by futures so that callers see the error thrown by the actual task.
     */
    public static Throwable unwrap(Throwable throwable) {
        var current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Rethrows the unwrapped error as is when unchecked, wraps it otherwise.
     */
    public static RuntimeException propagate(Throwable throwable) {
        final var error = unwrap(throwable);
        if (error instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        if (error instanceof Error e) {
            throw e;
        }
        return new IllegalStateException(error);
    }
}
