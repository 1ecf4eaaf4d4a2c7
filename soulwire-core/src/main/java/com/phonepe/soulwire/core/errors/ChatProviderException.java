package com.phonepe.soulwire.core.errors;

import lombok.Getter;

import java.util.Set;

/**
 * Failure reported by a chat provider. The {@link Kind} decides how the retry policy treats it.
 */
@Getter
public class ChatProviderException extends SoulException {
    private static final Set<Integer> RETRYABLE_STATUS_CODES = Set.of(429, 500, 502, 503);

    public enum Kind {
        CONNECTION,
        TIMEOUT,
        STATUS,
        EMPTY_RESPONSE,
        OTHER
    }

    private final Kind kind;
    private final int statusCode;

    public ChatProviderException(Kind kind, int statusCode, String message) {
        super(ErrorType.CHAT_PROVIDER_ERROR, message);
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public ChatProviderException(Kind kind, int statusCode, String message, Throwable cause) {
        super(ErrorType.CHAT_PROVIDER_ERROR, cause, message);
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public static ChatProviderException connection(String message) {
        return new ChatProviderException(Kind.CONNECTION, 0, message);
    }

    public static ChatProviderException timeout(String message) {
        return new ChatProviderException(Kind.TIMEOUT, 0, message);
    }

    public static ChatProviderException status(int statusCode, String message) {
        return new ChatProviderException(Kind.STATUS, statusCode, message);
    }

    public static ChatProviderException emptyResponse() {
        return new ChatProviderException(Kind.EMPTY_RESPONSE, 0, "The API returned an empty response.");
    }

    public static ChatProviderException other(String message, Throwable cause) {
        return new ChatProviderException(Kind.OTHER, 0, message, cause);
    }

    /**
     * Whether the bounded backoff retry should try again. Connection errors are handled by the recovery hook
     * instead and are never retried with backoff.
     */
    public boolean isBackoffRetryable() {
        return switch (kind) {
            case TIMEOUT, EMPTY_RESPONSE -> true;
            case STATUS -> RETRYABLE_STATUS_CODES.contains(statusCode);
            case CONNECTION, OTHER -> false;
        };
    }
}
