package com.phonepe.soulwire.core.errors;

import lombok.Getter;

/**
 * Base of all unchecked errors raised by the engine
 */
@Getter
public class SoulException extends RuntimeException {
    private final ErrorType errorType;

    public SoulException(ErrorType errorType, Object... args) {
        super(String.format(errorType.getMessage(), args));
        this.errorType = errorType;
    }

    public SoulException(ErrorType errorType, Throwable cause, Object... args) {
        super(String.format(errorType.getMessage(), args), cause);
        this.errorType = errorType;
    }
}
