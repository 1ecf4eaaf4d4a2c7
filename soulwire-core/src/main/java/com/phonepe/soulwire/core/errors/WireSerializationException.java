package com.phonepe.soulwire.core.errors;

/**
 * A wire envelope could not be converted to or from JSON
 */
public class WireSerializationException extends SoulException {
    public WireSerializationException(ErrorType errorType, String details, Throwable cause) {
        super(errorType, cause, details);
    }

    public WireSerializationException(ErrorType errorType, String details) {
        super(errorType, details);
    }
}
