package com.phonepe.soulwire.core.errors;

/**
 * Observed by receivers once the wire (or their side of it) is closed
 */
public class WireShutdownException extends SoulException {
    public WireShutdownException() {
        super(ErrorType.WIRE_SHUTDOWN);
    }
}
