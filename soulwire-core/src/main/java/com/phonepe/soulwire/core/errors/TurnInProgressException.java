package com.phonepe.soulwire.core.errors;

/**
 * Raised when a turn is requested while another one is still running on the same soul
 */
public class TurnInProgressException extends SoulException {
    public TurnInProgressException() {
        super(ErrorType.TURN_IN_PROGRESS);
    }
}
