package com.phonepe.soulwire.core.errors;

/**
 * Raised when steer or cancel is attempted without a running turn
 */
public class NoActiveTurnException extends SoulException {
    public NoActiveTurnException() {
        super(ErrorType.NO_ACTIVE_TURN);
    }
}
