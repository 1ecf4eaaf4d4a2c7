package com.phonepe.soulwire.core.errors;

import lombok.Getter;

/**
 * Raised when a turn runs more steps than configured
 */
@Getter
public class MaxStepsReachedException extends SoulException {
    private final int steps;

    public MaxStepsReachedException(int steps) {
        super(ErrorType.MAX_STEPS_REACHED, steps);
        this.steps = steps;
    }
}
