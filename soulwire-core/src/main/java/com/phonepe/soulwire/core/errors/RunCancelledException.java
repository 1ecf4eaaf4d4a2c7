package com.phonepe.soulwire.core.errors;

public class RunCancelledException extends SoulException {
    public RunCancelledException() {
        super(ErrorType.RUN_CANCELLED);
    }
}
