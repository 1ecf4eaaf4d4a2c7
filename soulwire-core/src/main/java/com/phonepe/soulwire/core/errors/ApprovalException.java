package com.phonepe.soulwire.core.errors;

public class ApprovalException extends SoulException {
    public ApprovalException(String reason) {
        super(ErrorType.APPROVAL_ERROR, reason);
    }
}
