package com.phonepe.soulwire.core.wire.messages;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Announces how an {@link ApprovalRequest} was answered
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ApprovalResponse extends WireMessage {
    String requestId;
    ApprovalOutcome response;

    @Builder
    @Jacksonized
    public ApprovalResponse(@NonNull String requestId, @NonNull ApprovalOutcome response) {
        super(WireMessageType.APPROVAL_RESPONSE);
        this.requestId = requestId;
        this.response = response;
    }
}
