package com.phonepe.soulwire.core.wire.messages;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum ApprovalOutcome {
    APPROVE("approve"),
    APPROVE_FOR_SESSION("approve_for_session"),
    REJECT("reject");

    @JsonValue
    private final String value;

    public boolean isApproved() {
        return this != REJECT;
    }
}
