package com.phonepe.soulwire.core.wire.messages;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Step number n (starting at 1) of the current turn has started
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class StepBegin extends WireMessage {
    int n;

    @Builder
    @Jacksonized
    public StepBegin(int n) {
        super(WireMessageType.STEP_BEGIN);
        this.n = n;
    }
}
