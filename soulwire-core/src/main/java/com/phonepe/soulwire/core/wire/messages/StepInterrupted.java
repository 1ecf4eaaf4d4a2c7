package com.phonepe.soulwire.core.wire.messages;

import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;

/**
 * The running step was interrupted by cancellation or an error
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class StepInterrupted extends WireMessage {
    public StepInterrupted() {
        super(WireMessageType.STEP_INTERRUPTED);
    }
}
