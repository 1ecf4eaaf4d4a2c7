package com.phonepe.soulwire.core.soul;

import com.phonepe.soulwire.core.messages.Message;
import lombok.Value;

@Value
public class TurnOutcome {
    StopReason stopReason;

    /**
     * Last assistant message, only set when the model stopped on its own
     */
    Message finalMessage;

    int stepCount;
}
