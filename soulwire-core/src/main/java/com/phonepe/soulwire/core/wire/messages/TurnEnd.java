package com.phonepe.soulwire.core.wire.messages;

import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;

/**
 * The turn finished normally
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class TurnEnd extends WireMessage {
    public TurnEnd() {
        super(WireMessageType.TURN_END);
    }
}
