package com.phonepe.soulwire.core.wire.messages;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A new turn has started for the given user input
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class TurnBegin extends WireMessage {
    UserInput userInput;

    @Builder
    @Jacksonized
    public TurnBegin(@NonNull UserInput userInput) {
        super(WireMessageType.TURN_BEGIN);
        this.userInput = userInput;
    }
}
