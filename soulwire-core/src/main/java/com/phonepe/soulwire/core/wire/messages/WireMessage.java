package com.phonepe.soulwire.core.wire.messages;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AccessLevel;
import lombok.Data;
import lombok.RequiredArgsConstructor;

/**
 * Anything exchanged on the wire. Events are broadcast, requests ({@link WireRequest}) need exactly one answer.
 * The type is not part of the payload, it is written in the envelope by {@link WireMessageSerde}.
 */
@Data
@RequiredArgsConstructor(access = AccessLevel.PROTECTED)
public abstract class WireMessage {
    @JsonIgnore
    private final WireMessageType type;

    @JsonIgnore
    public boolean isRequest() {
        return type.isRequest();
    }
}
