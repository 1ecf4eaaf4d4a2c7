package com.phonepe.soulwire.core.wire;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.phonepe.soulwire.core.wire.messages.WireEnvelopeDeserializer;
import com.phonepe.soulwire.core.wire.messages.WireEnvelopeSerializer;
import com.phonepe.soulwire.core.wire.messages.WireMessage;
import lombok.NonNull;
import lombok.Value;

/**
 * A persisted wire message with the time it was recorded, in unix seconds
 */
@Value
public class WireRecord {
    double timestamp;

    @JsonSerialize(using = WireEnvelopeSerializer.class)
    WireMessage message;

    @JsonCreator
    public WireRecord(
            @JsonProperty("timestamp") double timestamp,
            @JsonProperty("message") @JsonDeserialize(using = WireEnvelopeDeserializer.class) @NonNull
            WireMessage message) {
        this.timestamp = timestamp;
        this.message = message;
    }
}
