package com.phonepe.soulwire.core.wire.messages;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.phonepe.soulwire.core.messages.ContentPart;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * A streamed content part. The payload is the part itself.
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ContentPartEvent extends WireMessage {
    @JsonValue
    ContentPart part;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public ContentPartEvent(@NonNull ContentPart part) {
        super(WireMessageType.CONTENT_PART);
        this.part = part;
    }
}
