package com.phonepe.soulwire.core.wire.messages;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.phonepe.soulwire.core.messages.ToolCallPart;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ToolCallPartEvent extends WireMessage {
    @JsonValue
    ToolCallPart toolCallPart;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public ToolCallPartEvent(@NonNull ToolCallPart toolCallPart) {
        super(WireMessageType.TOOL_CALL_PART);
        this.toolCallPart = toolCallPart;
    }
}
