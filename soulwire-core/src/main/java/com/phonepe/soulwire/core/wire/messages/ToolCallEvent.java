package com.phonepe.soulwire.core.wire.messages;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.phonepe.soulwire.core.messages.ToolCall;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * The model started a tool call. Arguments may follow as {@link ToolCallPartEvent}s.
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ToolCallEvent extends WireMessage {
    @JsonValue
    ToolCall toolCall;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public ToolCallEvent(@NonNull ToolCall toolCall) {
        super(WireMessageType.TOOL_CALL);
        this.toolCall = toolCall;
    }
}
