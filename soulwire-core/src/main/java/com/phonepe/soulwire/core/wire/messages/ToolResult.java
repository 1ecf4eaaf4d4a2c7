package com.phonepe.soulwire.core.wire.messages;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Final result of a tool call
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ToolResult extends WireMessage {
    String toolCallId;
    ToolReturnValue returnValue;

    @Builder
    @Jacksonized
    public ToolResult(@NonNull String toolCallId, @NonNull ToolReturnValue returnValue) {
        super(WireMessageType.TOOL_RESULT);
        this.toolCallId = toolCallId;
        this.returnValue = returnValue;
    }
}
