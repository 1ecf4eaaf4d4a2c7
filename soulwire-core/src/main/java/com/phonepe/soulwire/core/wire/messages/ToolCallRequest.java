package com.phonepe.soulwire.core.wire.messages;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Asks the client to execute a tool that is implemented on the client side
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ToolCallRequest extends WireRequest<ToolReturnValue> {
    String id;
    String name;
    /**
     * Raw JSON arguments, may be absent
     */
    String arguments;

    @Builder
    @Jacksonized
    public ToolCallRequest(@NonNull String id, @NonNull String name, String arguments) {
        super(WireMessageType.TOOL_CALL_REQUEST);
        this.id = id;
        this.name = name;
        this.arguments = arguments;
    }

    @Override
    public ToolReturnValue defaultResolution() {
        return ToolReturnValue.interrupted();
    }

    @Override
    public <T> T accept(WireRequestVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
