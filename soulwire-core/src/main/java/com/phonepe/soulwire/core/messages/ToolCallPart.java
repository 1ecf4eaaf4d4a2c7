package com.phonepe.soulwire.core.messages;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Fragment of the arguments of the tool call currently being streamed
 */
@Value
@Builder
@Jacksonized
public class ToolCallPart implements StreamedMessagePart {
    String argumentsPart;

    public static ToolCallPart of(String argumentsPart) {
        return new ToolCallPart(argumentsPart);
    }

    public ToolCallPart merge(ToolCallPart next) {
        if (next.getArgumentsPart() == null) {
            return this;
        }
        return new ToolCallPart(argumentsPart == null
                                ? next.getArgumentsPart()
                                : argumentsPart + next.getArgumentsPart());
    }
}
