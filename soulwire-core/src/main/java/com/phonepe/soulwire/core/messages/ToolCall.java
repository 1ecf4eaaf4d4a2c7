package com.phonepe.soulwire.core.messages;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * A tool invocation requested by the model
 */
@Value
@Builder
@Jacksonized
@With
public class ToolCall implements StreamedMessagePart {
    public static final String FUNCTION_TYPE = "function";

    @Builder.Default
    String type = FUNCTION_TYPE;

    @NonNull
    String id;

    @NonNull
    FunctionBody function;

    Map<String, Object> extras;

    @Value
    @Builder
    @Jacksonized
    @With
    public static class FunctionBody {
        @NonNull
        String name;

        /**
         * Raw JSON arguments as produced by the model, possibly absent
         */
        String arguments;
    }

    public static ToolCall of(String id, String name, String arguments) {
        return ToolCall.builder()
                .id(id)
                .function(new FunctionBody(name, arguments))
                .build();
    }

    public String name() {
        return function.getName();
    }

    public String arguments() {
        return function.getArguments();
    }

    /**
     * Append a streamed argument fragment
     */
    public ToolCall merge(ToolCallPart part) {
        if (part.getArgumentsPart() == null) {
            return this;
        }
        final var current = function.getArguments();
        return withFunction(function.withArguments(
                current == null ? part.getArgumentsPart() : current + part.getArgumentsPart()));
    }
}
