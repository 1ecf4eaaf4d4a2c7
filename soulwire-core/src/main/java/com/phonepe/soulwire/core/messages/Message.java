package com.phonepe.soulwire.core.messages;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Objects;

/**
 * One entry of the conversation history
 */
@Value
@Builder
@Jacksonized
@With
public class Message {
    @NonNull
    Role role;

    @Builder.Default
    List<ContentPart> content = List.of();

    /**
     * Calls requested by the assistant, only present on assistant messages
     */
    List<ToolCall> toolCalls;

    /**
     * Call this message answers, only present on tool messages
     */
    String toolCallId;

    String name;

    public static Message of(Role role, List<ContentPart> content) {
        return Message.builder()
                .role(role)
                .content(content)
                .build();
    }

    public static Message user(String text) {
        return of(Role.USER, List.of(new TextPart(text)));
    }

    public static Message assistant(String text) {
        return of(Role.ASSISTANT, List.of(new TextPart(text)));
    }

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    public List<ToolCall> toolCallsOrEmpty() {
        return Objects.requireNonNullElse(toolCalls, List.of());
    }
}
