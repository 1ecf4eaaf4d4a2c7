package com.phonepe.soulwire.core.provider;

import com.phonepe.soulwire.core.errors.ChatProviderException;
import com.phonepe.soulwire.core.messages.ContentPart;
import com.phonepe.soulwire.core.messages.Message;
import com.phonepe.soulwire.core.messages.Role;
import com.phonepe.soulwire.core.messages.StreamedMessagePart;
import com.phonepe.soulwire.core.messages.ToolCall;
import com.phonepe.soulwire.core.messages.ToolCallPart;
import com.phonepe.soulwire.core.tools.ToolDefinition;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Runs one provider call and assembles the streamed parts into a complete assistant message
 */
@Slf4j
@UtilityClass
public class Generator {

    /**
     * @param onPart Called with every raw part as it arrives
     * @throws ChatProviderException with kind EMPTY_RESPONSE if the reply has neither content nor tool calls
     */
    public static GenerateResult generate(
            ChatProvider provider,
            String systemPrompt,
            List<ToolDefinition> tools,
            List<Message> history,
            Consumer<StreamedMessagePart> onPart) {
        final var stream = provider.generate(systemPrompt, tools, history);
        final var content = new ArrayList<ContentPart>();
        final var toolCalls = new ArrayList<ToolCall>();
        StreamedMessagePart pending = null;
        for (final var part : stream) {
            onPart.accept(part);
            if (pending == null) {
                pending = part;
                continue;
            }
            final var merged = merge(pending, part);
            if (merged != null) {
                pending = merged;
                continue;
            }
            collect(pending, content, toolCalls);
            pending = part;
        }
        if (pending != null) {
            collect(pending, content, toolCalls);
        }
        if (content.isEmpty() && toolCalls.isEmpty()) {
            throw ChatProviderException.emptyResponse();
        }
        final var message = Message.builder()
                .role(Role.ASSISTANT)
                .content(List.copyOf(content))
                .toolCalls(toolCalls.isEmpty() ? null : List.copyOf(toolCalls))
                .build();
        return new GenerateResult(stream.id(), message, stream.usage());
    }

    private static StreamedMessagePart merge(StreamedMessagePart current, StreamedMessagePart next) {
        if (current instanceof ContentPart currentPart && next instanceof ContentPart nextPart) {
            return currentPart.merge(nextPart).orElse(null);
        }
        if (current instanceof ToolCall toolCall && next instanceof ToolCallPart argumentsPart) {
            return toolCall.merge(argumentsPart);
        }
        if (current instanceof ToolCallPart currentPart && next instanceof ToolCallPart nextPart) {
            return currentPart.merge(nextPart);
        }
        return null;
    }

    private static void collect(StreamedMessagePart part, List<ContentPart> content, List<ToolCall> toolCalls) {
        if (part instanceof ContentPart contentPart) {
            content.add(contentPart);
        }
        else if (part instanceof ToolCall toolCall) {
            toolCalls.add(toolCall);
        }
        else {
            log.warn("Dropping argument fragment that does not follow a tool call");
        }
    }
}
