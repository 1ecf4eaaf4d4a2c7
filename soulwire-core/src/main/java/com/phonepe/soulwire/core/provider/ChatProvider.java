package com.phonepe.soulwire.core.provider;

import com.phonepe.soulwire.core.messages.Message;
import com.phonepe.soulwire.core.tools.ToolDefinition;

import java.util.List;

/**
 * Abstract representation of an LLM endpoint. Failures must be reported as
 * {@link com.phonepe.soulwire.core.errors.ChatProviderException} so that the retry policy can classify them.
 */
public interface ChatProvider {

    String modelName();

    /**
     * Start generating the next assistant message.
     *
     * @param systemPrompt System prompt for the call
     * @param tools        Tools the model may call
     * @param history      Conversation so far
     * @return The streamed response
     */
    StreamedMessage generate(String systemPrompt, List<ToolDefinition> tools, List<Message> history);
}
