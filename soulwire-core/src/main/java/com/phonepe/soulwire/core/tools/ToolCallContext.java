package com.phonepe.soulwire.core.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.soulwire.core.approval.Approval;
import com.phonepe.soulwire.core.messages.ToolCall;
import com.phonepe.soulwire.core.wire.Wire;
import com.phonepe.soulwire.core.wire.messages.DisplayBlock;
import com.phonepe.soulwire.core.wire.messages.Question;
import com.phonepe.soulwire.core.wire.messages.QuestionRequest;
import com.phonepe.soulwire.core.wire.messages.ToolCallRequest;
import com.phonepe.soulwire.core.wire.messages.ToolReturnValue;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Everything a tool can use while serving one call. Bound to the tool call being executed.
 */
@Value
public class ToolCallContext {
    ToolCall toolCall;
    Approval approval;
    Wire wire;
    ObjectMapper mapper;

    /**
     * Blocks until the user (or the session settings) decide on the action
     *
     * @return true if the action may go ahead
     */
    public boolean requestApproval(String action, String description, List<DisplayBlock> display)
            throws InterruptedException {
        return approval.request(toolCall.getId(), toolCall.name(), action, description, display);
    }

    /**
     * Asks the user structured questions over the wire.
     *
     * @return Answers keyed by question, empty if the user dismissed them
     * @throws com.phonepe.soulwire.core.errors.QuestionNotSupportedException if the client cannot ask questions
     */
    public Map<String, String> askQuestions(List<Question> questions) throws InterruptedException {
        final var request = QuestionRequest.builder()
                .id(UUID.randomUUID().toString())
                .toolCallId(toolCall.getId())
                .questions(questions)
                .build();
        wire.request(request);
        return request.await();
    }

    /**
     * Has the client execute this call
     */
    public ToolReturnValue delegateToClient() throws InterruptedException {
        final var request = ToolCallRequest.builder()
                .id(toolCall.getId())
                .name(toolCall.name())
                .arguments(toolCall.arguments())
                .build();
        wire.request(request);
        return request.await();
    }
}
