package com.phonepe.soulwire.core.wire.messages;

import lombok.Getter;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * All message kinds that travel on the wire, keyed by the name used in the serialized envelope
 */
@Getter
public enum WireMessageType {
    TURN_BEGIN("TurnBegin", TurnBegin.class, false),
    TURN_END("TurnEnd", TurnEnd.class, false),
    STEP_BEGIN("StepBegin", StepBegin.class, false),
    STEP_INTERRUPTED("StepInterrupted", StepInterrupted.class, false),
    COMPACTION_BEGIN("CompactionBegin", CompactionBegin.class, false),
    COMPACTION_END("CompactionEnd", CompactionEnd.class, false),
    STATUS_UPDATE("StatusUpdate", StatusUpdate.class, false),
    CONTENT_PART("ContentPart", ContentPartEvent.class, false),
    TOOL_CALL("ToolCall", ToolCallEvent.class, false),
    TOOL_CALL_PART("ToolCallPart", ToolCallPartEvent.class, false),
    TOOL_RESULT("ToolResult", ToolResult.class, false),
    APPROVAL_RESPONSE("ApprovalResponse", ApprovalResponse.class, false),
    SUBAGENT_EVENT("SubagentEvent", SubagentEvent.class, false),
    APPROVAL_REQUEST("ApprovalRequest", ApprovalRequest.class, true),
    QUESTION_REQUEST("QuestionRequest", QuestionRequest.class, true),
    TOOL_CALL_REQUEST("ToolCallRequest", ToolCallRequest.class, true),
    ;

    /**
     * Older names still found in persisted logs
     */
    private static final Map<String, WireMessageType> LEGACY_NAMES = Map.of(
            "ApprovalRequestResolved", APPROVAL_RESPONSE);

    private static final Map<String, WireMessageType> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(WireMessageType::getValue, Function.identity()));

    private final String value;
    private final Class<? extends WireMessage> messageClass;
    private final boolean request;

    WireMessageType(String value, Class<? extends WireMessage> messageClass, boolean request) {
        this.value = value;
        this.messageClass = messageClass;
        this.request = request;
    }

    public static Optional<WireMessageType> fromName(String name) {
        final var type = BY_NAME.get(name);
        if (null != type) {
            return Optional.of(type);
        }
        return Optional.ofNullable(LEGACY_NAMES.get(name));
    }
}
