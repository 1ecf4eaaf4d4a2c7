package com.phonepe.soulwire.core.errors;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Error categories raised by the engine. The message is a format template for the details of the failure.
 */
@Getter
@AllArgsConstructor
public enum ErrorType {
    TURN_IN_PROGRESS("An agent turn is already in progress", false),
    NO_ACTIVE_TURN("No agent turn is in progress", false),
    MAX_STEPS_REACHED("Max number of steps reached: %d", false),
    RUN_CANCELLED("The run was cancelled", false),
    CHAT_PROVIDER_ERROR("Chat provider call failed: %s", true),
    QUESTION_NOT_SUPPORTED("The connected client does not support interactive questions. "
                                   + "Do NOT call this tool again. "
                                   + "Ask the user directly in your text response instead.", false),
    APPROVAL_ERROR("Approval failed: %s", false),
    WIRE_SHUTDOWN("The wire has been shut down", false),
    SERIALIZATION_ERROR("Error serializing object to JSON. Error: %s", false),
    DESERIALIZATION_ERROR("Error deserializing object from JSON. Error: %s", false),
    TOOL_NOT_FOUND("Tool `%s` not found", false),
    TOOL_RUNTIME_ERROR("Error running tool: %s", true),
    STORAGE_ERROR("Session storage failure: %s", false),
    ;

    private final String message;
    private final boolean retryable;
}
