package com.phonepe.soulwire.core.messages;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Author of a message in the conversation history
 */
@Getter
@AllArgsConstructor
public enum Role {
    SYSTEM("system"),
    USER("user"),
    ASSISTANT("assistant"),
    TOOL("tool");

    @JsonValue
    private final String value;
}
