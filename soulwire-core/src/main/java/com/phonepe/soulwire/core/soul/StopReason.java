package com.phonepe.soulwire.core.soul;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Why a turn ended normally
 */
@Getter
@AllArgsConstructor
public enum StopReason {
    /**
     * The model answered without calling any tool
     */
    NO_TOOL_CALLS("no_tool_calls"),
    /**
     * The user rejected an action of a tool
     */
    TOOL_REJECTED("tool_rejected"),
    /**
     * The input was a slash command and no model call was made
     */
    SLASH_COMMAND("slash_command");

    @JsonValue
    private final String value;
}
