package com.phonepe.soulwire.core.wire.messages;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * What a tool produced. The output goes to the model, the message is an explanation for the model
 * and the display blocks are meant for the user.
 */
@Value
@Builder
@Jacksonized
@With
public class ToolReturnValue {
    @JsonProperty("is_error")
    boolean error;

    @Builder.Default
    String output = "";

    @Builder.Default
    String message = "";

    @Builder.Default
    List<DisplayBlock> display = List.of();

    Map<String, Object> extras;

    public static ToolReturnValue ok(String output, String message, String brief) {
        return ToolReturnValue.builder()
                .output(output)
                .message(message)
                .display(briefDisplay(brief))
                .build();
    }

    public static ToolReturnValue error(String output, String message, String brief) {
        return ToolReturnValue.builder()
                .error(true)
                .output(output)
                .message(message)
                .display(briefDisplay(brief))
                .build();
    }

    /**
     * Result recorded for a call whose step was cancelled before it finished
     */
    public static ToolReturnValue interrupted() {
        return error("", "The tool call was interrupted before it completed.", "Interrupted");
    }

    /**
     * Result recorded when the user rejected the action a tool asked approval for
     */
    public static ToolReturnValue rejected() {
        return error("",
                     "The tool call is rejected by the user. "
                             + "Stop what you are doing and wait for the user to tell you how to proceed.",
                     "Rejected by user");
    }

    /**
     * Text of the first brief block, empty if there is none
     */
    public String brief() {
        return display.stream()
                .filter(BriefDisplayBlock.class::isInstance)
                .map(block -> ((BriefDisplayBlock) block).getText())
                .findFirst()
                .orElse("");
    }

    private static List<DisplayBlock> briefDisplay(String brief) {
        if (brief == null || brief.isEmpty()) {
            return List.of();
        }
        return List.of(new BriefDisplayBlock(brief));
    }
}
