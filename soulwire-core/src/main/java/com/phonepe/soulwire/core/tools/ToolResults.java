package com.phonepe.soulwire.core.tools;

import com.phonepe.soulwire.core.messages.Message;
import com.phonepe.soulwire.core.messages.Messages;
import com.phonepe.soulwire.core.messages.Role;
import com.phonepe.soulwire.core.messages.TextPart;
import com.phonepe.soulwire.core.messages.ContentPart;
import com.phonepe.soulwire.core.wire.messages.ToolReturnValue;
import lombok.experimental.UtilityClass;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns tool results into the tool messages appended to the history
 */
@UtilityClass
public class ToolResults {
    public static final String EMPTY_OUTPUT = "Tool output is empty.";

    public static Message toMessage(String toolCallId, ToolReturnValue result) {
        final var content = new ArrayList<ContentPart>();
        if (result.isError()) {
            content.add(Messages.system("ERROR: " + result.getMessage()));
            if (StringUtils.isNotEmpty(result.getOutput())) {
                content.add(new TextPart(result.getOutput()));
            }
        }
        else {
            if (StringUtils.isNotEmpty(result.getMessage())) {
                content.add(Messages.system(result.getMessage()));
            }
            if (StringUtils.isNotEmpty(result.getOutput())) {
                content.add(new TextPart(result.getOutput()));
            }
            if (content.isEmpty()) {
                content.add(Messages.system(EMPTY_OUTPUT));
            }
        }
        return Message.builder()
                .role(Role.TOOL)
                .toolCallId(toolCallId)
                .content(List.copyOf(content))
                .build();
    }

    public static boolean isRejection(ToolReturnValue result) {
        return result.isError() && ToolReturnValue.rejected().getMessage().equals(result.getMessage());
    }
}
