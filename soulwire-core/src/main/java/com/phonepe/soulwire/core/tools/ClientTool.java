package com.phonepe.soulwire.core.tools;

import com.phonepe.soulwire.core.wire.messages.ToolReturnValue;

/**
 * A tool declared by the connected client and executed on its side. The call is sent over the wire as a
 * {@link com.phonepe.soulwire.core.wire.messages.ToolCallRequest} and the client answers with the result.
 */
public class ClientTool implements Tool {
    private final ToolDefinition definition;

    public ClientTool(ToolDefinition definition) {
        this.definition = definition;
    }

    @Override
    public ToolDefinition definition() {
        return definition;
    }

    @Override
    public ToolReturnValue call(ToolCallContext context, String arguments) throws InterruptedException {
        return context.delegateToClient();
    }
}
