package com.phonepe.soulwire.core.tools;

import com.phonepe.soulwire.core.wire.messages.ToolReturnValue;

/**
 * Something the model can call. Implementations are free to throw, errors are turned into error results by the
 * {@link ToolDispatcher}.
 */
public interface Tool {
    ToolDefinition definition();

    default String name() {
        return definition().getName();
    }

    /**
     * @param context   The call being served, gives access to approval and user interaction
     * @param arguments Raw JSON arguments produced by the model, may be null
     */
    ToolReturnValue call(ToolCallContext context, String arguments) throws Exception;
}
