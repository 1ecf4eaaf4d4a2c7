package com.phonepe.soulwire.core.tools;

import com.google.common.base.Stopwatch;
import com.phonepe.soulwire.core.errors.ErrorType;
import com.phonepe.soulwire.core.utils.SoulUtils;
import com.phonepe.soulwire.core.wire.messages.ToolReturnValue;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs tool calls, each as its own task. Never fails: unknown tools and tool errors become error results.
 */
@Slf4j
public class ToolDispatcher {
    private final Toolset toolset;
    private final ExecutorService executorService;

    public ToolDispatcher(Toolset toolset, ExecutorService executorService) {
        this.toolset = toolset;
        this.executorService = executorService;
    }

    public CompletableFuture<ToolReturnValue> dispatch(ToolCallContext context) {
        final var toolCall = context.getToolCall();
        final var tool = toolset.find(toolCall.name()).orElse(null);
        if (null == tool) {
            log.warn("Tool call {} requested unknown tool {}", toolCall.getId(), toolCall.name());
            return CompletableFuture.completedFuture(
                    ToolReturnValue.error("",
                                          ErrorType.TOOL_NOT_FOUND.getMessage().formatted(toolCall.name()),
                                          "Tool not found"));
        }
        return CompletableFuture.supplyAsync(() -> run(tool, context), executorService);
    }

    private static ToolReturnValue run(Tool tool, ToolCallContext context) {
        final var toolCall = context.getToolCall();
        log.debug("Calling tool: {} [{}] Arguments: {}", toolCall.getId(), toolCall.name(), toolCall.arguments());
        final var stopwatch = Stopwatch.createStarted();
        try {
            final var result = tool.call(context, toolCall.arguments());
            log.debug("Tool call {} [{}] completed in {} ms. Error: {}",
                      toolCall.getId(), toolCall.name(), stopwatch.elapsed(TimeUnit.MILLISECONDS), result.isError());
            return result;
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Tool call {} [{}] interrupted", toolCall.getId(), toolCall.name());
            return ToolReturnValue.interrupted();
        }
        catch (Exception e) {
            return processUnhandledException(context, e);
        }
    }

    private static ToolReturnValue processUnhandledException(ToolCallContext context, Exception e) {
        final var toolCall = context.getToolCall();
        final var errorMessage = SoulUtils.rootCause(e).getMessage();
        log.error("Error calling tool {} -> {}: {}", toolCall.getId(), toolCall.name(), errorMessage);
        if (log.isDebugEnabled()) {
            log.error("Error stacktrace for %s".formatted(toolCall.getId()), e);
        }
        return ToolReturnValue.error("",
                                     ErrorType.TOOL_RUNTIME_ERROR.getMessage().formatted(errorMessage),
                                     "Tool error");
    }
}
