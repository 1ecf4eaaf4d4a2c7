package com.phonepe.soulwire.core.tools;

import com.phonepe.soulwire.core.approval.Approval;
import com.phonepe.soulwire.core.messages.ToolCall;
import com.phonepe.soulwire.core.utils.JsonUtils;
import com.phonepe.soulwire.core.wire.SideOptions;
import com.phonepe.soulwire.core.wire.Wire;
import com.phonepe.soulwire.core.wire.messages.ToolCallRequest;
import com.phonepe.soulwire.core.wire.messages.ToolReturnValue;
import lombok.SneakyThrows;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ToolDispatcherTest {
    private ExecutorService executorService;
    private Wire wire;

    @BeforeEach
    void setup() {
        executorService = Executors.newCachedThreadPool();
        wire = new Wire();
    }

    @AfterEach
    void tearDown() {
        wire.shutdown();
        executorService.shutdownNow();
    }

    @Test
    @SneakyThrows
    void testRunsTool() {
        final var dispatcher = new ToolDispatcher(Toolset.of(new EchoTool()), executorService);
        final var result = dispatcher.dispatch(context("echo", "{\"text\":\"hi\"}")).get(5, TimeUnit.SECONDS);
        assertFalse(result.isError());
        assertEquals("{\"text\":\"hi\"}", result.getOutput());
        assertEquals("Echoed", result.brief());
    }

    @Test
    @SneakyThrows
    void testUnknownTool() {
        final var dispatcher = new ToolDispatcher(new Toolset(), executorService);
        final var future = dispatcher.dispatch(context("missing", "{}"));
        assertTrue(future.isDone());
        final var result = future.get();
        assertTrue(result.isError());
        assertEquals("Tool `missing` not found", result.getMessage());
    }

    @Test
    @SneakyThrows
    void testToolErrorBecomesResult() {
        final var failing = new Tool() {
            @Override
            public ToolDefinition definition() {
                return ToolDefinition.builder().name("read_file").build();
            }

            @Override
            public ToolReturnValue call(ToolCallContext context, String arguments) throws Exception {
                throw new IllegalStateException("wrapper", new IOException("No such file: a.txt"));
            }
        };
        final var dispatcher = new ToolDispatcher(Toolset.of(failing), executorService);
        final var result = dispatcher.dispatch(context("read_file", "{}")).get(5, TimeUnit.SECONDS);
        assertTrue(result.isError());
        assertEquals("Error running tool: No such file: a.txt", result.getMessage());
    }

    @Test
    @SneakyThrows
    void testInterruptedToolReportsInterruption() {
        final var blocking = new Tool() {
            @Override
            public ToolDefinition definition() {
                return ToolDefinition.builder().name("sleep").build();
            }

            @Override
            public ToolReturnValue call(ToolCallContext context, String arguments) throws Exception {
                throw new InterruptedException();
            }
        };
        final var dispatcher = new ToolDispatcher(Toolset.of(blocking), executorService);
        final var result = dispatcher.dispatch(context("sleep", null)).get(5, TimeUnit.SECONDS);
        assertEquals(ToolReturnValue.interrupted(), result);
    }

    @Test
    @SneakyThrows
    void testClientToolDelegatesOverWire() {
        final var handler = wire.attach(SideOptions.builder().requestHandler(true).build());
        final var clientTool = new ClientTool(ToolDefinition.builder()
                                                      .name("open_browser")
                                                      .description("Opens a URL in the user's browser")
                                                      .build());
        final var dispatcher = new ToolDispatcher(Toolset.of(clientTool), executorService);
        final var future = dispatcher.dispatch(context("open_browser", "{\"url\":\"https://example.com\"}"));

        final var request = (ToolCallRequest) handler.poll(Duration.ofSeconds(5)).orElseThrow();
        assertEquals("call-1", request.getId());
        assertEquals("open_browser", request.getName());
        assertEquals("{\"url\":\"https://example.com\"}", request.getArguments());
        request.resolve(ToolReturnValue.ok("opened", "", "Opened"));
        assertEquals("opened", future.get(5, TimeUnit.SECONDS).getOutput());
    }

    private ToolCallContext context(String toolName, String arguments) {
        return new ToolCallContext(ToolCall.of("call-1", toolName, arguments),
                                   new Approval(),
                                   wire,
                                   JsonUtils.createMapper());
    }

    private static class EchoTool implements Tool {
        @Override
        public ToolDefinition definition() {
            return ToolDefinition.builder()
                    .name("echo")
                    .description("Echoes the arguments")
                    .build();
        }

        @Override
        public ToolReturnValue call(ToolCallContext context, String arguments) {
            return ToolReturnValue.ok(arguments, "", "Echoed");
        }
    }
}
