package com.phonepe.soulwire.core.wire.stdio;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.soulwire.core.errors.ChatProviderException;
import com.phonepe.soulwire.core.provider.ChatProvider;
import com.phonepe.soulwire.core.soul.Soul;
import com.phonepe.soulwire.core.soul.SoulSetup;
import com.phonepe.soulwire.core.tools.Tool;
import com.phonepe.soulwire.core.tools.ToolCallContext;
import com.phonepe.soulwire.core.tools.ToolDefinition;
import com.phonepe.soulwire.core.tools.Toolset;
import com.phonepe.soulwire.core.utils.JsonUtils;
import com.phonepe.soulwire.core.utils.TestUtils;
import com.phonepe.soulwire.core.wire.InMemoryWireLog;
import com.phonepe.soulwire.core.wire.Wire;
import com.phonepe.soulwire.core.wire.WireRecord;
import com.phonepe.soulwire.core.wire.messages.ApprovalRequest;
import com.phonepe.soulwire.core.wire.messages.ToolReturnValue;
import com.phonepe.soulwire.core.wire.messages.TurnBegin;
import com.phonepe.soulwire.core.wire.messages.UserInput;
import lombok.SneakyThrows;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class WireStdioServerTest {
    private final ObjectMapper mapper = JsonUtils.createMapper();
    private ExecutorService executorService;
    private ChatProvider provider;
    private Wire wire;
    private Soul soul;

    @BeforeEach
    void setup() {
        executorService = Executors.newCachedThreadPool();
        provider = mock(ChatProvider.class);
        wire = new Wire();
        soul = Soul.builder()
                .provider(provider)
                .toolset(Toolset.of(new ShellTool()))
                .wire(wire)
                .setup(SoulSetup.builder()
                               .executorService(executorService)
                               .retrySetup(TestUtils.fastRetry())
                               .build())
                .build();
    }

    @AfterEach
    void tearDown() {
        wire.shutdown();
        executorService.shutdownNow();
    }

    @Test
    @SneakyThrows
    void testSynchronousMethods() {
        final var wireLog = new InMemoryWireLog();
        wireLog.append(new WireRecord(1.0, new TurnBegin(UserInput.text("earlier"))));
        wireLog.append(new WireRecord(2.0, ApprovalRequest.builder()
                .id("req-1")
                .toolCallId("call-1")
                .sender("shell")
                .action("run command")
                .build()));
        final var input = String.join("\n",
                                      "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\",\"params\":"
                                              + "{\"protocol_version\":\"1.1\",\"client\":{\"name\":\"test\"},"
                                              + "\"capabilities\":{\"supports_question\":true}}}",
                                      "this is not json",
                                      "[1,2]",
                                      "{\"jsonrpc\":\"1.0\",\"id\":2,\"method\":\"initialize\"}",
                                      "{\"jsonrpc\":\"2.0\",\"id\":3,\"method\":\"shutdown\"}",
                                      "{\"jsonrpc\":\"2.0\",\"id\":4,\"method\":\"steer\","
                                              + "\"params\":{\"user_input\":\"faster\"}}",
                                      "{\"jsonrpc\":\"2.0\",\"id\":5,\"method\":\"cancel\"}",
                                      "{\"jsonrpc\":\"2.0\",\"id\":6,\"method\":\"prompt\",\"params\":{}}",
                                      "",
                                      "{\"jsonrpc\":\"2.0\",\"id\":7,\"method\":\"replay\"}");
        final var output = new ByteArrayOutputStream();
        server(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)), output, wireLog).serve();

        final var lines = output.toString(StandardCharsets.UTF_8).lines().map(this::parse).toList();
        assertEquals(11, lines.size());

        final var initialized = lines.get(0);
        assertEquals(1, initialized.get("id").asInt());
        assertEquals("1.1", initialized.at("/result/protocol_version").asText());
        assertEquals("soulwire", initialized.at("/result/server/name").asText());
        assertEquals("compact", initialized.at("/result/slash_commands/0/name").asText());
        assertEquals("reset", initialized.at("/result/slash_commands/1/aliases/0").asText());

        assertEquals(JsonRpc.PARSE_ERROR, lines.get(1).at("/error/code").asInt());
        assertTrue(lines.get(1).get("id").isNull());
        assertEquals(JsonRpc.INVALID_REQUEST, lines.get(2).at("/error/code").asInt());
        assertEquals(JsonRpc.INVALID_REQUEST, lines.get(3).at("/error/code").asInt());
        assertEquals(2, lines.get(3).get("id").asInt());
        assertEquals(JsonRpc.METHOD_NOT_FOUND, lines.get(4).at("/error/code").asInt());
        assertEquals(JsonRpc.INVALID_STATE, lines.get(5).at("/error/code").asInt());
        assertEquals(JsonRpc.INVALID_STATE, lines.get(6).at("/error/code").asInt());
        assertEquals(JsonRpc.INVALID_PARAMS, lines.get(7).at("/error/code").asInt());

        assertEquals("event", lines.get(8).get("method").asText());
        assertFalse(lines.get(8).has("id"));
        assertEquals("TurnBegin", lines.get(8).at("/params/type").asText());
        assertEquals("earlier", lines.get(8).at("/params/payload/user_input").asText());
        assertEquals("request", lines.get(9).get("method").asText());
        assertEquals("ApprovalRequest", lines.get(9).at("/params/type").asText());
        assertEquals(7, lines.get(10).get("id").asInt());
        assertEquals("finished", lines.get(10).at("/result/status").asText());
        assertEquals(2, lines.get(10).at("/result/count").asInt());
    }

    @Test
    @SneakyThrows
    void testPromptWithApproval() {
        when(provider.generate(anyString(), anyList(), anyList()))
                .thenReturn(TestUtils.toolCallResponse("msg-1", "call-1", "shell", "ls"),
                            TestUtils.textResponse("msg-2", "Two files"));
        try (final var client = new Client()) {
            client.send("{\"jsonrpc\":\"2.0\",\"id\":\"p-1\",\"method\":\"prompt\","
                                + "\"params\":{\"user_input\":\"List files\"}}");
            final var request = client.find(node -> "request".equals(node.path("method").asText()));
            assertEquals("ApprovalRequest", request.at("/params/type").asText());
            assertEquals("call-1", request.at("/params/payload/tool_call_id").asText());
            client.send("{\"jsonrpc\":\"2.0\",\"id\":\"" + request.get("id").asText()
                                + "\",\"result\":{\"request_id\":\"" + request.get("id").asText()
                                + "\",\"response\":\"approve\"}}");

            final var response = client.find(response("p-1"));
            assertEquals("finished", response.at("/result/status").asText());
            final var toolResult = client.find(event("ToolResult"));
            assertEquals("ran ls", toolResult.at("/params/payload/return_value/output").asText());
            client.find(event("TurnEnd"));
        }
    }

    @Test
    @SneakyThrows
    void testCancelPrompt() {
        when(provider.generate(anyString(), anyList(), anyList()))
                .thenReturn(TestUtils.toolCallResponse("msg-1", "call-1", "shell", "make"));
        try (final var client = new Client()) {
            client.send("{\"jsonrpc\":\"2.0\",\"id\":10,\"method\":\"prompt\","
                                + "\"params\":{\"user_input\":\"Build\"}}");
            client.find(node -> "request".equals(node.path("method").asText()));
            client.send("{\"jsonrpc\":\"2.0\",\"id\":11,\"method\":\"prompt\","
                                + "\"params\":{\"user_input\":\"Again\"}}");
            final var busy = client.find(response("11"));
            assertEquals(JsonRpc.INVALID_STATE, busy.at("/error/code").asInt());

            client.send("{\"jsonrpc\":\"2.0\",\"id\":12,\"method\":\"cancel\"}");
            assertTrue(client.find(response("12")).has("result"));
            final var cancelled = client.find(response("10"));
            assertEquals("cancelled", cancelled.at("/result/status").asText());
            client.find(event("StepInterrupted"));
        }
    }

    @Test
    @SneakyThrows
    void testProviderFailure() {
        when(provider.generate(anyString(), anyList(), anyList()))
                .thenThrow(ChatProviderException.status(401, "Invalid API key"));
        try (final var client = new Client()) {
            client.send("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"prompt\",\"params\":{\"user_input\":\"Hi\"}}");
            final var response = client.find(response("1"));
            assertEquals(JsonRpc.CHAT_PROVIDER_ERROR, response.at("/error/code").asInt());
        }
    }

    @Test
    @SneakyThrows
    void testInvalidResultFallsBackToDefault() {
        when(provider.generate(anyString(), anyList(), anyList()))
                .thenReturn(TestUtils.toolCallResponse("msg-1", "call-1", "shell", "ls"),
                            TestUtils.textResponse("msg-2", "Stopped"));
        try (final var client = new Client()) {
            client.send("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"prompt\",\"params\":{\"user_input\":\"Hi\"}}");
            final var request = client.find(node -> "request".equals(node.path("method").asText()));
            client.send("{\"jsonrpc\":\"2.0\",\"id\":\"" + request.get("id").asText()
                                + "\",\"result\":{\"response\":\"maybe\"}}");
            final var response = client.find(response("1"));
            assertEquals("finished", response.at("/result/status").asText());
            final var approvalResponse = client.find(event("ApprovalResponse"));
            assertEquals("reject", approvalResponse.at("/params/payload/response").asText());
        }
    }

    private WireStdioServer server(InputStream input, OutputStream output, InMemoryWireLog wireLog) {
        return WireStdioServer.builder()
                .soul(soul)
                .wireLog(wireLog)
                .input(input)
                .output(output)
                .mapper(mapper)
                .executorService(executorService)
                .build();
    }

    private static Predicate<JsonNode> response(String id) {
        return node -> !node.has("method") && id.equals(node.path("id").asText());
    }

    private static Predicate<JsonNode> event(String type) {
        return node -> "event".equals(node.path("method").asText()) && type.equals(node.at("/params/type").asText());
    }

    @SneakyThrows
    private JsonNode parse(String line) {
        return mapper.readTree(line);
    }

    /**
     * Drives a server running on a background thread
     */
    private class Client implements AutoCloseable {
        private final PipedOutputStream toServer = new PipedOutputStream();
        private final BlockingQueue<String> fromServer = new LinkedBlockingQueue<>();
        private final List<JsonNode> seen = new ArrayList<>();
        private final Future<?> serving;

        @SneakyThrows
        Client() {
            final var input = new PipedInputStream(toServer, 64 * 1024);
            final var output = new OutputStream() {
                private final ByteArrayOutputStream line = new ByteArrayOutputStream();

                @Override
                public synchronized void write(int b) {
                    if (b == '\n') {
                        fromServer.add(line.toString(StandardCharsets.UTF_8));
                        line.reset();
                    }
                    else {
                        line.write(b);
                    }
                }
            };
            final var server = server(input, output, null);
            serving = executorService.submit(server::serve);
        }

        @SneakyThrows
        void send(String line) {
            toServer.write((line + "\n").getBytes(StandardCharsets.UTF_8));
            toServer.flush();
        }

        /**
         * First matching message, looking at what was already read before reading more
         */
        @SneakyThrows
        JsonNode find(Predicate<JsonNode> matcher) {
            final var alreadySeen = seen.stream().filter(matcher).findFirst();
            if (alreadySeen.isPresent()) {
                return alreadySeen.get();
            }
            final var deadline = System.currentTimeMillis() + 10_000;
            while (System.currentTimeMillis() < deadline) {
                final var line = fromServer.poll(100, TimeUnit.MILLISECONDS);
                if (null == line) {
                    continue;
                }
                final var node = parse(line);
                seen.add(node);
                if (matcher.test(node)) {
                    return node;
                }
            }
            throw new AssertionError("Expected message did not arrive in time");
        }

        @Override
        @SneakyThrows
        public void close() {
            toServer.close();
            serving.get(10, TimeUnit.SECONDS);
        }
    }

    private static class ShellTool implements Tool {
        @Override
        public ToolDefinition definition() {
            return ToolDefinition.builder().name("shell").build();
        }

        @Override
        public ToolReturnValue call(ToolCallContext context, String arguments) throws InterruptedException {
            if (!context.requestApproval("run command", arguments, List.of())) {
                return ToolReturnValue.rejected();
            }
            return ToolReturnValue.ok("ran " + arguments, "", "Ran");
        }
    }
}
