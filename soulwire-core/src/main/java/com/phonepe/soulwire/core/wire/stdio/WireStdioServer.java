package com.phonepe.soulwire.core.wire.stdio;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phonepe.soulwire.core.errors.ChatProviderException;
import com.phonepe.soulwire.core.errors.MaxStepsReachedException;
import com.phonepe.soulwire.core.errors.NoActiveTurnException;
import com.phonepe.soulwire.core.errors.RunCancelledException;
import com.phonepe.soulwire.core.errors.TurnInProgressException;
import com.phonepe.soulwire.core.errors.WireShutdownException;
import com.phonepe.soulwire.core.soul.Soul;
import com.phonepe.soulwire.core.soul.SoulState;
import com.phonepe.soulwire.core.utils.JsonUtils;
import com.phonepe.soulwire.core.wire.SideOptions;
import com.phonepe.soulwire.core.wire.WireLog;
import com.phonepe.soulwire.core.wire.WireSide;
import com.phonepe.soulwire.core.wire.messages.UserInput;
import com.phonepe.soulwire.core.wire.messages.WireMessage;
import com.phonepe.soulwire.core.wire.messages.WireMessageSerde;
import com.phonepe.soulwire.core.wire.messages.WireRequest;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Exposes a {@link Soul} over line delimited JSON-RPC 2.0. The server is the request handler of the wire: events
 * are sent as <code>event</code> notifications, requests as <code>request</code> calls whose responses resolve
 * them.
 * <p>
 * Turns run on a worker thread so that steer, cancel and request responses keep flowing while a prompt is
 * being served.
 */
@Slf4j
public class WireStdioServer {
    public static final String DEFAULT_SERVER_NAME = "soulwire";
    public static final String DEFAULT_SERVER_VERSION = "0.1.0";

    private final Soul soul;
    private final WireLog wireLog;
    private final BufferedReader reader;
    private final Writer writer;
    private final ObjectMapper mapper;
    private final ExecutorService executorService;
    private final String serverName;
    private final String serverVersion;

    private final Map<String, WireRequest<?>> pendingRequests = new ConcurrentHashMap<>();
    private final Object writeLock = new Object();
    private volatile WireSide side;

    /**
     * @param wireLog Source for the replay method, may be null if nothing is persisted
     */
    @Builder
    public WireStdioServer(
            @NonNull Soul soul,
            WireLog wireLog,
            @NonNull InputStream input,
            @NonNull OutputStream output,
            ObjectMapper mapper,
            ExecutorService executorService,
            String serverName,
            String serverVersion) {
        this.soul = soul;
        this.wireLog = wireLog;
        this.reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
        this.writer = new BufferedWriter(new OutputStreamWriter(output, StandardCharsets.UTF_8));
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
        this.executorService = Objects.requireNonNullElseGet(executorService, Executors::newCachedThreadPool);
        this.serverName = Objects.requireNonNullElse(serverName, DEFAULT_SERVER_NAME);
        this.serverVersion = Objects.requireNonNullElse(serverVersion, DEFAULT_SERVER_VERSION);
    }

    /**
     * Serves until the input is closed. Requests still pending at that point get their default answers and a
     * running turn is cancelled.
     */
    public void serve() {
        side = soul.wire().attach(SideOptions.builder().requestHandler(true).build());
        final var pump = executorService.submit(this::pumpOutbound);
        log.info("Serving agent {} on stdio", soul.name());
        try {
            String line;
            while (null != (line = readLine())) {
                if (!line.isBlank()) {
                    handleLine(line);
                }
            }
            log.info("Input closed, stopping server");
        }
        finally {
            pendingRequests.values().forEach(WireRequest::resolveWithDefault);
            pendingRequests.clear();
            if (soul.state() != SoulState.IDLE) {
                try {
                    soul.cancel();
                }
                catch (NoActiveTurnException e) {
                    log.debug("Turn ended before it could be cancelled");
                }
            }
            side.close();
            pump.cancel(true);
        }
    }

    private String readLine() {
        try {
            return reader.readLine();
        }
        catch (IOException e) {
            log.error("Error reading input: {}", e.getMessage());
            return null;
        }
    }

    private void pumpOutbound() {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                final var message = side.receive();
                final var envelope = WireMessageSerde.toEnvelope(mapper, message);
                if (message instanceof WireRequest<?> request) {
                    pendingRequests.put(request.getId(), request);
                    request.future().whenComplete((result, error) -> pendingRequests.remove(request.getId()));
                    send(JsonRpc.request(mapper, request.getId(), JsonRpc.METHOD_REQUEST, envelope));
                }
                else {
                    send(JsonRpc.notification(mapper, JsonRpc.METHOD_EVENT, envelope));
                }
            }
        }
        catch (WireShutdownException e) {
            log.debug("Wire closed, stopping outbound pump");
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void handleLine(String line) {
        final JsonNode message;
        try {
            message = mapper.readTree(line);
        }
        catch (JsonProcessingException e) {
            log.debug("Unparseable input: {}", e.getMessage());
            send(JsonRpc.error(mapper, null, JsonRpc.PARSE_ERROR, "Parse error"));
            return;
        }
        if (null == message || !message.isObject()
                || !JsonRpc.VERSION.equals(message.path(JsonRpc.FIELD_JSONRPC).asText())) {
            send(JsonRpc.error(mapper, idOf(message), JsonRpc.INVALID_REQUEST, "Invalid request"));
            return;
        }
        final var id = message.get(JsonRpc.FIELD_ID);
        final var method = message.get(JsonRpc.FIELD_METHOD);
        if (null == method) {
            if (null == id) {
                send(JsonRpc.error(mapper, null, JsonRpc.INVALID_REQUEST, "Invalid request"));
            }
            else {
                handleResponse(id, message);
            }
            return;
        }
        if (!method.isTextual()) {
            send(JsonRpc.error(mapper, id, JsonRpc.INVALID_REQUEST, "Invalid request"));
            return;
        }
        handleCall(id, method.asText(), message.path(JsonRpc.FIELD_PARAMS));
    }

    private void handleResponse(JsonNode id, JsonNode message) {
        final var request = pendingRequests.remove(id.asText());
        if (null == request) {
            log.warn("Received response for unknown request {}", id.asText());
            return;
        }
        if (message.hasNonNull(JsonRpc.FIELD_ERROR)) {
            log.info("Client failed request {}: {}. Resolving with default",
                     request.getId(), message.path(JsonRpc.FIELD_ERROR).path("message").asText());
            request.resolveWithDefault();
            return;
        }
        try {
            request.accept(new ResponseResolver(mapper, message.path(JsonRpc.FIELD_RESULT)));
        }
        catch (JsonRpcException | IllegalArgumentException e) {
            log.warn("Invalid result for request {}: {}. Resolving with default", request.getId(), e.getMessage());
            request.resolveWithDefault();
        }
    }

    private void handleCall(JsonNode id, String method, JsonNode params) {
        try {
            switch (method) {
                case JsonRpc.METHOD_INITIALIZE -> send(JsonRpc.result(mapper, id, initialize(params)));
                case JsonRpc.METHOD_PROMPT -> prompt(id, params);
                case JsonRpc.METHOD_STEER -> {
                    soul.steer(userInput(params));
                    send(JsonRpc.result(mapper, id, status("steered")));
                }
                case JsonRpc.METHOD_CANCEL -> {
                    soul.cancel();
                    send(JsonRpc.result(mapper, id, mapper.createObjectNode()));
                }
                case JsonRpc.METHOD_REPLAY -> send(JsonRpc.result(mapper, id, replay()));
                default -> throw new JsonRpcException(JsonRpc.METHOD_NOT_FOUND, "Method not found: " + method);
            }
        }
        catch (JsonRpcException e) {
            send(JsonRpc.error(mapper, id, e.getCode(), e.getMessage()));
        }
        catch (TurnInProgressException | NoActiveTurnException e) {
            send(JsonRpc.error(mapper, id, JsonRpc.INVALID_STATE, e.getMessage()));
        }
    }

    private ObjectNode initialize(JsonNode params) {
        final var supportsQuestion = params.path("capabilities").path("supports_question").asBoolean(false);
        side.setSupportsQuestions(supportsQuestion);
        log.info("Client {} initialized. Protocol: {} Questions supported: {}",
                 params.path("client").path("name").asText("unknown"),
                 params.path("protocol_version").asText("unknown"),
                 supportsQuestion);
        final var result = mapper.createObjectNode();
        result.put("protocol_version", JsonRpc.PROTOCOL_VERSION);
        final var server = result.putObject("server");
        server.put("name", serverName);
        server.put("version", serverVersion);
        final var commands = result.putArray("slash_commands");
        soul.slashCommands().commands().forEach(command -> {
            final var node = commands.addObject();
            node.put("name", command.getName());
            node.put("description", command.getDescription());
            final var aliases = node.putArray("aliases");
            command.getAliases().forEach(aliases::add);
        });
        return result;
    }

    private void prompt(JsonNode id, JsonNode params) {
        final var input = userInput(params);
        if (soul.state() != SoulState.IDLE) {
            throw new TurnInProgressException();
        }
        executorService.submit(() -> runTurn(id, input));
    }

    private void runTurn(JsonNode id, UserInput input) {
        try {
            soul.run(input);
            send(JsonRpc.result(mapper, id, status("finished")));
        }
        catch (RunCancelledException e) {
            send(JsonRpc.result(mapper, id, status("cancelled")));
        }
        catch (MaxStepsReachedException e) {
            send(JsonRpc.result(mapper, id, status("max_steps_reached").put("steps", e.getSteps())));
        }
        catch (TurnInProgressException e) {
            send(JsonRpc.error(mapper, id, JsonRpc.INVALID_STATE, e.getMessage()));
        }
        catch (ChatProviderException e) {
            log.error("Provider failure during turn: {}", e.getMessage());
            send(JsonRpc.error(mapper, id, JsonRpc.CHAT_PROVIDER_ERROR, e.getMessage()));
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            send(JsonRpc.error(mapper, id, JsonRpc.INTERNAL_ERROR, "Turn interrupted"));
        }
        catch (RuntimeException e) {
            log.error("Error running turn: " + e.getMessage(), e);
            send(JsonRpc.error(mapper, id, JsonRpc.INTERNAL_ERROR, e.getMessage()));
        }
    }

    private ObjectNode replay() {
        var count = 0;
        if (null != wireLog) {
            for (final var record : wireLog.records()) {
                final WireMessage message = record.getMessage();
                final var method = message.isRequest() ? JsonRpc.METHOD_REQUEST : JsonRpc.METHOD_EVENT;
                send(JsonRpc.notification(mapper, method, WireMessageSerde.toEnvelope(mapper, message)));
                count++;
            }
        }
        log.info("Replayed {} wire records", count);
        return status("finished").put("count", count);
    }

    private UserInput userInput(JsonNode params) {
        final var node = params.get("user_input");
        if (null == node || node.isNull()) {
            throw new JsonRpcException(JsonRpc.INVALID_PARAMS, "Missing user_input");
        }
        try {
            return mapper.treeToValue(node, UserInput.class);
        }
        catch (JsonProcessingException | IllegalArgumentException e) {
            throw new JsonRpcException(JsonRpc.INVALID_PARAMS, "Invalid user_input: " + e.getMessage());
        }
    }

    private ObjectNode status(String status) {
        return mapper.createObjectNode().put("status", status);
    }

    private static JsonNode idOf(JsonNode message) {
        return null != message && message.isObject() ? message.get(JsonRpc.FIELD_ID) : null;
    }

    private void send(ObjectNode message) {
        synchronized (writeLock) {
            try {
                writer.write(mapper.writeValueAsString(message));
                writer.write('\n');
                writer.flush();
            }
            catch (IOException e) {
                log.error("Error writing output: {}", e.getMessage());
            }
        }
    }
}
