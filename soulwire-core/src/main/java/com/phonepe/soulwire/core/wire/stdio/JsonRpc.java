package com.phonepe.soulwire.core.wire.stdio;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.experimental.UtilityClass;

/**
 * Names, codes and message builders of the JSON-RPC 2.0 dialect spoken on stdio
 */
@UtilityClass
public class JsonRpc {
    public static final String VERSION = "2.0";
    public static final String PROTOCOL_VERSION = "1.1";

    public static final String FIELD_JSONRPC = "jsonrpc";
    public static final String FIELD_ID = "id";
    public static final String FIELD_METHOD = "method";
    public static final String FIELD_PARAMS = "params";
    public static final String FIELD_RESULT = "result";
    public static final String FIELD_ERROR = "error";

    public static final String METHOD_INITIALIZE = "initialize";
    public static final String METHOD_PROMPT = "prompt";
    public static final String METHOD_STEER = "steer";
    public static final String METHOD_CANCEL = "cancel";
    public static final String METHOD_REPLAY = "replay";
    public static final String METHOD_EVENT = "event";
    public static final String METHOD_REQUEST = "request";

    public static final int PARSE_ERROR = -32700;
    public static final int INVALID_REQUEST = -32600;
    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INVALID_PARAMS = -32602;
    public static final int INTERNAL_ERROR = -32603;
    public static final int INVALID_STATE = -32000;
    public static final int CHAT_PROVIDER_ERROR = -32003;

    public static ObjectNode result(ObjectMapper mapper, JsonNode id, JsonNode result) {
        final var node = base(mapper);
        node.set(FIELD_ID, null == id ? NullNode.getInstance() : id);
        node.set(FIELD_RESULT, result);
        return node;
    }

    public static ObjectNode error(ObjectMapper mapper, JsonNode id, int code, String message) {
        final var node = base(mapper);
        node.set(FIELD_ID, null == id ? NullNode.getInstance() : id);
        final var error = node.putObject(FIELD_ERROR);
        error.put("code", code);
        error.put("message", message);
        return node;
    }

    /**
     * A message sent by the server without expecting an answer
     */
    public static ObjectNode notification(ObjectMapper mapper, String method, JsonNode params) {
        final var node = base(mapper);
        node.put(FIELD_METHOD, method);
        node.set(FIELD_PARAMS, params);
        return node;
    }

    public static ObjectNode request(ObjectMapper mapper, String id, String method, JsonNode params) {
        final var node = base(mapper);
        node.put(FIELD_METHOD, method);
        node.put(FIELD_ID, id);
        node.set(FIELD_PARAMS, params);
        return node;
    }

    private static ObjectNode base(ObjectMapper mapper) {
        final var node = mapper.createObjectNode();
        node.put(FIELD_JSONRPC, VERSION);
        return node;
    }
}
