package com.phonepe.soulwire.core.wire.stdio;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.soulwire.core.wire.messages.ApprovalOutcome;
import com.phonepe.soulwire.core.wire.messages.ApprovalRequest;
import com.phonepe.soulwire.core.wire.messages.QuestionRequest;
import com.phonepe.soulwire.core.wire.messages.ToolCallRequest;
import com.phonepe.soulwire.core.wire.messages.ToolReturnValue;
import com.phonepe.soulwire.core.wire.messages.WireRequestVisitor;

import java.util.Map;

/**
 * Resolves a request with the result a client sent back for it. Each request type expects its own result shape.
 */
class ResponseResolver implements WireRequestVisitor<Boolean> {
    private static final TypeReference<Map<String, String>> ANSWERS_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper;
    private final JsonNode result;

    ResponseResolver(ObjectMapper mapper, JsonNode result) {
        this.mapper = mapper;
        this.result = result;
    }

    @Override
    public Boolean visit(ApprovalRequest request) {
        final var response = result.get("response");
        if (null == response || !response.isTextual()) {
            throw new JsonRpcException(JsonRpc.INVALID_PARAMS, "Approval result must carry a response");
        }
        try {
            return request.resolve(mapper.treeToValue(response, ApprovalOutcome.class));
        }
        catch (JsonProcessingException e) {
            throw new JsonRpcException(JsonRpc.INVALID_PARAMS, "Invalid approval response: " + e.getMessage());
        }
    }

    @Override
    public Boolean visit(QuestionRequest request) {
        final var answers = result.get("answers");
        if (null == answers || !answers.isObject()) {
            throw new JsonRpcException(JsonRpc.INVALID_PARAMS, "Question result must carry answers");
        }
        return request.resolve(mapper.convertValue(answers, ANSWERS_TYPE));
    }

    @Override
    public Boolean visit(ToolCallRequest request) {
        final var returnValue = result.get("return_value");
        if (null == returnValue || !returnValue.isObject()) {
            throw new JsonRpcException(JsonRpc.INVALID_PARAMS, "Tool result must carry a return value");
        }
        try {
            return request.resolve(mapper.treeToValue(returnValue, ToolReturnValue.class));
        }
        catch (JsonProcessingException e) {
            throw new JsonRpcException(JsonRpc.INVALID_PARAMS, "Invalid tool return value: " + e.getMessage());
        }
    }
}
