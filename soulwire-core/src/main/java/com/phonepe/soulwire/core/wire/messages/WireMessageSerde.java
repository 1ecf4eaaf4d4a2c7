package com.phonepe.soulwire.core.wire.messages;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phonepe.soulwire.core.errors.ErrorType;
import com.phonepe.soulwire.core.errors.WireSerializationException;
import lombok.experimental.UtilityClass;

/**
 * Converts wire messages to and from the <code>{"type": ..., "payload": {...}}</code> envelope used for
 * persistence and transport
 */
@UtilityClass
public class WireMessageSerde {
    public static final String TYPE_FIELD = "type";
    public static final String PAYLOAD_FIELD = "payload";

    public static ObjectNode toEnvelope(ObjectMapper mapper, WireMessage message) {
        final var envelope = mapper.createObjectNode();
        envelope.put(TYPE_FIELD, message.getType().getValue());
        try {
            envelope.set(PAYLOAD_FIELD, mapper.valueToTree(message));
        }
        catch (IllegalArgumentException e) {
            throw new WireSerializationException(ErrorType.SERIALIZATION_ERROR, e.getMessage(), e);
        }
        return envelope;
    }

    public static String serialize(ObjectMapper mapper, WireMessage message) {
        try {
            return mapper.writeValueAsString(toEnvelope(mapper, message));
        }
        catch (JsonProcessingException e) {
            throw new WireSerializationException(ErrorType.SERIALIZATION_ERROR, e.getMessage(), e);
        }
    }

    public static WireMessage fromEnvelope(ObjectMapper mapper, JsonNode envelope) {
        if (envelope == null || !envelope.isObject()) {
            throw new WireSerializationException(ErrorType.DESERIALIZATION_ERROR, "Envelope must be a JSON object");
        }
        final var typeName = envelope.path(TYPE_FIELD).asText(null);
        if (typeName == null) {
            throw new WireSerializationException(ErrorType.DESERIALIZATION_ERROR, "Envelope has no type");
        }
        final var type = WireMessageType.fromName(typeName)
                .orElseThrow(() -> new WireSerializationException(ErrorType.DESERIALIZATION_ERROR,
                                                                  "Unknown wire message type " + typeName));
        var payload = envelope.get(PAYLOAD_FIELD);
        if (payload == null || payload.isNull()) {
            payload = mapper.createObjectNode();
        }
        try {
            return mapper.treeToValue(payload, type.getMessageClass());
        }
        catch (JsonProcessingException | IllegalArgumentException e) {
            throw new WireSerializationException(ErrorType.DESERIALIZATION_ERROR,
                                                 "Invalid payload for " + typeName + ": " + e.getMessage(), e);
        }
    }

    public static WireMessage deserialize(ObjectMapper mapper, String json) {
        try {
            return fromEnvelope(mapper, mapper.readTree(json));
        }
        catch (JsonProcessingException e) {
            throw new WireSerializationException(ErrorType.DESERIALIZATION_ERROR, e.getMessage(), e);
        }
    }
}
