package com.phonepe.soulwire.core.wire.messages;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;

/**
 * Reads a nested wire message from its envelope form
 */
public class WireEnvelopeDeserializer extends StdDeserializer<WireMessage> {
    public WireEnvelopeDeserializer() {
        super(WireMessage.class);
    }

    @Override
    public WireMessage deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        final JsonNode envelope = ctxt.readTree(p);
        final var typeName = envelope.path(WireMessageSerde.TYPE_FIELD).asText(null);
        final var type = WireMessageType.fromName(typeName == null ? "" : typeName)
                .orElse(null);
        if (type == null) {
            return (WireMessage) ctxt.handleWeirdStringValue(WireMessage.class,
                                                              String.valueOf(typeName),
                                                              "Unknown wire message type");
        }
        var payload = envelope.get(WireMessageSerde.PAYLOAD_FIELD);
        if (payload == null || payload.isNull()) {
            payload = ctxt.getNodeFactory().objectNode();
        }
        return ctxt.readTreeAsValue(payload, type.getMessageClass());
    }
}
