package com.phonepe.soulwire.core.wire.messages;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;

/**
 * Writes a nested wire message in its envelope form
 */
public class WireEnvelopeSerializer extends StdSerializer<WireMessage> {
    public WireEnvelopeSerializer() {
        super(WireMessage.class);
    }

    @Override
    public void serialize(WireMessage value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject();
        gen.writeStringField(WireMessageSerde.TYPE_FIELD, value.getType().getValue());
        gen.writeFieldName(WireMessageSerde.PAYLOAD_FIELD);
        provider.defaultSerializeValue(value, gen);
        gen.writeEndObject();
    }
}
