package com.phonepe.soulwire.core.wire.messages;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.phonepe.soulwire.core.messages.ContentPart;
import com.phonepe.soulwire.core.messages.TextPart;
import lombok.NonNull;
import lombok.Value;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * What the user sent for a turn. Either plain text, serialized as a JSON string, or a list of content parts,
 * serialized as an array.
 */
@Value
@JsonSerialize(using = UserInput.Serializer.class)
@JsonDeserialize(using = UserInput.Deserializer.class)
public class UserInput {
    String text;
    List<ContentPart> parts;

    public static UserInput text(@NonNull String text) {
        return new UserInput(text, null);
    }

    public static UserInput parts(@NonNull List<ContentPart> parts) {
        return new UserInput(null, List.copyOf(parts));
    }

    public boolean isText() {
        return text != null;
    }

    public List<ContentPart> toContent() {
        return isText() ? List.of(new TextPart(text)) : parts;
    }

    /**
     * The text of the input. For part lists only text parts are considered, joined with a space.
     */
    public String plainText() {
        if (isText()) {
            return text;
        }
        return parts.stream()
                .filter(TextPart.class::isInstance)
                .map(part -> ((TextPart) part).getText())
                .collect(Collectors.joining(" "));
    }

    public static class Serializer extends StdSerializer<UserInput> {
        public Serializer() {
            super(UserInput.class);
        }

        @Override
        public void serialize(UserInput value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            if (value.isText()) {
                gen.writeString(value.getText());
                return;
            }
            gen.writeStartArray();
            for (final var part : value.getParts()) {
                provider.defaultSerializeValue(part, gen);
            }
            gen.writeEndArray();
        }
    }

    public static class Deserializer extends StdDeserializer<UserInput> {
        public Deserializer() {
            super(UserInput.class);
        }

        @Override
        public UserInput deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (p.currentToken() == JsonToken.VALUE_STRING) {
                return UserInput.text(p.getText());
            }
            if (p.currentToken() == JsonToken.START_ARRAY) {
                final List<ContentPart> parts = ctxt.readValue(
                        p, ctxt.getTypeFactory().constructCollectionType(List.class, ContentPart.class));
                return UserInput.parts(parts);
            }
            return (UserInput) ctxt.handleUnexpectedToken(UserInput.class, p);
        }
    }
}
