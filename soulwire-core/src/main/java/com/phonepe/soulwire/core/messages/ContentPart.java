package com.phonepe.soulwire.core.messages;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.AccessLevel;
import lombok.Data;
import lombok.RequiredArgsConstructor;

import java.util.Optional;

/**
 * A piece of message content. Parts also travel on their own while a response is being streamed.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(name = ContentPartType.Values.TEXT, value = TextPart.class),
        @JsonSubTypes.Type(name = ContentPartType.Values.THINK, value = ThinkPart.class),
        @JsonSubTypes.Type(name = ContentPartType.Values.IMAGE_URL, value = ImageUrlPart.class),
        @JsonSubTypes.Type(name = ContentPartType.Values.AUDIO_URL, value = AudioUrlPart.class),
        @JsonSubTypes.Type(name = ContentPartType.Values.VIDEO_URL, value = VideoUrlPart.class),
})
@Data
@RequiredArgsConstructor(access = AccessLevel.PROTECTED)
public abstract class ContentPart implements StreamedMessagePart {
    private final ContentPartType type;

    public abstract <T> T accept(ContentPartVisitor<T> visitor);

    /**
     * Merge a streamed part that directly follows this one.
     *
     * @param next The part received after this one
     * @return The combined part, or empty if the two cannot be combined
     */
    public Optional<ContentPart> merge(ContentPart next) {
        return Optional.empty();
    }
}
