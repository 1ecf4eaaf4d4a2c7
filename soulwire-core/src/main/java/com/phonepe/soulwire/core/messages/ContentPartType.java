package com.phonepe.soulwire.core.messages;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.experimental.UtilityClass;

/**
 * Discriminator for the different kinds of content parts
 */
@Getter
public enum ContentPartType {
    TEXT(Values.TEXT),
    THINK(Values.THINK),
    IMAGE_URL(Values.IMAGE_URL),
    AUDIO_URL(Values.AUDIO_URL),
    VIDEO_URL(Values.VIDEO_URL),
    ;

    @JsonValue
    private final String value;

    ContentPartType(String value) {
        this.value = value;
    }

    @UtilityClass
    public static final class Values {
        public static final String TEXT = "text";
        public static final String THINK = "think";
        public static final String IMAGE_URL = "image_url";
        public static final String AUDIO_URL = "audio_url";
        public static final String VIDEO_URL = "video_url";
    }
}
