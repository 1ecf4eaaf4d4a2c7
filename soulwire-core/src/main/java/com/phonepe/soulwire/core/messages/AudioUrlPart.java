package com.phonepe.soulwire.core.messages;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Audio attachment referenced by URL
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class AudioUrlPart extends ContentPart {
    MediaUrl audioUrl;

    @Builder
    @Jacksonized
    public AudioUrlPart(@NonNull MediaUrl audioUrl) {
        super(ContentPartType.AUDIO_URL);
        this.audioUrl = audioUrl;
    }

    @Override
    public <T> T accept(ContentPartVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
