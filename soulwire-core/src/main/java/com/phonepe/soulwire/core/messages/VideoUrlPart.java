package com.phonepe.soulwire.core.messages;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Video attachment referenced by URL
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class VideoUrlPart extends ContentPart {
    MediaUrl videoUrl;

    @Builder
    @Jacksonized
    public VideoUrlPart(@NonNull MediaUrl videoUrl) {
        super(ContentPartType.VIDEO_URL);
        this.videoUrl = videoUrl;
    }

    @Override
    public <T> T accept(ContentPartVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
