package com.phonepe.soulwire.core.messages;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Image attachment referenced by URL
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ImageUrlPart extends ContentPart {
    MediaUrl imageUrl;

    @Builder
    @Jacksonized
    public ImageUrlPart(@NonNull MediaUrl imageUrl) {
        super(ContentPartType.IMAGE_URL);
        this.imageUrl = imageUrl;
    }

    @Override
    public <T> T accept(ContentPartVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
