package com.phonepe.soulwire.core.messages;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Location of a media attachment, with an optional provider side id
 */
@Value
@Builder
@Jacksonized
public class MediaUrl {
    @NonNull
    String url;
    String id;

    public static MediaUrl of(String url) {
        return new MediaUrl(url, null);
    }
}
