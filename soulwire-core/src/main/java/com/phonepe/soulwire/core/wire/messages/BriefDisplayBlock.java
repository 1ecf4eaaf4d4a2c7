package com.phonepe.soulwire.core.wire.messages;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A one line summary
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class BriefDisplayBlock extends DisplayBlock {
    String text;

    @Builder
    @Jacksonized
    public BriefDisplayBlock(@NonNull String text) {
        super(DisplayBlockType.BRIEF);
        this.text = text;
    }
}
