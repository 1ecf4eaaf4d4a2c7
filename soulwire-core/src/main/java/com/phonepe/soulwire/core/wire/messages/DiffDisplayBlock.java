package com.phonepe.soulwire.core.wire.messages;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Before and after text of a file change
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class DiffDisplayBlock extends DisplayBlock {
    String path;
    String oldText;
    String newText;

    @Builder
    @Jacksonized
    public DiffDisplayBlock(@NonNull String path, String oldText, String newText) {
        super(DisplayBlockType.DIFF);
        this.path = path;
        this.oldText = oldText;
        this.newText = newText;
    }
}
