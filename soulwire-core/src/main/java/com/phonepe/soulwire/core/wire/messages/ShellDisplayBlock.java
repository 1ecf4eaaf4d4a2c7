package com.phonepe.soulwire.core.wire.messages;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A shell command, with the language used for highlighting
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ShellDisplayBlock extends DisplayBlock {
    String language;
    String command;

    @Builder
    @Jacksonized
    public ShellDisplayBlock(String language, @NonNull String command) {
        super(DisplayBlockType.SHELL);
        this.language = language;
        this.command = command;
    }
}
