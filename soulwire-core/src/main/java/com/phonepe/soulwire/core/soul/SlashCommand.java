package com.phonepe.soulwire.core.soul;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A command typed by the user as <code>/name [args]</code> and handled by the engine instead of the model
 */
@Value
@Builder
public class SlashCommand {
    @NonNull
    String name;

    String description;

    @Singular
    List<String> aliases;

    @NonNull
    Handler handler;

    @FunctionalInterface
    public interface Handler {
        void run(Soul soul, String args) throws InterruptedException;
    }
}
