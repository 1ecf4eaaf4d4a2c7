package com.phonepe.soulwire.core.wire.messages;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Objects;

@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class TodoDisplayBlock extends DisplayBlock {
    List<Item> items;

    @Value
    @Builder
    @Jacksonized
    public static class Item {
        @NonNull
        String title;

        /**
         * One of pending, in_progress or done
         */
        @NonNull
        String status;
    }

    @Builder
    @Jacksonized
    public TodoDisplayBlock(List<Item> items) {
        super(DisplayBlockType.TODO);
        this.items = Objects.requireNonNullElse(items, List.of());
    }
}
