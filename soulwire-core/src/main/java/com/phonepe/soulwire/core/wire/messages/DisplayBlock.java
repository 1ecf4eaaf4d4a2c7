package com.phonepe.soulwire.core.wire.messages;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.AccessLevel;
import lombok.Data;
import lombok.RequiredArgsConstructor;

/**
 * Structured, user facing rendering hint attached to approvals and tool results
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME,
        include = JsonTypeInfo.As.EXISTING_PROPERTY,
        property = "type",
        visible = true,
        defaultImpl = UnknownDisplayBlock.class)
@JsonSubTypes({
        @JsonSubTypes.Type(name = DisplayBlockType.BRIEF, value = BriefDisplayBlock.class),
        @JsonSubTypes.Type(name = DisplayBlockType.DIFF, value = DiffDisplayBlock.class),
        @JsonSubTypes.Type(name = DisplayBlockType.TODO, value = TodoDisplayBlock.class),
        @JsonSubTypes.Type(name = DisplayBlockType.SHELL, value = ShellDisplayBlock.class),
})
@Data
@RequiredArgsConstructor(access = AccessLevel.PROTECTED)
public abstract class DisplayBlock {
    private final String type;
}
