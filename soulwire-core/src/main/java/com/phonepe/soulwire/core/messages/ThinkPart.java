package com.phonepe.soulwire.core.messages;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Optional;

/**
 * Reasoning content produced by the model. Never counted as conversation text.
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ThinkPart extends ContentPart {
    String think;

    /**
     * Opaque signature some providers attach to the end of a reasoning block
     */
    String encrypted;

    @Builder
    @Jacksonized
    public ThinkPart(@NonNull String think, String encrypted) {
        super(ContentPartType.THINK);
        this.think = think;
        this.encrypted = encrypted;
    }

    public ThinkPart(String think) {
        this(think, null);
    }

    @Override
    public <T> T accept(ContentPartVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Optional<ContentPart> merge(ContentPart next) {
        // A signed block is complete
        if (encrypted != null || !(next instanceof ThinkPart nextThink)) {
            return Optional.empty();
        }
        return Optional.of(new ThinkPart(think + nextThink.getThink(), nextThink.getEncrypted()));
    }
}
