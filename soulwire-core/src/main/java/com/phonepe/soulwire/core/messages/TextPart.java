package com.phonepe.soulwire.core.messages;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Optional;

/**
 * Plain text content
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class TextPart extends ContentPart {
    String text;

    @Builder
    @Jacksonized
    public TextPart(@NonNull String text) {
        super(ContentPartType.TEXT);
        this.text = text;
    }

    @Override
    public <T> T accept(ContentPartVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Optional<ContentPart> merge(ContentPart next) {
        if (next instanceof TextPart nextText) {
            return Optional.of(new TextPart(text + nextText.getText()));
        }
        return Optional.empty();
    }
}
