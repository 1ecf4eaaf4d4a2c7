package com.phonepe.soulwire.core.wire.messages;

import com.phonepe.soulwire.core.messages.TokenUsage;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Token accounting after a step. All fields are optional.
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class StatusUpdate extends WireMessage {
    /**
     * Fraction of the model context window in use
     */
    Double contextUsage;
    TokenUsage tokenUsage;
    String messageId;

    @Builder
    @Jacksonized
    public StatusUpdate(Double contextUsage, TokenUsage tokenUsage, String messageId) {
        super(WireMessageType.STATUS_UPDATE);
        this.contextUsage = contextUsage;
        this.tokenUsage = tokenUsage;
        this.messageId = messageId;
    }
}
