package com.phonepe.soulwire.core.wire.messages;

import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;

/**
 * Context compaction has started
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class CompactionBegin extends WireMessage {
    public CompactionBegin() {
        super(WireMessageType.COMPACTION_BEGIN);
    }
}
