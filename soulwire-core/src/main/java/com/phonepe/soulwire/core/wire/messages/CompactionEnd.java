package com.phonepe.soulwire.core.wire.messages;

import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;

/**
 * Context compaction has finished
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class CompactionEnd extends WireMessage {
    public CompactionEnd() {
        super(WireMessageType.COMPACTION_END);
    }
}
