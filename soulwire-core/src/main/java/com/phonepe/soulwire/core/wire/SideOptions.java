package com.phonepe.soulwire.core.wire;

import lombok.Builder;
import lombok.Value;

/**
 * How a side wants messages delivered
 */
@Value
@Builder
public class SideOptions {
    public static final SideOptions OBSERVER = SideOptions.builder().build();

    /**
     * Deliver the events wrapped in {@link com.phonepe.soulwire.core.wire.messages.SubagentEvent} instead of the
     * wrapper itself
     */
    boolean merged;

    /**
     * This side answers requests. The most recently attached handler side gets them.
     */
    boolean requestHandler;

    /**
     * The handler can present structured questions to the user. Can be changed after attaching.
     */
    boolean supportsQuestions;

    /**
     * Drain the backlog given at attach time before receiving live messages
     */
    boolean replayBacklog;
}
