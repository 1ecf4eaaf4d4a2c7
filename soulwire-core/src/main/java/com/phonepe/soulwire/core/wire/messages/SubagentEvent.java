package com.phonepe.soulwire.core.wire.messages;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * Relays a message produced by a subagent under the id of the tool call that spawned it.
 * The inner message is kept as is, in its own envelope.
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class SubagentEvent extends WireMessage {
    String taskToolCallId;

    @JsonSerialize(using = WireEnvelopeSerializer.class)
    WireMessage event;

    @JsonCreator
    public SubagentEvent(
            @JsonProperty("task_tool_call_id") @NonNull String taskToolCallId,
            @JsonProperty("event") @JsonDeserialize(using = WireEnvelopeDeserializer.class) @NonNull WireMessage event) {
        super(WireMessageType.SUBAGENT_EVENT);
        this.taskToolCallId = taskToolCallId;
        this.event = event;
    }
}
