package com.phonepe.soulwire.core.wire.messages;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Objects;

/**
 * Asks the client to approve an action a tool is about to perform
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ApprovalRequest extends WireRequest<ApprovalOutcome> {
    String id;
    String toolCallId;
    /**
     * Name of the tool asking for approval
     */
    String sender;
    /**
     * Category of the action. Actions approved for the session are matched on this.
     */
    String action;
    String description;
    List<DisplayBlock> display;

    @Builder
    @Jacksonized
    public ApprovalRequest(
            @NonNull String id,
            @NonNull String toolCallId,
            @NonNull String sender,
            @NonNull String action,
            String description,
            List<DisplayBlock> display) {
        super(WireMessageType.APPROVAL_REQUEST);
        this.id = id;
        this.toolCallId = toolCallId;
        this.sender = sender;
        this.action = action;
        this.description = Objects.requireNonNullElse(description, "");
        this.display = Objects.requireNonNullElse(display, List.of());
    }

    @Override
    public ApprovalOutcome defaultResolution() {
        return ApprovalOutcome.REJECT;
    }

    @Override
    public <T> T accept(WireRequestVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
