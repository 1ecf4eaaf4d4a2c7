package com.phonepe.soulwire.core.session;

import com.phonepe.soulwire.core.approval.ApprovalState;
import com.phonepe.soulwire.core.context.Context;
import com.phonepe.soulwire.core.wire.WireLog;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.List;

/**
 * One conversation and everything persisted for it
 */
@Value
@Slf4j
public class Session {
    String id;
    Path workDir;
    Context context;
    WireLog wireLog;
    SessionStateStore stateStore;

    /**
     * Approval state initialized from the stored session state. Every change is written back to the store.
     */
    public ApprovalState approvalState() {
        final var stored = stateStore.load().normalized().getApproval();
        final var approvalState = new ApprovalState(stored.isYolo(), stored.getAutoApproveActions(), null);
        approvalState.setOnChange(() -> saveApproval(approvalState));
        return approvalState;
    }

    private void saveApproval(ApprovalState approvalState) {
        final var current = stateStore.load().normalized();
        stateStore.save(current.withApproval(
                current.getApproval()
                        .withYolo(approvalState.isYolo())
                        .withAutoApproveActions(List.copyOf(approvalState.autoApproveActions()))));
        log.debug("Saved approval state for session {}", id);
    }
}
