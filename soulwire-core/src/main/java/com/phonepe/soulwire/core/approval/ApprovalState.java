package com.phonepe.soulwire.core.approval;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Session wide approval settings. Shared by reference between an agent and its subagents.
 * The change listener is called synchronously after every mutation that changed something.
 */
@Slf4j
public class ApprovalState {
    private boolean yolo;
    private final Set<String> autoApproveActions = new LinkedHashSet<>();
    private volatile Runnable onChange;

    public ApprovalState() {
        this(false, Set.of(), null);
    }

    public ApprovalState(boolean yolo, Collection<String> autoApproveActions, Runnable onChange) {
        this.yolo = yolo;
        this.autoApproveActions.addAll(autoApproveActions);
        this.onChange = onChange;
    }

    public void setOnChange(Runnable onChange) {
        this.onChange = onChange;
    }

    public synchronized boolean isYolo() {
        return yolo;
    }

    public void setYolo(boolean yolo) {
        synchronized (this) {
            if (this.yolo == yolo) {
                return;
            }
            this.yolo = yolo;
        }
        changed();
    }

    public synchronized boolean isAutoApproved(String action) {
        return yolo || autoApproveActions.contains(action);
    }

    public synchronized boolean isApprovedForSession(String action) {
        return autoApproveActions.contains(action);
    }

    /**
     * @return true if the action was not approved for the session before
     */
    public boolean addAutoApproveAction(String action) {
        synchronized (this) {
            if (!autoApproveActions.add(action)) {
                return false;
            }
        }
        changed();
        return true;
    }

    /**
     * Actions approved for the session, in the order they were approved
     */
    public synchronized Set<String> autoApproveActions() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(autoApproveActions));
    }

    private void changed() {
        final var listener = onChange;
        if (null == listener) {
            return;
        }
        try {
            listener.run();
        }
        catch (RuntimeException e) {
            log.error("Error running approval state change listener: {}", e.getMessage());
        }
    }
}
