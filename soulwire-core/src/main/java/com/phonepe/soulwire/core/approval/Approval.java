package com.phonepe.soulwire.core.approval;

import com.phonepe.soulwire.core.errors.ApprovalException;
import com.phonepe.soulwire.core.wire.messages.ApprovalOutcome;
import com.phonepe.soulwire.core.wire.messages.ApprovalRequest;
import com.phonepe.soulwire.core.wire.messages.DisplayBlock;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Gatekeeper for actions that need a human go ahead. Tools call {@link #request} and block, the engine takes
 * pending requests using {@link #fetchRequest()} and answers them using {@link #resolveRequest}.
 */
@Slf4j
public class Approval {
    private static final Duration FETCH_POLL_INTERVAL = Duration.ofMillis(100);

    private final ApprovalState state;
    private final BlockingQueue<ApprovalRequest> queue = new LinkedBlockingQueue<>();
    private final Map<String, ApprovalRequest> pending = new ConcurrentHashMap<>();
    private volatile boolean shutdown;

    public Approval() {
        this(new ApprovalState());
    }

    public Approval(boolean yolo) {
        this(new ApprovalState(yolo, List.of(), null));
    }

    public Approval(ApprovalState state) {
        this.state = state;
    }

    public ApprovalState state() {
        return state;
    }

    public boolean isYolo() {
        return state.isYolo();
    }

    public void setYolo(boolean yolo) {
        state.setYolo(yolo);
    }

    /**
     * A new approval with its own request queue, backed by the same state
     */
    public Approval share() {
        return new Approval(state);
    }

    /**
     * Ask for approval and wait for the answer.
     *
     * @param toolCallId  Id of the tool call asking, mandatory
     * @param sender      Name of the tool asking
     * @param action      Category of the action, used for approvals for the session
     * @param description What is about to be done
     * @param display     Extra rendering hints for the user
     * @return true if the action may go ahead
     */
    public boolean request(String toolCallId,
                           String sender,
                           String action,
                           String description,
                           List<DisplayBlock> display) throws InterruptedException {
        if (null == toolCallId) {
            throw new ApprovalException("Approval must be requested from a tool call");
        }
        log.debug("{} ({}) requesting approval: {} {}", sender, toolCallId, action, description);
        if (state.isAutoApproved(action)) {
            return true;
        }
        if (shutdown) {
            throw new ApprovalException("Approval queue is shut down");
        }
        final var request = ApprovalRequest.builder()
                .id(UUID.randomUUID().toString())
                .toolCallId(toolCallId)
                .sender(sender)
                .action(action)
                .description(description)
                .display(display)
                .build();
        pending.put(request.getId(), request);
        queue.add(request);
        final var outcome = request.await();
        if (outcome == ApprovalOutcome.APPROVE_FOR_SESSION) {
            state.addAutoApproveAction(action);
        }
        return outcome.isApproved();
    }

    /**
     * Blocks until a request needs an answer. Requests for actions that got approved for the session while they
     * were waiting are approved here and skipped.
     */
    public ApprovalRequest fetchRequest() throws InterruptedException {
        while (true) {
            final var request = fetchRequest(FETCH_POLL_INTERVAL);
            if (request.isPresent()) {
                return request.get();
            }
        }
    }

    public Optional<ApprovalRequest> fetchRequest(Duration timeout) throws InterruptedException {
        final var deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            if (shutdown) {
                throw new ApprovalException("Approval queue is shut down");
            }
            final var remaining = deadline - System.nanoTime();
            final var request = queue.poll(Math.max(0, remaining), TimeUnit.NANOSECONDS);
            if (null == request) {
                return Optional.empty();
            }
            if (request.isResolved()) {
                pending.remove(request.getId());
                continue;
            }
            if (state.isApprovedForSession(request.getAction())) {
                log.debug("Auto-approving previously requested action: {}", request.getAction());
                resolveRequest(request.getId(), ApprovalOutcome.APPROVE);
                continue;
            }
            return Optional.of(request);
        }
    }

    public void resolveRequest(String requestId, ApprovalOutcome outcome) {
        final var request = pending.remove(requestId);
        if (null == request) {
            throw new ApprovalException("No pending approval request with id " + requestId);
        }
        if (outcome == ApprovalOutcome.APPROVE_FOR_SESSION) {
            state.addAutoApproveAction(request.getAction());
        }
        log.debug("Received approval response for request {}: {}", requestId, outcome);
        request.resolve(outcome);
    }

    /**
     * Rejects everything that is still waiting
     */
    public void rejectAll() {
        queue.clear();
        List.copyOf(pending.keySet()).forEach(id -> {
            final var request = pending.remove(id);
            if (null != request && request.resolve(ApprovalOutcome.REJECT)) {
                log.debug("Rejected pending approval request {}", id);
            }
        });
    }

    public void shutdown() {
        shutdown = true;
        rejectAll();
    }
}
