package com.phonepe.soulwire.core.wire;

import com.phonepe.soulwire.core.errors.WireShutdownException;
import com.phonepe.soulwire.core.wire.messages.SubagentEvent;
import com.phonepe.soulwire.core.wire.messages.WireRequest;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Pipes everything a subagent puts on its own wire into the parent wire. Events are wrapped in a
 * {@link SubagentEvent} tagged with the tool call that started the subagent. Requests are forwarded as the
 * same objects so that the answer given on the parent side resolves them for the subagent.
 */
@Slf4j
public class SubagentRelay implements AutoCloseable {
    private final Wire parent;
    private final Wire child;
    private final String taskToolCallId;
    private final WireSide childSide;
    private final Future<?> pump;

    public SubagentRelay(Wire parent, Wire child, String taskToolCallId, ExecutorService executorService) {
        this.parent = parent;
        this.child = child;
        this.taskToolCallId = taskToolCallId;
        this.childSide = child.attach(SideOptions.builder()
                                              .requestHandler(true)
                                              .supportsQuestions(true)
                                              .build());
        this.pump = executorService.submit(this::relay);
    }

    @Override
    public void close() {
        child.detach(childSide);
        pump.cancel(true);
    }

    private void relay() {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                final var message = childSide.receive();
                if (message instanceof WireRequest<?> request) {
                    parent.request(request);
                }
                else {
                    parent.publish(new SubagentEvent(taskToolCallId, message));
                }
            }
        }
        catch (WireShutdownException e) {
            log.debug("Subagent wire for {} closed", taskToolCallId);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Relay for {} interrupted", taskToolCallId);
        }
    }
}
