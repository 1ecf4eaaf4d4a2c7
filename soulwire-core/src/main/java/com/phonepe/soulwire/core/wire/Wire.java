package com.phonepe.soulwire.core.wire;

import com.google.common.base.Preconditions;
import com.phonepe.soulwire.core.errors.QuestionNotSupportedException;
import com.phonepe.soulwire.core.wire.messages.QuestionRequest;
import com.phonepe.soulwire.core.wire.messages.WireMessage;
import com.phonepe.soulwire.core.wire.messages.WireRequest;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Typed bus between the engine and its consumers. Events are broadcast to every attached side, requests go to
 * the request handler side only and are answered through their resolution slot.
 * Publishing and requesting are serialized so that every side (and the recorder) sees the same order.
 * Delivery never waits on a consumer. A side that falls too far behind is detached as lagging.
 */
@Slf4j
public class Wire {
    @Getter
    private final WireSetup setup;
    private final WireRecorder recorder;
    private final List<WireSide> sides = new CopyOnWriteArrayList<>();
    private final Deque<WireRequest<?>> unhandledRequests = new ArrayDeque<>();
    private final Set<WireRequest<?>> outstanding = ConcurrentHashMap.newKeySet();
    private volatile boolean shutdown;

    public Wire() {
        this(WireSetup.DEFAULT, null);
    }

    public Wire(WireSetup setup) {
        this(setup, null);
    }

    /**
     * @param recorder Persists every message, may be null
     */
    public Wire(WireSetup setup, WireRecorder recorder) {
        this.setup = setup;
        this.recorder = recorder;
    }

    public WireSide attach(SideOptions options) {
        return attach(options, List.of());
    }

    /**
     * Attach a new side.
     *
     * @param options How messages should be delivered
     * @param backlog Messages handed out before live delivery starts, used only if the side replays
     * @return The new side
     */
    public synchronized WireSide attach(SideOptions options, Collection<WireMessage> backlog) {
        final var side = new WireSide(UUID.randomUUID().toString(), options, this, setup, backlog);
        sides.add(side);
        log.debug("Attached side {} (handler: {}, merged: {}, replay: {})",
                  side.getId(), options.isRequestHandler(), options.isMerged(), options.isReplayBacklog());
        if (options.isRequestHandler()) {
            while (!unhandledRequests.isEmpty()) {
                dispatchRequest(side, unhandledRequests.pollFirst());
            }
        }
        if (shutdown) {
            side.markDetached();
        }
        return side;
    }

    public synchronized void detach(WireSide side) {
        side.markDetached();
        sides.remove(side);
        log.debug("Detached side {}", side.getId());
    }

    public synchronized void publish(WireMessage event) {
        Preconditions.checkArgument(!event.isRequest(), "Requests must be sent using request()");
        if (shutdown) {
            log.debug("Wire is shut down. Ignoring event of type {}", event.getType());
            return;
        }
        record(event);
        sides.forEach(side -> side.deliver(event));
    }

    /**
     * Hands the request to the handler side and returns immediately. Callers wait using
     * {@link WireRequest#await()}.
     */
    public synchronized <R> void request(WireRequest<R> request) {
        if (shutdown) {
            log.debug("Wire is shut down. Ignoring request {}", request.getId());
            return;
        }
        outstanding.add(request);
        request.future().whenComplete((result, error) -> outstanding.remove(request));
        record(request);
        final var handler = currentHandler();
        if (handler == null) {
            log.debug("No request handler attached. Request {} queued", request.getId());
            unhandledRequests.addLast(request);
            return;
        }
        dispatchRequest(handler, request);
    }

    /**
     * Requests sent but not yet resolved
     */
    public List<WireRequest<?>> outstandingRequests() {
        return List.copyOf(outstanding);
    }

    public void shutdown() {
        synchronized (this) {
            if (shutdown) {
                return;
            }
            shutdown = true;
            if (recorder != null) {
                recorder.flush();
            }
        }
        log.debug("Wire shut down");
    }

    public boolean isShutdown() {
        return shutdown;
    }

    public List<WireSide> sides() {
        return List.copyOf(sides);
    }

    private WireSide currentHandler() {
        WireSide handler = null;
        for (final var side : sides) {
            if (side.isRequestHandler() && !side.isDetached()) {
                handler = side;
            }
        }
        return handler;
    }

    private void dispatchRequest(WireSide handler, WireRequest<?> request) {
        if (request.isResolved()) {
            return;
        }
        if (request instanceof QuestionRequest && !handler.isSupportsQuestions()) {
            log.debug("Side {} does not support questions. Failing request {}", handler.getId(), request.getId());
            request.setException(new QuestionNotSupportedException());
            return;
        }
        handler.deliver(request);
    }

    private void record(WireMessage message) {
        if (recorder != null) {
            recorder.record(message);
        }
    }
}
