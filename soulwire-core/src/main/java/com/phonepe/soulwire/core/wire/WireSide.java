package com.phonepe.soulwire.core.wire;

import com.phonepe.soulwire.core.errors.WireShutdownException;
import com.phonepe.soulwire.core.wire.messages.SubagentEvent;
import com.phonepe.soulwire.core.wire.messages.WireMessage;
import com.phonepe.soulwire.core.wire.messages.WireRequest;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One consumer attached to a {@link Wire}. Messages are delivered into a queue owned by the side without ever
 * blocking the publisher. A side holding {@link WireSetup#getSideQueueCapacity()} undelivered messages is detached
 * as lagging: it can still read what it holds and then observes shutdown.
 * While replaying, the backlog is handed out first and live messages are parked in an unbounded buffer until
 * the backlog is exhausted.
 */
@Slf4j
public class WireSide implements AutoCloseable {
    @Getter
    private final String id;
    @Getter
    private final SideOptions options;
    private final Wire wire;
    private final WireSetup setup;
    private final BlockingQueue<WireMessage> queue;

    private final Object replayLock = new Object();
    private final Deque<WireMessage> backlog = new ArrayDeque<>();
    private final Deque<WireMessage> replayBuffer = new ArrayDeque<>();
    private boolean replaying;

    @Getter
    private volatile boolean supportsQuestions;
    private volatile boolean detached;
    private final AtomicBoolean lagging = new AtomicBoolean();

    WireSide(String id, SideOptions options, Wire wire, WireSetup setup, Collection<WireMessage> replay) {
        this.id = id;
        this.options = options;
        this.wire = wire;
        this.setup = setup;
        this.queue = new LinkedBlockingQueue<>();
        this.supportsQuestions = options.isSupportsQuestions();
        if (options.isReplayBacklog()) {
            backlog.addAll(replay);
            replaying = true;
        }
    }

    public boolean isRequestHandler() {
        return options.isRequestHandler();
    }

    public void setSupportsQuestions(boolean supportsQuestions) {
        this.supportsQuestions = supportsQuestions;
    }

    /**
     * @return true if the side was detached because it stopped keeping up with the wire
     */
    public boolean isLagging() {
        return lagging.get();
    }

    public boolean isReplaying() {
        synchronized (replayLock) {
            return replaying;
        }
    }

    /**
     * Blocks until a message is available.
     *
     * @throws WireShutdownException once the wire is shut down (or this side detached) and nothing is left to read
     */
    public WireMessage receive() throws InterruptedException {
        while (true) {
            final var message = poll(setup.getPollInterval()).orElse(null);
            if (message != null) {
                return message;
            }
        }
    }

    /**
     * Waits at most the given time for a message
     *
     * @throws WireShutdownException once the wire is shut down (or this side detached) and nothing is left to read
     */
    public Optional<WireMessage> poll(Duration timeout) throws InterruptedException {
        final var replayed = nextReplayed();
        if (replayed.isPresent()) {
            return replayed;
        }
        final var message = queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (message != null) {
            return Optional.of(message);
        }
        if ((detached || wire.isShutdown()) && queue.isEmpty()) {
            throw new WireShutdownException();
        }
        return Optional.empty();
    }

    @Override
    public void close() {
        wire.detach(this);
    }

    void markDetached() {
        detached = true;
    }

    boolean isDetached() {
        return detached;
    }

    void deliver(WireMessage message) {
        var toDeliver = message;
        if (options.isMerged() && message instanceof SubagentEvent subagentEvent) {
            toDeliver = subagentEvent.getEvent();
        }
        synchronized (replayLock) {
            if (replaying) {
                replayBuffer.addLast(toDeliver);
                return;
            }
        }
        offer(toDeliver);
    }

    private Optional<WireMessage> nextReplayed() {
        synchronized (replayLock) {
            if (!replaying) {
                return Optional.empty();
            }
            if (!backlog.isEmpty()) {
                return Optional.of(backlog.pollFirst());
            }
            if (!replayBuffer.isEmpty()) {
                return Optional.of(replayBuffer.pollFirst());
            }
            replaying = false;
            log.debug("Side {} finished replay, switching to live delivery", id);
            return Optional.empty();
        }
    }

    private void offer(WireMessage message) {
        if (!detached && queue.size() >= setup.getSideQueueCapacity() && lagging.compareAndSet(false, true)) {
            log.warn("Side {} has {} undelivered messages. Detaching it as lagging", id, queue.size());
            wire.detach(this);
        }
        if (!detached) {
            queue.add(message);
            return;
        }
        log.warn("Side {} is detached. Message of type {} not delivered", id, message.getType());
        if (message instanceof WireRequest<?> request) {
            log.warn("Request {} could not be delivered to side {}. Resolving with default", request.getId(), id);
            request.resolveWithDefault();
        }
    }
}
