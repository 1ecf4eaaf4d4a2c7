package com.phonepe.soulwire.core.wire;

import com.phonepe.soulwire.core.wire.messages.ContentPartEvent;
import com.phonepe.soulwire.core.wire.messages.ToolCallEvent;
import com.phonepe.soulwire.core.wire.messages.ToolCallPartEvent;
import com.phonepe.soulwire.core.wire.messages.WireMessage;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;

/**
 * Writes wire traffic to a {@link WireLog}. Streamed chunks are coalesced: adjacent mergeable content parts
 * become one part and argument fragments are folded into the tool call they belong to. Anything else flushes
 * the pending chunk first so that the log keeps publish order.
 * Not thread safe, the {@link Wire} calls it under its own lock.
 */
@Slf4j
public class WireRecorder {
    private final WireLog wireLog;
    private final Clock clock;

    private WireMessage pending;
    private double pendingTimestamp;

    public WireRecorder(WireLog wireLog) {
        this(wireLog, Clock.systemUTC());
    }

    public WireRecorder(WireLog wireLog, Clock clock) {
        this.wireLog = wireLog;
        this.clock = clock;
    }

    public void record(WireMessage message) {
        if (pending != null) {
            final var merged = tryMerge(pending, message);
            if (merged != null) {
                pending = merged;
                return;
            }
            flush();
        }
        if (message instanceof ContentPartEvent || message instanceof ToolCallEvent) {
            pending = message;
            pendingTimestamp = now();
            return;
        }
        write(message, now());
    }

    public void flush() {
        if (pending == null) {
            return;
        }
        write(pending, pendingTimestamp);
        pending = null;
    }

    private static WireMessage tryMerge(WireMessage current, WireMessage next) {
        if (current instanceof ContentPartEvent currentPart && next instanceof ContentPartEvent nextPart) {
            return currentPart.getPart()
                    .merge(nextPart.getPart())
                    .map(ContentPartEvent::new)
                    .orElse(null);
        }
        if (current instanceof ToolCallEvent toolCall && next instanceof ToolCallPartEvent argumentsPart) {
            return new ToolCallEvent(toolCall.getToolCall().merge(argumentsPart.getToolCallPart()));
        }
        return null;
    }

    private void write(WireMessage message, double timestamp) {
        try {
            wireLog.append(new WireRecord(timestamp, message));
        }
        catch (RuntimeException e) {
            log.error("Error recording wire message of type {}: {}", message.getType(), e.getMessage());
        }
    }

    private double now() {
        return clock.millis() / 1000.0;
    }
}
