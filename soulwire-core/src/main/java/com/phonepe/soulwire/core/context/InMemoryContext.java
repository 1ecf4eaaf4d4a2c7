package com.phonepe.soulwire.core.context;

import com.phonepe.soulwire.core.messages.Message;

import java.util.ArrayList;
import java.util.List;

/**
 * Context that lives only as long as the process
 */
public class InMemoryContext implements Context {
    private final List<Message> history = new ArrayList<>();
    private long tokenCount;
    private int checkpoints;

    @Override
    public synchronized List<Message> history() {
        return List.copyOf(history);
    }

    @Override
    public synchronized long tokenCount() {
        return tokenCount;
    }

    @Override
    public synchronized int checkpointCount() {
        return checkpoints;
    }

    @Override
    public synchronized void append(List<Message> messages) {
        history.addAll(messages);
    }

    @Override
    public synchronized void updateTokenCount(long tokenCount) {
        this.tokenCount = tokenCount;
    }

    @Override
    public synchronized int checkpoint() {
        return checkpoints++;
    }

    @Override
    public synchronized void clear() {
        history.clear();
        tokenCount = 0;
        checkpoints = 0;
    }

    @Override
    public synchronized void replace(List<Message> messages) {
        history.clear();
        history.addAll(messages);
        checkpoints = 1;
    }
}
