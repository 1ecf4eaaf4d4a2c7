package com.phonepe.soulwire.core.context;

import com.phonepe.soulwire.core.messages.Message;

import java.util.List;

/**
 * Conversation history of an agent along with its token accounting.
 * History is append only, except for {@link #clear()} and {@link #replace(List)} which swap it out entirely.
 */
public interface Context {

    List<Message> history();

    /**
     * Tokens used by the history as last reported by the provider
     */
    long tokenCount();

    int checkpointCount();

    void append(List<Message> messages);

    default void append(Message message) {
        append(List.of(message));
    }

    void updateTokenCount(long tokenCount);

    /**
     * Marks the current end of the history
     *
     * @return Id of the new checkpoint
     */
    int checkpoint();

    void clear();

    /**
     * Replaces the whole history, used after compaction. The new history starts with a single checkpoint.
     */
    void replace(List<Message> messages);
}
