package com.phonepe.soulwire.core.provider;

import com.phonepe.soulwire.core.messages.StreamedMessagePart;
import com.phonepe.soulwire.core.messages.TokenUsage;

import java.util.Iterator;
import java.util.List;

/**
 * A response being streamed by a provider. Parts are read in order, usage is known once all parts are read.
 */
public interface StreamedMessage extends Iterable<StreamedMessagePart> {

    /**
     * Provider assigned id of the message, may be null
     */
    String id();

    /**
     * Usage of the call, may be null if the provider does not report it
     */
    TokenUsage usage();

    /**
     * A fully buffered response
     */
    static StreamedMessage of(String id, List<StreamedMessagePart> parts, TokenUsage usage) {
        final var copy = List.copyOf(parts);
        return new StreamedMessage() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public TokenUsage usage() {
                return usage;
            }

            @Override
            public Iterator<StreamedMessagePart> iterator() {
                return copy.iterator();
            }
        };
    }
}
