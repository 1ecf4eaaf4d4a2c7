package com.phonepe.soulwire.core.messages;

/**
 * Marker for the pieces a provider emits while streaming a response: content parts, complete tool calls and
 * tool call argument fragments.
 */
public interface StreamedMessagePart {
}
