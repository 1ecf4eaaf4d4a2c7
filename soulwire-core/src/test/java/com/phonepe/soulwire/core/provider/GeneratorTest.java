package com.phonepe.soulwire.core.provider;

import com.phonepe.soulwire.core.errors.ChatProviderException;
import com.phonepe.soulwire.core.messages.Role;
import com.phonepe.soulwire.core.messages.StreamedMessagePart;
import com.phonepe.soulwire.core.messages.TextPart;
import com.phonepe.soulwire.core.messages.ThinkPart;
import com.phonepe.soulwire.core.messages.ToolCall;
import com.phonepe.soulwire.core.messages.ToolCallPart;
import com.phonepe.soulwire.core.utils.TestUtils;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class GeneratorTest {

    @Test
    void testMergesStreamedParts() {
        final var parts = List.<StreamedMessagePart>of(
                new ThinkPart("The user "),
                new ThinkPart("wants a listing"),
                new TextPart("Let me "),
                new TextPart("look."),
                ToolCall.of("call-1", "shell", null),
                ToolCallPart.of("{\"command\":"),
                ToolCallPart.of("\"ls\"}"),
                ToolCall.of("call-2", "read_file", "{\"path\":\"a.txt\"}"));
        final var provider = mock(ChatProvider.class);
        when(provider.generate(anyString(), anyList(), anyList()))
                .thenReturn(StreamedMessage.of("msg-1", parts, TestUtils.usage(10, 5)));

        final var seen = new ArrayList<StreamedMessagePart>();
        final var result = Generator.generate(provider, "", List.of(), List.of(), seen::add);

        assertEquals(parts, seen);
        assertEquals("msg-1", result.getId());
        assertEquals(15, result.getUsage().total());
        final var message = result.getMessage();
        assertEquals(Role.ASSISTANT, message.getRole());
        assertEquals(List.of(new ThinkPart("The user wants a listing"), new TextPart("Let me look.")),
                     message.getContent());
        assertEquals(List.of(ToolCall.of("call-1", "shell", "{\"command\":\"ls\"}"),
                             ToolCall.of("call-2", "read_file", "{\"path\":\"a.txt\"}")),
                     message.getToolCalls());
    }

    @Test
    void testSignedThinkingIsNotMerged() {
        final var provider = mock(ChatProvider.class);
        when(provider.generate(anyString(), anyList(), anyList()))
                .thenReturn(StreamedMessage.of("msg-1",
                                               List.of(new ThinkPart("first", "sig-1"),
                                                       new ThinkPart("second"),
                                                       new TextPart("Done")),
                                               null));
        final var message = Generator.generate(provider, "", List.of(), List.of(), part -> {}).getMessage();
        assertEquals(3, message.getContent().size());
        assertFalse(message.hasToolCalls());
    }

    @Test
    void testEmptyResponse() {
        final var provider = mock(ChatProvider.class);
        when(provider.generate(anyString(), anyList(), anyList()))
                .thenReturn(StreamedMessage.of("msg-1", List.of(ToolCallPart.of("{}")), null));
        final var error = assertThrows(ChatProviderException.class,
                                       () -> Generator.generate(provider, "", List.of(), List.of(), part -> {}));
        assertEquals(ChatProviderException.Kind.EMPTY_RESPONSE, error.getKind());
    }
}
