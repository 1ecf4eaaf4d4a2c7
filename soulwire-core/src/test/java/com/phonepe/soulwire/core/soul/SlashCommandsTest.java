package com.phonepe.soulwire.core.soul;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SlashCommandsTest {

    @Test
    void testParse() {
        assertEquals(new SlashCommands.Invocation("compact", ""), SlashCommands.parse("/compact").orElseThrow());
        assertEquals(new SlashCommands.Invocation("compact", "keep the\nfile names"),
                     SlashCommands.parse("  /compact keep the\nfile names  ").orElseThrow());
        assertEquals(new SlashCommands.Invocation("mcp:list", ""), SlashCommands.parse("/mcp:list").orElseThrow());
        assertTrue(SlashCommands.parse("compact").isEmpty());
        assertTrue(SlashCommands.parse("/").isEmpty());
        assertTrue(SlashCommands.parse("/path/to/file").isEmpty());
        assertTrue(SlashCommands.parse(null).isEmpty());
    }

    @Test
    void testBuiltins() {
        final var commands = SlashCommands.withBuiltins();
        assertEquals(List.of("compact", "clear", "yolo"),
                     commands.commands().stream().map(SlashCommand::getName).toList());
        assertEquals("clear", commands.find("reset").orElseThrow().getName());
        assertTrue(commands.find("missing").isEmpty());
    }
}
