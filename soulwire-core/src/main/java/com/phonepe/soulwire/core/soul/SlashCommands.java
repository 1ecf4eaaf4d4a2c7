package com.phonepe.soulwire.core.soul;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Registry of slash commands, with the built in ones registered
 */
@Slf4j
public class SlashCommands {
    private static final Pattern COMMAND_PATTERN = Pattern.compile("^/([a-zA-Z0-9_:\\-]+)(?:\\s+(.*))?$",
                                                                   Pattern.DOTALL);

    private final Map<String, SlashCommand> byName = new LinkedHashMap<>();
    private final List<SlashCommand> commands = new ArrayList<>();

    /**
     * A parsed command line
     */
    @Value
    public static class Invocation {
        String name;
        String args;
    }

    public static Optional<Invocation> parse(String input) {
        if (null == input) {
            return Optional.empty();
        }
        final var matcher = COMMAND_PATTERN.matcher(input.strip());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(new Invocation(matcher.group(1), Objects.toString(matcher.group(2), "").strip()));
    }

    public static SlashCommands withBuiltins() {
        return new SlashCommands()
                .register(SlashCommand.builder()
                                  .name("compact")
                                  .description("Compact the context, optionally following an instruction")
                                  .handler(SlashCommands::compact)
                                  .build())
                .register(SlashCommand.builder()
                                  .name("clear")
                                  .alias("reset")
                                  .description("Clear the context")
                                  .handler(SlashCommands::clear)
                                  .build())
                .register(SlashCommand.builder()
                                  .name("yolo")
                                  .description("Toggle auto approval of all actions")
                                  .handler(SlashCommands::yolo)
                                  .build());
    }

    public synchronized SlashCommands register(SlashCommand command) {
        commands.add(command);
        byName.put(command.getName(), command);
        command.getAliases().forEach(alias -> byName.put(alias, command));
        return this;
    }

    public synchronized List<SlashCommand> commands() {
        return List.copyOf(commands);
    }

    public synchronized Optional<SlashCommand> find(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    void run(Soul soul, Invocation invocation) throws InterruptedException {
        final var command = find(invocation.getName()).orElse(null);
        if (null == command) {
            log.info("Unknown slash command /{}", invocation.getName());
            soul.publishNotice("Unknown slash command \"/" + invocation.getName() + "\".");
            return;
        }
        log.info("Running slash command /{}", command.getName());
        command.getHandler().run(soul, invocation.getArgs());
    }

    private static void compact(Soul soul, String args) throws InterruptedException {
        if (soul.context().checkpointCount() == 0) {
            soul.publishNotice("The context is empty.");
            return;
        }
        soul.compactContext(args);
        soul.publishNotice("The context has been compacted.");
    }

    private static void clear(Soul soul, String args) {
        soul.context().clear();
        soul.publishNotice("The context has been cleared.");
    }

    private static void yolo(Soul soul, String args) {
        final var approval = soul.approval();
        if (approval.isYolo()) {
            approval.setYolo(false);
            soul.publishNotice("You only die once! Actions will require approval.");
        }
        else {
            approval.setYolo(true);
            soul.publishNotice("You only live once! All actions will be auto-approved.");
        }
    }
}
