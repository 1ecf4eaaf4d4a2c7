/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.soulwire.core.compaction;

import com.phonepe.soulwire.core.messages.ContentPart;
import com.phonepe.soulwire.core.messages.Message;
import com.phonepe.soulwire.core.messages.Messages;
import com.phonepe.soulwire.core.messages.Role;
import com.phonepe.soulwire.core.messages.TextPart;
import com.phonepe.soulwire.core.provider.ChatProvider;
import com.phonepe.soulwire.core.provider.Generator;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Folds everything but the last few user/assistant messages into a single summary message written by the model
 */
@Slf4j
public class SimpleCompaction implements Compaction {
    private static final String SUMMARY_NOTICE = "Previous context has been compacted. Here is the compaction output:";

    private final int maxPreservedMessages;
    private final CompactionPrompts prompts;

    public SimpleCompaction(int maxPreservedMessages) {
        this(maxPreservedMessages, CompactionPrompts.DEFAULT);
    }

    public SimpleCompaction(int maxPreservedMessages, CompactionPrompts prompts) {
        this.maxPreservedMessages = maxPreservedMessages;
        this.prompts = prompts;
    }

    /**
     * Split of the history into the part to summarize and the tail to keep
     */
    @Value
    public static class Prepared {
        /**
         * The synthetic user message asking for the summary, null if there is nothing to compact
         */
        Message compactMessage;
        List<Message> toPreserve;
    }

    public Prepared prepare(List<Message> messages, String customInstruction) {
        if (messages.isEmpty() || maxPreservedMessages <= 0) {
            return new Prepared(null, messages);
        }
        var preserveStart = messages.size();
        var preserved = 0;
        for (var index = messages.size() - 1; index >= 0; index--) {
            final var role = messages.get(index).getRole();
            if (role == Role.USER || role == Role.ASSISTANT) {
                preserved++;
                if (preserved == maxPreservedMessages) {
                    preserveStart = index;
                    break;
                }
            }
        }
        if (preserved < maxPreservedMessages) {
            return new Prepared(null, messages);
        }
        final var toCompact = messages.subList(0, preserveStart);
        final var toPreserve = List.copyOf(messages.subList(preserveStart, messages.size()));
        if (toCompact.isEmpty()) {
            return new Prepared(null, toPreserve);
        }
        final var content = new ArrayList<ContentPart>();
        for (var i = 0; i < toCompact.size(); i++) {
            final var message = toCompact.get(i);
            content.add(new TextPart("## Message " + (i + 1) + "\nRole: " + message.getRole().getValue()
                                             + "\nContent:\n"));
            content.addAll(Messages.withoutThinking(message.getContent()));
        }
        var prompt = "\n" + prompts.getCompactPrompt();
        if (StringUtils.isNotBlank(customInstruction)) {
            prompt += prompts.customInstruction(customInstruction.strip());
        }
        content.add(new TextPart(prompt));
        return new Prepared(Message.of(Role.USER, List.copyOf(content)), toPreserve);
    }

    @Override
    public CompactionResult compact(List<Message> messages,
                                    ChatProvider provider,
                                    String customInstruction) {
        final var prepared = prepare(messages, customInstruction);
        if (prepared.getCompactMessage() == null) {
            return new CompactionResult(prepared.getToPreserve(), null);
        }
        log.info("Compacting {} messages, keeping the last {}",
                 messages.size() - prepared.getToPreserve().size(), prepared.getToPreserve().size());
        final var result = Generator.generate(provider,
                                              prompts.getSystemPrompt(),
                                              List.of(),
                                              List.of(prepared.getCompactMessage()),
                                              part -> {});
        if (result.getUsage() != null) {
            log.debug("Compaction used {} input tokens and {} output tokens",
                      result.getUsage().input(), result.getUsage().getOutput());
        }
        final var summary = new ArrayList<ContentPart>();
        summary.add(Messages.system(SUMMARY_NOTICE));
        summary.addAll(Messages.withoutThinking(result.getMessage().getContent()));
        final var compacted = new ArrayList<Message>();
        compacted.add(Message.of(Role.USER, List.copyOf(summary)));
        compacted.addAll(prepared.getToPreserve());
        return new CompactionResult(List.copyOf(compacted), result.getUsage());
    }
}
