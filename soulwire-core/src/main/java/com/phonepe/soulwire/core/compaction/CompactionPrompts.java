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

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import org.apache.commons.text.StringSubstitutor;

import java.util.Map;

@Value
@Builder
@With
@AllArgsConstructor(access = AccessLevel.PUBLIC)
public class CompactionPrompts {
    public static final String DEFAULT_SYSTEM_PROMPT =
            "You are a helpful assistant that compacts conversation context.";

    public static final String DEFAULT_COMPACT_PROMPT = """
            The messages above are the earlier part of a conversation between a user and a coding agent. \
            Write a summary of them that the agent can continue working from.

            Keep:
            - The task the user asked for and every constraint or preference the user stated
            - Decisions taken so far and the reasons given for them
            - Files, commands, identifiers and error messages that are still relevant, quoted exactly
            - Work that is finished and work that is still pending

            Drop small talk, repeated attempts that led nowhere and tool output that is no longer needed.
            Return only the summary, without any preamble.""";

    public static final String DEFAULT_CUSTOM_INSTRUCTION_TEMPLATE = """


            **Additional instruction from the user for this compaction:**
            ${instruction}""";

    public static final CompactionPrompts DEFAULT = CompactionPrompts.builder().build();

    @Builder.Default
    String systemPrompt = DEFAULT_SYSTEM_PROMPT;

    /**
     * Appended after the messages being compacted
     */
    @Builder.Default
    String compactPrompt = DEFAULT_COMPACT_PROMPT;

    /**
     * Appended after the compact prompt when the user gave an instruction. ${instruction} is replaced.
     */
    @Builder.Default
    String customInstructionTemplate = DEFAULT_CUSTOM_INSTRUCTION_TEMPLATE;

    public String customInstruction(String instruction) {
        return StringSubstitutor.replace(customInstructionTemplate, Map.of("instruction", instruction));
    }
}
