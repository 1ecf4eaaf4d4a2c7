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

import com.phonepe.soulwire.core.messages.Message;
import com.phonepe.soulwire.core.messages.Messages;
import com.phonepe.soulwire.core.messages.TokenUsage;
import lombok.Value;

import java.util.List;

@Value
public class CompactionResult {
    List<Message> messages;

    /**
     * Usage of the summarization call, null if no call was made
     */
    TokenUsage usage;

    /**
     * Rough token count of the compacted context. When the call reported usage, its output tokens stand for the
     * summary (the first message) and the rest is estimated from text length.
     */
    public long estimatedTokenCount() {
        if (usage != null && !messages.isEmpty()) {
            return usage.getOutput() + Messages.textLength(messages.subList(1, messages.size())) / 4;
        }
        return Messages.textLength(messages) / 4;
    }
}
