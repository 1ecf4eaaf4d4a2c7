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
import com.phonepe.soulwire.core.provider.ChatProvider;

import java.util.List;

/**
 * Shrinks the conversation history when it gets close to the context size of the model
 */
public interface Compaction {

    /**
     * @param messages          Current history
     * @param provider          Provider used to summarize
     * @param customInstruction Extra instruction from the user, may be null or empty
     * @return The replacement history
     */
    CompactionResult compact(List<Message> messages, ChatProvider provider, String customInstruction);
}
