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

import lombok.experimental.UtilityClass;

@UtilityClass
public class AutoCompaction {

    /**
     * Compaction is due when the used tokens reach the trigger ratio of the context size, or when fewer than the
     * reserved number of tokens remain. Nothing used means nothing to compact.
     *
     * @param usedTokens     Tokens currently in the context
     * @param maxContextSize Context size of the model
     * @param triggerRatio   Fraction of the context size at which to compact
     * @param reservedSize   Tokens kept free for the next response
     */
    public static boolean shouldAutoCompact(long usedTokens, long maxContextSize, double triggerRatio,
                                            long reservedSize) {
        if (usedTokens <= 0) {
            return false;
        }
        return usedTokens >= maxContextSize * triggerRatio || usedTokens >= maxContextSize - reservedSize;
    }
}
