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

import com.google.common.base.Preconditions;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * When and how aggressively the context is compacted
 */
@Value
@With
public class CompactionSetup {
    public static final double DEFAULT_TRIGGER_RATIO = 0.85;
    public static final int DEFAULT_MAX_PRESERVED_MESSAGES = 2;
    public static final CompactionSetup DEFAULT = CompactionSetup.builder().build();

    /**
     * Fraction of the model context size at which compaction starts
     */
    double triggerRatio;

    /**
     * Number of trailing user/assistant messages kept as they are
     */
    int maxPreservedMessages;

    @Builder
    public CompactionSetup(double triggerRatio, Integer maxPreservedMessages) {
        this.triggerRatio = triggerRatio == 0 ? DEFAULT_TRIGGER_RATIO : triggerRatio;
        Preconditions.checkArgument(this.triggerRatio > 0 && this.triggerRatio <= 1,
                                    "Trigger ratio must be in (0, 1]");
        this.maxPreservedMessages = null == maxPreservedMessages
                                    ? DEFAULT_MAX_PRESERVED_MESSAGES
                                    : maxPreservedMessages;
    }
}
