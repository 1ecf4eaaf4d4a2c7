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

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AutoCompactionTest {

    @ParameterizedTest
    @CsvSource({
            "150000, 200000, 0.85, 50000, true",
            "140000, 200000, 0.85, 50000, false",
            "850000, 1000000, 0.85, 50000, true",
            "840000, 1000000, 0.85, 50000, false",
            "0, 200000, 0.85, 50000, false",
            "0, 10, 0.1, 9, false",
            "170000, 200000, 0.85, 10000, true",
    })
    void testShouldAutoCompact(long used, long max, double ratio, long reserved, boolean expected) {
        assertEquals(expected, AutoCompaction.shouldAutoCompact(used, max, ratio, reserved));
    }
}
