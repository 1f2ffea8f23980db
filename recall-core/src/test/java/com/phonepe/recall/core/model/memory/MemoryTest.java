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

package com.phonepe.recall.core.model.memory;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class MemoryTest {

    @Test
    void testDefaults() {
        final var memory = Memory.builder()
                .id("m1")
                .namespace("ns")
                .content("prefers dark mode")
                .category(MemoryCategory.PREFERENCES)
                .createdAt(Instant.EPOCH)
                .build();
        assertEquals(Memory.DEFAULT_IMPORTANCE, memory.getImportance());
        assertEquals(Memory.DEFAULT_CONFIDENCE, memory.getConfidence());
        assertEquals(SourceType.IMPLICIT, memory.getSourceType());
        assertTrue(memory.getLineage().isEmpty());
        assertTrue(memory.getTags().isEmpty());
        assertFalse(memory.isExpiredAt(Instant.now()));
    }

    @Test
    void testScoresAreClamped() {
        final var memory = Memory.builder()
                .id("m1")
                .namespace("ns")
                .content("c")
                .category(MemoryCategory.FACTS)
                .createdAt(Instant.EPOCH)
                .importance(1.7)
                .confidence(-0.2)
                .build();
        assertEquals(1.0, memory.getImportance());
        assertEquals(0.0, memory.getConfidence());
    }

    @Test
    void testExpiry() {
        final var now = Instant.parse("2025-01-10T00:00:00Z");
        final var memory = Memory.builder()
                .id("m1")
                .namespace("ns")
                .content("c")
                .category(MemoryCategory.FACTS)
                .createdAt(Instant.EPOCH)
                .expiresAt(now)
                .build();
        assertTrue(memory.isExpiredAt(now));
        assertFalse(memory.isExpiredAt(now.minusSeconds(1)));
    }
}
