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

package com.phonepe.recall.memory.inmemory;

import com.phonepe.recall.core.model.memory.Memory;
import com.phonepe.recall.core.model.memory.MemoryCategory;
import com.phonepe.recall.core.model.memory.SourceType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryMemoryStoreTest {
    private static final Instant NOW = Instant.parse("2025-06-01T00:00:00Z");

    @Test
    void testUpdateAppliesToLatestVersion() {
        final var store = new InMemoryMemoryStore();
        store.save(memory("m1"));
        store.markUsed(List.of("m1", "missing"), NOW);

        final var updated = store.update("m1", memory -> memory.withContent("Deploys happen on Tuesdays"))
                .orElseThrow();

        assertEquals("Deploys happen on Tuesdays", updated.getContent());
        assertEquals(1, updated.getUseCount());
        assertEquals(NOW, updated.getLastUsedAt());
        assertEquals(updated, store.memory("m1").orElseThrow());
        assertTrue(store.update("missing", memory -> memory.withContent("x")).isEmpty());
        assertTrue(store.memory("missing").isEmpty());
    }

    private static Memory memory(String id) {
        return Memory.builder()
                .id(id)
                .namespace("ns")
                .content("Deploys happen on Mondays")
                .category(MemoryCategory.FACTS)
                .importance(0.5)
                .createdAt(NOW.minusSeconds(60))
                .sourceType(SourceType.EXPLICIT)
                .confidence(0.9)
                .lineage(List.of("s1"))
                .build();
    }
}
