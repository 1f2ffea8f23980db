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

package com.phonepe.recall.context.tools;

import com.phonepe.recall.core.errors.ErrorType;
import com.phonepe.recall.core.errors.RecallException;
import com.phonepe.recall.core.model.memory.Memory;
import com.phonepe.recall.core.model.memory.MemoryCategory;
import com.phonepe.recall.memory.inmemory.InMemoryMemoryStore;
import com.phonepe.recall.memory.retrieval.MemoryRetriever;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class MemorySearchToolTest {
    private static final Instant NOW = Instant.parse("2025-06-01T00:00:00Z");

    private MemorySearchTool tool;

    @BeforeEach
    void setup() {
        final var store = new InMemoryMemoryStore();
        store.save(memory("m1", "architect", "Handoff packets are stored per workflow", MemoryCategory.FACTS));
        store.save(memory("m2", "architect", "Prefer small handoff summaries", MemoryCategory.PREFERENCES));
        store.save(memory("m3", "service-engineer", "Handoff reads must be idempotent", MemoryCategory.RULES));
        tool = new MemorySearchTool(MemoryRetriever.builder()
                                            .memoryStore(store)
                                            .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                                            .build(), null);
    }

    @Test
    void testSpec() {
        final var spec = tool.spec();
        assertEquals("memory_search", spec.getName());
        assertEquals("query", spec.getParameterSchema().get("required").get(0).asText());
        assertEquals(10, spec.getParameterSchema().at("/properties/limit/default").asInt());
    }

    @Test
    void testSearchesCurrentNamespaceByDefault() {
        final var results = tool.search("architect", new MemorySearchTool.Arguments("handoff", null, null, null));
        assertEquals(2, results.size());
        assertTrue(results.stream().allMatch(r -> r.getMemory().getNamespace().equals("architect")));
    }

    @Test
    void testSearchesAllNamespaces() {
        final var results = tool.search("architect", new MemorySearchTool.Arguments("handoff", "all", null, null));
        assertEquals(3, results.size());
    }

    @Test
    void testCategoryAndLimit() {
        final var byCategory = tool.search("architect",
                                           new MemorySearchTool.Arguments("handoff", "all", MemoryCategory.RULES,
                                                                          null));
        assertEquals(1, byCategory.size());
        assertEquals("m3", byCategory.get(0).getMemory().getId());

        assertEquals(1, tool.search("architect", new MemorySearchTool.Arguments("handoff", "all", null, 1)).size());
    }

    @Test
    void testRunRendersResults() {
        final var output = tool.run("architect", "{\"query\": \"handoff\", \"category\": \"preferences\"}");
        assertEquals("""
                             ## Retrieved Memories

                             - [preferences] Prefer small handoff summaries (confidence: 80%)""", output);
        assertEquals("No memories found for: kafka", tool.run("architect", "{\"query\": \"kafka\"}"));
    }

    @Test
    void testInvalidArguments() {
        var error = assertThrows(RecallException.class, () -> tool.run("architect", "{}"));
        assertEquals(ErrorType.INVALID_INPUT, error.getErrorType());
        error = assertThrows(RecallException.class, () -> tool.run("architect", "{not json"));
        assertEquals(ErrorType.INVALID_INPUT, error.getErrorType());
    }

    private static Memory memory(String id, String namespace, String content, MemoryCategory category) {
        return Memory.builder()
                .id(id)
                .namespace(namespace)
                .content(content)
                .category(category)
                .createdAt(NOW)
                .build();
    }
}
