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

package com.phonepe.recall.context;

import com.phonepe.recall.core.collaborators.KnowledgeDocument;
import com.phonepe.recall.core.model.memory.Memory;
import com.phonepe.recall.core.model.memory.MemoryCategory;
import com.phonepe.recall.core.model.session.Scratchpad;
import com.phonepe.recall.memory.retrieval.ScoredMemory;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class PromptFormatterTest {

    @Test
    void testFormatMemories() {
        final var memories = List.of(scored("m1", "Prefers dark mode", MemoryCategory.PREFERENCES, 0.9),
                                     scored("m2", "Uses Java 17", MemoryCategory.FACTS, 0.75),
                                     scored("m3", "Never force push", MemoryCategory.RULES, 1.0));
        assertEquals("""
                             ## Retrieved Memories

                             - [preferences] Prefers dark mode (confidence: 90%)
                             - [facts] Uses Java 17 (confidence: 75%)""",
                     PromptFormatter.formatMemories(memories, 2));
        assertEquals("", PromptFormatter.formatMemories(List.of(), 5));
    }

    @Test
    void testFormatScratchpad() {
        final var scratchpad = Scratchpad.builder()
                .currentTask("Implement handoff store")
                .specFile("handoff.spec.md")
                .filesInProgress(List.of("HandoffStore.java", "HandoffService.java"))
                .validationGatesPassed(List.of(1, 2))
                .blockers(List.of("Waiting on index mapping"))
                .build();
        assertEquals("""
                             ## Session State

                             **Current Task:** Implement handoff store
                             **Spec File:** handoff.spec.md
                             **Files in Progress:** HandoffStore.java, HandoffService.java
                             **Validation Gates Passed:** 1, 2
                             **Blockers:** Waiting on index mapping""",
                     PromptFormatter.formatScratchpad(scratchpad));
        assertEquals("", PromptFormatter.formatScratchpad(Scratchpad.EMPTY));
        assertEquals("", PromptFormatter.formatScratchpad(null));
    }

    @Test
    void testFormatKnowledge() {
        final var documents = List.of(KnowledgeDocument.builder()
                                              .id("k1")
                                              .title("Index naming")
                                              .content("Prefix every index with the environment")
                                              .source("docs/es.md")
                                              .build(),
                                      KnowledgeDocument.builder()
                                              .id("k2")
                                              .content("Keep mappings strict")
                                              .build());
        assertEquals("""
                             ## Reference Knowledge

                             ### Index naming
                             _Source: docs/es.md_
                             Prefix every index with the environment

                             ### k2
                             Keep mappings strict""",
                     PromptFormatter.formatKnowledge(documents));
    }

    @Test
    void testJoinSkipsEmptySections() {
        assertEquals("a\n\nb", PromptFormatter.join("", "a", null, "b", ""));
        assertEquals("", PromptFormatter.join("", null));
    }

    private static ScoredMemory scored(String id, String content, MemoryCategory category, double confidence) {
        final var memory = Memory.builder()
                .id(id)
                .namespace("ns")
                .content(content)
                .category(category)
                .confidence(confidence)
                .createdAt(Instant.EPOCH)
                .build();
        return new ScoredMemory(memory, 0, 0, 0.5, 0.5);
    }
}
