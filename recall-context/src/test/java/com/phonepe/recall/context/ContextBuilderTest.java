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
import com.phonepe.recall.core.collaborators.KnowledgeSource;
import com.phonepe.recall.core.errors.ErrorType;
import com.phonepe.recall.core.errors.RecallException;
import com.phonepe.recall.core.model.handoff.HandoffContext;
import com.phonepe.recall.core.model.memory.Memory;
import com.phonepe.recall.core.model.memory.MemoryCategory;
import com.phonepe.recall.core.model.memory.SourceType;
import com.phonepe.recall.core.model.session.EventType;
import com.phonepe.recall.core.model.session.Role;
import com.phonepe.recall.core.model.session.Scratchpad;
import com.phonepe.recall.handoff.HandoffService;
import com.phonepe.recall.handoff.inmemory.InMemoryHandoffStore;
import com.phonepe.recall.memory.inmemory.InMemoryMemoryStore;
import com.phonepe.recall.memory.retrieval.MemoryRetriever;
import com.phonepe.recall.memory.retrieval.ScoredMemory;
import com.phonepe.recall.session.SessionService;
import com.phonepe.recall.session.compaction.CompactionStrategyType;
import com.phonepe.recall.session.compaction.Compactor;
import com.phonepe.recall.session.inmemory.InMemorySessionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ContextBuilderTest {
    private static final Instant NOW = Instant.parse("2025-06-01T00:00:00Z");
    private static final String NAMESPACE = "ns";
    private static final String WORKFLOW = "feature-development";

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private InMemoryMemoryStore memoryStore;
    private InMemoryHandoffStore handoffStore;
    private SessionService sessionService;
    private MemoryRetriever retriever;
    private HandoffService handoffService;
    private String sessionId;

    @BeforeEach
    void setup() {
        memoryStore = new InMemoryMemoryStore();
        handoffStore = new InMemoryHandoffStore();
        sessionService = SessionService.builder()
                .sessionStore(new InMemorySessionStore())
                .clock(clock)
                .build();
        retriever = MemoryRetriever.builder()
                .memoryStore(memoryStore)
                .clock(clock)
                .build();
        handoffService = HandoffService.builder()
                .handoffStore(handoffStore)
                .clock(clock)
                .build();
        sessionId = sessionService.createSession("dev", "service-engineer", WORKFLOW).getId();
        sessionService.appendEvent(sessionId, EventType.USER_MESSAGE, Role.USER, "Switch the UI to dark mode");
        sessionService.appendEvent(sessionId, EventType.MODEL_MESSAGE, Role.ASSISTANT, "Done, dark mode is on");
        sessionService.updateState(sessionId, Scratchpad.builder().currentTask("build x").build(), true);
        memoryStore.save(memory("m1", "User prefers dark mode", MemoryCategory.PREFERENCES, 0.5));
        memoryStore.save(memory("m2", "Always run the tests before merging", MemoryCategory.RULES, 0.9));
    }

    @Test
    void testBuildsCompleteContext() {
        final var handoff = handoffService.createHandoff("architect", "service-engineer", WORKFLOW,
                                                         HandoffContext.builder().specFile("x.spec.md").build(),
                                                         "Schema designed");
        final KnowledgeSource knowledge = query -> List.of(KnowledgeDocument.builder()
                                                               .id("k1")
                                                               .title("Theming guide")
                                                               .content("Use the palette tokens")
                                                               .source("docs/theming.md")
                                                               .build());
        final var context = builder(retriever, knowledge, ContextBuilderSetup.DEFAULT)
                .buildContext(turn("dark mode"));

        assertFalse(context.isDegraded());
        assertTrue(context.getDegradedParts().isEmpty());
        assertEquals(sessionId, context.getSessionId());
        assertEquals(2, context.getHistory().size());
        assertEquals(List.of("m1", "m2"),
                     context.getMemories().stream().map(m -> m.getMemory().getId()).sorted().toList());
        assertEquals(1, context.getKnowledge().size());
        assertEquals(handoff.getId(), context.getPendingHandoff().getId());
        assertEquals("memory_search", context.getToolSpecs().get(0).getName());
        assertTrue(context.getTokenEstimate() > 0);

        final var instructions = context.getInstructions();
        assertTrue(instructions.startsWith("## Handoff from architect"));
        assertTrue(instructions.contains("## Retrieved Memories"));
        assertTrue(instructions.contains("- [preferences] User prefers dark mode (confidence: 80%)"));
        assertTrue(instructions.contains("**Current Task:** build x"));
        assertTrue(instructions.contains("### Theming guide"));

        //Building a turn context only peeks at the handoff
        assertFalse(handoffStore.packet(handoff.getId()).orElseThrow().isConsumed());
    }

    @Test
    void testSlowKnowledgeDegradesContext() {
        final KnowledgeSource slow = query -> {
            try {
                Thread.sleep(2_000);
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return List.of();
        };
        final var setup = ContextBuilderSetup.builder()
                .knowledgeTimeout(Duration.ofMillis(100))
                .build();
        final var context = builder(retriever, slow, setup).buildContext(turn("dark mode"));

        assertTrue(context.isDegraded());
        assertEquals(List.of("knowledge"), context.getDegradedParts());
        assertTrue(context.getKnowledge().isEmpty());
        assertFalse(context.getMemories().isEmpty());
    }

    @Test
    void testFailingRetrievalDegradesContext() {
        final var failing = mock(MemoryRetriever.class);
        when(failing.retrieve(any())).thenThrow(RecallException.error(ErrorType.UPSTREAM_UNAVAILABLE, "es down"));
        when(failing.retrieveHighImportance(anyString(), anyDouble(), anyInt()))
                .thenReturn(List.of(new ScoredMemory(memory("m2", "Always run the tests before merging",
                                                            MemoryCategory.RULES, 0.9), 0, 1, 0.9, 0.45)));

        final var context = builder(failing, null, ContextBuilderSetup.DEFAULT).buildContext(turn("dark mode"));

        assertTrue(context.isDegraded());
        assertEquals(List.of("memories"), context.getDegradedParts());
        assertEquals(1, context.getMemories().size());
        assertEquals(2, context.getHistory().size());
    }

    @Test
    void testBlankMessageSkipsQueryLookups() {
        final var knowledge = mock(KnowledgeSource.class);
        final var context = builder(retriever, knowledge, ContextBuilderSetup.DEFAULT).buildContext(turn(" "));

        assertFalse(context.isDegraded());
        assertEquals(List.of("m2"), context.getMemories().stream().map(m -> m.getMemory().getId()).toList());
        verify(knowledge, never()).fetch(any());
    }

    @Test
    void testUnknownSessionFails() {
        final var builder = builder(retriever, null, ContextBuilderSetup.DEFAULT);
        final var turn = TurnInput.builder()
                .sessionId("missing")
                .message("dark mode")
                .agentMode("service-engineer")
                .namespace(NAMESPACE)
                .build();
        final var error = assertThrows(RecallException.class, () -> builder.buildContext(turn));
        assertEquals(ErrorType.NOT_FOUND, error.getErrorType());
    }

    @Test
    void testNewSessionContextConsumesHandoff() {
        final var handoff = handoffService.createHandoff("architect", "service-engineer", WORKFLOW,
                                                         HandoffContext.builder().build(), "Schema designed");
        final var builder = builder(retriever, null, ContextBuilderSetup.DEFAULT);

        final var context = builder.buildContextForNewSession(NAMESPACE, "service-engineer", WORKFLOW);
        assertNull(context.getSessionId());
        assertTrue(context.getHistory().isEmpty());
        assertEquals(List.of("m2"), context.getMemories().stream().map(m -> m.getMemory().getId()).toList());
        assertEquals(handoff.getId(), context.getPendingHandoff().getId());
        assertEquals(NOW, handoffStore.packet(handoff.getId()).orElseThrow().getConsumedAt());
        assertTrue(context.getInstructions().contains("Schema designed"));
    }

    @Test
    void testLongHistoryIsSummarized() {
        for (int i = 0; i < 60; i++) {
            sessionService.appendEvent(sessionId, EventType.USER_MESSAGE, Role.USER,
                                       ("message " + i + " ").repeat(1600));
        }
        final var compactor = Compactor.builder()
                .summarizer((events, target) -> CompletableFuture.completedFuture(
                        "Earlier: " + events.size() + " messages"))
                .build();
        try (final var builder = ContextBuilder.builder()
                .sessionService(sessionService)
                .memoryRetriever(retriever)
                .compactor(compactor)
                .build()) {
            final var context = builder.buildContext(turn("dark mode"));
            final var compaction = context.getCompaction();

            assertEquals(CompactionStrategyType.RECURSIVE_SUMMARIZATION, compaction.getStrategy());
            assertEquals(20, compaction.getOriginalCount());
            assertTrue(compaction.getTokensAfter() <= ContextBuilderSetup.DEFAULT_MAX_HISTORY_TOKENS);
            assertEquals(11, context.getHistory().size());
            assertEquals("[Session Summary]\nEarlier: 10 messages", context.getHistory().get(0).getContent());
            assertEquals(62, context.getHistory().get(10).getSequence());
        }
    }

    @Test
    void testCloseStopsOwnedExecutorOnly() {
        final var owned = builder(retriever, null, ContextBuilderSetup.DEFAULT);
        owned.close();
        assertThrows(RejectedExecutionException.class, () -> owned.buildContext(turn("dark mode")));

        final var shared = Executors.newSingleThreadExecutor();
        try {
            final var builder = ContextBuilder.builder()
                    .sessionService(sessionService)
                    .memoryRetriever(retriever)
                    .executorService(shared)
                    .build();
            builder.close();
            assertFalse(shared.isShutdown());
            assertEquals(2, builder.buildContext(turn("dark mode")).getHistory().size());
        }
        finally {
            shared.shutdown();
        }
    }

    @Test
    void testMergeKeepsHigherScore() {
        final var memory = memory("m1", "User prefers dark mode", MemoryCategory.PREFERENCES, 0.5);
        final var other = memory("m3", "Prefers short answers", MemoryCategory.PREFERENCES, 0.5);
        final var merged = ContextBuilder.mergeMemories(
                List.of(new ScoredMemory(memory, 1, 1, 0.5, 0.85), new ScoredMemory(other, 0.5, 1, 0.5, 0.6)),
                List.of(new ScoredMemory(memory, 0, 1, 0.5, 0.45)));
        assertEquals(2, merged.size());
        assertEquals("m1", merged.get(0).getMemory().getId());
        assertEquals(0.85, merged.get(0).getFinalScore());
        assertEquals("m3", merged.get(1).getMemory().getId());
    }

    private ContextBuilder builder(MemoryRetriever memoryRetriever, KnowledgeSource knowledge,
                                   ContextBuilderSetup setup) {
        return ContextBuilder.builder()
                .sessionService(sessionService)
                .memoryRetriever(memoryRetriever)
                .handoffService(handoffService)
                .knowledgeSource(knowledge)
                .setup(setup)
                .build();
    }

    private TurnInput turn(String message) {
        return TurnInput.builder()
                .sessionId(sessionId)
                .message(message)
                .agentMode("service-engineer")
                .namespace(NAMESPACE)
                .workflow(WORKFLOW)
                .build();
    }

    private static Memory memory(String id, String content, MemoryCategory category, double importance) {
        return Memory.builder()
                .id(id)
                .namespace(NAMESPACE)
                .content(content)
                .category(category)
                .importance(importance)
                .sourceType(SourceType.IMPLICIT)
                .createdAt(NOW)
                .build();
    }
}
