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

import com.google.common.base.Stopwatch;
import com.google.common.base.Strings;
import com.phonepe.recall.context.tools.MemorySearchTool;
import com.phonepe.recall.core.collaborators.KnowledgeDocument;
import com.phonepe.recall.core.collaborators.KnowledgeSource;
import com.phonepe.recall.core.errors.ErrorType;
import com.phonepe.recall.core.errors.RecallException;
import com.phonepe.recall.core.model.handoff.HandoffPacket;
import com.phonepe.recall.core.model.session.Scratchpad;
import com.phonepe.recall.core.model.session.SessionEvent;
import com.phonepe.recall.core.model.session.SessionState;
import com.phonepe.recall.handoff.HandoffFormatter;
import com.phonepe.recall.handoff.HandoffService;
import com.phonepe.recall.memory.retrieval.MemoryRetriever;
import com.phonepe.recall.memory.retrieval.MemoryScorer;
import com.phonepe.recall.memory.retrieval.RetrievalRequest;
import com.phonepe.recall.memory.retrieval.ScoredMemory;
import com.phonepe.recall.session.SessionService;
import com.phonepe.recall.session.compaction.CompactionResult;
import com.phonepe.recall.session.compaction.Compactor;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Assembles the context of a turn: compacted session history, retrieved memories, scratchpad, reference
 * knowledge and any pending handoff.
 * <p>
 * Session history and state are required, failing to read them fails the build. Memory, knowledge and handoff
 * lookups run in parallel with timeouts. When one of them fails the context is returned without it and flagged as
 * degraded.
 */
@Slf4j
public class ContextBuilder implements AutoCloseable {
    private static final String PART_MEMORIES = "memories";
    private static final String PART_HIGH_IMPORTANCE = "high_importance_memories";
    private static final String PART_KNOWLEDGE = "knowledge";
    private static final String PART_HANDOFF = "handoff";

    private final SessionService sessionService;
    private final MemoryRetriever memoryRetriever;
    private final Compactor compactor;
    private final HandoffService handoffService;
    private final KnowledgeSource knowledgeSource;
    private final MemorySearchTool memorySearchTool;
    @Getter
    private final ContextBuilderSetup setup;
    private final ExecutorService executorService;
    private final boolean ownsExecutor;

    /**
     * @param handoffService  Optional, no handoffs are looked up without it
     * @param knowledgeSource Optional, no reference knowledge without it
     * @param executorService Optional. Lookups run on a cached pool owned by this builder when missing. A passed in
     *                        executor is not shut down by {@link #close()}.
     */
    @Builder
    public ContextBuilder(
            @NonNull SessionService sessionService,
            @NonNull MemoryRetriever memoryRetriever,
            Compactor compactor,
            HandoffService handoffService,
            KnowledgeSource knowledgeSource,
            MemorySearchTool memorySearchTool,
            ContextBuilderSetup setup,
            ExecutorService executorService) {
        this.sessionService = sessionService;
        this.memoryRetriever = memoryRetriever;
        this.compactor = Objects.requireNonNullElseGet(
                compactor, () -> Compactor.builder().tokenEstimator(sessionService.getTokenEstimator()).build());
        this.handoffService = handoffService;
        this.knowledgeSource = knowledgeSource;
        this.memorySearchTool = Objects.requireNonNullElseGet(memorySearchTool,
                                                              () -> new MemorySearchTool(memoryRetriever, null));
        this.setup = Objects.requireNonNullElse(setup, ContextBuilderSetup.DEFAULT);
        this.ownsExecutor = executorService == null;
        this.executorService = Objects.requireNonNullElseGet(executorService, Executors::newCachedThreadPool);
    }

    public BuiltContext buildContext(@NonNull TurnInput turn) {
        final var stopwatch = Stopwatch.createStarted();
        final var deadline = new Deadline(setup.getOverallTimeout());
        final var query = Strings.isNullOrEmpty(turn.getMessage()) || turn.getMessage().isBlank()
                          ? null
                          : turn.getMessage();

        final var memoriesFuture = query == null
                                   ? CompletableFuture.completedFuture(List.<ScoredMemory>of())
                                   : async(() -> memoryRetriever.retrieve(RetrievalRequest.builder()
                                                                                  .namespace(turn.getNamespace())
                                                                                  .query(query)
                                                                                  .limit(setup.getMemoryLimit())
                                                                                  .build()));
        final var importantFuture = async(() -> memoryRetriever.retrieveHighImportance(
                turn.getNamespace(), setup.getImportanceThreshold(), setup.getImportanceLimit()));
        final var knowledgeFuture = knowledgeSource == null || !setup.isIncludeKnowledge() || query == null
                                    ? CompletableFuture.completedFuture(List.<KnowledgeDocument>of())
                                    : async(() -> knowledgeSource.fetch(query));
        final var handoffFuture = handoffService == null
                                  ? CompletableFuture.completedFuture(Optional.<HandoffPacket>empty())
                                  : async(() -> handoffService.peek(turn.getAgentMode(), turn.getWorkflow()));

        final List<SessionEvent> events;
        final SessionState state;
        try {
            events = sessionService.recentEvents(turn.getSessionId(), setup.getMaxHistoryEvents(), 0, Set.of());
            state = sessionService.state(turn.getSessionId());
        }
        catch (RuntimeException e) {
            List.of(memoriesFuture, importantFuture, knowledgeFuture, handoffFuture)
                    .forEach(future -> future.cancel(true));
            throw sessionFailure(turn.getSessionId(), e);
        }
        final var compaction = compactor.compact(events, compactor.getSetup()
                .withWindowSize(setup.getMaxHistoryEvents())
                .withTokenBudget(setup.getMaxHistoryTokens()));

        final var degraded = new ArrayList<String>();
        final var memories = await(memoriesFuture, setup.getRetrievalTimeout(), deadline, PART_MEMORIES,
                                   List.<ScoredMemory>of(), degraded);
        final var important = await(importantFuture, setup.getRetrievalTimeout(), deadline, PART_HIGH_IMPORTANCE,
                                    List.<ScoredMemory>of(), degraded);
        final var knowledge = await(knowledgeFuture, setup.getKnowledgeTimeout(), deadline, PART_KNOWLEDGE,
                                    List.<KnowledgeDocument>of(), degraded);
        final var handoff = await(handoffFuture, setup.getRetrievalTimeout(), deadline, PART_HANDOFF,
                                  Optional.<HandoffPacket>empty(), degraded);

        final var context = assemble(turn.getSessionId(), turn.getAgentMode(), turn.getNamespace(), compaction,
                                     mergeMemories(memories, important), state.getScratchpad(), knowledge,
                                     handoff.orElse(null), degraded);
        log.info("Built context for session {}: {} events ({}), {} memories, {} knowledge documents, "
                         + "~{} tokens in {}{}",
                 turn.getSessionId(), context.getHistory().size(), compaction.getStrategy(),
                 context.getMemories().size(), knowledge.size(), context.getTokenEstimate(), stopwatch.elapsed(),
                 degraded.isEmpty() ? "" : ". Degraded: " + degraded);
        if (log.isDebugEnabled()) {
            log.debug("Instructions for session {}:\n{}", turn.getSessionId(), context.getInstructions());
        }
        return context;
    }

    /**
     * Context for an agent that has no session yet: important memories and the pending handoff only. The
     * handoff is consumed since the new agent is taking over the work.
     */
    public BuiltContext buildContextForNewSession(
            @NonNull String namespace,
            @NonNull String agentMode,
            String workflow) {
        final var deadline = new Deadline(setup.getOverallTimeout());
        final var importantFuture = async(() -> memoryRetriever.retrieveHighImportance(
                namespace, setup.getImportanceThreshold(), setup.getImportanceLimit()));
        final var handoffFuture = handoffService == null
                                  ? CompletableFuture.completedFuture(Optional.<HandoffPacket>empty())
                                  : async(() -> handoffService.latest(agentMode, workflow));
        final var degraded = new ArrayList<String>();
        final var important = await(importantFuture, setup.getRetrievalTimeout(), deadline, PART_HIGH_IMPORTANCE,
                                    List.<ScoredMemory>of(), degraded);
        final var handoff = await(handoffFuture, setup.getRetrievalTimeout(), deadline, PART_HANDOFF,
                                  Optional.<HandoffPacket>empty(), degraded);
        final var context = assemble(null, agentMode, namespace, null, important, null, List.of(),
                                     handoff.orElse(null), degraded);
        log.info("Built new session context for {} in namespace {}: {} memories, handoff: {}", agentMode,
                 namespace, important.size(), handoff.map(HandoffPacket::getId).orElse("none"));
        return context;
    }

    /**
     * Unique by id, keeping the higher score, best first
     */
    static List<ScoredMemory> mergeMemories(List<ScoredMemory> first, List<ScoredMemory> second) {
        final var byId = new LinkedHashMap<String, ScoredMemory>();
        for (final var list : List.of(first, second)) {
            for (final var scored : list) {
                byId.merge(scored.getMemory().getId(), scored,
                           (current, candidate) -> candidate.getFinalScore() > current.getFinalScore()
                                                   ? candidate
                                                   : current);
            }
        }
        final var merged = new ArrayList<>(byId.values());
        merged.sort(MemoryScorer.BY_SCORE);
        return Collections.unmodifiableList(merged);
    }

    private BuiltContext assemble(
            String sessionId,
            String agentMode,
            String namespace,
            CompactionResult compaction,
            List<ScoredMemory> memories,
            Scratchpad scratchpad,
            List<KnowledgeDocument> knowledge,
            HandoffPacket handoff,
            List<String> degraded) {
        final var instructions = PromptFormatter.join(
                handoff == null ? "" : HandoffFormatter.formatForPrompt(handoff),
                PromptFormatter.formatMemories(memories, setup.getPromptMemoryLimit()),
                PromptFormatter.formatScratchpad(scratchpad),
                PromptFormatter.formatKnowledge(knowledge));
        final var history = compaction == null ? List.<SessionEvent>of() : compaction.getEvents();
        final var tokenEstimator = sessionService.getTokenEstimator();
        return BuiltContext.builder()
                .sessionId(sessionId)
                .agentMode(agentMode)
                .namespace(namespace)
                .instructions(instructions)
                .toolSpecs(List.of(memorySearchTool.spec()))
                .history(history)
                .compaction(compaction)
                .memories(memories)
                .scratchpad(scratchpad)
                .knowledge(knowledge)
                .pendingHandoff(handoff)
                .tokenEstimate(tokenEstimator.estimateEvents(history) + tokenEstimator.estimate(instructions))
                .degraded(!degraded.isEmpty())
                .degradedParts(List.copyOf(degraded))
                .build();
    }

    @Override
    public void close() {
        if (ownsExecutor && !executorService.isShutdown()) {
            log.info("Stopping context lookup executor");
            executorService.shutdown();
        }
    }

    private <T> CompletableFuture<T> async(Supplier<T> supplier) {
        return CompletableFuture.supplyAsync(supplier, executorService);
    }

    private static <T> T await(
            CompletableFuture<T> future,
            Duration timeout,
            Deadline deadline,
            String part,
            T fallback,
            List<String> degraded) {
        try {
            return future.get(deadline.bound(timeout).toMillis(), TimeUnit.MILLISECONDS);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for {}. Continuing without it", part);
        }
        catch (ExecutionException e) {
            log.warn("Lookup of {} failed. Continuing without it: {}", part,
                     RecallException.wrap(ErrorType.UPSTREAM_UNAVAILABLE, e).getMessage());
        }
        catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Lookup of {} did not finish in {}. Continuing without it", part, timeout);
        }
        degraded.add(part);
        return fallback;
    }

    private static RecallException sessionFailure(String sessionId, RuntimeException e) {
        final var error = RecallException.wrap(ErrorType.UPSTREAM_UNAVAILABLE, e);
        log.error("Cannot build context for session {}: {}", sessionId, error.getMessage());
        return error;
    }

    /**
     * Shared time budget of all optional lookups of one build
     */
    private static final class Deadline {
        private final long endNanos;

        private Deadline(Duration budget) {
            this.endNanos = System.nanoTime() + budget.toNanos();
        }

        Duration bound(Duration timeout) {
            final var remaining = Duration.ofNanos(Math.max(0, endNanos - System.nanoTime()));
            return remaining.compareTo(timeout) < 0 ? remaining : timeout;
        }
    }
}
