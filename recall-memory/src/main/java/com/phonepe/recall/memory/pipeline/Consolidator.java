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

package com.phonepe.recall.memory.pipeline;

import com.google.common.util.concurrent.Striped;
import com.phonepe.recall.core.model.memory.Memory;
import com.phonepe.recall.core.model.memory.MemoryFilter;
import com.phonepe.recall.core.model.memory.MemorySearchHit;
import com.phonepe.recall.core.retry.ConflictRetrier;
import com.phonepe.recall.core.retry.RetrySetup;
import com.phonepe.recall.core.store.MemoryStore;
import com.phonepe.recall.core.utils.TextUtils;
import com.phonepe.recall.memory.similarity.Similarity;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Merges candidates into the memories of a namespace.
 * <p>
 * Work for one namespace is serialized with a striped lock so that two runs cannot both create the same memory.
 * Only store calls happen under the lock. Changes to existing memories are versioned writes retried on conflict, so
 * usage counts recorded meanwhile survive and a memory expired meanwhile is never brought back. A candidate whose
 * match expired meanwhile becomes a new memory.
 */
@Slf4j
public class Consolidator {
    private static final Set<String> NEGATIONS = Set.of("never", "not", "don't", "dont", "avoid", "stop", "no",
                                                        "without");
    private static final Set<String> POLARITY_WORDS = Set.of("never", "not", "don't", "dont", "avoid", "stop", "no",
                                                             "without", "always", "do");
    private static final int LOCK_STRIPES = 64;

    private final MemoryStore memoryStore;
    private final Similarity similarity;
    private final PipelineSetup setup;
    private final Clock clock;
    private final ConflictRetrier retrier;
    private final Striped<Lock> namespaceLocks = Striped.lock(LOCK_STRIPES);

    @Builder
    public Consolidator(
            @NonNull MemoryStore memoryStore,
            @NonNull Similarity similarity,
            PipelineSetup setup,
            Clock clock,
            RetrySetup retrySetup) {
        this.memoryStore = memoryStore;
        this.similarity = similarity;
        this.setup = Objects.requireNonNullElse(setup, PipelineSetup.DEFAULT);
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);
        this.retrier = new ConflictRetrier(retrySetup);
    }

    /**
     * Consolidates all candidates of one run while holding the namespace lock
     */
    public List<ConsolidationOutcome> consolidate(
            @NonNull String namespace,
            @NonNull String sessionId,
            @NonNull List<MemoryCandidate> candidates) {
        final var lock = namespaceLocks.get(namespace);
        lock.lock();
        try {
            final var outcomes = new ArrayList<ConsolidationOutcome>(candidates.size());
            for (final var candidate : candidates) {
                final var outcome = consolidateOne(namespace, sessionId, candidate);
                log.debug("Candidate '{}' in namespace {}: {}", candidate.getContent(), namespace,
                          outcome.getAction());
                outcomes.add(outcome);
            }
            return outcomes;
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Collapses candidates of one run that are near duplicates of each other. The first one wins.
     */
    public List<MemoryCandidate> dedupe(List<MemoryCandidate> candidates) {
        final var unique = new ArrayList<MemoryCandidate>();
        for (final var candidate : candidates) {
            final var duplicate = unique.stream()
                    .anyMatch(kept -> similarity.similarity(kept.getContent(), candidate.getContent())
                            > setup.getBatchDedupThreshold());
            if (!duplicate) {
                unique.add(candidate);
            }
        }
        return unique;
    }

    private ConsolidationOutcome consolidateOne(String namespace, String sessionId, MemoryCandidate candidate) {
        final var now = clock.instant();
        final var existing = memoryStore.search(MemoryFilter.builder()
                                                        .namespaces(Set.of(namespace))
                                                        .activeAt(now)
                                                        .maxResults(setup.getConsolidationScanLimit())
                                                        .build())
                .stream()
                .map(MemorySearchHit::getMemory)
                .toList();

        for (final var memory : existing) {
            if (contradicts(memory.getContent(), candidate.getContent())) {
                if (moreTrusted(candidate, memory)) {
                    final var expired = retrier.execute(
                            "expire memory " + memory.getId(),
                            () -> memoryStore.update(memory.getId(),
                                                     current -> current.isExpiredAt(now)
                                                                ? current
                                                                : current.withExpiresAt(now)))
                            .orElse(null);
                    final var created = memoryStore.save(newMemory(namespace, sessionId, candidate));
                    log.info("Memory {} in namespace {} contradicted by session {}. Replaced with {}",
                             memory.getId(), namespace, sessionId, created.getId());
                    return new ConsolidationOutcome(ConsolidationAction.EXPIRE_AND_CREATE, candidate, created,
                                                    expired, 0.0);
                }
                return skip(namespace, memory, sessionId, candidate, 0.0, now);
            }
        }

        final var candidateWords = TextUtils.wordSet(candidate.getContent());
        final var best = existing.stream()
                .map(memory -> new Scored(memory, matchScore(memory, candidate, candidateWords)))
                .filter(scored -> scored.score() >= setup.getSimilarityThreshold())
                .max(Comparator.comparingDouble(Scored::score));
        if (best.isEmpty()) {
            return create(namespace, sessionId, candidate);
        }
        final var match = best.get();
        final var memory = match.memory();
        if (TextUtils.wordSet(memory.getContent()).containsAll(candidateWords)) {
            return skip(namespace, memory, sessionId, candidate, match.score(), now);
        }
        return updateActive(memory, now, current -> current.toBuilder()
                .content(mergeContent(current.getContent(), candidate.getContent()))
                .confidence(Math.min(1.0, current.getConfidence() + setup.getConfidenceStep()))
                .importance(Math.max(current.getImportance(), candidate.getImportance()))
                .lineage(appendLineage(current.getLineage(), sessionId))
                .lastUsedAt(now)
                .build())
                .map(updated -> new ConsolidationOutcome(ConsolidationAction.UPDATE, candidate, updated, null,
                                                         match.score()))
                .orElseGet(() -> create(namespace, sessionId, candidate));
    }

    private ConsolidationOutcome create(String namespace, String sessionId, MemoryCandidate candidate) {
        final var created = memoryStore.save(newMemory(namespace, sessionId, candidate));
        return new ConsolidationOutcome(ConsolidationAction.CREATE, candidate, created, null, 0.0);
    }

    /**
     * Applies the change to the latest version of the memory unless it has expired by now
     *
     * @return the changed memory, empty if the memory is gone or expired
     */
    private Optional<Memory> updateActive(Memory memory, Instant now, UnaryOperator<Memory> change) {
        final var updated = retrier.execute(
                "update memory " + memory.getId(),
                () -> memoryStore.update(memory.getId(),
                                         current -> current.isExpiredAt(now) ? current : change.apply(current)))
                .filter(current -> !current.isExpiredAt(now));
        if (updated.isEmpty()) {
            log.info("Memory {} in namespace {} expired while consolidating", memory.getId(), memory.getNamespace());
        }
        return updated;
    }

    /**
     * A memory that already contains every word of the candidate is a full match, which also keeps merged memories
     * stable when a run is repeated
     */
    private double matchScore(Memory memory, MemoryCandidate candidate, Set<String> candidateWords) {
        if (TextUtils.wordSet(memory.getContent()).containsAll(candidateWords)) {
            return 1.0;
        }
        return similarity.similarity(memory.getContent(), candidate.getContent());
    }

    private ConsolidationOutcome skip(
            String namespace,
            Memory memory,
            String sessionId,
            MemoryCandidate candidate,
            double score,
            Instant now) {
        if (memory.getLineage().contains(sessionId)) {
            return new ConsolidationOutcome(ConsolidationAction.SKIP, candidate, memory, null, score);
        }
        return updateActive(memory, now,
                            current -> current.withLineage(appendLineage(current.getLineage(), sessionId)))
                .map(extended -> new ConsolidationOutcome(ConsolidationAction.SKIP, candidate, extended, null,
                                                          score))
                .orElseGet(() -> create(namespace, sessionId, candidate));
    }

    private Memory newMemory(String namespace, String sessionId, MemoryCandidate candidate) {
        return Memory.builder()
                .id(UUID.randomUUID().toString())
                .namespace(namespace)
                .content(candidate.getContent())
                .category(candidate.getCategory())
                .importance(candidate.getImportance())
                .tags(candidate.getTags())
                .createdAt(clock.instant())
                .sourceType(candidate.getSourceType())
                .confidence(candidate.getConfidence())
                .lineage(List.of(sessionId))
                .build();
    }

    /**
     * Same statement with opposite polarity, e.g. "always use tabs" vs "never use tabs"
     */
    private boolean contradicts(String existing, String candidate) {
        if (negative(existing) == negative(candidate)) {
            return false;
        }
        final var existingCore = withoutPolarity(existing);
        final var candidateCore = withoutPolarity(candidate);
        if (existingCore.isEmpty() || candidateCore.isEmpty()) {
            return false;
        }
        return similarity.similarity(existingCore, candidateCore) >= setup.getSimilarityThreshold();
    }

    private static boolean negative(String text) {
        return TextUtils.words(text).stream().anyMatch(NEGATIONS::contains);
    }

    private static String withoutPolarity(String text) {
        return TextUtils.words(text)
                .stream()
                .filter(word -> !POLARITY_WORDS.contains(word))
                .collect(Collectors.joining(" "));
    }

    /**
     * Source rank first. On equal rank the candidate needs at least the confidence of the existing memory.
     */
    private static boolean moreTrusted(MemoryCandidate candidate, Memory existing) {
        final var rankDiff = candidate.getSourceType().getTrust() - existing.getSourceType().getTrust();
        if (rankDiff != 0) {
            return rankDiff > 0;
        }
        return candidate.getConfidence() >= existing.getConfidence();
    }

    private static String mergeContent(String existing, String candidate) {
        if (TextUtils.wordSet(candidate).containsAll(TextUtils.wordSet(existing))) {
            return candidate;
        }
        return existing + "; " + candidate;
    }

    private static List<String> appendLineage(List<String> lineage, String sessionId) {
        if (lineage.contains(sessionId)) {
            return lineage;
        }
        final var extended = new ArrayList<>(lineage);
        extended.add(sessionId);
        return extended;
    }

    private record Scored(Memory memory, double score) {
    }
}
